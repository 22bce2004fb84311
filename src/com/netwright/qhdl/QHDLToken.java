/*
 *
 * Copyright (c) 2026, NetWright contributors.
 * All rights reserved.
 *
 * This file is part of NetWright.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.netwright.qhdl;

import java.util.Objects;

/**
 * A token together with where it starts in the source.
 */
public class QHDLToken {
    private final QHDLTokenType type;
    private final String text;
    private final QHDLLocation location;

    public QHDLToken(QHDLTokenType type, String text, QHDLLocation location) {
        this.type = Objects.requireNonNull(type);
        this.text = Objects.requireNonNull(text);
        this.location = location;
    }

    public QHDLTokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public QHDLLocation getLocation() {
        return location;
    }

    /**
     * @param keyword A reserved word, any case.
     * @return True if this token is an identifier spelling that keyword.
     */
    public boolean isKeyword(String keyword) {
        return type == QHDLTokenType.IDENTIFIER && text.equalsIgnoreCase(keyword);
    }

    public boolean is(QHDLTokenType t) {
        return type == t;
    }

    /**
     * @return A short rendering for error messages.
     */
    public String describe() {
        if (type == QHDLTokenType.EOF) {
            return type.getDescription();
        }
        String displayText = text;
        if (text.length() > 40) {
            displayText = text.substring(0, 37) + "...";
        }
        return "'" + displayText + "'";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QHDLToken token = (QHDLToken) o;
        return type == token.type && text.equals(token.text) && Objects.equals(location, token.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, location);
    }

    @Override
    public String toString() {
        return describe() + "@" + location;
    }
}
