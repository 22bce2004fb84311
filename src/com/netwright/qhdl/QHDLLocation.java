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
 * A position inside a QHDL source, 1-based line and column.
 */
public class QHDLLocation {

    public static final String UNKNOWN_SOURCE = "<input>";

    private final String source;

    private final int line;

    private final int column;

    public QHDLLocation(String source, int line, int column) {
        this.source = source == null ? UNKNOWN_SOURCE : source;
        this.line = line;
        this.column = column;
    }

    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QHDLLocation that = (QHDLLocation) o;
        return line == that.line && column == that.column && source.equals(that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, line, column);
    }

    @Override
    public String toString() {
        return source + ":" + line + ":" + column;
    }
}
