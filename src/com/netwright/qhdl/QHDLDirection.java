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

/**
 * Provides basic directional options for ports.
 */
public enum QHDLDirection {
    IN,
    OUT;

    private final String keyword;

    QHDLDirection() {
        keyword = name().toLowerCase();
    }

    /**
     * @param s A direction keyword, any case.
     * @return The direction, or null if the keyword is not a direction.
     */
    public static QHDLDirection getEnum(String s) {
        for (QHDLDirection d : values()) {
            if (d.keyword.equalsIgnoreCase(s)) {
                return d;
            }
        }
        return null;
    }

    public boolean isInput() {
        return this == IN;
    }

    public boolean isOutput() {
        return this == OUT;
    }

    public String getKeyword() {
        return keyword;
    }
}
