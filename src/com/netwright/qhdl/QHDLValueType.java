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

import java.util.HashMap;
import java.util.Map;

/**
 * The generic value kinds the elaborator can evaluate and check. Any other
 * declared type name is treated as opaque.
 */
public enum QHDLValueType {
    REAL,
    INTEGER,
    BOOLEAN,
    STRING;

    private static final Map<String, QHDLValueType> typeNames = new HashMap<>();

    static {
        typeNames.put("real", REAL);
        typeNames.put("integer", INTEGER);
        typeNames.put("int", INTEGER);
        typeNames.put("natural", INTEGER);
        typeNames.put("positive", INTEGER);
        typeNames.put("boolean", BOOLEAN);
        typeNames.put("string", STRING);
    }

    /**
     * Maps a declared type name to its value kind.
     * @param typeName The type name from a GENERIC clause, any case.
     * @return The value kind, or null if the type is opaque.
     */
    public static QHDLValueType forTypeName(String typeName) {
        return typeNames.get(QHDLName.toKey(typeName));
    }

    /**
     * Smallest value allowed by a declared integer subtype.
     * @param typeName The type name from a GENERIC clause, any case.
     * @return 0 for natural, 1 for positive, otherwise {@link Long#MIN_VALUE}.
     */
    public static long lowerBound(String typeName) {
        switch (QHDLName.toKey(typeName)) {
            case "natural":
                return 0;
            case "positive":
                return 1;
            default:
                return Long.MIN_VALUE;
        }
    }

    public boolean isNumeric() {
        return this == REAL || this == INTEGER;
    }
}
