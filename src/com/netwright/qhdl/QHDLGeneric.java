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
 * A generic declared on an entity or component: a name, a declared type and
 * an optional default value.
 */
public class QHDLGeneric extends QHDLName {

    private final String typeName;

    private final QHDLValueType valueType;

    private final QHDLValue defaultValue;

    public QHDLGeneric(String name, String typeName, QHDLValue defaultValue, QHDLLocation location) {
        super(name, location);
        this.typeName = typeName;
        this.valueType = QHDLValueType.forTypeName(typeName);
        this.defaultValue = defaultValue;
    }

    public QHDLGeneric(String name, String typeName, QHDLValue defaultValue) {
        this(name, typeName, defaultValue, null);
    }

    public String getTypeName() {
        return typeName;
    }

    /**
     * @return The checked value kind, or null if the declared type is opaque.
     */
    public QHDLValueType getValueType() {
        return valueType;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    /**
     * @return The default value, or null if none was declared.
     */
    public QHDLValue getDefaultValue() {
        return defaultValue;
    }

    @Override
    public String toString() {
        return getName() + " : " + typeName + (hasDefault() ? " := " + defaultValue.toLiteral() : "");
    }
}
