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
 * A concrete generic value: a real, an integer, a boolean or a string.
 * Instances are immutable.
 */
public class QHDLValue {

    private final QHDLValueType type;

    private final Object value;

    private QHDLValue(QHDLValueType type, Object value) {
        this.type = Objects.requireNonNull(type);
        this.value = Objects.requireNonNull(value);
    }

    public static QHDLValue real(double value) {
        return new QHDLValue(QHDLValueType.REAL, value);
    }

    public static QHDLValue integer(long value) {
        return new QHDLValue(QHDLValueType.INTEGER, value);
    }

    public static QHDLValue bool(boolean value) {
        return new QHDLValue(QHDLValueType.BOOLEAN, value);
    }

    public static QHDLValue string(String value) {
        return new QHDLValue(QHDLValueType.STRING, value);
    }

    /**
     * Parses a numeric literal as written in QHDL source. Underscores between
     * digits are ignored; a literal with a decimal point or exponent is real.
     * @param text The literal text, optionally signed.
     * @return The numeric value.
     * @throws NumberFormatException if the text is not a number
     */
    public static QHDLValue parseNumber(String text) {
        String clean = text.replace("_", "");
        boolean isReal = clean.indexOf('.') >= 0 || clean.indexOf('e') >= 0 || clean.indexOf('E') >= 0;
        if (isReal) {
            return real(Double.parseDouble(clean));
        }
        return integer(Long.parseLong(clean));
    }

    /**
     * @return the type
     */
    public QHDLValueType getType() {
        return type;
    }

    /**
     * @return the value as a boxed Java object (Double, Long, Boolean or String)
     */
    public Object getValue() {
        return value;
    }

    /**
     * @return The numeric value widened to double, or null if this is not numeric.
     */
    public Double getRealValue() {
        if (!type.isNumeric()) {
            return null;
        }
        return ((Number) value).doubleValue();
    }

    /**
     * @return The integer value, or null if this is not an integer.
     */
    public Long getIntValue() {
        if (type != QHDLValueType.INTEGER) {
            return null;
        }
        return (Long) value;
    }

    public Boolean getBooleanValue() {
        if (type != QHDLValueType.BOOLEAN) {
            return null;
        }
        return (Boolean) value;
    }

    public String getStringValue() {
        if (type != QHDLValueType.STRING) {
            return null;
        }
        return (String) value;
    }

    /**
     * Converts this value to the requested kind, following the QHDL assignment
     * rules: integers widen to reals, everything else must match exactly.
     * @param target The declared kind, or null for an opaque type.
     * @return The converted value, or null if it cannot be converted.
     */
    public QHDLValue coerceTo(QHDLValueType target) {
        if (target == null || target == type) {
            return this;
        }
        if (target == QHDLValueType.REAL && type == QHDLValueType.INTEGER) {
            return real(((Long) value).doubleValue());
        }
        return null;
    }

    /**
     * @return The value in QHDL literal syntax.
     */
    public String toLiteral() {
        switch (type) {
            case STRING:
                return '"' + ((String) value).replace("\"", "\"\"") + '"';
            case BOOLEAN:
                return ((Boolean) value) ? "true" : "false";
            default:
                return value.toString();
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        QHDLValue other = (QHDLValue) obj;
        return type == other.type && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type + "(" + toLiteral() + ")";
    }
}
