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
 * One {@code formal => actual} element of a GENERIC MAP or PORT MAP. A port
 * association whose actual is the keyword {@code open} has no actual.
 */
public class QHDLAssociation {

    private final String formal;

    private final QHDLExpression actual;

    private final QHDLLocation location;

    public QHDLAssociation(String formal, QHDLExpression actual, QHDLLocation location) {
        this.formal = formal;
        this.actual = actual;
        this.location = location;
    }

    public QHDLAssociation(String formal, QHDLExpression actual) {
        this(formal, actual, null);
    }

    public static QHDLAssociation open(String formal, QHDLLocation location) {
        return new QHDLAssociation(formal, null, location);
    }

    public String getFormal() {
        return formal;
    }

    /**
     * @return The actual, or null if the formal is left open.
     */
    public QHDLExpression getActual() {
        return actual;
    }

    public boolean isOpen() {
        return actual == null;
    }

    public QHDLLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return formal + " => " + (isOpen() ? "open" : actual.toString());
    }
}
