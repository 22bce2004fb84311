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
 * Thrown on the first malformed construct of a QHDL source. Parsing does not
 * recover, so no partial design file is ever produced.
 */
public class QHDLParseException extends QHDLException {

    private final QHDLLocation location;

    private final String expected;

    private final String found;

    public QHDLParseException(QHDLLocation location, String expected, String found) {
        super("Parsing Error: Expected " + expected + ", encountered " + found + " at " + location + ".");
        this.location = location;
        this.expected = expected;
        this.found = found;
    }

    public QHDLParseException(QHDLToken token, String expected) {
        this(token.getLocation(), expected, token.describe());
    }

    public QHDLParseException(QHDLLocation location, String message) {
        super(message + " at " + location + ".");
        this.location = location;
        this.expected = null;
        this.found = null;
    }

    public QHDLLocation getLocation() {
        return location;
    }

    public int getLine() {
        return location.getLine();
    }

    public int getColumn() {
        return location.getColumn();
    }

    /**
     * @return What the parser was looking for, or null for lexical errors.
     */
    public String getExpected() {
        return expected;
    }

    /**
     * @return What was encountered instead, or null for lexical errors.
     */
    public String getFound() {
        return found;
    }
}
