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
 * A concurrent signal assignment {@code target <= source}. It only aliases
 * two wires; the source drives the target.
 */
public class QHDLAssignment {

    private final String target;

    private final String source;

    private final QHDLLocation location;

    public QHDLAssignment(String target, String source, QHDLLocation location) {
        this.target = target;
        this.source = source;
        this.location = location;
    }

    public QHDLAssignment(String target, String source) {
        this(target, source, null);
    }

    public String getTarget() {
        return target;
    }

    public String getSource() {
        return source;
    }

    public QHDLLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return target + " <= " + source;
    }
}
