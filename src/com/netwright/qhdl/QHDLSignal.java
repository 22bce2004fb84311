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
 * An internal wire declared in an architecture.
 */
public class QHDLSignal extends QHDLName {

    private final String typeName;

    public QHDLSignal(String name, String typeName, QHDLLocation location) {
        super(name, location);
        this.typeName = typeName;
    }

    public QHDLSignal(String name, String typeName) {
        this(name, typeName, null);
    }

    public String getTypeName() {
        return typeName;
    }

    @Override
    public String toString() {
        return getName() + " : " + typeName;
    }
}
