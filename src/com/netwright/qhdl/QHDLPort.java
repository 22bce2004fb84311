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
 * Represents a port on an entity or component interface.
 */
public class QHDLPort extends QHDLName {

    private final QHDLDirection direction;

    private final String typeName;

    public QHDLPort(String name, QHDLDirection direction, String typeName, QHDLLocation location) {
        super(name, location);
        this.direction = direction;
        this.typeName = typeName;
    }

    public QHDLPort(String name, QHDLDirection direction, String typeName) {
        this(name, direction, typeName, null);
    }

    /**
     * @return the direction
     */
    public QHDLDirection getDirection() {
        return direction;
    }

    public boolean isInput() {
        return direction.isInput();
    }

    public boolean isOutput() {
        return direction.isOutput();
    }

    public String getTypeName() {
        return typeName;
    }

    @Override
    public String toString() {
        return getName() + " : " + direction.getKeyword() + " " + typeName;
    }
}
