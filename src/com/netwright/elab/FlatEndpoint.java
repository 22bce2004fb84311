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

package com.netwright.elab;

import java.util.Objects;

import com.netwright.qhdl.QHDLDirection;
import com.netwright.qhdl.QHDLName;
import com.netwright.qhdl.QHDLPort;

/**
 * A connection point of the flat circuit: either a port of a leaf instance
 * or a port of the top-level entity. Seen from the nets, a top-level input
 * and a leaf output drive; a top-level output and a leaf input receive.
 */
public final class FlatEndpoint {

    /** Hierarchical leaf name, null for a top-level port */
    private final String instanceName;

    private final String portName;

    private final QHDLDirection direction;

    private final String typeName;

    public FlatEndpoint(String instanceName, String portName, QHDLDirection direction, String typeName) {
        this.instanceName = instanceName;
        this.portName = Objects.requireNonNull(portName);
        this.direction = Objects.requireNonNull(direction);
        this.typeName = typeName;
    }

    public static FlatEndpoint topLevel(QHDLPort port) {
        return new FlatEndpoint(null, port.getName(), port.getDirection(), port.getTypeName());
    }

    public static FlatEndpoint leaf(String instanceName, QHDLPort port) {
        return new FlatEndpoint(Objects.requireNonNull(instanceName), port.getName(), port.getDirection(),
                port.getTypeName());
    }

    public boolean isTopLevel() {
        return instanceName == null;
    }

    /**
     * @return The hierarchical name of the leaf instance, or null for a top-level port.
     */
    public String getInstanceName() {
        return instanceName;
    }

    public String getPortName() {
        return portName;
    }

    public QHDLDirection getDirection() {
        return direction;
    }

    public String getTypeName() {
        return typeName;
    }

    public boolean isDriver() {
        return isTopLevel() ? direction.isInput() : direction.isOutput();
    }

    public boolean isReceiver() {
        return !isDriver();
    }

    /**
     * @return "instance.port" for leaf ports, the bare port name at the top.
     */
    public String getName() {
        return isTopLevel() ? portName : instanceName + HierInstance.SEPARATOR + portName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlatEndpoint that = (FlatEndpoint) o;
        return QHDLName.toKey(getName()).equals(QHDLName.toKey(that.getName()))
                && isTopLevel() == that.isTopLevel();
    }

    @Override
    public int hashCode() {
        return Objects.hash(QHDLName.toKey(getName()), isTopLevel());
    }

    @Override
    public String toString() {
        return getName();
    }
}
