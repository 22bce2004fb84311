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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.netwright.qhdl.QHDLLocation;
import com.netwright.qhdl.QHDLName;
import com.netwright.qhdl.QHDLPort;
import com.netwright.qhdl.QHDLValue;

/**
 * A leaf of the flat circuit: an instance of a component that has no
 * architecture to expand, with its generics bound.
 */
public class FlatInstance {

    private final String name;

    private final String componentName;

    private final String entityName;

    private final Map<String, GenericBinding> generics;

    private final List<QHDLPort> ports;

    private final QHDLLocation location;

    /**
     * @param name Hierarchical instance name.
     * @param componentName Component the instance was declared with.
     * @param entityName Entity behind the component, null if the library has none.
     * @param generics Bindings keyed by generic key, in declaration order.
     * @param ports Ports of the component.
     * @param location Instantiation statement.
     */
    public FlatInstance(String name, String componentName, String entityName, Map<String, GenericBinding> generics,
            List<QHDLPort> ports, QHDLLocation location) {
        this.name = name;
        this.componentName = componentName;
        this.entityName = entityName;
        this.generics = Collections.unmodifiableMap(new LinkedHashMap<>(generics));
        this.ports = Collections.unmodifiableList(new ArrayList<>(ports));
        this.location = location;
    }

    public String getName() {
        return name;
    }

    public String getComponentName() {
        return componentName;
    }

    /**
     * @return The entity name, or null for a component with no entity in the library.
     */
    public String getEntityName() {
        return entityName;
    }

    /**
     * @return Entity name if known, otherwise the component name.
     */
    public String getTypeName() {
        return entityName != null ? entityName : componentName;
    }

    public List<GenericBinding> getGenericBindings() {
        return new ArrayList<>(generics.values());
    }

    public GenericBinding getGenericBinding(String genericName) {
        return generics.get(QHDLName.toKey(genericName));
    }

    /**
     * @param genericName Generic name, any case.
     * @return The bound value, or null if the generic is unknown or has no value.
     */
    public QHDLValue getGenericValue(String genericName) {
        GenericBinding b = getGenericBinding(genericName);
        return b == null ? null : b.getValue();
    }

    /**
     * @return Generic name to value, for the generics that have one.
     */
    public Map<String, QHDLValue> getGenericValues() {
        Map<String, QHDLValue> values = new LinkedHashMap<>();
        for (GenericBinding b : generics.values()) {
            if (b.isResolved()) {
                values.put(b.getName(), b.getValue());
            }
        }
        return values;
    }

    public List<QHDLPort> getPorts() {
        return ports;
    }

    public QHDLPort getPort(String portName) {
        for (QHDLPort p : ports) {
            if (QHDLName.sameName(p.getName(), portName)) {
                return p;
            }
        }
        return null;
    }

    /**
     * @param portName Port name, any case.
     * @return The endpoint for the port, or null if the instance has no such port.
     */
    public FlatEndpoint getEndpoint(String portName) {
        QHDLPort p = getPort(portName);
        return p == null ? null : FlatEndpoint.leaf(name, p);
    }

    public QHDLLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return name + " : " + getTypeName() + (generics.isEmpty() ? "" : " " + getGenericValues());
    }
}
