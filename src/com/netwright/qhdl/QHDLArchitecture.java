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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One structural implementation of an entity: its component declarations,
 * signals, instantiation statements and signal assignments, each kept in
 * declaration order.
 */
public class QHDLArchitecture extends QHDLName {

    private final String entityName;

    private final List<QHDLComponent> components;

    private final List<QHDLSignal> signals;

    private final List<QHDLInstance> instances;

    private final List<QHDLAssignment> assignments;

    public QHDLArchitecture(String name, String entityName, List<QHDLComponent> components,
                            List<QHDLSignal> signals, List<QHDLInstance> instances,
                            List<QHDLAssignment> assignments, QHDLLocation location) {
        super(name, location);
        this.entityName = entityName;
        this.components = Collections.unmodifiableList(new ArrayList<>(components));
        this.signals = Collections.unmodifiableList(new ArrayList<>(signals));
        this.instances = Collections.unmodifiableList(new ArrayList<>(instances));
        this.assignments = Collections.unmodifiableList(new ArrayList<>(assignments));
    }

    public String getEntityName() {
        return entityName;
    }

    public String getEntityKey() {
        return toKey(entityName);
    }

    public List<QHDLComponent> getComponents() {
        return components;
    }

    public List<QHDLSignal> getSignals() {
        return signals;
    }

    public List<QHDLInstance> getInstances() {
        return instances;
    }

    public List<QHDLAssignment> getAssignments() {
        return assignments;
    }

    /**
     * @param name A component name, any case.
     * @return The first component declared under that name, or null.
     */
    public QHDLComponent getComponent(String name) {
        for (QHDLComponent c : components) {
            if (sameName(c.getName(), name)) {
                return c;
            }
        }
        return null;
    }

    public QHDLInstance getInstance(String label) {
        for (QHDLInstance i : instances) {
            if (sameName(i.getName(), label)) {
                return i;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return getName() + " of " + entityName;
    }
}
