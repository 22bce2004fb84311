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
import java.util.List;

import com.netwright.qhdl.QHDLArchitecture;
import com.netwright.qhdl.QHDLComponent;
import com.netwright.qhdl.QHDLEntity;
import com.netwright.qhdl.QHDLInstance;
import com.netwright.qhdl.QHDLLocation;
import com.netwright.qhdl.QHDLName;
import com.netwright.qhdl.QHDLPort;

/**
 * The resolved connectivity of one architecture: each instance with its
 * component and port connections, plus the alias edges from signal
 * assignments. Computed once per architecture and shared by every instance of
 * its entity, since nothing in it depends on generic values.
 */
public class ArchitectureBinding {

    /**
     * One formal port of an instance wired to a signal or port of the
     * enclosing architecture.
     */
    public static class PortConnection {
        private final QHDLPort formal;
        private final Symbol actual;

        public PortConnection(QHDLPort formal, Symbol actual) {
            this.formal = formal;
            this.actual = actual;
        }

        public QHDLPort getFormal() {
            return formal;
        }

        /**
         * @return A symbol of kind {@link SymbolKind#SIGNAL} or {@link SymbolKind#PORT}.
         */
        public Symbol getActual() {
            return actual;
        }

        @Override
        public String toString() {
            return formal.getName() + " => " + actual.getName();
        }
    }

    /**
     * A resolved instantiation statement.
     */
    public static class InstanceBinding {
        private final QHDLInstance instance;
        private final QHDLComponent component;
        private final List<PortConnection> connections = new ArrayList<>();
        private final List<QHDLPort> openPorts = new ArrayList<>();
        private final List<QHDLPort> unconnectedPorts = new ArrayList<>();

        public InstanceBinding(QHDLInstance instance, QHDLComponent component) {
            this.instance = instance;
            this.component = component;
        }

        public QHDLInstance getInstance() {
            return instance;
        }

        public String getLabel() {
            return instance.getLabel();
        }

        public QHDLComponent getComponent() {
            return component;
        }

        public List<PortConnection> getConnections() {
            return Collections.unmodifiableList(connections);
        }

        /**
         * @return Ports associated with the keyword open.
         */
        public List<QHDLPort> getOpenPorts() {
            return Collections.unmodifiableList(openPorts);
        }

        /**
         * @return Ports missing from the port map altogether.
         */
        public List<QHDLPort> getUnconnectedPorts() {
            return Collections.unmodifiableList(unconnectedPorts);
        }

        void addConnection(PortConnection c) {
            connections.add(c);
        }

        void addOpenPort(QHDLPort p) {
            openPorts.add(p);
        }

        void addUnconnectedPort(QHDLPort p) {
            unconnectedPorts.add(p);
        }
    }

    /**
     * A signal assignment: the source drives the target, both become one net.
     */
    public static class AliasEdge {
        private final Symbol source;
        private final Symbol target;
        private final QHDLLocation location;

        public AliasEdge(Symbol source, Symbol target, QHDLLocation location) {
            this.source = source;
            this.target = target;
            this.location = location;
        }

        public Symbol getSource() {
            return source;
        }

        public Symbol getTarget() {
            return target;
        }

        public QHDLLocation getLocation() {
            return location;
        }

        @Override
        public String toString() {
            return target.getName() + " <= " + source.getName();
        }
    }

    private final QHDLEntity entity;

    private final QHDLArchitecture architecture;

    private final Scope scope;

    private final List<InstanceBinding> instances = new ArrayList<>();

    private final List<AliasEdge> aliases = new ArrayList<>();

    public ArchitectureBinding(QHDLEntity entity, QHDLArchitecture architecture, Scope scope) {
        this.entity = entity;
        this.architecture = architecture;
        this.scope = scope;
    }

    public QHDLEntity getEntity() {
        return entity;
    }

    public QHDLArchitecture getArchitecture() {
        return architecture;
    }

    /**
     * @return The architecture's scope; its parent holds the entity's generics and ports.
     */
    public Scope getScope() {
        return scope;
    }

    public List<InstanceBinding> getInstances() {
        return Collections.unmodifiableList(instances);
    }

    public InstanceBinding getInstance(String label) {
        for (InstanceBinding ib : instances) {
            if (ib.getInstance().getKey().equals(QHDLName.toKey(label))) {
                return ib;
            }
        }
        return null;
    }

    public List<AliasEdge> getAliases() {
        return Collections.unmodifiableList(aliases);
    }

    void addInstance(InstanceBinding ib) {
        instances.add(ib);
    }

    void addAlias(AliasEdge e) {
        aliases.add(e);
    }

    /**
     * @return "entity(architecture)", used as diagnostic context.
     */
    public String getDescription() {
        return describe(entity, architecture);
    }

    static String describe(QHDLEntity entity, QHDLArchitecture architecture) {
        return entity.getName() + "(" + architecture.getName() + ")";
    }

    @Override
    public String toString() {
        return getDescription();
    }
}
