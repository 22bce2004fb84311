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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.netwright.qhdl.QHDLName;
import com.netwright.qhdl.QHDLPort;

/**
 * The result of elaborating a top-level entity: leaf instances with bound
 * generics, the nets joining their ports and the ports of the top-level
 * entity, and the driver to receivers edges derived from those nets. A
 * circuit is never modified after construction.
 */
public class FlatCircuit {

    private final String topEntityName;

    private final String architectureName;

    private final List<QHDLPort> topPorts;

    private final List<FlatInstance> instances;

    private final Map<String, FlatInstance> instanceMap = new LinkedHashMap<>();

    private final List<FlatNet> nets;

    private final Map<String, FlatNet> netMap = new LinkedHashMap<>();

    private final Map<FlatEndpoint, FlatNet> endpointNets = new HashMap<>();

    private final List<FlatEdge> edges = new ArrayList<>();

    public FlatCircuit(String topEntityName, String architectureName, List<QHDLPort> topPorts,
            List<FlatInstance> instances, List<FlatNet> nets) {
        this.topEntityName = topEntityName;
        this.architectureName = architectureName;
        this.topPorts = Collections.unmodifiableList(new ArrayList<>(topPorts));
        this.instances = Collections.unmodifiableList(new ArrayList<>(instances));
        this.nets = Collections.unmodifiableList(new ArrayList<>(nets));
        for (FlatInstance i : instances) {
            instanceMap.put(QHDLName.toKey(i.getName()), i);
        }
        for (FlatNet n : nets) {
            netMap.put(QHDLName.toKey(n.getName()), n);
            for (FlatEndpoint e : n.getEndpoints()) {
                endpointNets.put(e, n);
            }
            List<FlatEndpoint> receivers = n.getReceivers();
            for (FlatEndpoint d : n.getDrivers()) {
                edges.add(new FlatEdge(d, receivers, n.getName()));
            }
        }
    }

    public String getTopEntityName() {
        return topEntityName;
    }

    public String getArchitectureName() {
        return architectureName;
    }

    public List<QHDLPort> getTopPorts() {
        return topPorts;
    }

    public List<FlatEndpoint> getTopLevelEndpoints() {
        List<FlatEndpoint> endpoints = new ArrayList<>(topPorts.size());
        for (QHDLPort p : topPorts) {
            endpoints.add(FlatEndpoint.topLevel(p));
        }
        return endpoints;
    }

    public List<FlatInstance> getInstances() {
        return instances;
    }

    /**
     * @param hierarchicalName Dotted instance name, any case.
     * @return The leaf instance, or null.
     */
    public FlatInstance getInstance(String hierarchicalName) {
        return instanceMap.get(QHDLName.toKey(hierarchicalName));
    }

    public List<FlatNet> getNets() {
        return nets;
    }

    public FlatNet getNet(String name) {
        return netMap.get(QHDLName.toKey(name));
    }

    /**
     * @param endpoint A leaf or top-level port.
     * @return The net the endpoint is on, or null if it is not connected.
     */
    public FlatNet getNet(FlatEndpoint endpoint) {
        return endpointNets.get(endpoint);
    }

    /**
     * @return One edge per driver, in net order.
     */
    public List<FlatEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    /**
     * Counts the nets an endpoint appears on. Elaboration places every
     * connected endpoint on exactly one net.
     * @param endpoint The endpoint to look for.
     * @return Number of occurrences over all nets.
     */
    public int countOccurrences(FlatEndpoint endpoint) {
        int count = 0;
        for (FlatNet n : nets) {
            for (FlatEndpoint e : n.getEndpoints()) {
                if (e.equals(endpoint)) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Describes the connectivity independent of declaration and net order,
     * for comparing two circuits.
     * @return Driver endpoint name to the sorted names of its receivers.
     */
    public Map<String, Set<String>> getConnectivity() {
        Map<String, Set<String>> connectivity = new TreeMap<>();
        for (FlatEdge e : edges) {
            Set<String> receivers = connectivity.computeIfAbsent(e.getDriver().getName(), k -> new TreeSet<>());
            for (FlatEndpoint r : e.getReceivers()) {
                receivers.add(r.getName());
            }
        }
        return connectivity;
    }

    @Override
    public String toString() {
        return topEntityName + "(" + architectureName + "): " + instances.size() + " leaf instances, "
                + nets.size() + " nets, " + edges.size() + " edges";
    }
}
