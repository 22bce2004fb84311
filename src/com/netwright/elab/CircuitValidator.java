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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

/**
 * Structural checks over a flat circuit: one driver per net, a driver for
 * every receiver not left open by a port map, every top-level port connected, every leaf generic bound
 * and, on request, no feedback loop between leaf instances.
 */
public class CircuitValidator {

    private final ElaborationOptions options;

    private final DiagnosticCollector diagnostics;

    public CircuitValidator(ElaborationOptions options, DiagnosticCollector diagnostics) {
        this.options = options;
        this.diagnostics = diagnostics;
    }

    /**
     * Runs all checks and reports what they find.
     * @param circuit The circuit to check.
     * @return True if no error was reported by this validation.
     */
    public boolean validate(FlatCircuit circuit) {
        int errorsBefore = diagnostics.getErrorCount();
        Set<FlatEndpoint> reported = new HashSet<>();
        checkTopLevelPorts(circuit, reported);
        checkDrivers(circuit, reported);
        checkGenerics(circuit);
        if (!options.isAllowFeedback()) {
            checkFeedback(circuit);
        }
        return diagnostics.getErrorCount() == errorsBefore;
    }

    private void checkTopLevelPorts(FlatCircuit circuit, Set<FlatEndpoint> reported) {
        String context = circuit.getTopEntityName();
        for (FlatEndpoint e : circuit.getTopLevelEndpoints()) {
            FlatNet net = circuit.getNet(e);
            if (net == null || net.getEndpoints().size() < 2) {
                reported.add(e);
                diagnostics.report(options.getUnconnectedPortSeverity(), DiagnosticType.UNCONNECTED_PORT,
                        context, null, "Top-level " + e.getDirection().getKeyword() + " port " + e.getName()
                        + " is not connected to anything");
            }
        }
    }

    private void checkDrivers(FlatCircuit circuit, Set<FlatEndpoint> reported) {
        for (FlatNet net : circuit.getNets()) {
            List<FlatEndpoint> drivers = net.getDrivers();
            if (drivers.size() > 1) {
                String message = "Net " + net.getName() + " has " + drivers.size() + " drivers " + drivers;
                if (options.isAllowMultiDriver()) {
                    diagnostics.warning(DiagnosticType.MULTIPLE_DRIVERS, net.getName(), null, message);
                } else {
                    diagnostics.error(DiagnosticType.MULTIPLE_DRIVERS, net.getName(), null, message);
                }
            } else if (drivers.isEmpty() && !net.isOpen()) {
                for (FlatEndpoint r : net.getReceivers()) {
                    if (reported.add(r)) {
                        diagnostics.report(options.getUnconnectedPortSeverity(), DiagnosticType.UNCONNECTED_PORT,
                                net.getName(), null, (r.isTopLevel() ? "Top-level port " : "Port ") + r.getName()
                                + " is not driven by anything");
                    }
                }
            }
        }
    }

    private void checkGenerics(FlatCircuit circuit) {
        for (FlatInstance i : circuit.getInstances()) {
            for (GenericBinding b : i.getGenericBindings()) {
                if (b.getSource() == GenericBinding.Source.UNRESOLVED) {
                    diagnostics.error(DiagnosticType.UNRESOLVED_GENERIC, i.getName(), i.getLocation(), "Generic "
                            + b.getName() + " of " + i.getTypeName() + " has neither a value nor a default");
                }
            }
        }
    }

    /**
     * Builds the leaf instance graph (an edge for every leaf output reaching a
     * leaf input) and reports the instances that lie on a cycle.
     */
    private void checkFeedback(FlatCircuit circuit) {
        Graph<String, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (FlatInstance i : circuit.getInstances()) {
            graph.addVertex(i.getName());
        }
        for (FlatEdge e : circuit.getEdges()) {
            if (e.getDriver().isTopLevel()) {
                continue;
            }
            for (FlatEndpoint r : e.getReceivers()) {
                if (!r.isTopLevel()) {
                    graph.addEdge(e.getDriver().getInstanceName(), r.getInstanceName());
                }
            }
        }
        CycleDetector<String, DefaultEdge> cycleDetector = new CycleDetector<>(graph);
        if (cycleDetector.detectCycles()) {
            List<String> involved = new ArrayList<>(cycleDetector.findCycles());
            Collections.sort(involved);
            diagnostics.error(DiagnosticType.COMBINATIONAL_CYCLE, circuit.getTopEntityName(), null,
                    "Feedback loop through leaf instances " + involved);
        }
    }
}
