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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

import com.netwright.elab.ArchitectureBinding.AliasEdge;
import com.netwright.elab.ArchitectureBinding.InstanceBinding;
import com.netwright.elab.ArchitectureBinding.PortConnection;
import com.netwright.qhdl.QHDLArchitecture;
import com.netwright.qhdl.QHDLComponent;
import com.netwright.qhdl.QHDLEntity;
import com.netwright.qhdl.QHDLInstance;
import com.netwright.qhdl.QHDLLibrary;
import com.netwright.qhdl.QHDLLocation;
import com.netwright.qhdl.QHDLPort;
import com.netwright.util.CodePerfTracker;

/**
 * Expands a top-level entity into a flat circuit. Every instance whose
 * component has an entity with an architecture in the library is replaced by
 * the contents of that architecture; everything else becomes a leaf. Internal
 * signals are named by their hierarchical path, and nets are found by a
 * breadth-first walk over the signals, ports and leaf ports joined by port
 * maps and assignments on all levels. The elaborator keeps no state between
 * runs, so one instance can elaborate several tops.
 */
public class Elaborator {

    private final QHDLLibrary library;

    private final ElaborationOptions options;

    private final CodePerfTracker tracker;

    public Elaborator(QHDLLibrary library, ElaborationOptions options, CodePerfTracker tracker) {
        this.library = library;
        this.options = options;
        this.tracker = tracker;
    }

    public Elaborator(QHDLLibrary library, ElaborationOptions options) {
        this(library, options, CodePerfTracker.SILENT);
    }

    public QHDLLibrary getLibrary() {
        return library;
    }

    public ElaborationOptions getOptions() {
        return options;
    }

    public ElaborationResult elaborate(String topEntityName) {
        return elaborate(topEntityName, null);
    }

    /**
     * Elaborates a top-level entity.
     * @param topEntityName Name of the entity to elaborate, any case.
     * @param selector Architecture choice for the top-level entity; null to use
     *                 the options.
     * @return The diagnostics and, if there were no errors, the flat circuit.
     */
    public ElaborationResult elaborate(String topEntityName, ArchitectureSelector selector) {
        return new Run().execute(topEntityName, selector);
    }

    /**
     * A signal or port at one position in the hierarchy, or a leaf port.
     */
    private static final class HierNode {
        private final int order;
        private final int depth;
        private final String name;
        private final FlatEndpoint endpoint;
        private final List<HierNode> neighbors = new ArrayList<>(2);
        /** Port of a composite instance associated with open */
        private boolean open;

        private HierNode(int order, int depth, String name, FlatEndpoint endpoint) {
            this.order = order;
            this.depth = depth;
            this.name = name;
            this.endpoint = endpoint;
        }
    }

    /**
     * State of a single elaboration run.
     */
    private final class Run {
        private final DiagnosticCollector diagnostics = new DiagnosticCollector();
        private final SymbolTable symbols = new SymbolTable();
        private final ConnectivityBinder binder = new ConnectivityBinder(symbols, diagnostics, options);
        private final GenericResolver resolver = new GenericResolver(diagnostics);
        private final Map<HierInstance, Map<String, HierNode>> nodes = new HashMap<>();
        private final List<HierNode> allNodes = new ArrayList<>();
        private final List<FlatInstance> leaves = new ArrayList<>();

        private ElaborationResult execute(String topEntityName, ArchitectureSelector selector) {
            QHDLEntity top = library.getEntity(topEntityName);
            if (top == null) {
                diagnostics.error(DiagnosticType.UNKNOWN_NAME, "", null, "Entity '" + topEntityName
                        + "' is not in library " + library.getName());
                return new ElaborationResult(topEntityName, diagnostics.getDiagnostics(), null);
            }
            for (QHDLArchitecture orphan : library.getOrphanArchitectures()) {
                diagnostics.warning(DiagnosticType.UNKNOWN_NAME, "", orphan.getLocation(), "Architecture "
                        + orphan.getName() + " of unknown entity " + orphan.getEntityName() + " is ignored");
            }

            tracker.start("Expand Hierarchy");
            String context = top.getName();
            HierInstance topInst = HierInstance.createTop(top.getName());
            List<QHDLPort> topPorts = new ArrayList<>();
            for (Symbol s : binder.getPortSymbols(top)) {
                QHDLPort p = s.getPayload(QHDLPort.class);
                topPorts.add(p);
                getNode(topInst, s, FlatEndpoint.topLevel(p));
            }
            Map<String, GenericBinding> generics = resolver.resolveTop(top, options.getTopGenerics(), options);
            reportUnresolved(generics, context, top.getLocation());

            QHDLArchitecture arch = null;
            if (library.isPrimitive(top.getName())) {
                diagnostics.error(DiagnosticType.UNKNOWN_NAME, context, top.getLocation(), "Entity "
                        + top.getName() + " has no architecture to elaborate");
            } else {
                arch = chooseArchitecture(top, selector, true, context, top.getLocation());
            }
            if (arch != null) {
                expand(topInst, top, arch, generics);
            }
            tracker.stop();
            if (arch == null) {
                return new ElaborationResult(top.getName(), diagnostics.getDiagnostics(), null);
            }

            tracker.start("Build Nets");
            FlatCircuit circuit = new FlatCircuit(top.getName(), arch.getName(), topPorts, leaves, buildNets());
            tracker.stop().start("Validate");
            boolean valid = new CircuitValidator(options, diagnostics).validate(circuit);
            tracker.stop();
            return new ElaborationResult(top.getName(), diagnostics.getDiagnostics(), valid ? circuit : null);
        }

        /**
         * Picks the architecture of one entity. An explicit selector wins, then
         * the per-entity selection, then the global one. Below the top, a global
         * named selection only applies to entities that have an architecture of
         * that name; other entities fall back to "only".
         */
        private QHDLArchitecture chooseArchitecture(QHDLEntity entity, ArchitectureSelector selector,
                boolean top, String context, QHDLLocation location) {
            List<QHDLArchitecture> candidates = library.getArchitectures(entity.getName());
            ArchitectureSelector sel = selector;
            if (sel == null) {
                sel = options.getArchitectureSelection(entity.getName());
            }
            if (sel == null) {
                sel = options.getArchitectureSelection();
                if (!top && !sel.isOnly() && sel.select(candidates) == null) {
                    sel = ArchitectureSelector.ONLY;
                }
            }
            QHDLArchitecture arch = sel.select(candidates);
            if (arch == null) {
                if (sel.isOnly()) {
                    List<String> names = new ArrayList<>();
                    for (QHDLArchitecture a : candidates) {
                        names.add(a.getName());
                    }
                    diagnostics.error(DiagnosticType.AMBIGUOUS_ARCHITECTURE, context, location, "Entity "
                            + entity.getName() + " has " + candidates.size() + " architectures " + names
                            + ", select one with " + ArchitectureSelector.NAMED_PREFIX + "<name>");
                } else {
                    diagnostics.error(DiagnosticType.UNKNOWN_NAME, context, location, "Entity "
                            + entity.getName() + " has no architecture named " + sel.getArchitectureName());
                }
            }
            return arch;
        }

        private void reportUnresolved(Map<String, GenericBinding> generics, String context,
                QHDLLocation location) {
            for (GenericBinding b : generics.values()) {
                if (b.getSource() == GenericBinding.Source.UNRESOLVED) {
                    diagnostics.error(DiagnosticType.UNRESOLVED_GENERIC, context, location, "Generic "
                            + b.getName() + " has neither a value nor a default");
                }
            }
        }

        private void expand(HierInstance inst, QHDLEntity entity, QHDLArchitecture arch,
                Map<String, GenericBinding> env) {
            ArchitectureBinding binding = binder.bind(entity, arch);
            for (Symbol s : binding.getScope().getSymbols(SymbolKind.SIGNAL)) {
                getNode(inst, s, null);
            }
            for (AliasEdge e : binding.getAliases()) {
                link(getNode(inst, e.getSource(), null), getNode(inst, e.getTarget(), null));
            }
            for (InstanceBinding ib : binding.getInstances()) {
                expandInstance(inst, ib, env);
            }
        }

        private void expandInstance(HierInstance parent, InstanceBinding ib, Map<String, GenericBinding> env) {
            QHDLInstance qi = ib.getInstance();
            QHDLComponent comp = ib.getComponent();
            String context = parent.getHierarchicalName(qi.getLabel());
            QHDLEntity entity = library.getEntity(comp.getName());
            if (entity != null) {
                List<String> mismatches = comp.getInterface().describeMismatches(entity.getInterface());
                if (!mismatches.isEmpty()) {
                    diagnostics.error(DiagnosticType.INTERFACE_MISMATCH, context, qi.getLocation(), "Component "
                            + comp.getName() + " does not match its entity: " + String.join("; ", mismatches));
                    return;
                }
            } else if (options.isRequireEntityForComponents()) {
                diagnostics.error(DiagnosticType.UNRESOLVED_COMPONENT, context, qi.getLocation(), "Component "
                        + comp.getName() + " has no entity in library " + library.getName());
                return;
            }

            HierInstance child = parent.getChild(qi.getLabel(), comp.getName());
            boolean leaf = entity == null || library.isPrimitive(entity.getName());
            QHDLArchitecture childArch = null;
            if (!leaf) {
                if (parent.isExpanding(entity.getName())) {
                    diagnostics.error(DiagnosticType.RECURSIVE_INSTANTIATION, context, qi.getLocation(), "Entity "
                            + entity.getName() + " is instantiated within itself: "
                            + parent.describeExpansionPath(entity.getName()));
                    return;
                }
                if (child.getDepth() > options.getMaxExpansionDepth()) {
                    diagnostics.error(DiagnosticType.EXPANSION_DEPTH_EXCEEDED, context, qi.getLocation(),
                            "Expanding " + entity.getName() + " would exceed the maximum depth of "
                            + options.getMaxExpansionDepth());
                    return;
                }
                childArch = chooseArchitecture(entity, null, false, context, qi.getLocation());
                if (childArch == null) {
                    return;
                }
            }

            Map<String, GenericBinding> generics = resolver.resolve(comp.getGenerics(),
                    entity == null ? null : entity.getInterface(), qi.getGenericMap(), env, context);
            if (leaf) {
                FlatInstance fi = new FlatInstance(child.getHierarchicalName(), comp.getName(),
                        entity == null ? null : entity.getName(), generics, comp.getPorts(), qi.getLocation());
                leaves.add(fi);
                for (PortConnection c : ib.getConnections()) {
                    HierNode endpoint = createNode(child.getDepth(), fi.getName() + HierInstance.SEPARATOR
                            + c.getFormal().getName(), FlatEndpoint.leaf(fi.getName(), c.getFormal()));
                    link(getNode(parent, c.getActual(), null), endpoint);
                }
                return;
            }
            reportUnresolved(generics, context, qi.getLocation());
            Scope childScope = binder.getEntityScope(entity);
            for (PortConnection c : ib.getConnections()) {
                Symbol inner = childScope.getLocal(c.getFormal().getName());
                if (inner != null) {
                    link(getNode(parent, c.getActual(), null), getNode(child, inner, null));
                }
            }
            for (QHDLPort p : ib.getOpenPorts()) {
                Symbol inner = childScope.getLocal(p.getName());
                if (inner != null) {
                    getNode(child, inner, null).open = true;
                }
            }
            expand(child, entity, childArch, generics);
        }

        private HierNode createNode(int depth, String name, FlatEndpoint endpoint) {
            HierNode n = new HierNode(allNodes.size(), depth, name, endpoint);
            allNodes.add(n);
            return n;
        }

        private HierNode getNode(HierInstance inst, Symbol s, FlatEndpoint endpoint) {
            Map<String, HierNode> local = nodes.computeIfAbsent(inst, k -> new HashMap<>());
            HierNode n = local.get(s.getKey());
            if (n == null) {
                n = createNode(inst.getDepth(), inst.getHierarchicalName(s.getName()), endpoint);
                local.put(s.getKey(), n);
            }
            return n;
        }

        private void link(HierNode a, HierNode b) {
            a.neighbors.add(b);
            b.neighbors.add(a);
        }

        /**
         * Groups the nodes into connected sets, keeping the sets that contain
         * at least one endpoint. Each net is named after its shallowest node,
         * the earliest created one on ties, and is open if any of its nodes is.
         */
        private List<FlatNet> buildNets() {
            List<FlatNet> nets = new ArrayList<>();
            boolean[] visited = new boolean[allNodes.size()];
            Queue<HierNode> queue = new ArrayDeque<>();
            for (HierNode start : allNodes) {
                if (visited[start.order]) {
                    continue;
                }
                List<HierNode> members = new ArrayList<>();
                visited[start.order] = true;
                queue.add(start);
                while (!queue.isEmpty()) {
                    HierNode n = queue.poll();
                    members.add(n);
                    for (HierNode m : n.neighbors) {
                        if (!visited[m.order]) {
                            visited[m.order] = true;
                            queue.add(m);
                        }
                    }
                }
                members.sort(Comparator.comparingInt(n -> n.order));
                HierNode representative = null;
                List<FlatEndpoint> endpoints = new ArrayList<>();
                boolean open = false;
                for (HierNode n : members) {
                    if (n.endpoint != null) {
                        endpoints.add(n.endpoint);
                    }
                    open |= n.open;
                    if (representative == null || n.depth < representative.depth) {
                        representative = n;
                    }
                }
                if (!endpoints.isEmpty()) {
                    nets.add(new FlatNet(representative.name, endpoints, open));
                }
            }
            return nets;
        }
    }
}
