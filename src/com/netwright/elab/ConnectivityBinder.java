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

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.netwright.elab.ArchitectureBinding.AliasEdge;
import com.netwright.elab.ArchitectureBinding.InstanceBinding;
import com.netwright.elab.ArchitectureBinding.PortConnection;
import com.netwright.qhdl.QHDLArchitecture;
import com.netwright.qhdl.QHDLAssignment;
import com.netwright.qhdl.QHDLAssociation;
import com.netwright.qhdl.QHDLComponent;
import com.netwright.qhdl.QHDLDuplicateNameException;
import com.netwright.qhdl.QHDLEntity;
import com.netwright.qhdl.QHDLExpression;
import com.netwright.qhdl.QHDLGeneric;
import com.netwright.qhdl.QHDLInstance;
import com.netwright.qhdl.QHDLLocation;
import com.netwright.qhdl.QHDLName;
import com.netwright.qhdl.QHDLPort;
import com.netwright.qhdl.QHDLSignal;

/**
 * Populates the symbol table for entities and architectures and resolves every
 * port map and signal assignment against it. Bindings are cached per
 * architecture, so each architecture is checked, and its problems reported,
 * only once per elaboration run however often it is instantiated.
 */
public class ConnectivityBinder {

    private final SymbolTable symbols;

    private final DiagnosticCollector diagnostics;

    private final ElaborationOptions options;

    private final Map<String, Scope> entityScopes = new HashMap<>();

    private final Map<String, ArchitectureBinding> bindings = new HashMap<>();

    public ConnectivityBinder(SymbolTable symbols, DiagnosticCollector diagnostics, ElaborationOptions options) {
        this.symbols = symbols;
        this.diagnostics = diagnostics;
        this.options = options;
    }

    /**
     * @return The scope holding the entity's generics and ports, created on first use.
     */
    public Scope getEntityScope(QHDLEntity entity) {
        Scope scope = entityScopes.get(entity.getKey());
        if (scope == null) {
            scope = symbols.createScope("entity " + entity.getName(), null);
            String context = entity.getName();
            for (QHDLGeneric g : entity.getGenerics()) {
                declare(scope, g.getName(), SymbolKind.GENERIC, g, g.getLocation(), context);
            }
            for (QHDLPort p : entity.getPorts()) {
                declare(scope, p.getName(), SymbolKind.PORT, p, p.getLocation(), context);
            }
            entityScopes.put(entity.getKey(), scope);
        }
        return scope;
    }

    /**
     * Resolves an architecture of an entity, or returns the cached result.
     * @param entity The entity the architecture implements.
     * @param arch The architecture.
     * @return The resolved connectivity.
     */
    public ArchitectureBinding bind(QHDLEntity entity, QHDLArchitecture arch) {
        String cacheKey = entity.getKey() + "/" + arch.getKey();
        ArchitectureBinding binding = bindings.get(cacheKey);
        if (binding == null) {
            binding = doBind(entity, arch);
            bindings.put(cacheKey, binding);
        }
        return binding;
    }

    public int getBoundArchitectureCount() {
        return bindings.size();
    }

    private Symbol declare(Scope scope, String name, SymbolKind kind, Object payload, QHDLLocation location,
            String context) {
        try {
            return symbols.declare(scope, name, kind, payload, location);
        } catch (QHDLDuplicateNameException e) {
            diagnostics.error(DiagnosticType.DUPLICATE_NAME, context, location, e.getMessage());
            return null;
        }
    }

    private ArchitectureBinding doBind(QHDLEntity entity, QHDLArchitecture arch) {
        String context = ArchitectureBinding.describe(entity, arch);
        Scope scope = symbols.createScope("architecture " + arch.getName() + " of " + entity.getName(),
                getEntityScope(entity));
        ArchitectureBinding binding = new ArchitectureBinding(entity, arch, scope);

        for (QHDLComponent c : arch.getComponents()) {
            if (declare(scope, c.getName(), SymbolKind.COMPONENT, c, c.getLocation(), context) != null) {
                checkComponentInterface(c, context);
            }
        }
        for (QHDLSignal s : arch.getSignals()) {
            declare(scope, s.getName(), SymbolKind.SIGNAL, s, s.getLocation(), context);
        }
        Set<QHDLInstance> declaredInstances = Collections.newSetFromMap(new IdentityHashMap<>());
        for (QHDLInstance inst : arch.getInstances()) {
            if (declare(scope, inst.getLabel(), SymbolKind.INSTANCE, inst, inst.getLocation(), context) != null) {
                declaredInstances.add(inst);
            }
        }

        for (QHDLInstance inst : arch.getInstances()) {
            if (!declaredInstances.contains(inst)) {
                continue;
            }
            InstanceBinding ib = bindInstance(scope, inst, context);
            if (ib != null) {
                binding.addInstance(ib);
            }
        }
        for (QHDLAssignment a : arch.getAssignments()) {
            AliasEdge e = bindAssignment(scope, a, context);
            if (e != null) {
                binding.addAlias(e);
            }
        }
        return binding;
    }

    private void checkComponentInterface(QHDLComponent c, String context) {
        Scope componentScope = symbols.createScope("component " + c.getName(), null);
        for (QHDLGeneric g : c.getGenerics()) {
            declare(componentScope, g.getName(), SymbolKind.GENERIC, g, g.getLocation(), context);
        }
        for (QHDLPort p : c.getPorts()) {
            declare(componentScope, p.getName(), SymbolKind.PORT, p, p.getLocation(), context);
        }
    }

    private InstanceBinding bindInstance(Scope scope, QHDLInstance inst, String context) {
        String instContext = context + " " + inst.getLabel();
        Symbol compSym = symbols.find(scope, inst.getComponentName());
        if (compSym == null || compSym.getKind() != SymbolKind.COMPONENT) {
            diagnostics.error(DiagnosticType.UNKNOWN_NAME, instContext, inst.getLocation(), "Component '"
                    + inst.getComponentName() + "' is not declared in " + scope.getName());
            return null;
        }
        QHDLComponent comp = compSym.getPayload(QHDLComponent.class);
        InstanceBinding ib = new InstanceBinding(inst, comp);
        Set<String> seen = new HashSet<>();
        for (QHDLAssociation a : inst.getPortMap()) {
            QHDLPort formal = comp.getPort(a.getFormal());
            if (formal == null) {
                diagnostics.error(DiagnosticType.UNKNOWN_NAME, instContext, a.getLocation(), "Port map names '"
                        + a.getFormal() + "', which component " + comp.getName() + " does not declare");
                continue;
            }
            if (!seen.add(formal.getKey())) {
                diagnostics.error(DiagnosticType.DUPLICATE_NAME, instContext, a.getLocation(), "Port '"
                        + formal.getName() + "' is associated more than once");
                continue;
            }
            if (a.isOpen()) {
                ib.addOpenPort(formal);
                continue;
            }
            QHDLExpression actualExpr = a.getActual();
            if (!actualExpr.isReference()) {
                diagnostics.error(DiagnosticType.UNKNOWN_CONNECTION, instContext, a.getLocation(), "Port '"
                        + formal.getName() + "' must be associated with a signal or port, not " + actualExpr);
                continue;
            }
            String actualName = ((QHDLExpression.Reference) actualExpr).getName();
            Symbol actual = resolveConnectable(scope, actualName, a.getLocation(), instContext);
            if (actual == null) {
                continue;
            }
            checkTypes(formal.getTypeName(), "port " + inst.getLabel() + "." + formal.getName(), actual,
                    a.getLocation(), instContext);
            if (actual.getKind() == SymbolKind.PORT) {
                QHDLPort outer = actual.getPayload(QHDLPort.class);
                if (formal.isOutput() && outer.isInput()) {
                    diagnostics.error(DiagnosticType.DIRECTION_MISMATCH, instContext, a.getLocation(),
                            "Output " + inst.getLabel() + "." + formal.getName() + " cannot drive input port "
                            + outer.getName());
                } else if (formal.isInput() && outer.isOutput()) {
                    diagnostics.error(DiagnosticType.DIRECTION_MISMATCH, instContext, a.getLocation(),
                            "Input " + inst.getLabel() + "." + formal.getName() + " cannot read output port "
                            + outer.getName());
                }
            }
            ib.addConnection(new PortConnection(formal, actual));
        }
        for (QHDLPort p : comp.getPorts()) {
            if (!seen.contains(p.getKey())) {
                ib.addUnconnectedPort(p);
                diagnostics.report(options.getUnconnectedPortSeverity(), DiagnosticType.UNCONNECTED_PORT,
                        instContext, inst.getLocation(), "Port " + inst.getLabel() + "." + p.getName()
                        + " is neither mapped nor open");
            }
        }
        return ib;
    }

    private AliasEdge bindAssignment(Scope scope, QHDLAssignment a, String context) {
        Symbol target = resolveConnectable(scope, a.getTarget(), a.getLocation(), context);
        Symbol source = resolveConnectable(scope, a.getSource(), a.getLocation(), context);
        if (target == null || source == null) {
            return null;
        }
        if (target.getKind() == SymbolKind.PORT && target.getPayload(QHDLPort.class).isInput()) {
            diagnostics.error(DiagnosticType.DIRECTION_MISMATCH, context, a.getLocation(), "Input port "
                    + target.getName() + " cannot be assigned");
        }
        if (source.getKind() == SymbolKind.PORT && source.getPayload(QHDLPort.class).isOutput()) {
            diagnostics.error(DiagnosticType.DIRECTION_MISMATCH, context, a.getLocation(), "Output port "
                    + source.getName() + " cannot be read");
        }
        checkTypes(typeOf(target), target.toString(), source, a.getLocation(), context);
        return new AliasEdge(source, target, a.getLocation());
    }

    private Symbol resolveConnectable(Scope scope, String name, QHDLLocation location, String context) {
        Symbol s = symbols.find(scope, name);
        if (s == null) {
            diagnostics.error(DiagnosticType.UNKNOWN_CONNECTION, context, location, "'" + name
                    + "' is not a signal or port of " + scope.getName());
            return null;
        }
        if (!s.getKind().isConnectable()) {
            diagnostics.error(DiagnosticType.UNKNOWN_CONNECTION, context, location, "'" + name + "' is a "
                    + s.getKind().getDescription() + ", not a signal or port");
            return null;
        }
        return s;
    }

    private void checkTypes(String expectedType, String what, Symbol actual, QHDLLocation location,
            String context) {
        String actualType = typeOf(actual);
        if (!QHDLName.sameName(expectedType, actualType)) {
            diagnostics.error(DiagnosticType.TYPE_MISMATCH, context, location, what + " of type " + expectedType
                    + " is connected to " + actual + " of type " + actualType);
        }
    }

    static String typeOf(Symbol connectable) {
        Object payload = connectable.getPayload();
        if (payload instanceof QHDLPort) {
            return ((QHDLPort) payload).getTypeName();
        }
        return ((QHDLSignal) payload).getTypeName();
    }

    /**
     * @return Ports of the entity in declaration order, as symbols of its scope.
     */
    public List<Symbol> getPortSymbols(QHDLEntity entity) {
        return getEntityScope(entity).getSymbols(SymbolKind.PORT);
    }
}
