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

import com.netwright.qhdl.QHDLDuplicateNameException;
import com.netwright.qhdl.QHDLLocation;
import com.netwright.qhdl.QHDLUnknownNameException;

/**
 * Creates scopes and declares and resolves names in them. QHDL has one
 * namespace per declarative region, and no name may be redeclared anywhere
 * along a scope chain, so an architecture cannot hide a port or generic of
 * its entity.
 */
public class SymbolTable {

    private int scopeCount = 0;

    public Scope createScope(String name, Scope parent) {
        scopeCount++;
        return new Scope(name, parent);
    }

    public int getScopeCount() {
        return scopeCount;
    }

    /**
     * Declares a name.
     * @param scope Region to declare in.
     * @param name The name as written.
     * @param kind What the name stands for.
     * @param payload The declaration object.
     * @param location Where the declaration is, may be null.
     * @return The new symbol.
     * @throws QHDLDuplicateNameException if the name is already visible from the scope
     */
    public Symbol declare(Scope scope, String name, SymbolKind kind, Object payload, QHDLLocation location) {
        Symbol existing = scope.find(name);
        if (existing != null) {
            throw new QHDLDuplicateNameException(name, "ERROR: " + kind.getDescription() + " " + name
                    + describe(location) + " conflicts with " + existing + describe(existing.getLocation())
                    + " in " + existing.getScope().getName() + ".");
        }
        return scope.add(name, kind, payload, location);
    }

    /**
     * Resolves a name.
     * @param scope Region to resolve from.
     * @param name The name, any case.
     * @return The visible symbol.
     * @throws QHDLUnknownNameException if the name is not visible from the scope
     */
    public Symbol lookup(Scope scope, String name) {
        Symbol s = scope.find(name);
        if (s == null) {
            throw new QHDLUnknownNameException(name, "ERROR: '" + name + "' is not declared in "
                    + scope.getName() + ".");
        }
        return s;
    }

    /**
     * @return The visible symbol, or null.
     */
    public Symbol find(Scope scope, String name) {
        return scope.find(name);
    }

    private static String describe(QHDLLocation location) {
        return location == null ? "" : " (" + location + ")";
    }
}
