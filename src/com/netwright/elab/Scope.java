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

/**
 * A declarative region. An architecture scope chains to the scope of its
 * entity, so names of the entity are visible inside the architecture.
 */
public class Scope {

    private final String name;

    private final Scope parent;

    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    Scope(String name, Scope parent) {
        this.name = name;
        this.parent = parent;
    }

    public String getName() {
        return name;
    }

    public Scope getParent() {
        return parent;
    }

    Symbol add(String symbolName, SymbolKind kind, Object payload, QHDLLocation location) {
        Symbol s = new Symbol(symbolName, kind, payload, this, symbols.size(), location);
        symbols.put(s.getKey(), s);
        return s;
    }

    /**
     * @param symbolName Name to look for, any case.
     * @return The symbol declared in this region only, or null.
     */
    public Symbol getLocal(String symbolName) {
        return symbols.get(QHDLName.toKey(symbolName));
    }

    /**
     * @param symbolName Name to look for, any case.
     * @return The symbol from this region or the nearest enclosing one, or null.
     */
    public Symbol find(String symbolName) {
        String key = QHDLName.toKey(symbolName);
        for (Scope s = this; s != null; s = s.parent) {
            Symbol sym = s.symbols.get(key);
            if (sym != null) {
                return sym;
            }
        }
        return null;
    }

    /**
     * @return Symbols of this region in declaration order.
     */
    public List<Symbol> getSymbols() {
        return Collections.unmodifiableList(new ArrayList<>(symbols.values()));
    }

    /**
     * @param kind Kind to filter by.
     * @return Symbols of this region of the given kind, in declaration order.
     */
    public List<Symbol> getSymbols(SymbolKind kind) {
        List<Symbol> result = new ArrayList<>();
        for (Symbol s : symbols.values()) {
            if (s.getKind() == kind) {
                result.add(s);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return parent == null ? name : parent + "/" + name;
    }
}
