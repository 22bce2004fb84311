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

import com.netwright.qhdl.QHDLLocation;
import com.netwright.qhdl.QHDLName;

/**
 * A name declared in a {@link Scope}, together with its kind and the
 * declaration it stands for (a QHDLGeneric, QHDLPort, QHDLSignal,
 * QHDLComponent or QHDLInstance).
 */
public class Symbol extends QHDLName {

    private final SymbolKind kind;

    private final Object payload;

    private final Scope scope;

    /** Position among the symbols of its scope */
    private final int index;

    Symbol(String name, SymbolKind kind, Object payload, Scope scope, int index, QHDLLocation location) {
        super(name, location);
        this.kind = kind;
        this.payload = payload;
        this.scope = scope;
        this.index = index;
    }

    public SymbolKind getKind() {
        return kind;
    }

    public Object getPayload() {
        return payload;
    }

    /**
     * @param type Expected class of the payload.
     * @return The payload cast to the given class.
     * @throws ClassCastException if the payload is of another class
     */
    public <T> T getPayload(Class<T> type) {
        return type.cast(payload);
    }

    public Scope getScope() {
        return scope;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj;
    }

    @Override
    public String toString() {
        return kind.getDescription() + " " + getName();
    }
}
