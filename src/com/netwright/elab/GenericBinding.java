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

import com.netwright.qhdl.QHDLGeneric;
import com.netwright.qhdl.QHDLValue;

/**
 * The outcome of binding one declared generic of an instance.
 */
public class GenericBinding {

    /**
     * Where the value of a generic came from.
     */
    public enum Source {
        /** Evaluated from the instance's generic map (or a top-level override) */
        MAPPED,
        /** The declared default */
        DEFAULT,
        /** Neither mapped nor defaulted */
        UNRESOLVED,
        /** Mapped, but the expression failed to evaluate or to match the declared type */
        INVALID
    }

    private final QHDLGeneric generic;

    private final Source source;

    private final QHDLValue value;

    private GenericBinding(QHDLGeneric generic, Source source, QHDLValue value) {
        this.generic = generic;
        this.source = source;
        this.value = value;
    }

    public static GenericBinding mapped(QHDLGeneric generic, QHDLValue value) {
        return new GenericBinding(generic, Source.MAPPED, value);
    }

    public static GenericBinding defaulted(QHDLGeneric generic, QHDLValue value) {
        return new GenericBinding(generic, Source.DEFAULT, value);
    }

    public static GenericBinding unresolved(QHDLGeneric generic) {
        return new GenericBinding(generic, Source.UNRESOLVED, null);
    }

    public static GenericBinding invalid(QHDLGeneric generic) {
        return new GenericBinding(generic, Source.INVALID, null);
    }

    public QHDLGeneric getGeneric() {
        return generic;
    }

    public String getName() {
        return generic.getName();
    }

    public Source getSource() {
        return source;
    }

    /**
     * @return The bound value, or null if the generic is unresolved or invalid.
     */
    public QHDLValue getValue() {
        return value;
    }

    public boolean isResolved() {
        return value != null;
    }

    @Override
    public String toString() {
        return generic.getName() + " = " + (value == null ? "<" + source.name().toLowerCase() + ">"
                : value.toLiteral() + " (" + source.name().toLowerCase() + ")");
    }
}
