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

/**
 * Categories of problems found after parsing. Syntax errors are thrown by the
 * parser and appear here only so that every category has a name.
 */
public enum DiagnosticType {
    SYNTAX_ERROR("Syntax error"),
    DUPLICATE_NAME("Duplicate name"),
    UNKNOWN_NAME("Unknown name"),
    TYPE_MISMATCH("Type mismatch"),
    UNRESOLVED_GENERIC("Unresolved generic"),
    UNKNOWN_GENERIC("Unknown generic"),
    UNKNOWN_CONNECTION("Unknown connection"),
    DIRECTION_MISMATCH("Direction mismatch"),
    UNCONNECTED_PORT("Unconnected port"),
    MULTIPLE_DRIVERS("Multiple drivers"),
    RECURSIVE_INSTANTIATION("Recursive instantiation"),
    EXPANSION_DEPTH_EXCEEDED("Expansion depth exceeded"),
    INTERFACE_MISMATCH("Interface mismatch"),
    UNRESOLVED_COMPONENT("Unresolved component"),
    AMBIGUOUS_ARCHITECTURE("Ambiguous architecture"),
    COMBINATIONAL_CYCLE("Combinational cycle");

    private final String title;

    DiagnosticType(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}
