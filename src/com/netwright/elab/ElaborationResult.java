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

/**
 * Outcome of one elaboration run: all diagnostics in discovery order and, if
 * none of them is an error, the flat circuit.
 */
public class ElaborationResult {

    private final String topEntityName;

    private final List<Diagnostic> diagnostics;

    private final FlatCircuit circuit;

    public ElaborationResult(String topEntityName, List<Diagnostic> diagnostics, FlatCircuit circuit) {
        this.topEntityName = topEntityName;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
        boolean failed = false;
        for (Diagnostic d : diagnostics) {
            failed |= d.isError();
        }
        this.circuit = failed ? null : circuit;
    }

    public String getTopEntityName() {
        return topEntityName;
    }

    public boolean isSuccess() {
        return circuit != null;
    }

    /**
     * @return The flat circuit, or null if elaboration failed.
     */
    public FlatCircuit getCircuit() {
        return circuit;
    }

    /**
     * @return The flat circuit.
     * @throws ElaborationException if elaboration failed
     */
    public FlatCircuit getCircuitOrThrow() {
        if (circuit == null) {
            throw new ElaborationException(topEntityName, diagnostics);
        }
        return circuit;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> getErrors() {
        List<Diagnostic> errors = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (d.isError()) {
                errors.add(d);
            }
        }
        return errors;
    }

    public List<Diagnostic> getWarnings() {
        List<Diagnostic> warnings = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (!d.isError()) {
                warnings.add(d);
            }
        }
        return warnings;
    }

    /**
     * @param type A diagnostic category.
     * @return Diagnostics of that category, in discovery order.
     */
    public List<Diagnostic> getDiagnostics(DiagnosticType type) {
        List<Diagnostic> matches = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (d.getType() == type) {
                matches.add(d);
            }
        }
        return matches;
    }

    public boolean hasDiagnostic(DiagnosticType type) {
        return !getDiagnostics(type).isEmpty();
    }
}
