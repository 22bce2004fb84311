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

import com.netwright.qhdl.QHDLLocation;

/**
 * Accumulates diagnostics in the order they are discovered so that one
 * elaboration run reports every problem it finds.
 */
public class DiagnosticCollector {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private int errorCount = 0;

    public Diagnostic report(Severity severity, DiagnosticType type, String context, QHDLLocation location,
            String message) {
        Diagnostic d = new Diagnostic(severity, type, context, location, message);
        diagnostics.add(d);
        if (d.isError()) {
            errorCount++;
        }
        return d;
    }

    public Diagnostic error(DiagnosticType type, String context, QHDLLocation location, String message) {
        return report(Severity.ERROR, type, context, location, message);
    }

    public Diagnostic warning(DiagnosticType type, String context, QHDLLocation location, String message) {
        return report(Severity.WARNING, type, context, location, message);
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
