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

import com.netwright.qhdl.QHDLException;

/**
 * Thrown when a circuit is requested from an elaboration run that failed. The
 * complete diagnostic list of the run travels with the exception.
 */
public class ElaborationException extends QHDLException {

    private final List<Diagnostic> diagnostics;

    public ElaborationException(String topEntityName, List<Diagnostic> diagnostics) {
        super(buildMessage(topEntityName, diagnostics));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    private static String buildMessage(String topEntityName, List<Diagnostic> diagnostics) {
        int errors = 0;
        Diagnostic first = null;
        for (Diagnostic d : diagnostics) {
            if (d.isError()) {
                errors++;
                if (first == null) {
                    first = d;
                }
            }
        }
        StringBuilder sb = new StringBuilder("ERROR: Elaboration of " + topEntityName + " failed with "
                + errors + " error(s)");
        if (first != null) {
            sb.append(", first: ").append(first);
        }
        return sb.toString();
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
