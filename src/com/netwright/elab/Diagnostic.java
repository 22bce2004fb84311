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

import java.util.Objects;

import com.netwright.qhdl.QHDLLocation;

/**
 * One problem found during elaboration: what kind, how serious, where in the
 * instance hierarchy and where in the source.
 */
public class Diagnostic {

    private final Severity severity;

    private final DiagnosticType type;

    /** Hierarchical instance name or design unit the problem was found in, empty at the top */
    private final String context;

    private final QHDLLocation location;

    private final String message;

    public Diagnostic(Severity severity, DiagnosticType type, String context, QHDLLocation location,
            String message) {
        this.severity = Objects.requireNonNull(severity);
        this.type = Objects.requireNonNull(type);
        this.context = context == null ? "" : context;
        this.location = location;
        this.message = message;
    }

    public Severity getSeverity() {
        return severity;
    }

    public DiagnosticType getType() {
        return type;
    }

    public String getContext() {
        return context;
    }

    /**
     * @return The source location, or null if the problem has none.
     */
    public QHDLLocation getLocation() {
        return location;
    }

    public String getMessage() {
        return message;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity).append(": [").append(type).append("] ");
        if (!context.isEmpty()) {
            sb.append(context).append(": ");
        }
        sb.append(message);
        if (location != null) {
            sb.append(" (").append(location).append(")");
        }
        return sb.toString();
    }
}
