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
 * How serious a {@link Diagnostic} is. Any {@link #ERROR} makes an elaboration
 * run fail.
 */
public enum Severity {
    WARNING,
    ERROR;

    /**
     * @param s "warning" or "error", any case.
     * @return The matching severity.
     * @throws IllegalArgumentException if the text names no severity
     */
    public static Severity parse(String s) {
        if (s != null) {
            for (Severity sev : values()) {
                if (sev.name().equalsIgnoreCase(s.trim())) {
                    return sev;
                }
            }
        }
        throw new IllegalArgumentException("ERROR: Unrecognized severity '" + s
                + "', expected 'warning' or 'error'.");
    }
}
