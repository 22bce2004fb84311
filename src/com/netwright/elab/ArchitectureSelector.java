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

import java.util.List;
import java.util.Objects;

import com.netwright.qhdl.QHDLArchitecture;
import com.netwright.qhdl.QHDLName;

/**
 * Policy for picking the architecture of an entity: either the single
 * architecture the entity has ({@code only}) or the one with a given name
 * ({@code named:<name>}).
 */
public final class ArchitectureSelector {

    public static final String ONLY_POLICY = "only";

    public static final String NAMED_PREFIX = "named:";

    public static final ArchitectureSelector ONLY = new ArchitectureSelector(null);

    /** Null for the "only" policy */
    private final String architectureName;

    private ArchitectureSelector(String architectureName) {
        this.architectureName = architectureName;
    }

    public static ArchitectureSelector named(String architectureName) {
        return new ArchitectureSelector(Objects.requireNonNull(architectureName));
    }

    /**
     * @param policy "only" or "named:&lt;name&gt;", keyword part in any case.
     * @return The selector described by the text.
     * @throws IllegalArgumentException if the text is neither form
     */
    public static ArchitectureSelector parse(String policy) {
        String p = policy == null ? "" : policy.trim();
        if (p.equalsIgnoreCase(ONLY_POLICY)) {
            return ONLY;
        }
        if (p.regionMatches(true, 0, NAMED_PREFIX, 0, NAMED_PREFIX.length())) {
            String name = p.substring(NAMED_PREFIX.length()).trim();
            if (!name.isEmpty()) {
                return named(name);
            }
        }
        throw new IllegalArgumentException("ERROR: Unrecognized architecture selection '" + policy
                + "', expected '" + ONLY_POLICY + "' or '" + NAMED_PREFIX + "<name>'.");
    }

    public boolean isOnly() {
        return architectureName == null;
    }

    /**
     * @return The requested architecture name, or null for the "only" policy.
     */
    public String getArchitectureName() {
        return architectureName;
    }

    /**
     * Applies this policy to the architectures of one entity.
     * @param candidates Architectures of the entity, not empty.
     * @return The chosen architecture, or null if the policy selects none
     *         (several candidates under "only", or no candidate of the requested name).
     */
    public QHDLArchitecture select(List<QHDLArchitecture> candidates) {
        if (isOnly()) {
            return candidates.size() == 1 ? candidates.get(0) : null;
        }
        for (QHDLArchitecture a : candidates) {
            if (QHDLName.sameName(a.getName(), architectureName)) {
                return a;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArchitectureSelector that = (ArchitectureSelector) o;
        if (architectureName == null || that.architectureName == null) {
            return architectureName == that.architectureName;
        }
        return QHDLName.sameName(architectureName, that.architectureName);
    }

    @Override
    public int hashCode() {
        return architectureName == null ? 0 : QHDLName.toKey(architectureName).hashCode();
    }

    @Override
    public String toString() {
        return isOnly() ? ONLY_POLICY : NAMED_PREFIX + architectureName;
    }
}
