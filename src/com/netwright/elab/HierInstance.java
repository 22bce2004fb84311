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

import java.util.Arrays;

import com.netwright.qhdl.QHDLName;

/**
 * Immutable position in the instance hierarchy: the labels from the top-level
 * entity down to an instance, together with the entity expanded at each level.
 * The entity keys double as the expansion path used to detect recursive
 * instantiation.
 */
public class HierInstance {

    public static final String SEPARATOR = ".";

    /** Instance labels below the top, empty for the top itself */
    private final String[] labels;

    /** Entity (or, for leaves without an entity, component) key per level, top first */
    private final String[] entityKeys;

    private HierInstance(String[] labels, String[] entityKeys) {
        if (entityKeys.length != labels.length + 1) {
            throw new IllegalStateException("Expansion path must have one entity per level");
        }
        this.labels = labels;
        this.entityKeys = entityKeys;
    }

    public static HierInstance createTop(String topEntityName) {
        return new HierInstance(new String[0], new String[]{QHDLName.toKey(topEntityName)});
    }

    public HierInstance getChild(String label, String entityName) {
        String[] newLabels = Arrays.copyOf(labels, labels.length + 1);
        newLabels[labels.length] = label;
        String[] newKeys = Arrays.copyOf(entityKeys, entityKeys.length + 1);
        newKeys[entityKeys.length] = QHDLName.toKey(entityName);
        return new HierInstance(newLabels, newKeys);
    }

    /**
     * @return The enclosing instance, or null for the top.
     */
    public HierInstance getParent() {
        if (isTopLevel()) {
            return null;
        }
        return new HierInstance(Arrays.copyOf(labels, labels.length - 1),
                Arrays.copyOf(entityKeys, entityKeys.length - 1));
    }

    public boolean isTopLevel() {
        return labels.length == 0;
    }

    /**
     * @return Number of instantiation levels below the top.
     */
    public int getDepth() {
        return labels.length;
    }

    /**
     * @return The instance label, or null for the top.
     */
    public String getLabel() {
        return isTopLevel() ? null : labels[labels.length - 1];
    }

    public String getEntityKey() {
        return entityKeys[entityKeys.length - 1];
    }

    /**
     * Checks whether an entity is being expanded on the path to this instance,
     * including this instance itself.
     * @param entityName Entity name, any case.
     * @return True if expanding the entity below this instance would recurse.
     */
    public boolean isExpanding(String entityName) {
        String key = QHDLName.toKey(entityName);
        for (String k : entityKeys) {
            if (k.equals(key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return The dotted label path, empty for the top.
     */
    public String getHierarchicalName() {
        return String.join(SEPARATOR, labels);
    }

    /**
     * @param localName A name declared at this level.
     * @return The name qualified by this instance's path.
     */
    public String getHierarchicalName(String localName) {
        return isTopLevel() ? localName : getHierarchicalName() + SEPARATOR + localName;
    }

    /**
     * @param nextEntityName Entity about to be expanded below this instance.
     * @return The entity path, for instance "a -> b -> a".
     */
    public String describeExpansionPath(String nextEntityName) {
        StringBuilder sb = new StringBuilder();
        for (String k : entityKeys) {
            sb.append(k).append(" -> ");
        }
        return sb.append(QHDLName.toKey(nextEntityName)).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HierInstance that = (HierInstance) o;
        return Arrays.equals(labels, that.labels) && Arrays.equals(entityKeys, that.entityKeys);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(labels) + Arrays.hashCode(entityKeys);
    }

    @Override
    public String toString() {
        return isTopLevel() ? "<top " + entityKeys[0] + ">" : getHierarchicalName();
    }
}
