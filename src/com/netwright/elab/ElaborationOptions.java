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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.netwright.qhdl.QHDLName;
import com.netwright.qhdl.QHDLValue;
import com.netwright.util.MessageGenerator;
import com.netwright.util.Params;

/**
 * Settings of one elaboration run. Defaults come from {@link Params}, so they
 * can be changed globally through environment variables or JVM properties.
 */
public class ElaborationOptions {

    public static final String ALLOW_MULTI_DRIVER = "allowMultiDriver";
    public static final String UNCONNECTED_PORT_SEVERITY = "unconnectedPortSeverity";
    public static final String MAX_EXPANSION_DEPTH = "maxExpansionDepth";
    public static final String ARCHITECTURE_SELECTION = "architectureSelection";
    public static final String ALLOW_FEEDBACK = "allowFeedback";
    public static final String REQUIRE_ENTITY_FOR_COMPONENTS = "requireEntityForComponents";

    private boolean allowMultiDriver = Params.NW_ALLOW_MULTI_DRIVER;

    private Severity unconnectedPortSeverity = defaultUnconnectedPortSeverity();

    private int maxExpansionDepth = Params.NW_MAX_EXPANSION_DEPTH;

    private ArchitectureSelector architectureSelection = ArchitectureSelector.ONLY;

    private boolean allowFeedback = true;

    private boolean requireEntityForComponents = false;

    /** Keyed by entity key */
    private final Map<String, ArchitectureSelector> entitySelections = new LinkedHashMap<>();

    /** Keyed by generic key */
    private final Map<String, QHDLValue> topGenerics = new LinkedHashMap<>();

    private final Map<String, String> topGenericNames = new LinkedHashMap<>();

    private static Severity defaultUnconnectedPortSeverity() {
        String value = Params.NW_UNCONNECTED_PORT_SEVERITY;
        if (value == null) {
            return Severity.ERROR;
        }
        try {
            return Severity.parse(value);
        } catch (IllegalArgumentException e) {
            MessageGenerator.briefError("WARNING: Ignoring " + Params.NW_UNCONNECTED_PORT_SEVERITY_NAME
                    + "='" + value + "', expected 'warning' or 'error'.");
            return Severity.ERROR;
        }
    }

    /**
     * Builds options from name/value pairs as a driver would pass them. Values
     * may be given as strings or as their natural Java types.
     * @param settings Option name to value.
     * @return New options, with defaults for everything not named.
     * @throws IllegalArgumentException on unknown option names or unusable values
     */
    public static ElaborationOptions fromMap(Map<String, ?> settings) {
        ElaborationOptions options = new ElaborationOptions();
        for (Map.Entry<String, ?> e : settings.entrySet()) {
            String key = e.getKey();
            Object value = e.getValue();
            if (ALLOW_MULTI_DRIVER.equals(key)) {
                options.setAllowMultiDriver(toBoolean(key, value));
            } else if (UNCONNECTED_PORT_SEVERITY.equals(key)) {
                options.setUnconnectedPortSeverity(value instanceof Severity ? (Severity) value
                        : Severity.parse(String.valueOf(value)));
            } else if (MAX_EXPANSION_DEPTH.equals(key)) {
                options.setMaxExpansionDepth(toInt(key, value));
            } else if (ARCHITECTURE_SELECTION.equals(key)) {
                options.setArchitectureSelection(value instanceof ArchitectureSelector
                        ? (ArchitectureSelector) value : ArchitectureSelector.parse(String.valueOf(value)));
            } else if (ALLOW_FEEDBACK.equals(key)) {
                options.setAllowFeedback(toBoolean(key, value));
            } else if (REQUIRE_ENTITY_FOR_COMPONENTS.equals(key)) {
                options.setRequireEntityForComponents(toBoolean(key, value));
            } else {
                throw new IllegalArgumentException("ERROR: Unrecognized elaboration option '" + key + "'.");
            }
        }
        return options;
    }

    private static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String s = String.valueOf(value).trim();
        if (s.equalsIgnoreCase("true")) {
            return true;
        }
        if (s.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("ERROR: Option '" + key + "' expects true or false, got '"
                + value + "'.");
    }

    private static int toInt(String key, Object value) {
        if (value instanceof Integer) {
            return (Integer) value;
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("ERROR: Option '" + key + "' expects an integer, got '"
                    + value + "'.", e);
        }
    }

    public boolean isAllowMultiDriver() {
        return allowMultiDriver;
    }

    public ElaborationOptions setAllowMultiDriver(boolean allowMultiDriver) {
        this.allowMultiDriver = allowMultiDriver;
        return this;
    }

    public Severity getUnconnectedPortSeverity() {
        return unconnectedPortSeverity;
    }

    public ElaborationOptions setUnconnectedPortSeverity(Severity unconnectedPortSeverity) {
        if (unconnectedPortSeverity == null) {
            throw new IllegalArgumentException("ERROR: Unconnected port severity cannot be null.");
        }
        this.unconnectedPortSeverity = unconnectedPortSeverity;
        return this;
    }

    public int getMaxExpansionDepth() {
        return maxExpansionDepth;
    }

    public ElaborationOptions setMaxExpansionDepth(int maxExpansionDepth) {
        if (maxExpansionDepth < 0) {
            throw new IllegalArgumentException("ERROR: Maximum expansion depth must not be negative, got "
                    + maxExpansionDepth + ".");
        }
        this.maxExpansionDepth = maxExpansionDepth;
        return this;
    }

    /**
     * @return The selection for the top-level entity. Entities below the top
     *         use it only when they have an architecture of the selected name,
     *         and otherwise their single architecture.
     */
    public ArchitectureSelector getArchitectureSelection() {
        return architectureSelection;
    }

    public ElaborationOptions setArchitectureSelection(ArchitectureSelector architectureSelection) {
        if (architectureSelection == null) {
            throw new IllegalArgumentException("ERROR: Architecture selection cannot be null.");
        }
        this.architectureSelection = architectureSelection;
        return this;
    }

    public boolean isAllowFeedback() {
        return allowFeedback;
    }

    public ElaborationOptions setAllowFeedback(boolean allowFeedback) {
        this.allowFeedback = allowFeedback;
        return this;
    }

    public boolean isRequireEntityForComponents() {
        return requireEntityForComponents;
    }

    public ElaborationOptions setRequireEntityForComponents(boolean requireEntityForComponents) {
        this.requireEntityForComponents = requireEntityForComponents;
        return this;
    }

    /**
     * Overrides the architecture choice for every instance of one entity.
     * @param entityName Entity name, any case.
     * @param selector Selection policy for that entity.
     * @return These options.
     */
    public ElaborationOptions selectArchitecture(String entityName, ArchitectureSelector selector) {
        entitySelections.put(QHDLName.toKey(entityName), selector);
        return this;
    }

    /**
     * @param entityName Entity name, any case.
     * @return The per-entity selector, or null if the entity has none.
     */
    public ArchitectureSelector getArchitectureSelection(String entityName) {
        return entitySelections.get(QHDLName.toKey(entityName));
    }

    /**
     * Supplies a value for a generic of the top-level entity.
     * @param genericName Generic name, any case.
     * @param value The value, checked against the generic's declared type during elaboration.
     * @return These options.
     */
    public ElaborationOptions setTopGeneric(String genericName, QHDLValue value) {
        String key = QHDLName.toKey(genericName);
        topGenerics.put(key, value);
        topGenericNames.put(key, genericName);
        return this;
    }

    /**
     * @return Top-level generic values keyed by their case-folded names.
     */
    public Map<String, QHDLValue> getTopGenerics() {
        return Collections.unmodifiableMap(topGenerics);
    }

    /**
     * @param key Case-folded generic name.
     * @return The name as it was given to {@link #setTopGeneric(String, QHDLValue)}.
     */
    public String getTopGenericName(String key) {
        return topGenericNames.get(key);
    }

    @Override
    public String toString() {
        return "{" + ALLOW_MULTI_DRIVER + "=" + allowMultiDriver
                + ", " + UNCONNECTED_PORT_SEVERITY + "=" + unconnectedPortSeverity.name().toLowerCase()
                + ", " + MAX_EXPANSION_DEPTH + "=" + maxExpansionDepth
                + ", " + ARCHITECTURE_SELECTION + "=" + architectureSelection
                + ", " + ALLOW_FEEDBACK + "=" + allowFeedback
                + ", " + REQUIRE_ENTITY_FOR_COMPONENTS + "=" + requireEntityForComponents + "}";
    }
}
