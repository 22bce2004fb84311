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

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.netwright.qhdl.QHDLValue;
import com.netwright.util.Params;

class TestElaborationOptions {

    @Test
    void testDefaults() {
        ElaborationOptions options = new ElaborationOptions();
        Assertions.assertEquals(Params.NW_ALLOW_MULTI_DRIVER, options.isAllowMultiDriver());
        Assertions.assertEquals(Params.NW_MAX_EXPANSION_DEPTH, options.getMaxExpansionDepth());
        Assertions.assertEquals(ArchitectureSelector.ONLY, options.getArchitectureSelection());
        Assertions.assertTrue(options.isAllowFeedback());
        Assertions.assertFalse(options.isRequireEntityForComponents());
        Assertions.assertTrue(options.getTopGenerics().isEmpty());
    }

    @Test
    void testFromStrings() {
        Map<String, String> settings = new HashMap<>();
        settings.put(ElaborationOptions.ALLOW_MULTI_DRIVER, "TRUE");
        settings.put(ElaborationOptions.UNCONNECTED_PORT_SEVERITY, "warning");
        settings.put(ElaborationOptions.MAX_EXPANSION_DEPTH, " 12 ");
        settings.put(ElaborationOptions.ARCHITECTURE_SELECTION, "named:rtl");
        settings.put(ElaborationOptions.ALLOW_FEEDBACK, "false");
        settings.put(ElaborationOptions.REQUIRE_ENTITY_FOR_COMPONENTS, "true");
        ElaborationOptions options = ElaborationOptions.fromMap(settings);
        Assertions.assertTrue(options.isAllowMultiDriver());
        Assertions.assertEquals(Severity.WARNING, options.getUnconnectedPortSeverity());
        Assertions.assertEquals(12, options.getMaxExpansionDepth());
        Assertions.assertEquals(ArchitectureSelector.named("RTL"), options.getArchitectureSelection());
        Assertions.assertFalse(options.isAllowFeedback());
        Assertions.assertTrue(options.isRequireEntityForComponents());
    }

    @Test
    void testFromNativeValues() {
        Map<String, Object> settings = new HashMap<>();
        settings.put(ElaborationOptions.ALLOW_MULTI_DRIVER, Boolean.TRUE);
        settings.put(ElaborationOptions.UNCONNECTED_PORT_SEVERITY, Severity.WARNING);
        settings.put(ElaborationOptions.MAX_EXPANSION_DEPTH, 3);
        settings.put(ElaborationOptions.ARCHITECTURE_SELECTION, ArchitectureSelector.named("fast"));
        ElaborationOptions options = ElaborationOptions.fromMap(settings);
        Assertions.assertTrue(options.isAllowMultiDriver());
        Assertions.assertEquals(3, options.getMaxExpansionDepth());
        Assertions.assertEquals("fast", options.getArchitectureSelection().getArchitectureName());
    }

    @ParameterizedTest
    @CsvSource({
        "maxDepth, 3",
        "allowMultiDriver, maybe",
        "unconnectedPortSeverity, fatal",
        "maxExpansionDepth, deep",
        "maxExpansionDepth, -1",
        "architectureSelection, first",
        "architectureSelection, 'named:'",
    })
    void testRejectedSettings(String key, String value) {
        Map<String, String> settings = new HashMap<>();
        settings.put(key, value);
        Assertions.assertThrows(IllegalArgumentException.class, () -> ElaborationOptions.fromMap(settings));
    }

    @Test
    void testTopGenericsKeepGivenName() {
        ElaborationOptions options = new ElaborationOptions().setTopGeneric("Theta", QHDLValue.real(0.1));
        Assertions.assertEquals(QHDLValue.real(0.1), options.getTopGenerics().get("theta"));
        Assertions.assertEquals("Theta", options.getTopGenericName("theta"));
    }

    @Test
    void testPerEntitySelection() {
        ElaborationOptions options = new ElaborationOptions()
                .selectArchitecture("Interferometer", ArchitectureSelector.named("balanced"));
        Assertions.assertEquals(ArchitectureSelector.named("balanced"),
                options.getArchitectureSelection("INTERFEROMETER"));
        Assertions.assertNull(options.getArchitectureSelection("Cascade"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"only", " ONLY ", "named:a", "Named: b "})
    void testSelectorParse(String policy) {
        ArchitectureSelector s = ArchitectureSelector.parse(policy);
        Assertions.assertEquals(policy.trim().equalsIgnoreCase("only"), s.isOnly());
        Assertions.assertEquals(s, ArchitectureSelector.parse(s.toString()));
    }
}
