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
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.netwright.qhdl.QHDLArchitecture;
import com.netwright.qhdl.QHDLComponent;
import com.netwright.qhdl.QHDLEntity;
import com.netwright.qhdl.QHDLExpression;
import com.netwright.qhdl.QHDLGeneric;
import com.netwright.qhdl.QHDLInstance;
import com.netwright.qhdl.QHDLParser;
import com.netwright.qhdl.QHDLValue;

class TestGenericResolver {

    private final DiagnosticCollector diagnostics = new DiagnosticCollector();

    private final GenericResolver resolver = new GenericResolver(diagnostics);

    /**
     * Parses a single instance of component C, declared with the given
     * generic clause, using the given generic map.
     */
    private static QHDLArchitecture arch(String genericClause, String genericMap) {
        return QHDLParser.parse("architecture a of T is\n"
                + "  component C generic (" + genericClause + "); end component;\n"
                + "begin\n"
                + "  U: C generic map (" + genericMap + ");\n"
                + "end;").getArchitectures().get(0);
    }

    private Map<String, GenericBinding> resolve(String genericClause, String genericMap,
            Map<String, GenericBinding> env) {
        QHDLArchitecture a = arch(genericClause, genericMap);
        QHDLComponent c = a.getComponent("C");
        QHDLInstance u = a.getInstance("U");
        return resolver.resolve(c.getGenerics(), null, u.getGenericMap(), env, "T(a) U");
    }

    private static Map<String, GenericBinding> env(String name, QHDLValue value) {
        return Collections.singletonMap(name.toLowerCase(),
                GenericBinding.mapped(new QHDLGeneric(name, value.getType().name().toLowerCase(), null), value));
    }

    @Test
    void testMappedDefaultAndOpen() {
        Map<String, GenericBinding> b = resolve("a : integer := 1; b : real := 2.5; c : integer := 7",
                "a => 3, c => open", Collections.emptyMap());
        Assertions.assertEquals(List.of("a", "b", "c"), List.copyOf(b.keySet()));
        Assertions.assertEquals(GenericBinding.Source.MAPPED, b.get("a").getSource());
        Assertions.assertEquals(QHDLValue.integer(3), b.get("a").getValue());
        Assertions.assertEquals(GenericBinding.Source.DEFAULT, b.get("b").getSource());
        Assertions.assertEquals(QHDLValue.real(2.5), b.get("b").getValue());
        Assertions.assertEquals(QHDLValue.integer(7), b.get("c").getValue());
        Assertions.assertTrue(diagnostics.getDiagnostics().isEmpty());
    }

    @Test
    void testUnresolvedIsLeftToCaller() {
        Map<String, GenericBinding> b = resolve("k : integer; j : integer := 0", "j => 1", Collections.emptyMap());
        Assertions.assertEquals(GenericBinding.Source.UNRESOLVED, b.get("k").getSource());
        Assertions.assertFalse(b.get("k").isResolved());
        Assertions.assertFalse(diagnostics.hasErrors());
    }

    @Test
    void testEntityDefaultFillsIn() {
        QHDLArchitecture a = arch("theta : real", "theta => open");
        QHDLEntity entity = QHDLParser.parse("entity C is generic (theta : real := 0.5); end;").getEntity("C");
        Map<String, GenericBinding> b = resolver.resolve(a.getComponent("C").getGenerics(), entity.getInterface(),
                a.getInstance("U").getGenericMap(), Collections.emptyMap(), "ctx");
        Assertions.assertEquals(GenericBinding.Source.DEFAULT, b.get("theta").getSource());
        Assertions.assertEquals(QHDLValue.real(0.5), b.get("theta").getValue());
    }

    @Test
    void testComponentDefaultWinsOverEntityDefault() {
        QHDLArchitecture a = arch("theta : real := 1.0", "theta => open");
        QHDLEntity entity = QHDLParser.parse("entity C is generic (theta : real := 0.5); end;").getEntity("C");
        Map<String, GenericBinding> b = resolver.resolve(a.getComponent("C").getGenerics(), entity.getInterface(),
                a.getInstance("U").getGenericMap(), Collections.emptyMap(), "ctx");
        Assertions.assertEquals(QHDLValue.real(1.0), b.get("theta").getValue());
    }

    @Test
    void testIntegerWidensToReal() {
        Map<String, GenericBinding> b = resolve("theta : real", "theta => 2", Collections.emptyMap());
        Assertions.assertEquals(QHDLValue.real(2.0), b.get("theta").getValue());
    }

    @Test
    void testReferencesEnclosingGenerics() {
        Map<String, GenericBinding> b = resolve("phi : real", "phi => PHI * 2",
                env("phi", QHDLValue.real(0.25)));
        Assertions.assertEquals(QHDLValue.real(0.5), b.get("phi").getValue());
    }

    @ParameterizedTest
    @CsvSource({
        "n : integer, n => 1.5, TYPE_MISMATCH",
        "n : natural, n => -1, TYPE_MISMATCH",
        "n : positive, n => 0, TYPE_MISMATCH",
        "n : integer, n => 1 / 0, TYPE_MISMATCH",
        "n : integer, n => 9223372036854775807 + 1, TYPE_MISMATCH",
        "n : integer, n => true + 1, TYPE_MISMATCH",
        "n : integer, n => missing, UNKNOWN_NAME",
        "n : integer, m => 1, UNKNOWN_GENERIC",
    })
    void testInvalidMappings(String clause, String map, DiagnosticType expected) {
        Map<String, GenericBinding> b = resolve(clause, map, Collections.emptyMap());
        Assertions.assertEquals(1, diagnostics.getErrorCount());
        Assertions.assertEquals(expected, diagnostics.getDiagnostics().get(0).getType());
        Assertions.assertEquals("T(a) U", diagnostics.getDiagnostics().get(0).getContext());
        Assertions.assertFalse(b.get("n").isResolved());
    }

    @Test
    void testDuplicateAssociation() {
        resolve("n : integer", "n => 1, N => 2", Collections.emptyMap());
        Assertions.assertEquals(DiagnosticType.DUPLICATE_NAME, diagnostics.getDiagnostics().get(0).getType());
    }

    @Test
    void testUnresolvedUpstreamIsSilent() {
        Map<String, GenericBinding> env = Collections.singletonMap("k",
                GenericBinding.unresolved(new QHDLGeneric("k", "integer", null)));
        Map<String, GenericBinding> b = resolve("n : integer", "n => k + 1", env);
        Assertions.assertEquals(GenericBinding.Source.INVALID, b.get("n").getSource());
        Assertions.assertTrue(diagnostics.getDiagnostics().isEmpty());
    }

    @Test
    void testEvaluate() {
        QHDLExpression e = arch("s : string", "s => \"ab\" + \"cd\"").getInstance("U").getGenericMap().get(0)
                .getActual();
        Assertions.assertEquals(QHDLValue.string("abcd"), resolver.evaluate(e, Collections.emptyMap()));
        QHDLExpression n = arch("n : integer", "n => -(7 - 10) * 2 / 4").getInstance("U").getGenericMap().get(0)
                .getActual();
        Assertions.assertEquals(QHDLValue.integer(1), resolver.evaluate(n, Collections.emptyMap()));
    }

    @Test
    void testEvaluateLongestAcceptedSum() {
        StringBuilder sum = new StringBuilder("n => 1");
        for (int i = 1; i < QHDLParser.MAX_EXPRESSION_DEPTH; i++) {
            sum.append(" + 1");
        }
        QHDLExpression e = arch("n : integer", sum.toString()).getInstance("U").getGenericMap().get(0).getActual();
        Assertions.assertEquals(QHDLParser.MAX_EXPRESSION_DEPTH, e.getDepth());
        Assertions.assertEquals(QHDLValue.integer(QHDLParser.MAX_EXPRESSION_DEPTH),
                resolver.evaluate(e, Collections.emptyMap()));
    }

    @Test
    void testTopLevelOverrides() {
        QHDLEntity top = QHDLParser.parse("entity Top is generic (n : positive; gain : real := 1.0); end;")
                .getEntity("Top");
        ElaborationOptions options = new ElaborationOptions().setTopGeneric("N", QHDLValue.integer(4))
                .setTopGeneric("Bogus", QHDLValue.integer(1));
        Map<String, GenericBinding> b = resolver.resolveTop(top, options.getTopGenerics(), options);
        Assertions.assertEquals(QHDLValue.integer(4), b.get("n").getValue());
        Assertions.assertEquals(GenericBinding.Source.DEFAULT, b.get("gain").getSource());
        Assertions.assertEquals(1, diagnostics.getErrorCount());
        Diagnostic d = diagnostics.getDiagnostics().get(0);
        Assertions.assertEquals(DiagnosticType.UNKNOWN_GENERIC, d.getType());
        Assertions.assertTrue(d.getMessage().contains("'Bogus'"));
    }
}
