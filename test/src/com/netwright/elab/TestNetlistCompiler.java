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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.netwright.qhdl.QHDLDesignFile;
import com.netwright.qhdl.QHDLDuplicateNameException;
import com.netwright.qhdl.QHDLParseException;
import com.netwright.support.QHDLTestSources;

class TestNetlistCompiler {

    @Test
    void testLoadAndElaborate() {
        NetlistCompiler compiler = new NetlistCompiler();
        compiler.load(QHDLTestSources.BEAMSPLITTER, QHDLTestSources.read(QHDLTestSources.BEAMSPLITTER));
        QHDLDesignFile file = compiler.load(QHDLTestSources.DOUBLE_BEAMSPLITTER,
                QHDLTestSources.read(QHDLTestSources.DOUBLE_BEAMSPLITTER));
        Assertions.assertEquals(QHDLTestSources.DOUBLE_BEAMSPLITTER, file.getSourceName());
        ElaborationResult result = compiler.elaborate("DoubleBeamsplitter");
        Assertions.assertTrue(result.isSuccess());
        Assertions.assertEquals(2, result.getCircuit().getInstances().size());
    }

    @Test
    void testParseDoesNotRegister() {
        NetlistCompiler compiler = new NetlistCompiler();
        QHDLDesignFile file = compiler.parse(QHDLTestSources.read(QHDLTestSources.CASCADE));
        Assertions.assertEquals(4, file.getEntities().size());
        Assertions.assertTrue(compiler.getLibrary().getEntities().isEmpty());
        compiler.register(file);
        Assertions.assertEquals(4, compiler.getLibrary().getEntities().size());
        Assertions.assertThrows(QHDLDuplicateNameException.class,
                () -> compiler.registerEntity(file.getEntities().get(0)));
    }

    @Test
    void testSyntaxErrorRegistersNothing() {
        NetlistCompiler compiler = new NetlistCompiler();
        Assertions.assertThrows(QHDLParseException.class,
                () -> compiler.load("bad.qhdl", "entity Good is end;\nentity Bad is port (; end;"));
        Assertions.assertNull(compiler.getLibrary().getEntity("Good"));
    }

    @Test
    void testLoadAll() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put(QHDLTestSources.DOUBLE_BEAMSPLITTER, QHDLTestSources.read(QHDLTestSources.DOUBLE_BEAMSPLITTER));
        sources.put(QHDLTestSources.BEAMSPLITTER, QHDLTestSources.read(QHDLTestSources.BEAMSPLITTER));
        NetlistCompiler compiler = new NetlistCompiler();
        compiler.loadAll(sources);
        FlatCircuit circuit = compiler.elaborate("DoubleBeamsplitter", new ElaborationOptions())
                .getCircuitOrThrow();
        Assertions.assertEquals("Beamsplitter", circuit.getInstance("B2").getEntityName());
    }

    @Test
    void testLoadFiles(@TempDir Path dir) throws IOException {
        Path file = dir.resolve(QHDLTestSources.RECURSIVE);
        Files.write(file, QHDLTestSources.read(QHDLTestSources.RECURSIVE).getBytes(StandardCharsets.UTF_8));
        NetlistCompiler compiler = new NetlistCompiler();
        compiler.loadFiles(List.of(file));
        ElaborationResult result = compiler.elaborate("Loop", ArchitectureSelector.ONLY, new ElaborationOptions());
        Assertions.assertTrue(result.hasDiagnostic(DiagnosticType.RECURSIVE_INSTANTIATION));
        ElaborationException e = Assertions.assertThrows(ElaborationException.class, result::getCircuitOrThrow);
        Assertions.assertTrue(e.getMessage().startsWith("ERROR: Elaboration of Loop failed"));
    }
}
