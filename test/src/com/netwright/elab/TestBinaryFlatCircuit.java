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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.esotericsoftware.kryo.io.Output;

import com.netwright.qhdl.QHDLDirection;
import com.netwright.qhdl.QHDLPort;
import com.netwright.support.QHDLTestSources;

class TestBinaryFlatCircuit {

    private static FlatCircuit cascade() {
        return new Elaborator(QHDLTestSources.library(QHDLTestSources.CASCADE), new ElaborationOptions())
                .elaborate("Cascade").getCircuitOrThrow();
    }

    private static void assertSameCircuit(FlatCircuit expected, FlatCircuit actual) {
        Assertions.assertEquals(expected.getTopEntityName(), actual.getTopEntityName());
        Assertions.assertEquals(expected.getArchitectureName(), actual.getArchitectureName());
        Assertions.assertEquals(expected.getTopLevelEndpoints(), actual.getTopLevelEndpoints());
        Assertions.assertEquals(expected.getConnectivity(), actual.getConnectivity());
        Assertions.assertEquals(expected.getNets().size(), actual.getNets().size());
        for (int i = 0; i < expected.getNets().size(); i++) {
            Assertions.assertEquals(expected.getNets().get(i).getName(), actual.getNets().get(i).getName());
        }
        Assertions.assertEquals(expected.getInstances().size(), actual.getInstances().size());
        for (FlatInstance e : expected.getInstances()) {
            FlatInstance a = actual.getInstance(e.getName());
            Assertions.assertNotNull(a, e.getName());
            Assertions.assertEquals(e.getComponentName(), a.getComponentName());
            Assertions.assertEquals(e.getEntityName(), a.getEntityName());
            Assertions.assertEquals(e.getGenericValues(), a.getGenericValues());
            for (GenericBinding b : e.getGenericBindings()) {
                Assertions.assertEquals(b.getSource(), a.getGenericBinding(b.getName()).getSource());
            }
        }
    }

    @Test
    void testWriteThenRead() {
        FlatCircuit circuit = cascade();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        BinaryFlatCircuitWriter.writeFlatCircuit(baos, circuit);
        FlatCircuit read = BinaryFlatCircuitReader.readFlatCircuit(new ByteArrayInputStream(baos.toByteArray()));
        assertSameCircuit(circuit, read);
    }

    @Test
    void testWriteThenReadFile(@TempDir Path dir) throws IOException {
        FlatCircuit circuit = new Elaborator(QHDLTestSources.library(QHDLTestSources.DOUBLE_BEAMSPLITTER),
                new ElaborationOptions()).elaborate("DoubleBeamsplitter").getCircuitOrThrow();
        Path file = dir.resolve("double.nwc");
        try (OutputStream os = Files.newOutputStream(file)) {
            BinaryFlatCircuitWriter.writeFlatCircuit(os, circuit);
        }
        FlatCircuit read;
        try (InputStream is = Files.newInputStream(file)) {
            read = BinaryFlatCircuitReader.readFlatCircuit(is);
        }
        assertSameCircuit(circuit, read);
        Assertions.assertNull(read.getInstance("B1").getEntityName());
    }

    @Test
    void testStringMapIsDense() {
        Map<String, Integer> strings = BinaryFlatCircuitWriter.createStringMap(cascade());
        Assertions.assertTrue(strings.containsKey("Cascade"));
        Assertions.assertTrue(strings.containsKey("M1.a1"));
        Assertions.assertTrue(strings.containsKey("M2.BS2"));
        Assertions.assertEquals(strings.size(), strings.values().stream().distinct().count());
        Assertions.assertEquals(strings.size() - 1, (int) strings.values().stream().max(Integer::compare).get());
    }

    private static byte[] header(int stringCount, String... strings) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        Output os = new Output(baos);
        os.writeString(BinaryFlatCircuitWriter.FLAT_CIRCUIT_BINARY_TAG);
        os.writeString(BinaryFlatCircuitWriter.FLAT_CIRCUIT_BINARY_VERSION);
        os.writeInt(stringCount);
        for (String s : strings) {
            os.writeString(s);
        }
        os.flush();
        return baos.toByteArray();
    }

    private static String readFailure(byte[] data) {
        RuntimeException e = Assertions.assertThrows(RuntimeException.class,
                () -> BinaryFlatCircuitReader.readFlatCircuit(new ByteArrayInputStream(data)));
        return e.getMessage();
    }

    @Test
    void testOpenNetSurvives() {
        QHDLPort in = new QHDLPort("I", QHDLDirection.IN, "t");
        QHDLPort out = new QHDLPort("O", QHDLDirection.OUT, "t");
        FlatInstance u = new FlatInstance("W.U", "Buf", null, Collections.emptyMap(), List.of(in, out), null);
        FlatCircuit circuit = new FlatCircuit("Top", "a", List.of(out), List.of(u), List.of(
                new FlatNet("O", List.of(FlatEndpoint.topLevel(out), u.getEndpoint("O"))),
                new FlatNet("W.I", List.of(u.getEndpoint("I")), true)));
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        BinaryFlatCircuitWriter.writeFlatCircuit(baos, circuit);
        FlatCircuit read = BinaryFlatCircuitReader.readFlatCircuit(new ByteArrayInputStream(baos.toByteArray()));
        assertSameCircuit(circuit, read);
        Assertions.assertFalse(read.getNet("O").isOpen());
        Assertions.assertTrue(read.getNet("W.I").isOpen());
    }

    @Test
    void testRejectsStringIndexOutsideTable() {
        byte[] strings = header(1, "Top");
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        Output os = new Output(baos);
        os.writeBytes(strings);
        os.writeInt(7);
        os.flush();
        String message = readFailure(baos.toByteArray());
        Assertions.assertTrue(message.startsWith("ERROR:"), message);
        Assertions.assertTrue(message.contains("outside the string table"), message);
    }

    @Test
    void testRejectsNegativeCount() {
        String message = readFailure(header(-3));
        Assertions.assertTrue(message.startsWith("ERROR:"), message);
        Assertions.assertTrue(message.contains("negative count -3"), message);
    }

    @Test
    void testRejectsTruncatedData() {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        BinaryFlatCircuitWriter.writeFlatCircuit(baos, cascade());
        byte[] data = baos.toByteArray();
        String message = readFailure(Arrays.copyOf(data, data.length / 2));
        Assertions.assertTrue(message.contains("ends unexpectedly"), message);
    }

    @Test
    void testRejectsForeignData() {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        Output os = new Output(baos);
        os.writeString("SOMETHING_ELSE");
        os.flush();
        RuntimeException e = Assertions.assertThrows(RuntimeException.class,
                () -> BinaryFlatCircuitReader.readFlatCircuit(new ByteArrayInputStream(baos.toByteArray())));
        Assertions.assertTrue(e.getMessage().contains("Cannot recognize"));
    }
}
