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

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.netwright.qhdl.QHDLDirection;
import com.netwright.qhdl.QHDLGeneric;
import com.netwright.qhdl.QHDLPort;
import com.netwright.qhdl.QHDLValue;
import com.netwright.qhdl.QHDLValueType;

/**
 * Reads a circuit written by {@link BinaryFlatCircuitWriter}.
 */
public class BinaryFlatCircuitReader {

    private static String readString(Input is, String[] strings) {
        int idx = is.readInt();
        if (idx == BinaryFlatCircuitWriter.NULL_STRING) {
            return null;
        }
        if (idx < 0 || idx >= strings.length) {
            throw new RuntimeException("ERROR: Couldn't read string, index " + idx
                    + " is outside the string table of " + strings.length);
        }
        return strings[idx];
    }

    private static int readCount(Input is, String what) {
        int count = is.readInt();
        if (count < 0) {
            throw new RuntimeException("ERROR: Couldn't read " + what + ", negative count " + count);
        }
        return count;
    }

    private static <T extends Enum<T>> T readEnum(Input is, T[] values, String what) {
        int ordinal = is.readByte();
        if (ordinal < 0 || ordinal >= values.length) {
            throw new RuntimeException("ERROR: Couldn't read " + what + ", unknown code " + ordinal);
        }
        return values[ordinal];
    }

    private static QHDLPort readPort(Input is, String[] strings) {
        String name = readString(is, strings);
        QHDLDirection dir = readEnum(is, QHDLDirection.values(), "port direction of " + name);
        return new QHDLPort(name, dir, readString(is, strings));
    }

    private static QHDLValue readValue(Input is, String[] strings) {
        QHDLValueType type = readEnum(is, QHDLValueType.values(), "generic value type");
        switch (type) {
            case REAL:
                return QHDLValue.real(is.readDouble());
            case INTEGER:
                return QHDLValue.integer(is.readLong());
            case BOOLEAN:
                return QHDLValue.bool(is.readBoolean());
            default:
                return QHDLValue.string(readString(is, strings));
        }
    }

    private static GenericBinding readGenericBinding(Input is, String[] strings) {
        String name = readString(is, strings);
        QHDLGeneric g = new QHDLGeneric(name, readString(is, strings), null);
        GenericBinding.Source source = readEnum(is, GenericBinding.Source.values(), "source of generic " + name);
        switch (source) {
            case MAPPED:
                return GenericBinding.mapped(g, readValue(is, strings));
            case DEFAULT:
                return GenericBinding.defaulted(g, readValue(is, strings));
            case UNRESOLVED:
                return GenericBinding.unresolved(g);
            default:
                return GenericBinding.invalid(g);
        }
    }

    private static FlatInstance readInstance(Input is, String[] strings) {
        String name = readString(is, strings);
        String componentName = readString(is, strings);
        String entityName = readString(is, strings);
        int portCount = readCount(is, "ports of " + name);
        List<QHDLPort> ports = new ArrayList<>();
        for (int i = 0; i < portCount; i++) {
            ports.add(readPort(is, strings));
        }
        int genericCount = readCount(is, "generics of " + name);
        Map<String, GenericBinding> generics = new LinkedHashMap<>();
        for (int i = 0; i < genericCount; i++) {
            GenericBinding b = readGenericBinding(is, strings);
            generics.put(b.getGeneric().getKey(), b);
        }
        return new FlatInstance(name, componentName, entityName, generics, ports, null);
    }

    private static FlatNet readNet(Input is, String[] strings) {
        String name = readString(is, strings);
        int count = readCount(is, "endpoints of net " + name);
        List<FlatEndpoint> endpoints = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String instanceName = readString(is, strings);
            String portName = readString(is, strings);
            QHDLDirection dir = readEnum(is, QHDLDirection.values(), "direction of " + portName);
            endpoints.add(new FlatEndpoint(instanceName, portName, dir, readString(is, strings)));
        }
        return new FlatNet(name, endpoints, is.readBoolean());
    }

    /**
     * Reads a circuit from a stream. The stream is not closed.
     * @param inputStream Source stream, positioned at the start of a written circuit.
     * @return The circuit.
     * @throws RuntimeException if the data is not a circuit of the supported
     *         version, or is truncated or corrupted
     */
    public static FlatCircuit readFlatCircuit(InputStream inputStream) {
        Input is = new Input(inputStream);
        try {
            return readFlatCircuit(is);
        } catch (KryoException e) {
            throw new RuntimeException("ERROR: Flat circuit binary data ends unexpectedly", e);
        }
    }

    private static FlatCircuit readFlatCircuit(Input is) {
        if (!BinaryFlatCircuitWriter.FLAT_CIRCUIT_BINARY_TAG.equals(is.readString())) {
            throw new RuntimeException("ERROR: Cannot recognize flat circuit binary format");
        }
        if (!BinaryFlatCircuitWriter.FLAT_CIRCUIT_BINARY_VERSION.equals(is.readString())) {
            throw new RuntimeException("ERROR: Unsupported flat circuit binary format version");
        }
        int stringCount = readCount(is, "string table");
        List<String> table = new ArrayList<>();
        for (int i = 0; i < stringCount; i++) {
            table.add(is.readString());
        }
        String[] strings = table.toArray(new String[0]);
        String topEntityName = readString(is, strings);
        String architectureName = readString(is, strings);
        int portCount = readCount(is, "top-level ports");
        List<QHDLPort> topPorts = new ArrayList<>();
        for (int i = 0; i < portCount; i++) {
            topPorts.add(readPort(is, strings));
        }
        int instanceCount = readCount(is, "instances");
        List<FlatInstance> instances = new ArrayList<>();
        for (int i = 0; i < instanceCount; i++) {
            instances.add(readInstance(is, strings));
        }
        int netCount = readCount(is, "nets");
        List<FlatNet> nets = new ArrayList<>();
        for (int i = 0; i < netCount; i++) {
            nets.add(readNet(is, strings));
        }
        return new FlatCircuit(topEntityName, architectureName, topPorts, instances, nets);
    }
}
