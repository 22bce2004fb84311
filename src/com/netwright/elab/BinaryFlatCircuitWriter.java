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

import java.io.OutputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Map.Entry;

import com.esotericsoftware.kryo.io.Output;
import com.netwright.qhdl.QHDLPort;
import com.netwright.qhdl.QHDLValue;

/**
 * Writes a {@link FlatCircuit} in a compact binary form for downstream tools.
 * All names are collected into a string table at the front of the stream and
 * referenced by index afterwards. Source locations are not written.
 */
public class BinaryFlatCircuitWriter {

    public static final String FLAT_CIRCUIT_BINARY_TAG = "NETWRIGHT_FLAT_CIRCUIT_BINARY";
    public static final String FLAT_CIRCUIT_BINARY_VERSION = "0.0.2";

    public static final int NULL_STRING = -1;

    private static void addStringToStringMap(String s, Map<String, Integer> stringMap) {
        if (s != null) {
            stringMap.computeIfAbsent(s, v -> stringMap.size());
        }
    }

    private static void addPortToStringMap(QHDLPort p, Map<String, Integer> stringMap) {
        addStringToStringMap(p.getName(), stringMap);
        addStringToStringMap(p.getTypeName(), stringMap);
    }

    /**
     * Enumerates every string of a circuit.
     * @param circuit The circuit to enumerate.
     * @return Each unique string mapped to its index in the string table.
     */
    public static Map<String, Integer> createStringMap(FlatCircuit circuit) {
        Map<String, Integer> stringMap = new HashMap<>();
        addStringToStringMap(circuit.getTopEntityName(), stringMap);
        addStringToStringMap(circuit.getArchitectureName(), stringMap);
        for (QHDLPort p : circuit.getTopPorts()) {
            addPortToStringMap(p, stringMap);
        }
        for (FlatInstance i : circuit.getInstances()) {
            addStringToStringMap(i.getName(), stringMap);
            addStringToStringMap(i.getComponentName(), stringMap);
            addStringToStringMap(i.getEntityName(), stringMap);
            for (QHDLPort p : i.getPorts()) {
                addPortToStringMap(p, stringMap);
            }
            for (GenericBinding b : i.getGenericBindings()) {
                addStringToStringMap(b.getName(), stringMap);
                addStringToStringMap(b.getGeneric().getTypeName(), stringMap);
                if (b.isResolved() && b.getValue().getStringValue() != null) {
                    addStringToStringMap(b.getValue().getStringValue(), stringMap);
                }
            }
        }
        for (FlatNet n : circuit.getNets()) {
            addStringToStringMap(n.getName(), stringMap);
            for (FlatEndpoint e : n.getEndpoints()) {
                addStringToStringMap(e.getInstanceName(), stringMap);
                addStringToStringMap(e.getPortName(), stringMap);
                addStringToStringMap(e.getTypeName(), stringMap);
            }
        }
        return stringMap;
    }

    private static void writeString(String s, Output os, Map<String, Integer> stringMap) {
        os.writeInt(s == null ? NULL_STRING : stringMap.get(s));
    }

    private static void writePort(QHDLPort p, Output os, Map<String, Integer> stringMap) {
        writeString(p.getName(), os, stringMap);
        os.writeByte(p.getDirection().ordinal());
        writeString(p.getTypeName(), os, stringMap);
    }

    private static void writeValue(QHDLValue v, Output os, Map<String, Integer> stringMap) {
        os.writeByte(v.getType().ordinal());
        switch (v.getType()) {
            case REAL:
                os.writeDouble(v.getRealValue());
                break;
            case INTEGER:
                os.writeLong(v.getIntValue());
                break;
            case BOOLEAN:
                os.writeBoolean(v.getBooleanValue());
                break;
            default:
                writeString(v.getStringValue(), os, stringMap);
                break;
        }
    }

    private static void writeInstance(FlatInstance i, Output os, Map<String, Integer> stringMap) {
        writeString(i.getName(), os, stringMap);
        writeString(i.getComponentName(), os, stringMap);
        writeString(i.getEntityName(), os, stringMap);
        os.writeInt(i.getPorts().size());
        for (QHDLPort p : i.getPorts()) {
            writePort(p, os, stringMap);
        }
        os.writeInt(i.getGenericBindings().size());
        for (GenericBinding b : i.getGenericBindings()) {
            writeString(b.getName(), os, stringMap);
            writeString(b.getGeneric().getTypeName(), os, stringMap);
            os.writeByte(b.getSource().ordinal());
            if (b.isResolved()) {
                writeValue(b.getValue(), os, stringMap);
            }
        }
    }

    private static void writeNet(FlatNet n, Output os, Map<String, Integer> stringMap) {
        writeString(n.getName(), os, stringMap);
        os.writeInt(n.getEndpoints().size());
        for (FlatEndpoint e : n.getEndpoints()) {
            writeString(e.getInstanceName(), os, stringMap);
            writeString(e.getPortName(), os, stringMap);
            os.writeByte(e.getDirection().ordinal());
            writeString(e.getTypeName(), os, stringMap);
        }
        os.writeBoolean(n.isOpen());
    }

    /**
     * Writes a circuit to a stream. The stream is flushed but left open.
     * @param outputStream Destination stream.
     * @param circuit The circuit to write.
     * @see BinaryFlatCircuitReader#readFlatCircuit(java.io.InputStream)
     */
    public static void writeFlatCircuit(OutputStream outputStream, FlatCircuit circuit) {
        Map<String, Integer> stringMap = createStringMap(circuit);
        Output os = new Output(outputStream);
        os.writeString(FLAT_CIRCUIT_BINARY_TAG);
        os.writeString(FLAT_CIRCUIT_BINARY_VERSION);
        String[] strings = new String[stringMap.size()];
        for (Entry<String, Integer> e : stringMap.entrySet()) {
            strings[e.getValue()] = e.getKey();
        }
        os.writeInt(strings.length);
        for (String s : strings) {
            os.writeString(s);
        }
        writeString(circuit.getTopEntityName(), os, stringMap);
        writeString(circuit.getArchitectureName(), os, stringMap);
        os.writeInt(circuit.getTopPorts().size());
        for (QHDLPort p : circuit.getTopPorts()) {
            writePort(p, os, stringMap);
        }
        os.writeInt(circuit.getInstances().size());
        for (FlatInstance i : circuit.getInstances()) {
            writeInstance(i, os, stringMap);
        }
        os.writeInt(circuit.getNets().size());
        for (FlatNet n : circuit.getNets()) {
            writeNet(n, os, stringMap);
        }
        os.flush();
    }
}
