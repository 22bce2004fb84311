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

package com.netwright.qhdl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The externally visible shape of an entity or a component declaration: its
 * ordered generics and ports. Lookups are case-insensitive. If a name is
 * declared twice, lookups return the first declaration; the duplicate itself
 * is reported when the interface is entered into a symbol table.
 */
public class QHDLInterface {

    public static final QHDLInterface EMPTY = new QHDLInterface(Collections.emptyList(), Collections.emptyList());

    private final List<QHDLGeneric> generics;

    private final List<QHDLPort> ports;

    private final Map<String, QHDLGeneric> genericMap;

    private final Map<String, QHDLPort> portMap;

    public QHDLInterface(List<QHDLGeneric> generics, List<QHDLPort> ports) {
        this.generics = Collections.unmodifiableList(new ArrayList<>(generics));
        this.ports = Collections.unmodifiableList(new ArrayList<>(ports));
        genericMap = new LinkedHashMap<>();
        for (QHDLGeneric g : generics) {
            genericMap.putIfAbsent(g.getKey(), g);
        }
        portMap = new LinkedHashMap<>();
        for (QHDLPort p : ports) {
            portMap.putIfAbsent(p.getKey(), p);
        }
    }

    public List<QHDLGeneric> getGenerics() {
        return generics;
    }

    public List<QHDLPort> getPorts() {
        return ports;
    }

    public QHDLGeneric getGeneric(String name) {
        return genericMap.get(QHDLName.toKey(name));
    }

    public QHDLPort getPort(String name) {
        return portMap.get(QHDLName.toKey(name));
    }

    /**
     * Compares this interface with another one, generic by generic and port by
     * port, ignoring declaration order and case. Default values are not part of
     * the shape.
     * @param other The interface to compare against.
     * @return Human readable differences, empty if the shapes match.
     */
    public List<String> describeMismatches(QHDLInterface other) {
        List<String> mismatches = new ArrayList<>();
        for (QHDLGeneric g : generics) {
            QHDLGeneric o = other.getGeneric(g.getName());
            if (o == null) {
                mismatches.add("generic " + g.getName() + " is missing");
            } else if (!QHDLName.sameName(g.getTypeName(), o.getTypeName())) {
                mismatches.add("generic " + g.getName() + " is " + g.getTypeName() + " here but "
                        + o.getTypeName() + " there");
            }
        }
        for (QHDLGeneric o : other.generics) {
            if (getGeneric(o.getName()) == null) {
                mismatches.add("generic " + o.getName() + " is not declared");
            }
        }
        for (QHDLPort p : ports) {
            QHDLPort o = other.getPort(p.getName());
            if (o == null) {
                mismatches.add("port " + p.getName() + " is missing");
            } else {
                if (p.getDirection() != o.getDirection()) {
                    mismatches.add("port " + p.getName() + " is " + p.getDirection().getKeyword()
                            + " here but " + o.getDirection().getKeyword() + " there");
                }
                if (!QHDLName.sameName(p.getTypeName(), o.getTypeName())) {
                    mismatches.add("port " + p.getName() + " is " + p.getTypeName() + " here but "
                            + o.getTypeName() + " there");
                }
            }
        }
        for (QHDLPort o : other.ports) {
            if (getPort(o.getName()) == null) {
                mismatches.add("port " + o.getName() + " is not declared");
            }
        }
        return mismatches;
    }
}
