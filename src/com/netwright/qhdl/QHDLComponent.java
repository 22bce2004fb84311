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

import java.util.List;

/**
 * A component declaration inside an architecture: the local view of an
 * entity's interface. It is matched against the library by name only when
 * the architecture is elaborated.
 */
public class QHDLComponent extends QHDLName {

    private final QHDLInterface iface;

    public QHDLComponent(String name, QHDLInterface iface, QHDLLocation location) {
        super(name, location);
        this.iface = iface;
    }

    public QHDLComponent(String name, List<QHDLGeneric> generics, List<QHDLPort> ports) {
        this(name, new QHDLInterface(generics, ports), null);
    }

    public QHDLInterface getInterface() {
        return iface;
    }

    public List<QHDLGeneric> getGenerics() {
        return iface.getGenerics();
    }

    public List<QHDLPort> getPorts() {
        return iface.getPorts();
    }

    public QHDLPort getPort(String name) {
        return iface.getPort(name);
    }

    public QHDLGeneric getGeneric(String name) {
        return iface.getGeneric(name);
    }
}
