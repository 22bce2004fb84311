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
import java.util.List;

/**
 * A labeled instantiation statement: a use of a component inside an
 * architecture, with its generic map and port map.
 */
public class QHDLInstance extends QHDLName {

    private final String componentName;

    private final List<QHDLAssociation> genericMap;

    private final List<QHDLAssociation> portMap;

    public QHDLInstance(String label, String componentName, List<QHDLAssociation> genericMap,
                        List<QHDLAssociation> portMap, QHDLLocation location) {
        super(label, location);
        this.componentName = componentName;
        this.genericMap = Collections.unmodifiableList(new ArrayList<>(genericMap));
        this.portMap = Collections.unmodifiableList(new ArrayList<>(portMap));
    }

    public QHDLInstance(String label, String componentName, List<QHDLAssociation> genericMap,
                        List<QHDLAssociation> portMap) {
        this(label, componentName, genericMap, portMap, null);
    }

    public String getLabel() {
        return getName();
    }

    public String getComponentName() {
        return componentName;
    }

    public List<QHDLAssociation> getGenericMap() {
        return genericMap;
    }

    public List<QHDLAssociation> getPortMap() {
        return portMap;
    }

    @Override
    public String toString() {
        return getName() + " : " + componentName;
    }
}
