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
 * Everything parsed from one QHDL source: its entities and architectures in
 * the order they appear.
 */
public class QHDLDesignFile {

    private final String sourceName;

    private final List<QHDLEntity> entities;

    private final List<QHDLArchitecture> architectures;

    public QHDLDesignFile(String sourceName, List<QHDLEntity> entities, List<QHDLArchitecture> architectures) {
        this.sourceName = sourceName;
        this.entities = Collections.unmodifiableList(new ArrayList<>(entities));
        this.architectures = Collections.unmodifiableList(new ArrayList<>(architectures));
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<QHDLEntity> getEntities() {
        return entities;
    }

    public List<QHDLArchitecture> getArchitectures() {
        return architectures;
    }

    public QHDLEntity getEntity(String name) {
        for (QHDLEntity e : entities) {
            if (QHDLName.sameName(e.getName(), name)) {
                return e;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return sourceName + " (" + entities.size() + " entities, " + architectures.size() + " architectures)";
    }
}
