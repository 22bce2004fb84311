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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps track of the entities and architectures available to elaboration.
 * Units are keyed case-insensitively and kept in registration order.
 * Architectures may be registered before the entity they implement; the link
 * is only checked when elaborating. A library is populated first and then
 * only read, so it can be shared by elaboration runs.
 */
public class QHDLLibrary extends QHDLName {

    public static final String DEFAULT_LIBRARY_NAME = "work";

    private final Map<String, QHDLEntity> entities = new LinkedHashMap<>();

    private final Map<String, Map<String, QHDLArchitecture>> architectures = new LinkedHashMap<>();

    public QHDLLibrary(String name) {
        super(name);
    }

    public QHDLLibrary() {
        this(DEFAULT_LIBRARY_NAME);
    }

    /**
     * Adds the provided entity to the library. All entities must be unique by their name.
     * @param entity The entity to add.
     * @throws QHDLDuplicateNameException if an entity of the same name exists
     */
    public void registerEntity(QHDLEntity entity) {
        QHDLEntity existing = entities.putIfAbsent(entity.getKey(), entity);
        if (existing != null) {
            throw new QHDLDuplicateNameException(entity.getName(), "ERROR: Failed to add entity "
                    + entity.getName() + describe(entity.getLocation()) + " to library " + getName()
                    + ". The library already contains an entity with the same name"
                    + describe(existing.getLocation()) + ".");
        }
    }

    /**
     * Adds the provided architecture. Architecture names must be unique per entity.
     * @param arch The architecture to add.
     * @throws QHDLDuplicateNameException if the entity already has an architecture of that name
     */
    public void registerArchitecture(QHDLArchitecture arch) {
        Map<String, QHDLArchitecture> archs = architectures.computeIfAbsent(arch.getEntityKey(),
                k -> new LinkedHashMap<>());
        QHDLArchitecture existing = archs.putIfAbsent(arch.getKey(), arch);
        if (existing != null) {
            throw new QHDLDuplicateNameException(arch.getName(), "ERROR: Failed to add architecture "
                    + arch.getName() + " of " + arch.getEntityName() + describe(arch.getLocation())
                    + " to library " + getName() + ". It was already declared"
                    + describe(existing.getLocation()) + ".");
        }
    }

    /**
     * Registers every unit of a parsed source, entities first.
     * @param file The parsed source.
     */
    public void register(QHDLDesignFile file) {
        for (QHDLEntity e : file.getEntities()) {
            registerEntity(e);
        }
        for (QHDLArchitecture a : file.getArchitectures()) {
            registerArchitecture(a);
        }
    }

    private static String describe(QHDLLocation location) {
        return location == null ? "" : " (" + location + ")";
    }

    public QHDLEntity getEntity(String name) {
        return entities.get(toKey(name));
    }

    public boolean containsEntity(String name) {
        return entities.containsKey(toKey(name));
    }

    public Collection<QHDLEntity> getEntities() {
        return Collections.unmodifiableCollection(entities.values());
    }

    /**
     * @param entityName Name of the entity, any case.
     * @return Its architectures in registration order, possibly empty.
     */
    public List<QHDLArchitecture> getArchitectures(String entityName) {
        Map<String, QHDLArchitecture> archs = architectures.get(toKey(entityName));
        if (archs == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(archs.values()));
    }

    public QHDLArchitecture getArchitecture(String entityName, String archName) {
        Map<String, QHDLArchitecture> archs = architectures.get(toKey(entityName));
        if (archs == null) {
            return null;
        }
        return archs.get(toKey(archName));
    }

    /**
     * @param entityName Name of the entity, any case.
     * @return True if instances of this entity cannot be expanded any further.
     */
    public boolean isPrimitive(String entityName) {
        return getArchitectures(entityName).isEmpty();
    }

    /**
     * @return Architectures whose entity was never registered.
     */
    public List<QHDLArchitecture> getOrphanArchitectures() {
        List<QHDLArchitecture> orphans = new ArrayList<>();
        for (Map.Entry<String, Map<String, QHDLArchitecture>> e : architectures.entrySet()) {
            if (!entities.containsKey(e.getKey())) {
                orphans.addAll(e.getValue().values());
            }
        }
        return orphans;
    }
}
