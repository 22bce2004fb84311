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

import java.util.Locale;
import java.util.Objects;

import com.netwright.util.StringPool;

/**
 * This class serves as the universal common ancestor for most all QHDL design
 * objects. It keeps the name as written in the source together with the
 * case-folded key used for every comparison, since QHDL identifiers are
 * case-insensitive.
 */
public class QHDLName implements Comparable<QHDLName> {
    /** Keys of all declared names, shared across libraries */
    private static final StringPool KEYS = StringPool.concurrentPool();

    /** Name of the object, as written */
    private final String name;

    /** Lower-case name, used for lookups */
    private final String key;

    /** Where the object was declared, null if built programmatically */
    private final QHDLLocation location;

    public QHDLName(String name, QHDLLocation location) {
        this.name = Objects.requireNonNull(name);
        this.key = KEYS.uniquifyKey(name);
        this.location = location;
    }

    public QHDLName(String name) {
        this(name, null);
    }

    /**
     * Folds an identifier to the form used for comparisons. Unlike the keys of
     * declared names, the result is not pooled.
     * @param name The identifier as written.
     * @return The lookup key for the identifier.
     */
    public static String toKey(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    public static boolean sameName(String a, String b) {
        return a.equalsIgnoreCase(b);
    }

    public String getName() {
        return name;
    }

    public String getKey() {
        return key;
    }

    public QHDLLocation getLocation() {
        return location;
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), key);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        QHDLName other = (QHDLName) obj;
        return key.equals(other.key);
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public int compareTo(QHDLName o) {
        return this.getKey().compareTo(o.getKey());
    }

}
