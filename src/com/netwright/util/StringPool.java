/*
 * Original work: Copyright (c) 2022, Xilinx, Inc.
 *                Copyright (c) 2022, Advanced Micro Devices, Inc.
 *                Author: Jakob Wenzel, Xilinx Research Labs.
 *                This file is derived from RapidWright.
 * Modified work: Copyright (c) 2026, NetWright contributors.
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

package com.netwright.util;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Deduplicates identifier strings. QHDL names are case-insensitive, so besides
 * the identifiers as written the pool hands out their case-folded lookup keys:
 * every spelling of a name maps to one shared key instance.
 */
public class StringPool {

    private final Map<String,String> stringPool;

    /** Identifier as written to its pooled key */
    private final Map<String,String> keyPool;

    private StringPool(Map<String, String> stringPool, Map<String, String> keyPool) {
        this.stringPool = stringPool;
        this.keyPool = keyPool;
    }

    /**
     * Create a new thread safe StringPool
     * @return a thread safe StringPool
     */
    public static StringPool concurrentPool() {
        return new StringPool(new ConcurrentHashMap<>(), new ConcurrentHashMap<>());
    }

    /**
     * Create a new StringPool that should be only used by a single thread.
     * @return a non thread safe StringPool
     */
    public static StringPool singleThreadedPool() {
        return new StringPool(new HashMap<>(), new HashMap<>());
    }

    /**
     * @param name An identifier as written.
     * @return The pooled instance equal to name.
     */
    public String uniquifyName(String name) {
        return stringPool.computeIfAbsent(name, Function.identity());
    }

    /**
     * @param name An identifier in any case.
     * @return The pooled lower-case key of name, shared by all its spellings.
     */
    public String uniquifyKey(String name) {
        String key = keyPool.get(name);
        if (key == null) {
            key = uniquifyName(name.toLowerCase(Locale.ROOT));
            keyPool.putIfAbsent(name, key);
        }
        return key;
    }

    /**
     * @return Number of distinct strings held, keys included.
     */
    public int size() {
        return stringPool.size();
    }

}
