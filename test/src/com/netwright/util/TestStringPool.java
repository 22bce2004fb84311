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

package com.netwright.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TestStringPool {

    @Test
    void testUniquifyName() {
        StringPool pool = StringPool.singleThreadedPool();
        String first = pool.uniquifyName(new String("Out1".toCharArray()));
        String second = pool.uniquifyName(new String("Out1".toCharArray()));
        Assertions.assertSame(first, second);
        Assertions.assertEquals(1, pool.size());
    }

    @Test
    void testKeysAreSharedAcrossSpellings() {
        StringPool pool = StringPool.singleThreadedPool();
        String key = pool.uniquifyKey("Beamsplitter");
        Assertions.assertEquals("beamsplitter", key);
        Assertions.assertSame(key, pool.uniquifyKey("BEAMSPLITTER"));
        Assertions.assertSame(key, pool.uniquifyKey(new String("Beamsplitter".toCharArray())));
        Assertions.assertSame(key, pool.uniquifyName(new String("beamsplitter".toCharArray())));
        Assertions.assertEquals(1, pool.size());
    }

    @Test
    void testConcurrentKeys() {
        StringPool pool = StringPool.concurrentPool();
        List<Callable<String>> tasks = new ArrayList<>();
        for (int i = 0; i < 64; i++) {
            String spelling = i % 2 == 0 ? "Theta" : "THETA";
            tasks.add(() -> pool.uniquifyKey(spelling));
        }
        List<String> keys = ParallelismTools.join(ParallelismTools.submitAll(tasks));
        for (String key : keys) {
            Assertions.assertSame(keys.get(0), key);
        }
        Assertions.assertEquals("theta", keys.get(0));
    }
}
