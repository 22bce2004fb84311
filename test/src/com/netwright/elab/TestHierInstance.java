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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TestHierInstance {

    @Test
    void testNaming() {
        HierInstance top = HierInstance.createTop("Cascade");
        HierInstance m1 = top.getChild("M1", "Interferometer");
        HierInstance bs1 = m1.getChild("BS1", "Beamsplitter");

        Assertions.assertTrue(top.isTopLevel());
        Assertions.assertEquals("", top.getHierarchicalName());
        Assertions.assertEquals("x1", top.getHierarchicalName("x1"));
        Assertions.assertEquals("M1.a1", m1.getHierarchicalName("a1"));
        Assertions.assertEquals("M1.BS1", bs1.getHierarchicalName());
        Assertions.assertEquals(2, bs1.getDepth());
        Assertions.assertEquals("BS1", bs1.getLabel());
        Assertions.assertNull(top.getLabel());
        Assertions.assertEquals("beamsplitter", bs1.getEntityKey());
    }

    @Test
    void testParentAndEquality() {
        HierInstance top = HierInstance.createTop("Cascade");
        HierInstance m1 = top.getChild("M1", "Interferometer");
        Assertions.assertEquals(m1, m1.getChild("P1", "Phase").getParent());
        Assertions.assertEquals(m1.hashCode(), top.getChild("M1", "Interferometer").hashCode());
        Assertions.assertNotEquals(m1, top.getChild("M2", "Interferometer"));
        Assertions.assertNull(top.getParent());
    }

    @Test
    void testRecursionDetection() {
        HierInstance a = HierInstance.createTop("PingA");
        HierInstance b = a.getChild("B", "PingB");
        Assertions.assertTrue(b.isExpanding("pinga"));
        Assertions.assertTrue(b.isExpanding("PINGB"));
        Assertions.assertFalse(b.isExpanding("Loop"));
        Assertions.assertEquals("pinga -> pingb -> pinga", b.describeExpansionPath("PingA"));
    }
}
