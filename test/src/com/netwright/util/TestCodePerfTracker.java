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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TestCodePerfTracker {

    @Test
    void testSegments() {
        CodePerfTracker t = new CodePerfTracker("test", false);
        t.start("Outer").start("Inner");
        t.stop().stop();
        Assertions.assertTrue(t.getTotalRuntime() >= 0);
        t.printSummary();
    }

    @Test
    void testStopWithoutStart() {
        CodePerfTracker t = new CodePerfTracker("test", false);
        Assertions.assertThrows(IllegalStateException.class, t::stop);
        Assertions.assertThrows(IllegalStateException.class, () -> t.stop("Never"));
    }

    @Test
    void testSilentTrackerIgnoresEverything() {
        Assertions.assertFalse(CodePerfTracker.SILENT.isVerbose());
        CodePerfTracker.SILENT.stop();
        CodePerfTracker.SILENT.start("A").stop("B");
        Assertions.assertEquals(0, CodePerfTracker.SILENT.getTotalRuntime());
    }
}
