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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.netwright.support.QHDLTestSources;

class TestQHDLLibrary {

    @Test
    void testLookupIgnoresCase() {
        QHDLLibrary library = QHDLTestSources.library(QHDLTestSources.CASCADE);
        Assertions.assertEquals("work", library.getName());
        Assertions.assertTrue(library.containsEntity("CASCADE"));
        Assertions.assertSame(library.getEntity("Cascade"), library.getEntity("cascade"));
        Assertions.assertNotNull(library.getArchitecture("interferometer", "STRUCTURE"));
        Assertions.assertNull(library.getEntity("Missing"));
        Assertions.assertEquals(4, library.getEntities().size());
    }

    @Test
    void testPrimitives() {
        QHDLLibrary library = QHDLTestSources.library(QHDLTestSources.CASCADE);
        Assertions.assertTrue(library.isPrimitive("Beamsplitter"));
        Assertions.assertTrue(library.isPrimitive("Phase"));
        Assertions.assertFalse(library.isPrimitive("Interferometer"));
        Assertions.assertTrue(library.getArchitectures("Phase").isEmpty());
    }

    @Test
    void testDuplicateEntity() {
        QHDLLibrary library = QHDLTestSources.library(QHDLTestSources.BEAMSPLITTER);
        QHDLDesignFile again = QHDLParser.parse("other.qhdl",
                "entity BEAMSPLITTER is port (A : in fieldmode); end;");
        QHDLDuplicateNameException e = Assertions.assertThrows(QHDLDuplicateNameException.class,
                () -> library.register(again));
        Assertions.assertEquals("BEAMSPLITTER", e.getName());
        Assertions.assertTrue(e.getMessage().contains("other.qhdl:1:1"));
        Assertions.assertTrue(e.getMessage().contains(QHDLTestSources.BEAMSPLITTER + ":2:1"));
    }

    @Test
    void testDuplicateArchitecture() {
        QHDLLibrary library = new QHDLLibrary("lib");
        library.register(QHDLParser.parse("entity E is end; architecture a of E is begin end;"));
        Assertions.assertThrows(QHDLDuplicateNameException.class,
                () -> library.register(QHDLParser.parse("architecture A of e is begin end;")));
        library.register(QHDLParser.parse("architecture b of E is begin end;"));
        List<QHDLArchitecture> archs = library.getArchitectures("E");
        Assertions.assertEquals(2, archs.size());
        Assertions.assertEquals("a", archs.get(0).getName());
        Assertions.assertEquals("b", archs.get(1).getName());
    }

    @Test
    void testArchitectureBeforeEntity() {
        QHDLLibrary library = new QHDLLibrary();
        library.register(QHDLParser.parse("architecture a of Late is begin end;"));
        Assertions.assertEquals(1, library.getOrphanArchitectures().size());
        library.register(QHDLParser.parse("entity Late is end;"));
        Assertions.assertTrue(library.getOrphanArchitectures().isEmpty());
        Assertions.assertFalse(library.isPrimitive("Late"));
    }
}
