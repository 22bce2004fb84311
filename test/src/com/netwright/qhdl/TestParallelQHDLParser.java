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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.netwright.support.QHDLTestSources;
import com.netwright.util.CodePerfTracker;

class TestParallelQHDLParser {

    private static Map<String, String> manySources(int count) {
        Map<String, String> sources = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            sources.put("unit" + i + ".qhdl", "entity E" + i + " is port (I : in t; O : out t); end E" + i + ";\n"
                    + "architecture a of E" + i + " is begin O <= I; end a;");
        }
        return sources;
    }

    @Test
    void testParseInInputOrder() {
        ParallelQHDLParser parser = new ParallelQHDLParser(manySources(32));
        List<QHDLDesignFile> files = parser.parseDesignFiles(CodePerfTracker.SILENT);
        Assertions.assertEquals(32, files.size());
        for (int i = 0; i < files.size(); i++) {
            Assertions.assertEquals("unit" + i + ".qhdl", files.get(i).getSourceName());
            Assertions.assertEquals("E" + i, files.get(i).getEntities().get(0).getName());
        }
    }

    @Test
    void testParseIntoLibrary() {
        QHDLLibrary library = new ParallelQHDLParser(manySources(8)).parse();
        Assertions.assertEquals(8, library.getEntities().size());
        Assertions.assertFalse(library.isPrimitive("e7"));
    }

    @Test
    void testFirstFailureInInputOrder() {
        Map<String, String> sources = manySources(4);
        sources.put("broken1.qhdl", "entity ;");
        sources.put("broken2.qhdl", "architecture ;");
        RuntimeException e = Assertions.assertThrows(RuntimeException.class,
                () -> new ParallelQHDLParser(sources).parse());
        Throwable cause = e;
        while (cause != null && !(cause instanceof QHDLParseException)) {
            cause = cause.getCause();
        }
        Assertions.assertNotNull(cause, "parse error should be reported");
        Assertions.assertEquals("broken1.qhdl", ((QHDLParseException) cause).getLocation().getSource());
    }

    @Test
    void testDuplicatesAcrossSources() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("a.qhdl", "entity Dup is end;");
        sources.put("b.qhdl", "entity dup is end;");
        QHDLDuplicateNameException e = Assertions.assertThrows(QHDLDuplicateNameException.class,
                () -> new ParallelQHDLParser(sources).parse());
        Assertions.assertTrue(e.getMessage().contains("b.qhdl"));
    }

    @Test
    void testParseFiles(@TempDir Path dir) throws IOException {
        List<Path> paths = new ArrayList<>();
        for (String name : new String[]{QHDLTestSources.BEAMSPLITTER, QHDLTestSources.DOUBLE_BEAMSPLITTER}) {
            Path p = dir.resolve(name);
            Files.write(p, QHDLTestSources.read(name).getBytes(StandardCharsets.UTF_8));
            paths.add(p);
        }
        ParallelQHDLParser parser = new ParallelQHDLParser(paths);
        Assertions.assertEquals(paths.get(0).toString(), parser.getSourceNames().get(0));
        QHDLLibrary library = parser.parse();
        Assertions.assertTrue(library.isPrimitive("Beamsplitter"));
        Assertions.assertEquals(1, library.getArchitectures("DoubleBeamsplitter").size());
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        ParallelQHDLParser parser = new ParallelQHDLParser(List.of(dir.resolve("missing.qhdl")));
        RuntimeException e = Assertions.assertThrows(RuntimeException.class, parser::parse);
        Throwable cause = e;
        while (cause != null && !(cause instanceof UncheckedIOException)) {
            cause = cause.getCause();
        }
        Assertions.assertNotNull(cause);
    }
}
