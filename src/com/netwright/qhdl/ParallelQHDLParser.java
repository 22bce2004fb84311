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
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

import com.netwright.util.CodePerfTracker;
import com.netwright.util.ParallelismTools;
import com.netwright.util.StringPool;

/**
 * Parses several independent QHDL sources on the shared worker pool. All
 * sources are parsed before any of them is registered; registration then
 * happens on the calling thread in input order, so duplicate names are
 * reported against the same source no matter how the parses were scheduled.
 */
public class ParallelQHDLParser {

    private final List<String> sourceNames = new ArrayList<>();

    private final List<Callable<String>> readers = new ArrayList<>();

    protected final StringPool uniquifier = StringPool.concurrentPool();

    /**
     * @param sources Source name to source text, iterated in the order the
     *                sources should be registered.
     */
    public ParallelQHDLParser(Map<String, String> sources) {
        for (Map.Entry<String, String> e : sources.entrySet()) {
            String text = e.getValue();
            sourceNames.add(e.getKey());
            readers.add(() -> text);
        }
    }

    /**
     * @param paths Files to parse. Each file is read by the task that parses it.
     */
    public ParallelQHDLParser(List<Path> paths) {
        for (Path p : paths) {
            sourceNames.add(p.toString());
            readers.add(() -> readFile(p));
        }
    }

    private static String readFile(Path p) {
        try {
            return new String(Files.readAllBytes(p), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Couldn't read QHDL source " + p, e);
        }
    }

    public List<String> getSourceNames() {
        return sourceNames;
    }

    /**
     * Parses every source.
     * @param t Tracker for the parse and join phases.
     * @return One design file per source, in input order.
     * @throws QHDLParseException from the first failing source in input order
     */
    public List<QHDLDesignFile> parseDesignFiles(CodePerfTracker t) {
        t.start("Parse QHDL Sources");
        List<Callable<QHDLDesignFile>> tasks = new ArrayList<>(readers.size());
        for (int i = 0; i < readers.size(); i++) {
            String sourceName = sourceNames.get(i);
            Callable<String> reader = readers.get(i);
            tasks.add(() -> new QHDLParser(sourceName, reader.call(), uniquifier).parseDesignFile());
        }
        List<Future<QHDLDesignFile>> futures = ParallelismTools.submitAll(tasks);
        List<QHDLDesignFile> files = ParallelismTools.join(futures);
        t.stop();
        return files;
    }

    /**
     * Parses every source and registers the results into the given library.
     * @param library Library to register into.
     * @param t Tracker for the parse and register phases.
     * @return The library.
     */
    public QHDLLibrary parse(QHDLLibrary library, CodePerfTracker t) {
        List<QHDLDesignFile> files = parseDesignFiles(t);
        t.start("Register Design Units");
        for (QHDLDesignFile f : files) {
            library.register(f);
        }
        t.stop();
        return library;
    }

    public QHDLLibrary parse() {
        return parse(new QHDLLibrary(), CodePerfTracker.SILENT);
    }
}
