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

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

import com.netwright.qhdl.ParallelQHDLParser;
import com.netwright.qhdl.QHDLArchitecture;
import com.netwright.qhdl.QHDLDesignFile;
import com.netwright.qhdl.QHDLEntity;
import com.netwright.qhdl.QHDLLibrary;
import com.netwright.qhdl.QHDLLocation;
import com.netwright.qhdl.QHDLParser;
import com.netwright.util.CodePerfTracker;
import com.netwright.util.MessageGenerator;
import com.netwright.util.Params;
import com.netwright.util.StringPool;

/**
 * Entry point for drivers: parse QHDL text, register the parsed units into a
 * library, and elaborate a top-level entity of that library.
 */
public class NetlistCompiler {

    private final QHDLLibrary library;

    private final StringPool uniquifier = StringPool.singleThreadedPool();

    public NetlistCompiler(@NotNull QHDLLibrary library) {
        this.library = library;
    }

    public NetlistCompiler() {
        this(new QHDLLibrary());
    }

    public QHDLLibrary getLibrary() {
        return library;
    }

    /**
     * Parses one source without registering it.
     * @param sourceName Name used in locations.
     * @param text The source text.
     * @return The parsed entities and architectures.
     * @throws com.netwright.qhdl.QHDLParseException on the first syntax error
     */
    public QHDLDesignFile parse(@NotNull String sourceName, @NotNull String text) {
        return new QHDLParser(sourceName, text, uniquifier).parseDesignFile();
    }

    public QHDLDesignFile parse(@NotNull String text) {
        return parse(QHDLLocation.UNKNOWN_SOURCE, text);
    }

    /**
     * @throws com.netwright.qhdl.QHDLDuplicateNameException if the library already has the entity
     */
    public void registerEntity(@NotNull QHDLEntity entity) {
        library.registerEntity(entity);
    }

    public void registerArchitecture(@NotNull QHDLArchitecture architecture) {
        library.registerArchitecture(architecture);
    }

    /**
     * Registers all units of a parsed source.
     * @param file The parsed source.
     * @throws com.netwright.qhdl.QHDLDuplicateNameException on the first unit that is already registered
     */
    public void register(@NotNull QHDLDesignFile file) {
        library.register(file);
    }

    /**
     * Parses and registers one source.
     * @return The parsed source.
     */
    public QHDLDesignFile load(@NotNull String sourceName, @NotNull String text) {
        QHDLDesignFile file = parse(sourceName, text);
        register(file);
        return file;
    }

    /**
     * Parses several sources in parallel and registers them in the given order.
     * @param sources Source name to text.
     */
    public void loadAll(@NotNull Map<String, String> sources) {
        new ParallelQHDLParser(sources).parse(library, CodePerfTracker.fromParams("Load QHDL Sources"));
    }

    /**
     * Parses several files in parallel and registers them in the given order.
     * @param paths Files to read.
     */
    public void loadFiles(@NotNull List<Path> paths) {
        new ParallelQHDLParser(paths).parse(library, CodePerfTracker.fromParams("Load QHDL Files"));
    }

    public ElaborationResult elaborate(@NotNull String topEntityName, @NotNull ElaborationOptions options) {
        return elaborate(topEntityName, null, options);
    }

    public ElaborationResult elaborate(@NotNull String topEntityName) {
        return elaborate(topEntityName, null, new ElaborationOptions());
    }

    /**
     * Elaborates a top-level entity of the library.
     * @param topEntityName Entity to elaborate.
     * @param selector Architecture choice for the top-level entity, null to use the options.
     * @param options Elaboration settings.
     * @return Diagnostics and, on success, the flat circuit.
     */
    public ElaborationResult elaborate(@NotNull String topEntityName, ArchitectureSelector selector,
            @NotNull ElaborationOptions options) {
        CodePerfTracker t = CodePerfTracker.fromParams("Elaborate " + topEntityName);
        ElaborationResult result = new Elaborator(library, options, t).elaborate(topEntityName, selector);
        if (Params.NW_VERBOSE) {
            t.printSummary();
            for (Diagnostic d : result.getDiagnostics()) {
                MessageGenerator.briefError(d.toString());
            }
            if (result.isSuccess()) {
                MessageGenerator.briefMessage(result.getCircuit().toString());
            }
        }
        return result;
    }
}
