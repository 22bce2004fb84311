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

package com.netwright.support;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import com.netwright.elab.NetlistCompiler;
import com.netwright.qhdl.QHDLLibrary;
import com.netwright.qhdl.QHDLParser;

/**
 * Loads the QHDL fixtures under {@code /qhdl} on the test classpath.
 */
public class QHDLTestSources {

    public static final String BEAMSPLITTER = "beamsplitter.qhdl";

    public static final String DOUBLE_BEAMSPLITTER = "double_beamsplitter.qhdl";

    public static final String CASCADE = "cascade.qhdl";

    public static final String RECURSIVE = "recursive.qhdl";

    public static String read(String fileName) {
        String resource = "/qhdl/" + fileName;
        try (InputStream in = QHDLTestSources.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("ERROR: Missing test resource " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parses the named fixtures, in order, into a fresh library.
     */
    public static QHDLLibrary library(String... fileNames) {
        QHDLLibrary library = new QHDLLibrary();
        for (String f : fileNames) {
            library.register(QHDLParser.parse(f, read(f)));
        }
        return library;
    }

    public static NetlistCompiler compiler(String... fileNames) {
        return new NetlistCompiler(library(fileNames));
    }
}
