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

/**
 * Lexical categories of QHDL source text.
 */
public enum QHDLTokenType {
    IDENTIFIER("identifier"),
    NUMBER("number"),
    STRING("string literal"),
    LEFT_PAREN("'('"),
    RIGHT_PAREN("')'"),
    SEMICOLON("';'"),
    COLON("':'"),
    COMMA("','"),
    DOT("'.'"),
    DEFAULT_ASSIGN("':='"),
    ARROW("'=>'"),
    SIGNAL_ASSIGN("'<='"),
    PLUS("'+'"),
    MINUS("'-'"),
    STAR("'*'"),
    SLASH("'/'"),
    EOF("end of file");

    private final String description;

    QHDLTokenType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
