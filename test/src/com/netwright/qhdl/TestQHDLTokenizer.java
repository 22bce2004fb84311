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

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.netwright.util.StringPool;

class TestQHDLTokenizer {

    @NotNull
    private static List<QHDLToken> tokenize(String text) {
        QHDLTokenizer tokenizer = new QHDLTokenizer("test.qhdl", text);
        List<QHDLToken> tokens = new ArrayList<>();
        QHDLToken t;
        do {
            t = tokenizer.nextToken();
            tokens.add(t);
        } while (!t.is(QHDLTokenType.EOF));
        return tokens;
    }

    private static List<QHDLTokenType> types(String text) {
        List<QHDLTokenType> types = new ArrayList<>();
        for (QHDLToken t : tokenize(text)) {
            types.add(t.getType());
        }
        return types;
    }

    @Test
    void testDelimiters() {
        Assertions.assertEquals(List.of(
                QHDLTokenType.LEFT_PAREN, QHDLTokenType.RIGHT_PAREN, QHDLTokenType.SEMICOLON,
                QHDLTokenType.COLON, QHDLTokenType.DEFAULT_ASSIGN, QHDLTokenType.COMMA,
                QHDLTokenType.ARROW, QHDLTokenType.SIGNAL_ASSIGN, QHDLTokenType.DOT,
                QHDLTokenType.PLUS, QHDLTokenType.MINUS, QHDLTokenType.STAR, QHDLTokenType.SLASH,
                QHDLTokenType.EOF),
                types("( ) ; : := , => <= . + - * /"));
    }

    @Test
    void testCommentsAndLocations() {
        List<QHDLToken> tokens = tokenize("-- header comment\n  entity Foo -- trailing\nis");
        Assertions.assertEquals(4, tokens.size());
        QHDLToken entity = tokens.get(0);
        Assertions.assertTrue(entity.isKeyword("ENTITY"));
        Assertions.assertEquals(new QHDLLocation("test.qhdl", 2, 3), entity.getLocation());
        Assertions.assertEquals("Foo", tokens.get(1).getText());
        Assertions.assertEquals(2, tokens.get(1).getLocation().getLine());
        Assertions.assertEquals(10, tokens.get(1).getLocation().getColumn());
        Assertions.assertEquals(3, tokens.get(2).getLocation().getLine());
        Assertions.assertTrue(tokens.get(3).is(QHDLTokenType.EOF));
    }

    @Test
    void testSingleMinusIsNotComment() {
        Assertions.assertEquals(List.of(QHDLTokenType.MINUS, QHDLTokenType.NUMBER, QHDLTokenType.EOF),
                types("- 1"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "42", "1_000", "3.14", "0.7853981633974483", "1.0e-3", "2E10"})
    void testNumbers(String literal) {
        List<QHDLToken> tokens = tokenize(literal);
        Assertions.assertEquals(2, tokens.size());
        Assertions.assertEquals(QHDLTokenType.NUMBER, tokens.get(0).getType());
        Assertions.assertEquals(literal, tokens.get(0).getText());
    }

    @ParameterizedTest
    @ValueSource(strings = {"12abc", "1.", "1e", "#", "= 1", "<"})
    void testMalformedInput(String text) {
        Assertions.assertThrows(QHDLParseException.class, () -> tokenize(text));
    }

    @Test
    void testStringLiteral() {
        List<QHDLToken> tokens = tokenize("\"say \"\"hi\"\"\"");
        Assertions.assertEquals(QHDLTokenType.STRING, tokens.get(0).getType());
        Assertions.assertEquals("say \"hi\"", tokens.get(0).getText());
    }

    @Test
    void testUnterminatedString() {
        QHDLParseException e = Assertions.assertThrows(QHDLParseException.class,
                () -> tokenize("x := \"open\nend"));
        Assertions.assertEquals(1, e.getLine());
        Assertions.assertEquals(6, e.getColumn());
        Assertions.assertEquals("end of line", e.getFound());
    }

    @Test
    void testIdentifiersArePooled() {
        StringPool pool = StringPool.singleThreadedPool();
        QHDLTokenizer tokenizer = new QHDLTokenizer("a", new String("sig1 sig1".toCharArray()), pool);
        QHDLToken first = tokenizer.nextToken();
        QHDLToken second = tokenizer.nextToken();
        Assertions.assertSame(first.getText(), second.getText());
    }

    @Test
    void testFromStream() {
        byte[] bytes = "port map".getBytes(StandardCharsets.UTF_8);
        QHDLTokenizer tokenizer = QHDLTokenizer.fromStream("stream.qhdl", new ByteArrayInputStream(bytes),
                StringPool.singleThreadedPool());
        Assertions.assertTrue(tokenizer.nextToken().isKeyword("port"));
        Assertions.assertEquals("stream.qhdl", tokenizer.nextToken().getLocation().getSource());
    }
}
