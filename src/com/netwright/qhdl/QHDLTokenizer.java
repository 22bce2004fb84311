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
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import com.netwright.util.StringPool;

/**
 * Tokenize QHDL source text. Whitespace and {@code --} line comments are
 * skipped; keywords are not distinguished from identifiers here, the parser
 * matches them case-insensitively. Identifier texts are de-duplicated through
 * a {@link StringPool}.
 */
public class QHDLTokenizer {

    private final String sourceName;

    private final String text;

    protected final StringPool uniquifier;

    private int offset = 0;
    private int line = 1;
    private int column = 1;

    public QHDLTokenizer(String sourceName, String text, StringPool uniquifier) {
        this.sourceName = sourceName == null ? QHDLLocation.UNKNOWN_SOURCE : sourceName;
        this.text = text;
        this.uniquifier = uniquifier;
    }

    public QHDLTokenizer(String sourceName, String text) {
        this(sourceName, text, StringPool.singleThreadedPool());
    }

    /**
     * Reads a whole stream as UTF-8 and tokenizes it.
     * @param sourceName Name used in locations.
     * @param in The stream, consumed but not closed.
     * @param uniquifier Pool for identifier texts.
     * @return A tokenizer over the stream's contents.
     */
    public static QHDLTokenizer fromStream(String sourceName, InputStream in, StringPool uniquifier) {
        try {
            return new QHDLTokenizer(sourceName, new String(in.readAllBytes(), StandardCharsets.UTF_8),
                    uniquifier);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: IOException while reading QHDL source: " + sourceName, e);
        }
    }

    private boolean atEnd() {
        return offset >= text.length();
    }

    private char peekChar(int ahead) {
        int i = offset + ahead;
        return i < text.length() ? text.charAt(i) : 0;
    }

    private char readChar() {
        char c = text.charAt(offset++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private QHDLLocation here() {
        return new QHDLLocation(sourceName, line, column);
    }

    private void skipWhitespaceAndComments() {
        while (!atEnd()) {
            char c = peekChar(0);
            if (c == '-' && peekChar(1) == '-') {
                while (!atEnd() && peekChar(0) != '\n') {
                    readChar();
                }
            } else if (Character.isWhitespace(c)) {
                readChar();
            } else {
                return;
            }
        }
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    /**
     * Get the next token
     * @return the next token, a token of type {@link QHDLTokenType#EOF} at the end of input
     * @throws QHDLParseException on characters that cannot start a token
     */
    public QHDLToken nextToken() {
        skipWhitespaceAndComments();
        QHDLLocation start = here();
        if (atEnd()) {
            return new QHDLToken(QHDLTokenType.EOF, "", start);
        }
        char c = peekChar(0);
        if (isIdentifierStart(c)) {
            return new QHDLToken(QHDLTokenType.IDENTIFIER, uniquifier.uniquifyName(readIdentifier()), start);
        }
        if (isDigit(c)) {
            return new QHDLToken(QHDLTokenType.NUMBER, readNumber(), start);
        }
        if (c == '"') {
            return new QHDLToken(QHDLTokenType.STRING, readString(start), start);
        }
        readChar();
        switch (c) {
            case '(':
                return new QHDLToken(QHDLTokenType.LEFT_PAREN, "(", start);
            case ')':
                return new QHDLToken(QHDLTokenType.RIGHT_PAREN, ")", start);
            case ';':
                return new QHDLToken(QHDLTokenType.SEMICOLON, ";", start);
            case ',':
                return new QHDLToken(QHDLTokenType.COMMA, ",", start);
            case '.':
                return new QHDLToken(QHDLTokenType.DOT, ".", start);
            case '+':
                return new QHDLToken(QHDLTokenType.PLUS, "+", start);
            case '-':
                return new QHDLToken(QHDLTokenType.MINUS, "-", start);
            case '*':
                return new QHDLToken(QHDLTokenType.STAR, "*", start);
            case '/':
                return new QHDLToken(QHDLTokenType.SLASH, "/", start);
            case ':':
                if (peekChar(0) == '=') {
                    readChar();
                    return new QHDLToken(QHDLTokenType.DEFAULT_ASSIGN, ":=", start);
                }
                return new QHDLToken(QHDLTokenType.COLON, ":", start);
            case '=':
                if (peekChar(0) == '>') {
                    readChar();
                    return new QHDLToken(QHDLTokenType.ARROW, "=>", start);
                }
                break;
            case '<':
                if (peekChar(0) == '=') {
                    readChar();
                    return new QHDLToken(QHDLTokenType.SIGNAL_ASSIGN, "<=", start);
                }
                break;
            default:
                break;
        }
        throw new QHDLParseException(start, "a token", "'" + c + "'");
    }

    private String readIdentifier() {
        int begin = offset;
        while (!atEnd() && isIdentifierPart(peekChar(0))) {
            readChar();
        }
        return text.substring(begin, offset);
    }

    private void readDigits() {
        if (!isDigit(peekChar(0))) {
            throw new QHDLParseException(here(), "a digit", describeChar(peekChar(0)));
        }
        while (!atEnd() && (isDigit(peekChar(0)) || (peekChar(0) == '_' && isDigit(peekChar(1))))) {
            readChar();
        }
    }

    private String readNumber() {
        int begin = offset;
        readDigits();
        if (peekChar(0) == '.') {
            readChar();
            readDigits();
        }
        if (peekChar(0) == 'e' || peekChar(0) == 'E') {
            readChar();
            if (peekChar(0) == '+' || peekChar(0) == '-') {
                readChar();
            }
            readDigits();
        }
        if (isIdentifierStart(peekChar(0))) {
            throw new QHDLParseException(here(), "a delimiter after number", describeChar(peekChar(0)));
        }
        return text.substring(begin, offset);
    }

    private String readString(QHDLLocation start) {
        readChar(); // opening quote
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (atEnd() || peekChar(0) == '\n') {
                throw new QHDLParseException(start, "closing '\"'", atEnd() ? "end of file" : "end of line");
            }
            char c = readChar();
            if (c == '"') {
                if (peekChar(0) == '"') {
                    readChar();
                    sb.append('"');
                    continue;
                }
                return sb.toString();
            }
            sb.append(c);
        }
    }

    private static String describeChar(char c) {
        return c == 0 ? "end of file" : "'" + c + "'";
    }

    public String getSourceName() {
        return sourceName;
    }

    public StringPool getUniquifier() {
        return uniquifier;
    }
}
