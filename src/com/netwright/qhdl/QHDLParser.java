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

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.netwright.util.StringPool;

/**
 * Recursive descent parser for QHDL design files. Keywords are matched
 * case-insensitively. The first malformed construct aborts the parse with a
 * {@link QHDLParseException}; no partial design file is returned.
 */
public class QHDLParser {
    public static final String ENTITY = "entity";
    public static final String IS = "is";
    public static final String GENERIC = "generic";
    public static final String PORT = "port";
    public static final String END = "end";
    public static final String ARCHITECTURE = "architecture";
    public static final String OF = "of";
    public static final String BEGIN = "begin";
    public static final String COMPONENT = "component";
    public static final String SIGNAL = "signal";
    public static final String MAP = "map";
    public static final String IN = "in";
    public static final String OUT = "out";
    public static final String OPEN = "open";
    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String LIBRARY = "library";
    public static final String USE = "use";
    public static final String ALL = "all";

    private static final Set<String> RESERVED = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            ENTITY, IS, GENERIC, PORT, END, ARCHITECTURE, OF, BEGIN, COMPONENT, SIGNAL, MAP, IN, OUT, OPEN,
            TRUE, FALSE, LIBRARY, USE, ALL, "inout", "buffer")));

    /** Deepest expression tree, and deepest nesting of parentheses and signs, accepted */
    public static final int MAX_EXPRESSION_DEPTH = 256;

    protected final QHDLTokenizer tokenizer;

    private QHDLToken current;

    private int expressionNesting;

    public QHDLParser(QHDLTokenizer tokenizer) {
        this.tokenizer = tokenizer;
        this.current = tokenizer.nextToken();
    }

    public QHDLParser(String sourceName, String text, StringPool uniquifier) {
        this(new QHDLTokenizer(sourceName, text, uniquifier));
    }

    public QHDLParser(String sourceName, String text) {
        this(new QHDLTokenizer(sourceName, text));
    }

    public QHDLParser(String sourceName, InputStream in, StringPool uniquifier) {
        this(QHDLTokenizer.fromStream(sourceName, in, uniquifier));
    }

    /**
     * Parses a complete QHDL source text.
     * @param sourceName Name used in locations and error messages.
     * @param text The source text.
     * @return The parsed design file.
     * @throws QHDLParseException on the first syntax error
     */
    public static QHDLDesignFile parse(String sourceName, String text) {
        return new QHDLParser(sourceName, text).parseDesignFile();
    }

    public static QHDLDesignFile parse(String text) {
        return parse(QHDLLocation.UNKNOWN_SOURCE, text);
    }

    public static boolean isReserved(String word) {
        return RESERVED.contains(QHDLName.toKey(word));
    }

    /**
     * Parses entities and architectures until the end of input.
     * @return The parsed design file.
     */
    public QHDLDesignFile parseDesignFile() {
        List<QHDLEntity> entities = new ArrayList<>();
        List<QHDLArchitecture> architectures = new ArrayList<>();
        while (!current.is(QHDLTokenType.EOF)) {
            if (current.isKeyword(ENTITY)) {
                entities.add(parseEntity());
            } else if (current.isKeyword(ARCHITECTURE)) {
                architectures.add(parseArchitecture());
            } else if (current.isKeyword(LIBRARY)) {
                parseLibraryClause();
            } else if (current.isKeyword(USE)) {
                parseUseClause();
            } else {
                throw new QHDLParseException(current, "'entity' or 'architecture'");
            }
        }
        return new QHDLDesignFile(tokenizer.getSourceName(), entities, architectures);
    }

    //-------------------------------------------------------------------------
    // Token helpers

    private QHDLToken advance() {
        QHDLToken t = current;
        if (!t.is(QHDLTokenType.EOF)) {
            current = tokenizer.nextToken();
        }
        return t;
    }

    protected QHDLToken expect(QHDLTokenType type) {
        if (!current.is(type)) {
            throw new QHDLParseException(current, type.getDescription());
        }
        return advance();
    }

    protected QHDLToken expect(String keyword) {
        if (!current.isKeyword(keyword)) {
            throw new QHDLParseException(current, "'" + keyword + "'");
        }
        return advance();
    }

    private boolean accept(QHDLTokenType type) {
        if (current.is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean accept(String keyword) {
        if (current.isKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private QHDLToken expectIdentifier() {
        if (!current.is(QHDLTokenType.IDENTIFIER) || isReserved(current.getText())) {
            throw new QHDLParseException(current, "an identifier");
        }
        return advance();
    }

    /**
     * Consumes the optional closing name after END and the final semicolon.
     */
    private void parseEndName(String openedName) {
        if (current.is(QHDLTokenType.IDENTIFIER) && !isReserved(current.getText())) {
            QHDLToken closing = advance();
            if (!QHDLName.sameName(openedName, closing.getText())) {
                throw new QHDLParseException(closing.getLocation(), "'" + openedName + "'", closing.describe());
            }
        }
        expect(QHDLTokenType.SEMICOLON);
    }

    //-------------------------------------------------------------------------
    // Design units

    private void parseLibraryClause() {
        expect(LIBRARY);
        expectIdentifier();
        while (accept(QHDLTokenType.COMMA)) {
            expectIdentifier();
        }
        expect(QHDLTokenType.SEMICOLON);
    }

    private void parseUseClause() {
        expect(USE);
        expectIdentifier();
        while (accept(QHDLTokenType.DOT)) {
            if (!accept(ALL)) {
                expectIdentifier();
            }
        }
        expect(QHDLTokenType.SEMICOLON);
    }

    private QHDLEntity parseEntity() {
        QHDLToken start = expect(ENTITY);
        QHDLToken name = expectIdentifier();
        expect(IS);
        QHDLInterface iface = parseInterface();
        expect(END);
        accept(ENTITY);
        parseEndName(name.getText());
        return new QHDLEntity(name.getText(), iface, start.getLocation());
    }

    private QHDLComponent parseComponent() {
        QHDLToken start = expect(COMPONENT);
        QHDLToken name = expectIdentifier();
        accept(IS);
        QHDLInterface iface = parseInterface();
        expect(END);
        expect(COMPONENT);
        parseEndName(name.getText());
        return new QHDLComponent(name.getText(), iface, start.getLocation());
    }

    private QHDLInterface parseInterface() {
        List<QHDLGeneric> generics = Collections.emptyList();
        List<QHDLPort> ports = Collections.emptyList();
        if (current.isKeyword(GENERIC)) {
            generics = parseGenericClause();
        }
        if (current.isKeyword(PORT)) {
            ports = parsePortClause();
        }
        return new QHDLInterface(generics, ports);
    }

    private List<QHDLGeneric> parseGenericClause() {
        expect(GENERIC);
        expect(QHDLTokenType.LEFT_PAREN);
        List<QHDLGeneric> generics = new ArrayList<>();
        do {
            List<QHDLToken> names = parseIdentifierList();
            expect(QHDLTokenType.COLON);
            String typeName = expectIdentifier().getText();
            QHDLValue defaultValue = null;
            if (accept(QHDLTokenType.DEFAULT_ASSIGN)) {
                defaultValue = parseLiteral();
            }
            for (QHDLToken n : names) {
                generics.add(new QHDLGeneric(n.getText(), typeName, defaultValue, n.getLocation()));
            }
        } while (accept(QHDLTokenType.SEMICOLON));
        expect(QHDLTokenType.RIGHT_PAREN);
        expect(QHDLTokenType.SEMICOLON);
        return generics;
    }

    private List<QHDLPort> parsePortClause() {
        expect(PORT);
        expect(QHDLTokenType.LEFT_PAREN);
        List<QHDLPort> ports = new ArrayList<>();
        do {
            List<QHDLToken> names = parseIdentifierList();
            expect(QHDLTokenType.COLON);
            QHDLDirection dir = current.is(QHDLTokenType.IDENTIFIER) ? QHDLDirection.getEnum(current.getText()) : null;
            if (dir == null) {
                throw new QHDLParseException(current, "'in' or 'out'");
            }
            advance();
            String typeName = expectIdentifier().getText();
            for (QHDLToken n : names) {
                ports.add(new QHDLPort(n.getText(), dir, typeName, n.getLocation()));
            }
        } while (accept(QHDLTokenType.SEMICOLON));
        expect(QHDLTokenType.RIGHT_PAREN);
        expect(QHDLTokenType.SEMICOLON);
        return ports;
    }

    private List<QHDLToken> parseIdentifierList() {
        List<QHDLToken> names = new ArrayList<>();
        names.add(expectIdentifier());
        while (accept(QHDLTokenType.COMMA)) {
            names.add(expectIdentifier());
        }
        return names;
    }

    private QHDLArchitecture parseArchitecture() {
        QHDLToken start = expect(ARCHITECTURE);
        QHDLToken name = expectIdentifier();
        expect(OF);
        QHDLToken entityName = expectIdentifier();
        expect(IS);
        List<QHDLComponent> components = new ArrayList<>();
        List<QHDLSignal> signals = new ArrayList<>();
        while (!current.isKeyword(BEGIN)) {
            if (current.isKeyword(COMPONENT)) {
                components.add(parseComponent());
            } else if (current.isKeyword(SIGNAL)) {
                parseSignalDeclaration(signals);
            } else {
                throw new QHDLParseException(current, "'component', 'signal' or 'begin'");
            }
        }
        expect(BEGIN);
        List<QHDLInstance> instances = new ArrayList<>();
        List<QHDLAssignment> assignments = new ArrayList<>();
        while (!current.isKeyword(END)) {
            parseStatement(instances, assignments);
        }
        expect(END);
        accept(ARCHITECTURE);
        parseEndName(name.getText());
        return new QHDLArchitecture(name.getText(), entityName.getText(), components, signals, instances,
                assignments, start.getLocation());
    }

    private void parseSignalDeclaration(List<QHDLSignal> signals) {
        expect(SIGNAL);
        List<QHDLToken> names = parseIdentifierList();
        expect(QHDLTokenType.COLON);
        String typeName = expectIdentifier().getText();
        expect(QHDLTokenType.SEMICOLON);
        for (QHDLToken n : names) {
            signals.add(new QHDLSignal(n.getText(), typeName, n.getLocation()));
        }
    }

    private void parseStatement(List<QHDLInstance> instances, List<QHDLAssignment> assignments) {
        QHDLToken first = expectIdentifier();
        if (accept(QHDLTokenType.SIGNAL_ASSIGN)) {
            QHDLToken source = expectIdentifier();
            expect(QHDLTokenType.SEMICOLON);
            assignments.add(new QHDLAssignment(first.getText(), source.getText(), first.getLocation()));
            return;
        }
        if (!current.is(QHDLTokenType.COLON)) {
            throw new QHDLParseException(current, "':' or '<='");
        }
        advance();
        accept(COMPONENT);
        QHDLToken componentName = expectIdentifier();
        List<QHDLAssociation> genericMap = Collections.emptyList();
        List<QHDLAssociation> portMap = Collections.emptyList();
        if (accept(GENERIC)) {
            expect(MAP);
            genericMap = parseAssociationList(true);
        }
        if (accept(PORT)) {
            expect(MAP);
            portMap = parseAssociationList(false);
        }
        expect(QHDLTokenType.SEMICOLON);
        instances.add(new QHDLInstance(first.getText(), componentName.getText(), genericMap, portMap,
                first.getLocation()));
    }

    private List<QHDLAssociation> parseAssociationList(boolean generic) {
        expect(QHDLTokenType.LEFT_PAREN);
        List<QHDLAssociation> associations = new ArrayList<>();
        do {
            QHDLToken formal = expectIdentifier();
            expect(QHDLTokenType.ARROW);
            if (accept(OPEN)) {
                associations.add(QHDLAssociation.open(formal.getText(), formal.getLocation()));
                continue;
            }
            QHDLExpression actual;
            if (generic) {
                actual = parseExpression();
            } else {
                QHDLToken ref = expectIdentifier();
                actual = new QHDLExpression.Reference(ref.getText(), ref.getLocation());
            }
            associations.add(new QHDLAssociation(formal.getText(), actual, formal.getLocation()));
        } while (accept(QHDLTokenType.COMMA));
        expect(QHDLTokenType.RIGHT_PAREN);
        return associations;
    }

    //-------------------------------------------------------------------------
    // Values and expressions

    private QHDLValue parseLiteral() {
        QHDLToken t = current;
        if (t.is(QHDLTokenType.PLUS) || t.is(QHDLTokenType.MINUS)) {
            advance();
            QHDLToken number = expect(QHDLTokenType.NUMBER);
            return parseNumber((t.is(QHDLTokenType.MINUS) ? "-" : "") + number.getText(), number);
        }
        if (t.is(QHDLTokenType.NUMBER)) {
            advance();
            return parseNumber(t.getText(), t);
        }
        if (t.is(QHDLTokenType.STRING)) {
            advance();
            return QHDLValue.string(t.getText());
        }
        if (accept(TRUE)) {
            return QHDLValue.bool(true);
        }
        if (accept(FALSE)) {
            return QHDLValue.bool(false);
        }
        throw new QHDLParseException(t, "a literal");
    }

    private static QHDLValue parseNumber(String text, QHDLToken token) {
        try {
            return QHDLValue.parseNumber(text);
        } catch (NumberFormatException e) {
            throw new QHDLParseException(token.getLocation(), "Numeric literal out of range: " + text);
        }
    }

    private void enterNestedExpression(QHDLToken t) {
        if (++expressionNesting > MAX_EXPRESSION_DEPTH) {
            throw new QHDLParseException(t.getLocation(), "Expression nests deeper than "
                    + MAX_EXPRESSION_DEPTH + " levels");
        }
    }

    private QHDLExpression checkDepth(QHDLExpression e) {
        if (e.getDepth() > MAX_EXPRESSION_DEPTH) {
            throw new QHDLParseException(e.getLocation(), "Expression nests deeper than "
                    + MAX_EXPRESSION_DEPTH + " levels");
        }
        return e;
    }

    private QHDLExpression parseExpression() {
        QHDLExpression left = parseTerm();
        while (current.is(QHDLTokenType.PLUS) || current.is(QHDLTokenType.MINUS)) {
            QHDLToken op = advance();
            left = checkDepth(new QHDLExpression.Binary(op.getText().charAt(0), left, parseTerm(),
                    op.getLocation()));
        }
        return left;
    }

    private QHDLExpression parseTerm() {
        QHDLExpression left = parseFactor();
        while (current.is(QHDLTokenType.STAR) || current.is(QHDLTokenType.SLASH)) {
            QHDLToken op = advance();
            left = checkDepth(new QHDLExpression.Binary(op.getText().charAt(0), left, parseFactor(),
                    op.getLocation()));
        }
        return left;
    }

    private QHDLExpression parseFactor() {
        QHDLToken t = current;
        switch (t.getType()) {
            case PLUS:
            case MINUS:
                advance();
                enterNestedExpression(t);
                QHDLExpression operand = parseFactor();
                expressionNesting--;
                return checkDepth(new QHDLExpression.Unary(t.getText().charAt(0), operand, t.getLocation()));
            case NUMBER:
                advance();
                return new QHDLExpression.Literal(parseNumber(t.getText(), t), t.getLocation());
            case STRING:
                advance();
                return new QHDLExpression.Literal(QHDLValue.string(t.getText()), t.getLocation());
            case LEFT_PAREN:
                advance();
                enterNestedExpression(t);
                QHDLExpression inner = parseExpression();
                expect(QHDLTokenType.RIGHT_PAREN);
                expressionNesting--;
                return inner;
            case IDENTIFIER:
                if (accept(TRUE)) {
                    return new QHDLExpression.Literal(QHDLValue.bool(true), t.getLocation());
                }
                if (accept(FALSE)) {
                    return new QHDLExpression.Literal(QHDLValue.bool(false), t.getLocation());
                }
                QHDLToken ref = expectIdentifier();
                return new QHDLExpression.Reference(ref.getText(), ref.getLocation());
            default:
                throw new QHDLParseException(t, "an expression");
        }
    }
}
