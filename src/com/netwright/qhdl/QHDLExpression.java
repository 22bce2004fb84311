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

import java.util.Objects;

/**
 * The right-hand side of a GENERIC MAP or PORT MAP association. Port map
 * actuals are always plain references; generic map actuals may be literals,
 * references to generics of the enclosing entity, or arithmetic over both.
 * Evaluation happens during elaboration, once the enclosing generic values
 * are known.
 */
public abstract class QHDLExpression {

    private final QHDLLocation location;

    protected QHDLExpression(QHDLLocation location) {
        this.location = location;
    }

    public QHDLLocation getLocation() {
        return location;
    }

    /**
     * @return Number of nodes on the longest path from this expression to a
     *         literal or reference, 1 for those themselves.
     */
    public abstract int getDepth();

    /**
     * @return True if this expression is a bare name.
     */
    public boolean isReference() {
        return false;
    }

    /**
     * A constant value.
     */
    public static final class Literal extends QHDLExpression {
        private final QHDLValue value;

        public Literal(QHDLValue value, QHDLLocation location) {
            super(location);
            this.value = Objects.requireNonNull(value);
        }

        public QHDLValue getValue() {
            return value;
        }

        @Override
        public int getDepth() {
            return 1;
        }

        @Override
        public String toString() {
            return value.toLiteral();
        }
    }

    /**
     * A name, resolved against the enclosing scope.
     */
    public static final class Reference extends QHDLExpression {
        private final String name;

        public Reference(String name, QHDLLocation location) {
            super(location);
            this.name = Objects.requireNonNull(name);
        }

        public String getName() {
            return name;
        }

        @Override
        public int getDepth() {
            return 1;
        }

        @Override
        public boolean isReference() {
            return true;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Unary plus or minus.
     */
    public static final class Unary extends QHDLExpression {
        private final char operator;
        private final QHDLExpression operand;
        private final int depth;

        public Unary(char operator, QHDLExpression operand, QHDLLocation location) {
            super(location);
            this.operator = operator;
            this.operand = Objects.requireNonNull(operand);
            this.depth = operand.getDepth() + 1;
        }

        public char getOperator() {
            return operator;
        }

        public QHDLExpression getOperand() {
            return operand;
        }

        @Override
        public int getDepth() {
            return depth;
        }

        @Override
        public String toString() {
            return operator + operand.toString();
        }
    }

    /**
     * One of {@code + - * /} applied to two operands.
     */
    public static final class Binary extends QHDLExpression {
        private final char operator;
        private final QHDLExpression left;
        private final QHDLExpression right;
        private final int depth;

        public Binary(char operator, QHDLExpression left, QHDLExpression right, QHDLLocation location) {
            super(location);
            this.operator = operator;
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
            this.depth = Math.max(left.getDepth(), right.getDepth()) + 1;
        }

        public char getOperator() {
            return operator;
        }

        public QHDLExpression getLeft() {
            return left;
        }

        public QHDLExpression getRight() {
            return right;
        }

        @Override
        public int getDepth() {
            return depth;
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator + " " + right + ")";
        }
    }
}
