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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.netwright.qhdl.QHDLAssociation;
import com.netwright.qhdl.QHDLEntity;
import com.netwright.qhdl.QHDLException;
import com.netwright.qhdl.QHDLExpression;
import com.netwright.qhdl.QHDLGeneric;
import com.netwright.qhdl.QHDLInterface;
import com.netwright.qhdl.QHDLLocation;
import com.netwright.qhdl.QHDLName;
import com.netwright.qhdl.QHDLValue;
import com.netwright.qhdl.QHDLValueType;

/**
 * Binds the declared generics of an instance to concrete values. Generic map
 * expressions are evaluated against the bindings of the enclosing instance,
 * which is how generic values flow down the hierarchy. Problems are reported
 * to the collector as they are found; generics that merely lack a value are
 * left {@link GenericBinding.Source#UNRESOLVED} for the caller to report, since
 * only the caller knows whether the instance ends up in the flat circuit.
 */
public class GenericResolver {

    private final DiagnosticCollector diagnostics;

    public GenericResolver(DiagnosticCollector diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Raised when a generic expression cannot be evaluated.
     */
    public static class EvaluationException extends QHDLException {

        private final DiagnosticType type;

        private final QHDLLocation location;

        public EvaluationException(DiagnosticType type, QHDLLocation location, String message) {
            super(message);
            this.type = type;
            this.location = location;
        }

        public DiagnosticType getType() {
            return type;
        }

        public QHDLLocation getLocation() {
            return location;
        }
    }

    /**
     * Binds the generics of an instance.
     * @param declared Generics as declared on the instantiated component.
     * @param entityInterface Interface of the entity behind the component, used
     *                        for defaults the component does not declare; may be null.
     * @param genericMap The instance's generic map.
     * @param env Bindings of the enclosing instance, keyed by generic key.
     * @param context Hierarchical name of the instance, for diagnostics.
     * @return One binding per declared generic, keyed by generic key, in declaration order.
     */
    public Map<String, GenericBinding> resolve(List<QHDLGeneric> declared, QHDLInterface entityInterface,
            List<QHDLAssociation> genericMap, Map<String, GenericBinding> env, String context) {
        Map<String, QHDLGeneric> declaredByKey = new LinkedHashMap<>();
        for (QHDLGeneric g : declared) {
            declaredByKey.putIfAbsent(g.getKey(), g);
        }
        Map<String, QHDLAssociation> mapped = new LinkedHashMap<>();
        for (QHDLAssociation a : genericMap) {
            String key = QHDLName.toKey(a.getFormal());
            if (!declaredByKey.containsKey(key)) {
                diagnostics.error(DiagnosticType.UNKNOWN_GENERIC, context, a.getLocation(),
                        "Generic map names '" + a.getFormal() + "', which the component does not declare");
                continue;
            }
            if (mapped.putIfAbsent(key, a) != null) {
                diagnostics.error(DiagnosticType.DUPLICATE_NAME, context, a.getLocation(),
                        "Generic '" + a.getFormal() + "' is associated more than once");
            }
        }

        Map<String, GenericBinding> bindings = new LinkedHashMap<>();
        for (QHDLGeneric g : declaredByKey.values()) {
            QHDLAssociation a = mapped.get(g.getKey());
            GenericBinding b;
            if (a != null && !a.isOpen()) {
                b = bindExpression(g, a.getActual(), env, context);
            } else {
                b = bindDefault(g, entityInterface == null ? null : entityInterface.getGeneric(g.getName()), context);
            }
            bindings.put(g.getKey(), b);
        }
        return bindings;
    }

    /**
     * Binds the generics of the top-level entity from caller supplied values
     * and declared defaults.
     * @param top The top-level entity.
     * @param overrides Values keyed by generic key.
     * @param options Supplies the names of the overrides as they were given.
     * @return One binding per declared generic, keyed by generic key.
     */
    public Map<String, GenericBinding> resolveTop(QHDLEntity top, Map<String, QHDLValue> overrides,
            ElaborationOptions options) {
        String context = top.getName();
        for (String key : overrides.keySet()) {
            if (top.getGeneric(key) == null) {
                diagnostics.error(DiagnosticType.UNKNOWN_GENERIC, context, null, "Top-level generic '"
                        + options.getTopGenericName(key) + "' is not declared on entity " + top.getName());
            }
        }
        Map<String, GenericBinding> bindings = new LinkedHashMap<>();
        for (QHDLGeneric g : top.getGenerics()) {
            if (bindings.containsKey(g.getKey())) {
                continue;
            }
            QHDLValue v = overrides.get(g.getKey());
            GenericBinding b = v != null ? bindValue(g, v, g.getLocation(), context)
                    : bindDefault(g, null, context);
            bindings.put(g.getKey(), b);
        }
        return bindings;
    }

    private GenericBinding bindExpression(QHDLGeneric g, QHDLExpression expr, Map<String, GenericBinding> env,
            String context) {
        QHDLValue v;
        try {
            v = evaluate(expr, env);
        } catch (EvaluationException e) {
            diagnostics.error(e.getType(), context, e.getLocation(), "Generic " + g.getName() + ": "
                    + e.getMessage());
            return GenericBinding.invalid(g);
        }
        if (v == null) {
            // Depends on a generic of the enclosing instance that has no value
            return GenericBinding.invalid(g);
        }
        return bindValue(g, v, expr.getLocation(), context);
    }

    private GenericBinding bindDefault(QHDLGeneric g, QHDLGeneric entityGeneric, String context) {
        QHDLGeneric source = g;
        if (!g.hasDefault() && entityGeneric != null && entityGeneric.hasDefault()) {
            source = entityGeneric;
        }
        if (!source.hasDefault()) {
            return GenericBinding.unresolved(g);
        }
        QHDLValue v = coerce(g, source.getDefaultValue(), source.getLocation(), context);
        return v == null ? GenericBinding.invalid(g) : GenericBinding.defaulted(g, v);
    }

    private GenericBinding bindValue(QHDLGeneric g, QHDLValue v, QHDLLocation location, String context) {
        QHDLValue coerced = coerce(g, v, location, context);
        return coerced == null ? GenericBinding.invalid(g) : GenericBinding.mapped(g, coerced);
    }

    private QHDLValue coerce(QHDLGeneric g, QHDLValue v, QHDLLocation location, String context) {
        QHDLValue coerced = v.coerceTo(g.getValueType());
        if (coerced == null) {
            diagnostics.error(DiagnosticType.TYPE_MISMATCH, context, location, "Generic " + g.getName()
                    + " of type " + g.getTypeName() + " cannot take the " + v.getType().name().toLowerCase()
                    + " value " + v.toLiteral());
            return null;
        }
        if (coerced.getType() == QHDLValueType.INTEGER && g.getValueType() == QHDLValueType.INTEGER) {
            long bound = QHDLValueType.lowerBound(g.getTypeName());
            if (coerced.getIntValue() < bound) {
                diagnostics.error(DiagnosticType.TYPE_MISMATCH, context, location, "Generic " + g.getName()
                        + " of type " + g.getTypeName() + " must be at least " + bound + ", got "
                        + coerced.toLiteral());
                return null;
            }
        }
        return coerced;
    }

    /**
     * Evaluates a generic expression. Recursion follows the expression tree,
     * which the parser bounds by {@link com.netwright.qhdl.QHDLParser#MAX_EXPRESSION_DEPTH}.
     * @param expr The expression.
     * @param env Bindings visible to the expression, keyed by generic key.
     * @return The value, or null if the expression depends on a binding without a value.
     * @throws EvaluationException if a name is unknown or the operands do not fit the operator
     */
    public QHDLValue evaluate(QHDLExpression expr, Map<String, GenericBinding> env) {
        if (expr instanceof QHDLExpression.Literal) {
            return ((QHDLExpression.Literal) expr).getValue();
        }
        if (expr instanceof QHDLExpression.Reference) {
            String name = ((QHDLExpression.Reference) expr).getName();
            GenericBinding b = env.get(QHDLName.toKey(name));
            if (b == null) {
                throw new EvaluationException(DiagnosticType.UNKNOWN_NAME, expr.getLocation(),
                        "'" + name + "' is not a generic of the enclosing entity");
            }
            return b.getValue();
        }
        if (expr instanceof QHDLExpression.Unary) {
            QHDLExpression.Unary u = (QHDLExpression.Unary) expr;
            QHDLValue v = evaluate(u.getOperand(), env);
            if (v == null) {
                return null;
            }
            if (!v.getType().isNumeric()) {
                throw new EvaluationException(DiagnosticType.TYPE_MISMATCH, expr.getLocation(),
                        "operator " + u.getOperator() + " needs a number, got " + v.toLiteral());
            }
            if (u.getOperator() == '+') {
                return v;
            }
            try {
                return v.getType() == QHDLValueType.INTEGER ? QHDLValue.integer(Math.negateExact(v.getIntValue()))
                        : QHDLValue.real(-v.getRealValue());
            } catch (ArithmeticException e) {
                throw new EvaluationException(DiagnosticType.TYPE_MISMATCH, expr.getLocation(), "integer overflow");
            }
        }
        QHDLExpression.Binary bin = (QHDLExpression.Binary) expr;
        QHDLValue l = evaluate(bin.getLeft(), env);
        QHDLValue r = evaluate(bin.getRight(), env);
        if (l == null || r == null) {
            return null;
        }
        return apply(bin.getOperator(), l, r, expr.getLocation());
    }

    private static QHDLValue apply(char op, QHDLValue l, QHDLValue r, QHDLLocation location) {
        if (op == '+' && l.getType() == QHDLValueType.STRING && r.getType() == QHDLValueType.STRING) {
            return QHDLValue.string(l.getStringValue() + r.getStringValue());
        }
        if (!l.getType().isNumeric() || !r.getType().isNumeric()) {
            throw new EvaluationException(DiagnosticType.TYPE_MISMATCH, location, "operator " + op
                    + " cannot combine " + l.toLiteral() + " and " + r.toLiteral());
        }
        if (op == '/' && r.getRealValue() == 0.0) {
            throw new EvaluationException(DiagnosticType.TYPE_MISMATCH, location, "division by zero");
        }
        if (l.getType() == QHDLValueType.INTEGER && r.getType() == QHDLValueType.INTEGER) {
            long a = l.getIntValue();
            long b = r.getIntValue();
            try {
                switch (op) {
                    case '+': return QHDLValue.integer(Math.addExact(a, b));
                    case '-': return QHDLValue.integer(Math.subtractExact(a, b));
                    case '*': return QHDLValue.integer(Math.multiplyExact(a, b));
                    default:
                        if (a == Long.MIN_VALUE && b == -1) {
                            throw new ArithmeticException();
                        }
                        return QHDLValue.integer(a / b);
                }
            } catch (ArithmeticException e) {
                throw new EvaluationException(DiagnosticType.TYPE_MISMATCH, location, "integer overflow");
            }
        }
        double a = l.getRealValue();
        double b = r.getRealValue();
        switch (op) {
            case '+': return QHDLValue.real(a + b);
            case '-': return QHDLValue.real(a - b);
            case '*': return QHDLValue.real(a * b);
            default: return QHDLValue.real(a / b);
        }
    }
}
