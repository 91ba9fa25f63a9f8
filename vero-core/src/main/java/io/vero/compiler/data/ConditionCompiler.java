/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.vero.compiler.data;

import io.vero.ast.ComparisonOperator;
import io.vero.ast.DataCondition;
import io.vero.ast.Expression;
import io.vero.compiler.Scope;
import io.vero.compiler.expr.ExpressionCompiler;

import java.util.ArrayList;
import java.util.List;

import static io.vero.common.StringUtils.quote;

/**
 * Compiles WHERE trees into a boolean expression over a row variable. The output is a pure
 * function of the tree: composite nodes are always parenthesized, comparisons never are.
 */
public class ConditionCompiler {

    public static final String ALWAYS_TRUE = "true";

    private final ExpressionCompiler expressions;

    public ConditionCompiler(ExpressionCompiler expressions) {
        this.expressions = expressions;
    }

    public String compile(DataCondition condition, String row, Scope scope) {
        if (condition instanceof DataCondition.And a) {
            return "(" + compile(a.left(), row, scope) + " && " + compile(a.right(), row, scope) + ")";
        } else if (condition instanceof DataCondition.Or o) {
            return "(" + compile(o.left(), row, scope) + " || " + compile(o.right(), row, scope) + ")";
        } else if (condition instanceof DataCondition.Not n) {
            return "!(" + compile(n.condition(), row, scope) + ")";
        } else if (condition instanceof DataCondition.Comparison c) {
            return comparison(c, row, scope);
        }
        return ALWAYS_TRUE;
    }

    /**
     * @return an arrow function such as {@code (row) => row['age'] >= 18}
     */
    public String predicate(DataCondition condition, Scope scope) {
        return "(row) => " + compile(condition, "row", scope);
    }

    private String comparison(DataCondition.Comparison c, String row, Scope scope) {
        if (c.operator() == null || c.column() == null) {
            return ALWAYS_TRUE;
        }
        String column = row + "[" + quote(c.column()) + "]";
        String value = c.value() == null ? "null" : expressions.compile(c.value(), scope);
        ComparisonOperator op = c.operator();
        return switch (op) {
            case EQ -> column + " === " + value;
            case NE -> column + " !== " + value;
            case GT, LT, GTE, LTE -> column + " " + op.getSymbol() + " " + value;
            case CONTAINS -> "String(" + column + " ?? '').includes(" + value + ")";
            case STARTS_WITH -> "String(" + column + " ?? '').startsWith(" + value + ")";
            case ENDS_WITH -> "String(" + column + " ?? '').endsWith(" + value + ")";
            case MATCHES -> "new RegExp(" + value + ").test(String(" + column + " ?? ''))";
            case IN -> list(c, scope) + ".includes(" + column + ")";
            case NOT_IN -> "!" + list(c, scope) + ".includes(" + column + ")";
            case IS_NULL -> "(" + column + " === null || " + column + " === undefined)";
            case IS_EMPTY -> "(" + column + " === null || " + column + " === undefined || " + column + " === '')";
            case IS_NOT_EMPTY -> "(" + column + " !== null && " + column + " !== undefined && " + column + " !== '')";
        };
    }

    private String list(DataCondition.Comparison c, Scope scope) {
        List<String> items = new ArrayList<>();
        List<Expression> values = c.values().isEmpty() && c.value() != null ? List.of(c.value()) : c.values();
        for (Expression value : values) {
            items.add(expressions.compile(value, scope));
        }
        return "[" + String.join(", ", items) + "]";
    }

}
