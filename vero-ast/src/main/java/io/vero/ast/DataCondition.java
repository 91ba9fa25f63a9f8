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
package io.vero.ast;

import java.util.List;

/**
 * Recursive WHERE tree over named columns.
 */
public sealed interface DataCondition extends AstNode permits
        DataCondition.And, DataCondition.Or, DataCondition.Not, DataCondition.Comparison {

    record And(DataCondition left, DataCondition right) implements DataCondition {
    }

    record Or(DataCondition left, DataCondition right) implements DataCondition {
    }

    record Not(DataCondition condition) implements DataCondition {
    }

    /**
     * @param operator null when the upstream operator has no known meaning
     * @param values operands of IN / NOT_IN
     */
    record Comparison(String column, ComparisonOperator operator, Expression value, List<Expression> values) implements DataCondition {

        public Comparison {
            values = AstNode.list(values);
        }

        public static Comparison of(String column, ComparisonOperator operator, Expression value) {
            return new Comparison(column, operator, value, List.of());
        }

    }

    static DataCondition and(DataCondition left, DataCondition right) {
        return new And(left, right);
    }

    static DataCondition or(DataCondition left, DataCondition right) {
        return new Or(left, right);
    }

}
