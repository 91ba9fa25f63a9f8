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

/**
 * Condition of an element assertion: either a fixed {@link State} or a value expression.
 */
public record VerifyCondition(Operator operator, State state, Expression value) implements AstNode {

    public enum Operator {IS, IS_NOT, CONTAINS, NOT_CONTAINS}

    public enum State {VISIBLE, HIDDEN, ENABLED, DISABLED, CHECKED, FOCUSED, EMPTY}

    public VerifyCondition {
        operator = operator == null ? Operator.IS : operator;
    }

    public static VerifyCondition is(State state) {
        return new VerifyCondition(Operator.IS, state, null);
    }

    public static VerifyCondition isNot(State state) {
        return new VerifyCondition(Operator.IS_NOT, state, null);
    }

    public boolean isNegated() {
        return operator == Operator.IS_NOT || operator == Operator.NOT_CONTAINS;
    }

}
