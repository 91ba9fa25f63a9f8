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
 * Value expressions: literals, variable and environment references, and the utility
 * transforms that can be chained left to right.
 */
public sealed interface Expression extends AstNode permits
        Expression.StringLiteral, Expression.NumberLiteral, Expression.BooleanLiteral,
        Expression.VariableReference, Expression.EnvVarReference, Expression.Utility {

    <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * Utility transforms. The {@code value} operand of a transform is replaced by the output of
     * the previous link when the transform appears on the right side of a {@link Chained}.
     */
    sealed interface Utility extends Expression permits
            Trim, Convert, Extract, Replace, Split, Join, Length, Pad, Today, Now, AddDate, SubtractDate,
            Format, DatePart, Round, Absolute, Generate, RandomNumber, Chained {
    }

    enum ConvertType {UPPERCASE, LOWERCASE, NUMBER, TEXT}

    enum DateUnit {DAY, MONTH, YEAR}

    enum FormatType {DATE, CURRENCY, PERCENT}

    enum DatePartType {YEAR, MONTH, DAY}

    enum RoundDirection {UP, DOWN}

    // ========== Terminals ==========

    record StringLiteral(String value) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record NumberLiteral(double value) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record BooleanLiteral(boolean value) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * @param page owning page for {@code Page.variable} references, null for locals
     */
    record VariableReference(String page, String name) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record EnvVarReference(String name) implements Expression {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ========== Utility transforms ==========

    record Trim(Expression value) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Convert(ConvertType type, Expression value) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Extract(Expression value, Expression start, Expression end) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Replace(Expression value, Expression search, Expression replacement) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Split(Expression value, Expression delimiter) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Join(Expression value, Expression delimiter) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Length(Expression value) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Pad(Expression value, Expression length, Expression padChar) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Today() implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Now() implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record AddDate(Expression amount, DateUnit unit, Expression date) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record SubtractDate(Expression amount, DateUnit unit, Expression date) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * @param pattern date pattern for DATE
     * @param currency ISO currency code for CURRENCY, defaults to USD
     */
    record Format(Expression value, FormatType type, String pattern, String currency) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record DatePart(DatePartType part, Expression date) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Round(Expression value, Integer decimals, RoundDirection direction) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Absolute(Expression value) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * @param pattern regex-like pattern, or null (or "UUID") for a random UUID
     */
    record Generate(String pattern) implements Utility {
        public boolean isUuid() {
            return pattern == null || "UUID".equalsIgnoreCase(pattern);
        }

        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record RandomNumber(Expression min, Expression max) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Chained(Expression first, Expression second) implements Utility {
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

}
