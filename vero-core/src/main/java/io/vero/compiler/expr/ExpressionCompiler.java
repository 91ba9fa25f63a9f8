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
package io.vero.compiler.expr;

import io.vero.ast.Expression;
import io.vero.ast.ExpressionVisitor;
import io.vero.compiler.Scope;

import static io.vero.common.StringUtils.quote;

/**
 * Compiles value expressions. Utility transforms compile to calls on the generated program's
 * runtime helpers ({@code veroString}, {@code veroDate}, {@code veroNumber}, {@code veroConvert},
 * {@code veroGenerate}).
 * <p>
 * Chains thread the compiled left side into the right link as its implicit input, so the
 * output grows linearly with the chain length.
 */
public class ExpressionCompiler {

    public static final String ENV = "__env__";

    public String compile(Expression expression, Scope scope) {
        return compile(expression, scope, null);
    }

    /**
     * @param input compiled code replacing the primary operand of a utility transform, or null
     */
    public String compile(Expression expression, Scope scope, String input) {
        if (expression == null) {
            return input == null ? "null" : input;
        }
        return expression.accept(new Emitter(scope, input));
    }

    public static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * Plain text of a literal, for step titles. Non-literals are described by their shape.
     */
    public static String describe(Expression expression) {
        if (expression instanceof Expression.StringLiteral s) {
            return s.value();
        } else if (expression instanceof Expression.NumberLiteral n) {
            return formatNumber(n.value());
        } else if (expression instanceof Expression.BooleanLiteral b) {
            return String.valueOf(b.value());
        } else if (expression instanceof Expression.VariableReference v) {
            return v.page() == null ? v.name() : v.page() + "." + v.name();
        } else if (expression instanceof Expression.EnvVarReference e) {
            return "{{" + e.name() + "}}";
        }
        return expression == null ? "" : expression.getClass().getSimpleName();
    }

    private class Emitter implements ExpressionVisitor<String> {

        final Scope scope;
        final String input;

        Emitter(Scope scope, String input) {
            this.scope = scope;
            this.input = input;
        }

        String operand(Expression value) {
            return input != null ? input : compile(value, scope, null);
        }

        String arg(Expression value) {
            return compile(value, scope, null);
        }

        // ========== Terminals ==========

        @Override
        public String visit(Expression.StringLiteral e) {
            return quote(e.value());
        }

        @Override
        public String visit(Expression.NumberLiteral e) {
            return formatNumber(e.value());
        }

        @Override
        public String visit(Expression.BooleanLiteral e) {
            return String.valueOf(e.value());
        }

        @Override
        public String visit(Expression.VariableReference e) {
            if (e.page() == null) {
                return e.name();
            }
            String owner = scope.resolvePage(e.page());
            return owner + "." + e.name();
        }

        @Override
        public String visit(Expression.EnvVarReference e) {
            return ENV + "[" + quote(e.name()) + "]";
        }

        // ========== Strings ==========

        @Override
        public String visit(Expression.Trim e) {
            return "veroString.trim(" + operand(e.value()) + ")";
        }

        @Override
        public String visit(Expression.Convert e) {
            String value = operand(e.value());
            if (e.type() == null) {
                return value;
            }
            return switch (e.type()) {
                case UPPERCASE -> "veroString.uppercase(" + value + ")";
                case LOWERCASE -> "veroString.lowercase(" + value + ")";
                case NUMBER -> "veroConvert.toNumber(" + value + ")";
                case TEXT -> "veroConvert.toString(" + value + ")";
            };
        }

        @Override
        public String visit(Expression.Extract e) {
            String end = e.end() == null ? "" : ", " + arg(e.end());
            return "veroString.substring(" + operand(e.value()) + ", " + arg(e.start()) + end + ")";
        }

        @Override
        public String visit(Expression.Replace e) {
            return "veroString.replace(" + operand(e.value()) + ", " + arg(e.search()) + ", " + arg(e.replacement()) + ")";
        }

        @Override
        public String visit(Expression.Split e) {
            return "veroString.split(" + operand(e.value()) + ", " + arg(e.delimiter()) + ")";
        }

        @Override
        public String visit(Expression.Join e) {
            return "veroString.join(" + operand(e.value()) + ", " + arg(e.delimiter()) + ")";
        }

        @Override
        public String visit(Expression.Length e) {
            return "veroString.length(" + operand(e.value()) + ")";
        }

        @Override
        public String visit(Expression.Pad e) {
            String padChar = e.padChar() == null ? "' '" : arg(e.padChar());
            return "veroString.padStart(" + operand(e.value()) + ", " + arg(e.length()) + ", " + padChar + ")";
        }

        // ========== Dates ==========

        @Override
        public String visit(Expression.Today e) {
            return "veroDate.today()";
        }

        @Override
        public String visit(Expression.Now e) {
            return "veroDate.now()";
        }

        @Override
        public String visit(Expression.AddDate e) {
            return dateArithmetic("add", e.unit(), e.date(), e.amount());
        }

        @Override
        public String visit(Expression.SubtractDate e) {
            return dateArithmetic("subtract", e.unit(), e.date(), e.amount());
        }

        private String dateArithmetic(String verb, Expression.DateUnit unit, Expression date, Expression amount) {
            String suffix = switch (unit == null ? Expression.DateUnit.DAY : unit) {
                case DAY -> "Days";
                case MONTH -> "Months";
                case YEAR -> "Years";
            };
            String base = input != null ? input : date == null ? "veroDate.today()" : arg(date);
            return "veroDate." + verb + suffix + "(" + base + ", " + arg(amount) + ")";
        }

        @Override
        public String visit(Expression.Format e) {
            String value = operand(e.value());
            Expression.FormatType type = e.type() == null ? Expression.FormatType.DATE : e.type();
            return switch (type) {
                case DATE -> "veroDate.formatDate(" + value + ", " + quote(e.pattern() == null ? "YYYY-MM-DD" : e.pattern()) + ")";
                case CURRENCY -> "veroNumber.formatCurrency(" + value + ", " + quote(e.currency() == null ? "USD" : e.currency()) + ")";
                case PERCENT -> "veroNumber.formatPercent(" + value + ")";
            };
        }

        @Override
        public String visit(Expression.DatePart e) {
            String date = operand(e.date());
            Expression.DatePartType part = e.part() == null ? Expression.DatePartType.DAY : e.part();
            return switch (part) {
                case YEAR -> "veroDate.year(" + date + ")";
                case MONTH -> "veroDate.month(" + date + ")";
                case DAY -> "veroDate.day(" + date + ")";
            };
        }

        // ========== Numbers ==========

        @Override
        public String visit(Expression.Round e) {
            String value = operand(e.value());
            if (e.direction() == Expression.RoundDirection.UP) {
                return "veroNumber.ceiling(" + value + ")";
            }
            if (e.direction() == Expression.RoundDirection.DOWN) {
                return "veroNumber.floor(" + value + ")";
            }
            return e.decimals() == null ? "veroNumber.round(" + value + ")" : "veroNumber.round(" + value + ", " + e.decimals() + ")";
        }

        @Override
        public String visit(Expression.Absolute e) {
            return "veroNumber.abs(" + operand(e.value()) + ")";
        }

        // ========== Generators ==========

        @Override
        public String visit(Expression.Generate e) {
            return e.isUuid() ? "veroGenerate.uuid()" : "veroGenerate.fromRegex(" + quote(e.pattern()) + ")";
        }

        @Override
        public String visit(Expression.RandomNumber e) {
            return "veroGenerate.randomInt(" + arg(e.min()) + ", " + arg(e.max()) + ")";
        }

        @Override
        public String visit(Expression.Chained e) {
            String first = compile(e.first(), scope, input);
            return compile(e.second(), scope, first);
        }

    }

}
