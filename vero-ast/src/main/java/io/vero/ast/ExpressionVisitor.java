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

public interface ExpressionVisitor<R> {

    R visit(Expression.StringLiteral e);

    R visit(Expression.NumberLiteral e);

    R visit(Expression.BooleanLiteral e);

    R visit(Expression.VariableReference e);

    R visit(Expression.EnvVarReference e);

    R visit(Expression.Trim e);

    R visit(Expression.Convert e);

    R visit(Expression.Extract e);

    R visit(Expression.Replace e);

    R visit(Expression.Split e);

    R visit(Expression.Join e);

    R visit(Expression.Length e);

    R visit(Expression.Pad e);

    R visit(Expression.Today e);

    R visit(Expression.Now e);

    R visit(Expression.AddDate e);

    R visit(Expression.SubtractDate e);

    R visit(Expression.Format e);

    R visit(Expression.DatePart e);

    R visit(Expression.Round e);

    R visit(Expression.Absolute e);

    R visit(Expression.Generate e);

    R visit(Expression.RandomNumber e);

    R visit(Expression.Chained e);
}
