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
package io.vero.compiler.scan;

import io.vero.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Direct children of every node shape. Statement and expression children come from
 * exhaustive visitors, so a new variant cannot be added without deciding its children here.
 */
public final class AstChildren {

    private static final StatementChildren STATEMENTS = new StatementChildren();
    private static final ExpressionChildren EXPRESSIONS = new ExpressionChildren();

    private AstChildren() {
        // only static methods
    }

    public static List<AstNode> of(AstNode node) {
        if (node instanceof Statement s) {
            return s.accept(STATEMENTS);
        } else if (node instanceof Expression e) {
            return e.accept(EXPRESSIONS);
        } else if (node instanceof Target.Locator l) {
            return nodes(l.selector());
        } else if (node instanceof Selector s) {
            return new ArrayList<>(s.modifiers());
        } else if (node instanceof SelectorModifier.Has h) {
            return nodes(h.selector());
        } else if (node instanceof SelectorModifier.HasNot h) {
            return nodes(h.selector());
        } else if (node instanceof DataCondition.And a) {
            return nodes(a.left(), a.right());
        } else if (node instanceof DataCondition.Or o) {
            return nodes(o.left(), o.right());
        } else if (node instanceof DataCondition.Not n) {
            return nodes(n.condition());
        } else if (node instanceof DataCondition.Comparison c) {
            List<AstNode> list = nodes(c.value());
            list.addAll(c.values());
            return list;
        } else if (node instanceof Query.TableQuery q) {
            return nodes(q.table(), q.where(), q.defaultValue());
        } else if (node instanceof Query.AggregationQuery q) {
            return nodes(q.table(), q.where());
        } else if (node instanceof ActionCall c) {
            return new ArrayList<>(c.arguments());
        } else if (node instanceof VerifyCondition c) {
            return nodes(c.value());
        } else if (node instanceof HasCondition c) {
            return nodes(c.attribute(), c.value());
        } else if (node instanceof VariableCondition c) {
            return nodes(c.value());
        } else if (node instanceof ResponseCondition c) {
            return nodes(c.value());
        } else if (node instanceof BooleanCondition.ElementState e) {
            return nodes(e.target());
        } else if (node instanceof LoadFilter f) {
            return nodes(f.value());
        }
        // leaves: Target.Text, Target.Field, TableReference, simple modifiers, VariableTruthy
        return new ArrayList<>();
    }

    static List<AstNode> nodes(AstNode... items) {
        List<AstNode> list = new ArrayList<>(items.length);
        for (AstNode item : items) {
            if (item != null) {
                list.add(item);
            }
        }
        return list;
    }

    static List<AstNode> concat(List<AstNode> head, List<? extends AstNode> tail) {
        head.addAll(tail);
        return head;
    }

    static class StatementChildren implements StatementVisitor<List<AstNode>> {

        @Override
        public List<AstNode> visit(Statement.Click s) {
            return nodes(s.target());
        }

        @Override
        public List<AstNode> visit(Statement.RightClick s) {
            return nodes(s.target());
        }

        @Override
        public List<AstNode> visit(Statement.DoubleClick s) {
            return nodes(s.target());
        }

        @Override
        public List<AstNode> visit(Statement.ForceClick s) {
            return nodes(s.target());
        }

        @Override
        public List<AstNode> visit(Statement.Drag s) {
            return nodes(s.source(), s.destination());
        }

        @Override
        public List<AstNode> visit(Statement.Fill s) {
            return nodes(s.target(), s.value());
        }

        @Override
        public List<AstNode> visit(Statement.Open s) {
            return nodes(s.url());
        }

        @Override
        public List<AstNode> visit(Statement.Check s) {
            return nodes(s.target());
        }

        @Override
        public List<AstNode> visit(Statement.Uncheck s) {
            return nodes(s.target());
        }

        @Override
        public List<AstNode> visit(Statement.Hover s) {
            return nodes(s.target());
        }

        @Override
        public List<AstNode> visit(Statement.Press s) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Statement.Wait s) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Statement.WaitFor s) {
            return nodes(s.target());
        }

        @Override
        public List<AstNode> visit(Statement.Return s) {
            return nodes(s.target(), s.expression());
        }

        @Override
        public List<AstNode> visit(Statement.Refresh s) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Statement.SwitchToNewTab s) {
            return nodes(s.url());
        }

        @Override
        public List<AstNode> visit(Statement.SwitchToTab s) {
            return nodes(s.tabIndex());
        }

        @Override
        public List<AstNode> visit(Statement.OpenInNewTab s) {
            return nodes(s.url());
        }

        @Override
        public List<AstNode> visit(Statement.CloseTab s) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Statement.AcceptDialog s) {
            return nodes(s.responseText());
        }

        @Override
        public List<AstNode> visit(Statement.DismissDialog s) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Statement.SwitchToFrame s) {
            return nodes(s.selector());
        }

        @Override
        public List<AstNode> visit(Statement.SwitchToMainFrame s) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Statement.Download s) {
            return nodes(s.target(), s.saveAs());
        }

        @Override
        public List<AstNode> visit(Statement.SetCookie s) {
            return nodes(s.name(), s.value());
        }

        @Override
        public List<AstNode> visit(Statement.ClearCookies s) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Statement.SetStorage s) {
            return nodes(s.key(), s.value());
        }

        @Override
        public List<AstNode> visit(Statement.GetStorage s) {
            return nodes(s.key());
        }

        @Override
        public List<AstNode> visit(Statement.ClearStorage s) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Statement.Scroll s) {
            return nodes(s.target());
        }

        @Override
        public List<AstNode> visit(Statement.WaitForNavigation s) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Statement.WaitForNetworkIdle s) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Statement.WaitForUrl s) {
            return nodes(s.value());
        }

        @Override
        public List<AstNode> visit(Statement.Log s) {
            return nodes(s.message());
        }

        @Override
        public List<AstNode> visit(Statement.TakeScreenshot s) {
            return nodes(s.target());
        }

        @Override
        public List<AstNode> visit(Statement.Upload s) {
            return concat(nodes(s.target()), s.files());
        }

        @Override
        public List<AstNode> visit(Statement.Perform s) {
            return nodes(s.call());
        }

        @Override
        public List<AstNode> visit(Statement.PerformAssignment s) {
            return nodes(s.call());
        }

        @Override
        public List<AstNode> visit(Statement.Verify s) {
            return nodes(s.target(), s.subject(), s.condition());
        }

        @Override
        public List<AstNode> visit(Statement.VerifyUrl s) {
            return nodes(s.value());
        }

        @Override
        public List<AstNode> visit(Statement.VerifyTitle s) {
            return nodes(s.value());
        }

        @Override
        public List<AstNode> visit(Statement.VerifyHas s) {
            return nodes(s.target(), s.condition());
        }

        @Override
        public List<AstNode> visit(Statement.VerifyScreenshot s) {
            return nodes(s.target());
        }

        @Override
        public List<AstNode> visit(Statement.VerifyVariable s) {
            return nodes(s.variable(), s.condition());
        }

        @Override
        public List<AstNode> visit(Statement.VerifyResponse s) {
            return nodes(s.condition());
        }

        @Override
        public List<AstNode> visit(Statement.ApiRequest s) {
            return nodes(s.url(), s.body(), s.headers());
        }

        @Override
        public List<AstNode> visit(Statement.MockApi s) {
            return nodes(s.url(), s.body());
        }

        @Override
        public List<AstNode> visit(Statement.Load s) {
            return nodes(s.where());
        }

        @Override
        public List<AstNode> visit(Statement.ForEach s) {
            return new ArrayList<>(s.statements());
        }

        @Override
        public List<AstNode> visit(Statement.IfElse s) {
            return concat(concat(nodes(s.condition()), s.ifStatements()), s.elseStatements());
        }

        @Override
        public List<AstNode> visit(Statement.Repeat s) {
            return concat(nodes(s.count()), s.statements());
        }

        @Override
        public List<AstNode> visit(Statement.TryCatch s) {
            return concat(new ArrayList<>(s.tryStatements()), s.catchStatements());
        }

        @Override
        public List<AstNode> visit(Statement.Row s) {
            return nodes(s.table(), s.where());
        }

        @Override
        public List<AstNode> visit(Statement.Rows s) {
            return nodes(s.table(), s.where());
        }

        @Override
        public List<AstNode> visit(Statement.ColumnAccess s) {
            return nodes(s.table(), s.where());
        }

        @Override
        public List<AstNode> visit(Statement.Count s) {
            return nodes(s.table(), s.where());
        }

        @Override
        public List<AstNode> visit(Statement.DataQuery s) {
            return nodes(s.query());
        }

        @Override
        public List<AstNode> visit(Statement.UtilityAssignment s) {
            return nodes(s.expression());
        }

        @Override
        public List<AstNode> visit(Statement.Unsupported s) {
            return nodes();
        }

    }

    static class ExpressionChildren implements ExpressionVisitor<List<AstNode>> {

        @Override
        public List<AstNode> visit(Expression.StringLiteral e) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Expression.NumberLiteral e) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Expression.BooleanLiteral e) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Expression.VariableReference e) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Expression.EnvVarReference e) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Expression.Trim e) {
            return nodes(e.value());
        }

        @Override
        public List<AstNode> visit(Expression.Convert e) {
            return nodes(e.value());
        }

        @Override
        public List<AstNode> visit(Expression.Extract e) {
            return nodes(e.value(), e.start(), e.end());
        }

        @Override
        public List<AstNode> visit(Expression.Replace e) {
            return nodes(e.value(), e.search(), e.replacement());
        }

        @Override
        public List<AstNode> visit(Expression.Split e) {
            return nodes(e.value(), e.delimiter());
        }

        @Override
        public List<AstNode> visit(Expression.Join e) {
            return nodes(e.value(), e.delimiter());
        }

        @Override
        public List<AstNode> visit(Expression.Length e) {
            return nodes(e.value());
        }

        @Override
        public List<AstNode> visit(Expression.Pad e) {
            return nodes(e.value(), e.length(), e.padChar());
        }

        @Override
        public List<AstNode> visit(Expression.Today e) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Expression.Now e) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Expression.AddDate e) {
            return nodes(e.amount(), e.date());
        }

        @Override
        public List<AstNode> visit(Expression.SubtractDate e) {
            return nodes(e.amount(), e.date());
        }

        @Override
        public List<AstNode> visit(Expression.Format e) {
            return nodes(e.value());
        }

        @Override
        public List<AstNode> visit(Expression.DatePart e) {
            return nodes(e.date());
        }

        @Override
        public List<AstNode> visit(Expression.Round e) {
            return nodes(e.value());
        }

        @Override
        public List<AstNode> visit(Expression.Absolute e) {
            return nodes(e.value());
        }

        @Override
        public List<AstNode> visit(Expression.Generate e) {
            return nodes();
        }

        @Override
        public List<AstNode> visit(Expression.RandomNumber e) {
            return nodes(e.min(), e.max());
        }

        @Override
        public List<AstNode> visit(Expression.Chained e) {
            return nodes(e.first(), e.second());
        }

    }

}
