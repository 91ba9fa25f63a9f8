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
 * Closed union of every statement the DSL can express. Each variant carries the source line
 * it was parsed from and dispatches to exactly one {@link StatementVisitor} method.
 */
public sealed interface Statement extends AstNode permits
        Statement.Click, Statement.RightClick, Statement.DoubleClick, Statement.ForceClick,
        Statement.Drag, Statement.Fill, Statement.Open, Statement.Check, Statement.Uncheck,
        Statement.Hover, Statement.Press, Statement.Wait, Statement.WaitFor, Statement.Return,
        Statement.Refresh, Statement.SwitchToNewTab, Statement.SwitchToTab, Statement.OpenInNewTab,
        Statement.CloseTab, Statement.AcceptDialog, Statement.DismissDialog, Statement.SwitchToFrame,
        Statement.SwitchToMainFrame, Statement.Download, Statement.SetCookie, Statement.ClearCookies,
        Statement.SetStorage, Statement.GetStorage, Statement.ClearStorage, Statement.Scroll,
        Statement.WaitForNavigation, Statement.WaitForNetworkIdle, Statement.WaitForUrl, Statement.Log,
        Statement.TakeScreenshot, Statement.Upload, Statement.Perform, Statement.PerformAssignment,
        Statement.Verify, Statement.VerifyUrl, Statement.VerifyTitle, Statement.VerifyHas,
        Statement.VerifyScreenshot, Statement.VerifyVariable, Statement.VerifyResponse,
        Statement.ApiRequest, Statement.MockApi, Statement.Load, Statement.ForEach, Statement.IfElse,
        Statement.Repeat, Statement.TryCatch, Statement.Row, Statement.Rows, Statement.ColumnAccess,
        Statement.Count, Statement.DataQuery, Statement.UtilityAssignment, Statement.Unsupported {

    int line();

    <R> R accept(StatementVisitor<R> visitor);

    enum WaitUnit {SECONDS, MILLISECONDS}

    enum ReturnType {VISIBLE, TEXT, VALUE, EXPRESSION}

    enum ScrollDirection {UP, DOWN}

    enum Match {CONTAINS, EQUALS, MATCHES}

    enum HttpMethod {GET, POST, PUT, DELETE, PATCH}

    enum RowModifier {FIRST, LAST, RANDOM}

    enum ResultType {DATA, LIST, TEXT, NUMBER, FLAG}

    // ========== Interaction ==========

    record Click(Target target, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record RightClick(Target target, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record DoubleClick(Target target, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ForceClick(Target target, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Drags the source onto a destination target, or to absolute coordinates when the
     * destination is null.
     */
    record Drag(Target source, Target destination, Integer x, Integer y, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Fill(Target target, Expression value, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Open(Expression url, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Check(Target target, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Uncheck(Target target, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Hover(Target target, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Press(String key, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Wait(double duration, WaitUnit unit, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record WaitFor(Target target, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Only meaningful inside a page action. {@code target} is used for VISIBLE, TEXT and VALUE,
     * {@code expression} for EXPRESSION.
     */
    record Return(ReturnType returnType, Target target, Expression expression, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Refresh(int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ========== Tabs, dialogs and frames ==========

    record SwitchToNewTab(Expression url, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record SwitchToTab(Expression tabIndex, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record OpenInNewTab(Expression url, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record CloseTab(int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record AcceptDialog(Expression responseText, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record DismissDialog(int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record SwitchToFrame(Selector selector, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record SwitchToMainFrame(int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ========== Browser state ==========

    record Download(Target target, Expression saveAs, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record SetCookie(Expression name, Expression value, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ClearCookies(int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record SetStorage(Expression key, Expression value, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record GetStorage(Expression key, String variable, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ClearStorage(int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Scrolls a target into view, or the whole page in a direction when target is null.
     */
    record Scroll(ScrollDirection direction, Target target, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record WaitForNavigation(int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record WaitForNetworkIdle(int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record WaitForUrl(Match match, Expression value, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Log(Expression message, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record TakeScreenshot(Target target, String filename, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Upload(List<Expression> files, Target target, int line) implements Statement {
        public Upload {
            files = AstNode.list(files);
        }

        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ========== Actions ==========

    record Perform(ActionCall call, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record PerformAssignment(VarType varType, String variableName, ActionCall call, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ========== Assertions ==========

    /**
     * Either {@code target} or {@code subject} is set; a subject expression is matched as visible text.
     */
    record Verify(Target target, Expression subject, VerifyCondition condition, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record VerifyUrl(Match match, Expression value, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record VerifyTitle(Match match, Expression value, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record VerifyHas(Target target, HasCondition condition, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record VerifyScreenshot(Target target, String name, ScreenshotOptions options, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record VerifyVariable(Expression.VariableReference variable, VariableCondition condition, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record VerifyResponse(ResponseCondition condition, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ========== API ==========

    record ApiRequest(HttpMethod method, Expression url, Expression body, Expression headers, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record MockApi(Expression url, int status, Expression body, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ========== Control flow ==========

    record ForEach(String itemVariable, String collectionVariable, List<Statement> statements, int line) implements Statement {
        public ForEach {
            statements = AstNode.list(statements);
        }

        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record IfElse(BooleanCondition condition, List<Statement> ifStatements, List<Statement> elseStatements, int line) implements Statement {
        public IfElse {
            ifStatements = AstNode.list(ifStatements);
            elseStatements = AstNode.list(elseStatements);
        }

        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Repeat(Expression count, List<Statement> statements, int line) implements Statement {
        public Repeat {
            statements = AstNode.list(statements);
        }

        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record TryCatch(List<Statement> tryStatements, List<Statement> catchStatements, int line) implements Statement {
        public TryCatch {
            tryStatements = AstNode.list(tryStatements);
            catchStatements = AstNode.list(catchStatements);
        }

        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ========== Data ==========

    /**
     * Legacy single-condition table load.
     */
    record Load(String variable, String tableName, String projectName, LoadFilter where, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Row(String variableName, RowModifier modifier, TableReference table, DataCondition where,
               List<OrderBy> orderBy, int line) implements Statement {
        public Row {
            orderBy = AstNode.list(orderBy);
        }

        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Rows(String variableName, TableReference table, DataCondition where, List<OrderBy> orderBy,
                Integer limit, Integer offset, int line) implements Statement {
        public Rows {
            orderBy = AstNode.list(orderBy);
        }

        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ColumnAccess(String variableName, boolean distinct, TableReference table, String column,
                        DataCondition where, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Count(String variableName, TableReference table, DataCondition where, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record DataQuery(ResultType resultType, String variableName, Query query, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record UtilityAssignment(VarType varType, String variableName, Expression expression, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A statement kind this compiler has no rule for, kept so the rest of the unit still compiles.
     */
    record Unsupported(String type, int line) implements Statement {
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

}
