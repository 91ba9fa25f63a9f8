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
package io.vero.compiler.statement;

import io.vero.ast.ActionCall;
import io.vero.ast.BooleanCondition;
import io.vero.ast.Expression;
import io.vero.ast.HasCondition;
import io.vero.ast.ResponseCondition;
import io.vero.ast.ScreenshotOptions;
import io.vero.ast.Statement;
import io.vero.ast.StatementVisitor;
import io.vero.ast.Target;
import io.vero.ast.VariableCondition;
import io.vero.ast.VerifyCondition;
import io.vero.compiler.CodeBuilder;
import io.vero.compiler.CompileContext;
import io.vero.compiler.CompileWarning;
import io.vero.compiler.Scope;
import io.vero.compiler.data.ConditionCompiler;
import io.vero.compiler.data.DataQueryCompiler;
import io.vero.compiler.data.TableAccessCompiler;
import io.vero.compiler.debug.DebugInstrumenter;
import io.vero.compiler.expr.ExpressionCompiler;
import io.vero.compiler.locator.SelectorResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static io.vero.common.StringUtils.quote;

/**
 * Maps each statement to one or more lines of Playwright code. Lines are relative to the
 * enclosing block; compound statements indent their bodies through {@link CodeBuilder}.
 */
public class StatementCompiler {

    private final CompileContext context;
    private final ExpressionCompiler expressions;
    private final SelectorResolver selectors;
    private final TableAccessCompiler tables;
    private final DataQueryCompiler queries;
    private final DebugInstrumenter debug;

    public StatementCompiler(CompileContext context) {
        this.context = context;
        expressions = new ExpressionCompiler();
        selectors = new SelectorResolver(context);
        ConditionCompiler conditions = new ConditionCompiler(expressions);
        tables = new TableAccessCompiler(context, conditions);
        queries = new DataQueryCompiler(conditions, expressions);
        debug = new DebugInstrumenter(context);
    }

    public ExpressionCompiler getExpressions() {
        return expressions;
    }

    public List<String> compile(Statement statement, Scope scope) {
        return statement.accept(new Rules(scope));
    }

    public List<String> compileAll(List<Statement> statements, Scope scope) {
        List<String> lines = new ArrayList<>();
        for (Statement statement : statements) {
            lines.addAll(compile(statement, scope));
        }
        return lines;
    }

    /**
     * Top-level scenario statements; each one is wrapped with debug hooks in debug mode.
     */
    public List<String> compileBody(List<Statement> statements, Scope scope) {
        if (!context.getOptions().isDebug()) {
            return compileAll(statements, scope);
        }
        List<String> lines = new ArrayList<>();
        for (Statement statement : statements) {
            String declared = DebugInstrumenter.declaredVariable(statement);
            List<String> body = compile(statement, declared == null ? scope : scope.withHoisted(true));
            lines.addAll(debug.wrap(statement, body, declared));
        }
        return lines;
    }

    private class Rules implements StatementVisitor<List<String>> {

        final Scope scope;
        final String page;

        Rules(Scope scope) {
            this.scope = scope;
            this.page = scope.pageHandle();
        }

        String loc(Target target, int line) {
            return selectors.resolve(target, scope, line);
        }

        String expr(Expression expression) {
            return expressions.compile(expression, scope);
        }

        /**
         * An interaction, titled as a test step when compiling a scenario.
         */
        List<String> step(String title, String... code) {
            if (!scope.wrapSteps()) {
                return List.of(code);
            }
            return new CodeBuilder().block("await test.step(" + quote(title) + ", async () => {", List.of(code), "});").toLines();
        }

        List<String> withRebinds(String... code) {
            List<String> lines = new ArrayList<>(List.of(code));
            lines.addAll(scope.rebinds());
            return lines;
        }

        List<String> block(String header, List<Statement> body, String footer) {
            return new CodeBuilder().block(header, compileAll(body, scope.withHoisted(false)), footer).toLines();
        }

        String describe(Target target) {
            return SelectorResolver.describe(target);
        }

        String call(ActionCall call, int line) {
            String owner = call.page() == null ? scope.resolvePage(null) : scope.resolvePage(call.page());
            List<String> args = new ArrayList<>();
            for (Expression argument : call.arguments()) {
                args.add(expr(argument));
            }
            String target = owner == null ? call.action() : owner + "." + call.action();
            if (owner == null) {
                context.warn(CompileWarning.UNKNOWN_ACTION, line, "action '" + call.action() + "' has no page and no current page");
            }
            return "await " + target + "(" + String.join(", ", args) + ")";
        }

        // ========== Interaction ==========

        @Override
        public List<String> visit(Statement.Click s) {
            return step("Click " + describe(s.target()), "await " + loc(s.target(), s.line()) + ".click();");
        }

        @Override
        public List<String> visit(Statement.RightClick s) {
            return step("Right click " + describe(s.target()), "await " + loc(s.target(), s.line()) + ".click({ button: 'right' });");
        }

        @Override
        public List<String> visit(Statement.DoubleClick s) {
            return step("Double click " + describe(s.target()), "await " + loc(s.target(), s.line()) + ".dblclick();");
        }

        @Override
        public List<String> visit(Statement.ForceClick s) {
            return step("Force click " + describe(s.target()), "await " + loc(s.target(), s.line()) + ".click({ force: true });");
        }

        @Override
        public List<String> visit(Statement.Drag s) {
            String source = loc(s.source(), s.line());
            if (s.destination() != null) {
                return step("Drag " + describe(s.source()) + " to " + describe(s.destination()),
                        "await " + source + ".dragTo(" + loc(s.destination(), s.line()) + ");");
            }
            int x = s.x() == null ? 0 : s.x();
            int y = s.y() == null ? 0 : s.y();
            return step("Drag " + describe(s.source()) + " to " + x + ", " + y,
                    "await " + source + ".hover();",
                    "await " + page + ".mouse.down();",
                    "await " + page + ".mouse.move(" + x + ", " + y + ");",
                    "await " + page + ".mouse.up();");
        }

        @Override
        public List<String> visit(Statement.Fill s) {
            return step("Fill " + describe(s.target()) + " with " + ExpressionCompiler.describe(s.value()),
                    "await " + loc(s.target(), s.line()) + ".fill(" + expr(s.value()) + ");");
        }

        @Override
        public List<String> visit(Statement.Open s) {
            return step("Navigate to " + ExpressionCompiler.describe(s.url()), "await " + page + ".goto(" + expr(s.url()) + ");");
        }

        @Override
        public List<String> visit(Statement.Check s) {
            return step("Check " + describe(s.target()), "await " + loc(s.target(), s.line()) + ".check();");
        }

        @Override
        public List<String> visit(Statement.Uncheck s) {
            return step("Uncheck " + describe(s.target()), "await " + loc(s.target(), s.line()) + ".uncheck();");
        }

        @Override
        public List<String> visit(Statement.Hover s) {
            return step("Hover " + describe(s.target()), "await " + loc(s.target(), s.line()) + ".hover();");
        }

        @Override
        public List<String> visit(Statement.Press s) {
            return step("Press " + s.key(), "await " + page + ".keyboard.press(" + quote(s.key()) + ");");
        }

        @Override
        public List<String> visit(Statement.Wait s) {
            String amount = ExpressionCompiler.formatNumber(s.duration());
            if (s.unit() == Statement.WaitUnit.MILLISECONDS) {
                return step("Wait " + amount + " milliseconds", "await " + page + ".waitForTimeout(" + amount + ");");
            }
            String millis = ExpressionCompiler.formatNumber(s.duration() * 1000);
            return step("Wait " + amount + (s.duration() == 1 ? " second" : " seconds"),
                    "await " + page + ".waitForTimeout(" + millis + ");");
        }

        @Override
        public List<String> visit(Statement.WaitFor s) {
            return step("Wait for " + describe(s.target()), "await " + loc(s.target(), s.line()) + ".waitFor({ state: 'visible' });");
        }

        @Override
        public List<String> visit(Statement.Return s) {
            Statement.ReturnType type = s.returnType() == null ? Statement.ReturnType.EXPRESSION : s.returnType();
            if (type != Statement.ReturnType.EXPRESSION && s.target() == null) {
                type = Statement.ReturnType.EXPRESSION;
            }
            return List.of(switch (type) {
                case VISIBLE -> "return await " + loc(s.target(), s.line()) + ".isVisible();";
                case TEXT -> "return (await " + loc(s.target(), s.line()) + ".textContent()) ?? '';";
                case VALUE -> "return await " + loc(s.target(), s.line()) + ".inputValue();";
                case EXPRESSION -> s.expression() == null ? "return;" : "return " + expr(s.expression()) + ";";
            });
        }

        @Override
        public List<String> visit(Statement.Refresh s) {
            return step("Refresh page", "await " + page + ".reload();");
        }

        // ========== Tabs, dialogs and frames ==========

        @Override
        public List<String> visit(Statement.SwitchToNewTab s) {
            String pages = scope.contextHandle() + ".pages()";
            if (s.url() != null) {
                return withRebinds(page + " = await " + scope.contextHandle() + ".newPage();",
                        "await " + page + ".goto(" + expr(s.url()) + ");");
            }
            return withRebinds(page + " = " + pages + "[" + pages + ".length - 1];",
                    "await " + page + ".bringToFront();");
        }

        @Override
        public List<String> visit(Statement.SwitchToTab s) {
            String index = s.tabIndex() instanceof Expression.NumberLiteral n
                    ? ExpressionCompiler.formatNumber(n.value() - 1)
                    : "(" + expr(s.tabIndex()) + ") - 1";
            return withRebinds(page + " = " + scope.contextHandle() + ".pages()[" + index + "];",
                    "await " + page + ".bringToFront();");
        }

        @Override
        public List<String> visit(Statement.OpenInNewTab s) {
            return withRebinds(page + " = await " + scope.contextHandle() + ".newPage();",
                    "await " + page + ".goto(" + expr(s.url()) + ");");
        }

        @Override
        public List<String> visit(Statement.CloseTab s) {
            String pages = scope.contextHandle() + ".pages()";
            return withRebinds("await " + page + ".close();",
                    page + " = " + pages + "[" + pages + ".length - 1];",
                    "await " + page + ".bringToFront();");
        }

        @Override
        public List<String> visit(Statement.AcceptDialog s) {
            String accept = s.responseText() == null ? "dialog.accept()" : "dialog.accept(" + expr(s.responseText()) + ")";
            return List.of(page + ".once('dialog', (dialog) => " + accept + ");");
        }

        @Override
        public List<String> visit(Statement.DismissDialog s) {
            return List.of(page + ".once('dialog', (dialog) => dialog.dismiss());");
        }

        @Override
        public List<String> visit(Statement.SwitchToFrame s) {
            if (s.selector() == null) {
                return List.of(Scope.FRAME + " = null;");
            }
            return List.of(Scope.FRAME + " = " + selectors.resolve(s.selector(), scope.locatorRoot()) + ".contentFrame();");
        }

        @Override
        public List<String> visit(Statement.SwitchToMainFrame s) {
            return List.of(Scope.FRAME + " = null;");
        }

        // ========== Browser state ==========

        @Override
        public List<String> visit(Statement.Download s) {
            String download = context.nextTemp("download");
            List<String> lines = new ArrayList<>();
            lines.add("const [" + download + "] = await Promise.all([" + page + ".waitForEvent('download'), "
                    + loc(s.target(), s.line()) + ".click()]);");
            if (s.saveAs() != null) {
                lines.add("await " + download + ".saveAs(" + expr(s.saveAs()) + ");");
            } else {
                lines.add("await " + download + ".path();");
            }
            return step("Download from " + describe(s.target()), lines.toArray(new String[0]));
        }

        @Override
        public List<String> visit(Statement.SetCookie s) {
            return List.of("await " + page + ".context().addCookies([{ name: " + expr(s.name()) + ", value: " + expr(s.value())
                    + ", url: " + page + ".url() }]);");
        }

        @Override
        public List<String> visit(Statement.ClearCookies s) {
            return List.of("await " + page + ".context().clearCookies();");
        }

        @Override
        public List<String> visit(Statement.SetStorage s) {
            return List.of("await " + page + ".evaluate(([key, value]) => localStorage.setItem(key, value), ["
                    + expr(s.key()) + ", " + expr(s.value()) + "]);");
        }

        @Override
        public List<String> visit(Statement.GetStorage s) {
            return List.of(scope.declare(s.variable()) + " = await " + page + ".evaluate((key) => localStorage.getItem(key), "
                    + expr(s.key()) + ");");
        }

        @Override
        public List<String> visit(Statement.ClearStorage s) {
            return List.of("await " + page + ".evaluate(() => localStorage.clear());");
        }

        @Override
        public List<String> visit(Statement.Scroll s) {
            if (s.target() != null) {
                return step("Scroll to " + describe(s.target()), "await " + loc(s.target(), s.line()) + ".scrollIntoViewIfNeeded();");
            }
            boolean up = s.direction() == Statement.ScrollDirection.UP;
            return step("Scroll " + (up ? "up" : "down"), "await " + page + ".mouse.wheel(0, " + (up ? "-500" : "500") + ");");
        }

        @Override
        public List<String> visit(Statement.WaitForNavigation s) {
            return step("Wait for navigation", "await " + page + ".waitForLoadState('load');");
        }

        @Override
        public List<String> visit(Statement.WaitForNetworkIdle s) {
            return step("Wait for network idle", "await " + page + ".waitForLoadState('networkidle');");
        }

        @Override
        public List<String> visit(Statement.WaitForUrl s) {
            String value = expr(s.value());
            Statement.Match match = s.match() == null ? Statement.Match.CONTAINS : s.match();
            String code = switch (match) {
                case CONTAINS -> "await " + page + ".waitForURL((url) => url.toString().includes(" + value + "));";
                case EQUALS -> "await " + page + ".waitForURL(" + value + ");";
                case MATCHES -> "await " + page + ".waitForURL(new RegExp(" + value + "));";
            };
            return step("Wait for URL " + ExpressionCompiler.describe(s.value()), code);
        }

        @Override
        public List<String> visit(Statement.Log s) {
            return step("Log: " + ExpressionCompiler.describe(s.message()), "console.log(" + expr(s.message()) + ");");
        }

        @Override
        public List<String> visit(Statement.TakeScreenshot s) {
            String path = quote(s.filename() == null ? "screenshot-" + s.line() + ".png" : s.filename());
            if (s.target() != null) {
                return step("Screenshot " + describe(s.target()), "await " + loc(s.target(), s.line()) + ".screenshot({ path: " + path + " });");
            }
            return step("Screenshot page", "await " + page + ".screenshot({ path: " + path + ", fullPage: true });");
        }

        @Override
        public List<String> visit(Statement.Upload s) {
            List<String> files = new ArrayList<>();
            for (Expression file : s.files()) {
                files.add(expr(file));
            }
            String arg = files.size() == 1 ? files.get(0) : "[" + String.join(", ", files) + "]";
            return step("Upload to " + describe(s.target()), "await " + loc(s.target(), s.line()) + ".setInputFiles(" + arg + ");");
        }

        // ========== Actions ==========

        @Override
        public List<String> visit(Statement.Perform s) {
            ActionCall call = s.call();
            String title = call.page() == null ? call.action() : call.page() + "." + call.action();
            return step("Perform " + title, call(call, s.line()) + ";");
        }

        @Override
        public List<String> visit(Statement.PerformAssignment s) {
            return List.of(scope.declare(s.variableName()) + " = " + call(s.call(), s.line()) + ";");
        }

        // ========== Assertions ==========

        @Override
        public List<String> visit(Statement.Verify s) {
            String subject = s.target() != null
                    ? loc(s.target(), s.line())
                    : scope.locatorRoot() + ".getByText(" + expr(s.subject()) + ")";
            VerifyCondition c = s.condition() == null ? VerifyCondition.is(VerifyCondition.State.VISIBLE) : s.condition();
            String not = c.isNegated() ? "not." : "";
            String matcher;
            if (c.state() != null) {
                matcher = switch (c.state()) {
                    case VISIBLE -> "toBeVisible()";
                    case HIDDEN -> "toBeHidden()";
                    case ENABLED -> "toBeEnabled()";
                    case DISABLED -> "toBeDisabled()";
                    case CHECKED -> "toBeChecked()";
                    case FOCUSED -> "toBeFocused()";
                    case EMPTY -> "toBeEmpty()";
                };
            } else {
                boolean contains = c.operator() == VerifyCondition.Operator.CONTAINS
                        || c.operator() == VerifyCondition.Operator.NOT_CONTAINS;
                matcher = (contains ? "toContainText(" : "toHaveText(") + expr(c.value()) + ")";
            }
            return List.of("await expect(" + subject + ")." + not + matcher + ";");
        }

        @Override
        public List<String> visit(Statement.VerifyUrl s) {
            return List.of("await expect(" + page + ").toHaveURL(" + matchArgument(s.match(), s.value()) + ");");
        }

        @Override
        public List<String> visit(Statement.VerifyTitle s) {
            return List.of("await expect(" + page + ").toHaveTitle(" + matchArgument(s.match(), s.value()) + ");");
        }

        private String matchArgument(Statement.Match match, Expression value) {
            Statement.Match m = match == null ? Statement.Match.CONTAINS : match;
            return switch (m) {
                case EQUALS -> expr(value);
                case MATCHES -> "new RegExp(" + expr(value) + ")";
                case CONTAINS -> value instanceof Expression.StringLiteral literal
                        ? "new RegExp(" + quote(escapeRegex(literal.value())) + ")"
                        : "new RegExp(String(" + expr(value) + ").replace(/[.*+?^${}()|[\\]\\\\]/g, '\\\\$&'))";
            };
        }

        @Override
        public List<String> visit(Statement.VerifyHas s) {
            HasCondition c = s.condition();
            String value = expr(c.value());
            String matcher = switch (c.kind()) {
                case COUNT -> "toHaveCount(" + value + ")";
                case VALUE -> "toHaveValue(" + value + ")";
                case ATTRIBUTE -> "toHaveAttribute(" + expr(c.attribute()) + ", " + value + ")";
                case TEXT -> "toHaveText(" + value + ")";
                case CONTAINS_TEXT -> "toContainText(" + value + ")";
                case CLASS -> "toHaveClass(new RegExp(" + value + "))";
            };
            return List.of("await expect(" + loc(s.target(), s.line()) + ")." + matcher + ";");
        }

        @Override
        public List<String> visit(Statement.VerifyScreenshot s) {
            String subject = s.target() == null ? page : loc(s.target(), s.line());
            String name = s.name() == null ? "screenshot-" + s.line() : s.name();
            if (!name.contains(".")) {
                name = name + ".png";
            }
            List<String> options = new ArrayList<>();
            ScreenshotOptions o = s.options();
            if (o != null) {
                if (o.effectiveThreshold() != null) {
                    options.add("threshold: " + ExpressionCompiler.formatNumber(o.effectiveThreshold()));
                }
                if (o.effectiveMaxDiffPixels() != null) {
                    options.add("maxDiffPixels: " + o.effectiveMaxDiffPixels());
                }
                if (o.effectiveMaxDiffPixelRatio() != null) {
                    options.add("maxDiffPixelRatio: " + ExpressionCompiler.formatNumber(o.effectiveMaxDiffPixelRatio()));
                }
            }
            String args = options.isEmpty() ? quote(name) : quote(name) + ", { " + String.join(", ", options) + " }";
            return List.of("await expect(" + subject + ").toHaveScreenshot(" + args + ");");
        }

        @Override
        public List<String> visit(Statement.VerifyVariable s) {
            String variable = expr(s.variable());
            VariableCondition c = s.condition();
            String value = expr(c.value());
            String matcher = switch (c.kind()) {
                case IS_TRUE -> "toBeTruthy()";
                case IS_FALSE -> "toBeFalsy()";
                case IS_NOT_TRUE -> "not.toBeTruthy()";
                case IS_NOT_FALSE -> "not.toBeFalsy()";
                case CONTAINS -> "toContain(" + value + ")";
                case NOT_CONTAINS -> "not.toContain(" + value + ")";
                case EQUALS -> "toEqual(" + value + ")";
                case NOT_EQUALS -> "not.toEqual(" + value + ")";
            };
            return List.of("expect(" + variable + ")." + matcher + ";");
        }

        @Override
        public List<String> visit(Statement.VerifyResponse s) {
            ResponseCondition c = s.condition();
            String actual = switch (c.subject()) {
                case STATUS -> Scope.API_RESPONSE + ".status()";
                case BODY -> "await " + Scope.API_RESPONSE + ".text()";
                case HEADERS -> "JSON.stringify(" + Scope.API_RESPONSE + ".headers())";
            };
            String value = expr(c.value());
            String matcher = switch (c.operator()) {
                case EQUALS -> "toBe(" + value + ")";
                case NOT_EQUALS -> "not.toBe(" + value + ")";
                case CONTAINS -> "toContain(" + value + ")";
                case GREATER_THAN -> "toBeGreaterThan(" + value + ")";
                case LESS_THAN -> "toBeLessThan(" + value + ")";
                case GREATER_OR_EQUAL -> "toBeGreaterThanOrEqual(" + value + ")";
                case LESS_OR_EQUAL -> "toBeLessThanOrEqual(" + value + ")";
            };
            return List.of("expect(" + actual + ")." + matcher + ";");
        }

        // ========== API ==========

        @Override
        public List<String> visit(Statement.ApiRequest s) {
            Statement.HttpMethod method = s.method() == null ? Statement.HttpMethod.GET : s.method();
            List<String> options = new ArrayList<>();
            if (s.body() != null) {
                options.add("data: " + expr(s.body()));
            }
            if (s.headers() != null) {
                options.add("headers: " + expr(s.headers()));
            }
            String args = expr(s.url()) + (options.isEmpty() ? "" : ", { " + String.join(", ", options) + " }");
            String verb = method.name().toLowerCase(Locale.ROOT);
            return step(method.name() + " " + ExpressionCompiler.describe(s.url()),
                    Scope.API_RESPONSE + " = await " + scope.requestHandle() + "." + verb + "(" + args + ");");
        }

        @Override
        public List<String> visit(Statement.MockApi s) {
            String body = s.body() == null ? "''" : expr(s.body());
            return List.of("await " + page + ".route(" + expr(s.url()) + ", (route) => route.fulfill({ status: " + s.status()
                    + ", body: " + body + " }));");
        }

        // ========== Control flow ==========

        @Override
        public List<String> visit(Statement.ForEach s) {
            return block("for (const " + s.itemVariable() + " of " + s.collectionVariable() + ") {", s.statements(), "}");
        }

        @Override
        public List<String> visit(Statement.IfElse s) {
            CodeBuilder cb = new CodeBuilder();
            Scope inner = scope.withHoisted(false);
            cb.open("if (" + condition(s.condition(), s.line()) + ") {");
            cb.lines(compileAll(s.ifStatements(), inner));
            if (!s.elseStatements().isEmpty()) {
                cb.reopen("} else {");
                cb.lines(compileAll(s.elseStatements(), inner));
            }
            cb.close("}");
            return cb.toLines();
        }

        private String condition(BooleanCondition condition, int line) {
            if (condition instanceof BooleanCondition.VariableTruthy v) {
                return v.variableName();
            } else if (condition instanceof BooleanCondition.ElementState e) {
                String method = switch (e.state()) {
                    case VISIBLE -> "isVisible()";
                    case HIDDEN -> "isHidden()";
                    case ENABLED -> "isEnabled()";
                    case DISABLED -> "isDisabled()";
                    case CHECKED -> "isChecked()";
                    case EDITABLE -> "isEditable()";
                };
                String check = "await " + loc(e.target(), line) + "." + method;
                return e.negated() ? "!(" + check + ")" : check;
            }
            return ConditionCompiler.ALWAYS_TRUE;
        }

        @Override
        public List<String> visit(Statement.Repeat s) {
            String i = context.nextTemp("i");
            return block("for (let " + i + " = 0; " + i + " < " + expr(s.count()) + "; " + i + "++) {", s.statements(), "}");
        }

        @Override
        public List<String> visit(Statement.TryCatch s) {
            Scope inner = scope.withHoisted(false);
            CodeBuilder cb = new CodeBuilder();
            cb.open("try {");
            cb.lines(compileAll(s.tryStatements(), inner));
            cb.reopen("} catch (__error) {");
            cb.lines(compileAll(s.catchStatements(), inner));
            cb.close("}");
            return cb.toLines();
        }

        // ========== Data ==========

        @Override
        public List<String> visit(Statement.Load s) {
            return tables.load(s, scope);
        }

        @Override
        public List<String> visit(Statement.Row s) {
            return tables.row(s, scope);
        }

        @Override
        public List<String> visit(Statement.Rows s) {
            return tables.rows(s, scope);
        }

        @Override
        public List<String> visit(Statement.ColumnAccess s) {
            return tables.column(s, scope);
        }

        @Override
        public List<String> visit(Statement.Count s) {
            return tables.count(s, scope);
        }

        @Override
        public List<String> visit(Statement.DataQuery s) {
            return queries.compile(s, scope);
        }

        @Override
        public List<String> visit(Statement.UtilityAssignment s) {
            return List.of(scope.declare(s.variableName()) + " = " + expr(s.expression()) + ";");
        }

        @Override
        public List<String> visit(Statement.Unsupported s) {
            context.warn(CompileWarning.UNSUPPORTED_STATEMENT, s.line(), "no compilation rule for statement '" + s.type() + "'");
            return List.of("// Unsupported statement: " + s.type());
        }

    }

    static String escapeRegex(String text) {
        StringBuilder sb = new StringBuilder();
        for (char c : text.toCharArray()) {
            if (".*+?^${}()|[]\\/".indexOf(c) != -1) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

}
