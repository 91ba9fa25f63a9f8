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

import io.vero.common.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Reads the JSON form of a parsed program, as handed over by the upstream parser.
 * <p>
 * Nodes are discriminated by a {@code type} property. Unknown statement types become
 * {@link Statement.Unsupported} so that the rest of the program can still be compiled; unknown
 * expression types become a null literal. Structural errors (not JSON, root not an object)
 * throw {@link RuntimeException}.
 */
public class AstReader {

    private static final Logger logger = LoggerFactory.getLogger(AstReader.class);

    private AstReader() {
        // only static methods
    }

    public static Program load(Path path) {
        try {
            String content = Files.readString(path);
            return parse(content);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load program from: " + path, e);
        }
    }

    public static Program parse(String json) {
        Json j = Json.of(json);
        if (!j.isObject()) {
            throw new RuntimeException("Invalid program: expected JSON object");
        }
        Map<String, Object> root = j.asMap();
        Program program = new Program(
                list(root, "pages", AstReader::page),
                list(root, "pageActions", AstReader::pageActions),
                list(root, "features", AstReader::feature),
                list(root, "fixtures", AstReader::fixture));
        logger.debug("read program: {} pages, {} page actions, {} features, {} fixtures", program.pages().size(),
                program.pageActions().size(), program.features().size(), program.fixtures().size());
        return program;
    }

    // ========== Declarations ==========

    static Page page(Map<String, Object> map) {
        List<Page.Field> fields = list(map, "fields", m -> new Page.Field(str(m, "name"), selector(m.get("selector"))));
        List<Page.Variable> variables = list(map, "variables", m ->
                new Page.Variable(str(m, "name"), varType(str(m, "varType")), expr(m.get("value"))));
        return new Page(str(map, "name"), fields, variables, list(map, "actions", AstReader::action), line(map));
    }

    static ActionDefinition action(Map<String, Object> map) {
        List<String> params = new ArrayList<>();
        for (Object o : rawList(map, "parameters")) {
            if (o instanceof Map<?, ?> m) {
                params.add(String.valueOf(m.get("name")));
            } else {
                params.add(String.valueOf(o));
            }
        }
        return new ActionDefinition(str(map, "name"), params, varType(str(map, "returnType")), statements(map, "statements"));
    }

    static PageActions pageActions(Map<String, Object> map) {
        return new PageActions(str(map, "name"), str(map, "forPage"), list(map, "actions", AstReader::action), line(map));
    }

    static Feature feature(Map<String, Object> map) {
        Set<Feature.Annotation> annotations = enumSet(Feature.Annotation.class, rawList(map, "annotations"));
        List<Feature.FixtureUse> fixtures = list(map, "fixtures", m -> {
            Map<String, Expression> options = new LinkedHashMap<>();
            Object raw = m.get("options");
            if (raw instanceof List<?> items) {
                for (Object item : items) {
                    Map<String, Object> option = asMap(item);
                    options.put(str(option, "name"), expr(option.get("value")));
                }
            } else if (raw instanceof Map<?, ?> values) {
                values.forEach((k, v) -> options.put(String.valueOf(k), expr(v)));
            }
            return new Feature.FixtureUse(str(m, "fixtureName"), options);
        });
        List<Feature.Hook> hooks = list(map, "hooks", m ->
                new Feature.Hook(enumValue(Feature.Hook.Type.class, str(m, "hookType")), statements(m, "statements")));
        return new Feature(str(map, "name"), annotations, strings(map, "uses"), fixtures, hooks,
                list(map, "scenarios", AstReader::scenario), line(map));
    }

    static Scenario scenario(Map<String, Object> map) {
        List<String> tags = new ArrayList<>();
        for (String tag : strings(map, "tags")) {
            tags.add(tag.startsWith("@") ? tag.substring(1) : tag);
        }
        return new Scenario(str(map, "name"), tags, enumSet(Scenario.Annotation.class, rawList(map, "annotations")),
                statements(map, "statements"), line(map));
    }

    static Fixture fixture(Map<String, Object> map) {
        List<Fixture.Option> options = list(map, "options", m -> new Fixture.Option(str(m, "name"), expr(m.get("defaultValue"))));
        return new Fixture(str(map, "name"), strings(map, "parameters"), enumValue(Fixture.Scope.class, str(map, "scope")),
                strings(map, "dependencies"), bool(map, "auto"), options, statements(map, "setup"), statements(map, "teardown"));
    }

    // ========== Statements ==========

    static List<Statement> statements(Map<String, Object> map, String key) {
        return list(map, key, AstReader::statement);
    }

    static Statement statement(Map<String, Object> m) {
        String type = str(m, "type");
        int line = line(m);
        if (type == null) {
            return new Statement.Unsupported("<missing>", line);
        }
        return switch (type) {
            case "Click" -> new Statement.Click(target(m.get("target")), line);
            case "RightClick" -> new Statement.RightClick(target(m.get("target")), line);
            case "DoubleClick" -> new Statement.DoubleClick(target(m.get("target")), line);
            case "ForceClick" -> new Statement.ForceClick(target(m.get("target")), line);
            case "Drag" -> drag(m, line);
            case "Fill" -> new Statement.Fill(target(m.get("target")), expr(m.get("value")), line);
            case "Open" -> new Statement.Open(expr(m.get("url")), line);
            case "Check" -> new Statement.Check(target(m.get("target")), line);
            case "Uncheck" -> new Statement.Uncheck(target(m.get("target")), line);
            case "Hover" -> new Statement.Hover(target(m.get("target")), line);
            case "Press" -> new Statement.Press(str(m, "key"), line);
            case "Wait" -> new Statement.Wait(dbl(m, "duration", 1),
                    "milliseconds".equalsIgnoreCase(str(m, "unit")) ? Statement.WaitUnit.MILLISECONDS : Statement.WaitUnit.SECONDS, line);
            case "WaitFor" -> new Statement.WaitFor(target(m.get("target")), line);
            case "Return" -> new Statement.Return(enumValue(Statement.ReturnType.class, str(m, "returnType")),
                    target(m.get("target")), expr(m.get("expression")), line);
            case "Refresh" -> new Statement.Refresh(line);
            case "SwitchToNewTab" -> new Statement.SwitchToNewTab(expr(m.get("url")), line);
            case "SwitchToTab" -> new Statement.SwitchToTab(expr(m.get("tabIndex")), line);
            case "OpenInNewTab" -> new Statement.OpenInNewTab(expr(m.get("url")), line);
            case "CloseTab" -> new Statement.CloseTab(line);
            case "AcceptDialog" -> new Statement.AcceptDialog(expr(m.get("responseText")), line);
            case "DismissDialog" -> new Statement.DismissDialog(line);
            case "SwitchToFrame" -> new Statement.SwitchToFrame(selector(m.get("selector")), line);
            case "SwitchToMainFrame" -> new Statement.SwitchToMainFrame(line);
            case "Download" -> new Statement.Download(target(m.get("target")), expr(m.get("saveAs")), line);
            case "SetCookie" -> new Statement.SetCookie(expr(m.get("name")), expr(m.get("value")), line);
            case "ClearCookies" -> new Statement.ClearCookies(line);
            case "SetStorage" -> new Statement.SetStorage(expr(m.get("key")), expr(m.get("value")), line);
            case "GetStorage" -> new Statement.GetStorage(expr(m.get("key")), str(m, "variable"), line);
            case "ClearStorage" -> new Statement.ClearStorage(line);
            case "Scroll" -> new Statement.Scroll(enumValue(Statement.ScrollDirection.class, str(m, "direction")),
                    target(m.get("target")), line);
            case "WaitForNavigation" -> new Statement.WaitForNavigation(line);
            case "WaitForNetworkIdle" -> new Statement.WaitForNetworkIdle(line);
            case "WaitForUrl" -> new Statement.WaitForUrl(match(str(m, "condition")), expr(m.get("value")), line);
            case "Log" -> new Statement.Log(expr(m.get("message")), line);
            case "TakeScreenshot" -> new Statement.TakeScreenshot(target(m.get("target")), str(m, "filename"), line);
            case "Upload" -> new Statement.Upload(exprs(rawList(m, "files")), target(m.get("target")), line);
            case "Perform" -> new Statement.Perform(actionCall(asMap(m.get("action"))), line);
            case "PerformAssignment" -> new Statement.PerformAssignment(varType(str(m, "varType")), str(m, "variableName"),
                    actionCall(asMap(m.get("action"))), line);
            case "Verify" -> verify(m, line);
            case "VerifyUrl" -> new Statement.VerifyUrl(match(str(m, "condition")), expr(m.get("value")), line);
            case "VerifyTitle" -> new Statement.VerifyTitle(match(str(m, "condition")), expr(m.get("value")), line);
            case "VerifyHas" -> new Statement.VerifyHas(target(m.get("target")), hasCondition(asMap(m.get("hasCondition"))), line);
            case "VerifyScreenshot" -> new Statement.VerifyScreenshot(target(m.get("target")), str(m, "name"),
                    screenshotOptions(asMap(m.get("options"))), line);
            case "VerifyVariable" -> verifyVariable(m, line);
            case "VerifyResponse" -> verifyResponse(m, line);
            case "ApiRequest" -> new Statement.ApiRequest(enumValue(Statement.HttpMethod.class, str(m, "method")),
                    expr(m.get("url")), expr(m.get("body")), expr(m.get("headers")), line);
            case "MockApi" -> new Statement.MockApi(expr(m.get("url")), (int) dbl(m, "status", 200), expr(m.get("body")), line);
            case "Load" -> load(m, line);
            case "ForEach" -> new Statement.ForEach(str(m, "itemVariable"), str(m, "collectionVariable"),
                    statements(m, "statements"), line);
            case "IfElse" -> new Statement.IfElse(booleanCondition(asMap(m.get("condition"))), statements(m, "ifStatements"),
                    statements(m, "elseStatements"), line);
            case "Repeat" -> new Statement.Repeat(expr(m.get("count")), statements(m, "statements"), line);
            case "TryCatch" -> new Statement.TryCatch(statements(m, "tryStatements"), statements(m, "catchStatements"), line);
            case "Row" -> new Statement.Row(str(m, "variableName"), enumValue(Statement.RowModifier.class, str(m, "modifier")),
                    tableReference(asMap(m.get("tableRef"))), condition(m.get("where")), orderBy(m), line);
            case "Rows" -> new Statement.Rows(str(m, "variableName"), tableReference(asMap(m.get("tableRef"))),
                    condition(m.get("where")), orderBy(m), integer(m, "limit"), integer(m, "offset"), line);
            case "ColumnAccess" -> new Statement.ColumnAccess(str(m, "variableName"), bool(m, "distinct"),
                    tableReference(asMap(m.get("tableRef"))), str(m, "column"), condition(m.get("where")), line);
            case "Count" -> new Statement.Count(str(m, "variableName"), tableReference(asMap(m.get("tableRef"))),
                    condition(m.get("where")), line);
            case "DataQuery" -> new Statement.DataQuery(enumValue(Statement.ResultType.class, str(m, "resultType")),
                    str(m, "variableName"), query(asMap(m.get("query"))), line);
            case "UtilityAssignment" -> new Statement.UtilityAssignment(varType(str(m, "varType")), str(m, "variableName"),
                    expr(m.get("expression")), line);
            default -> {
                logger.debug("unsupported statement type '{}' at line {}", type, line);
                yield new Statement.Unsupported(type, line);
            }
        };
    }

    private static Statement drag(Map<String, Object> m, int line) {
        Map<String, Object> destination = asMap(m.get("destination"));
        if ("Coordinate".equals(str(destination, "type"))) {
            return new Statement.Drag(target(m.get("source")), null, integer(destination, "x"), integer(destination, "y"), line);
        }
        return new Statement.Drag(target(m.get("source")), target(m.get("destination")), null, null, line);
    }

    private static Statement verify(Map<String, Object> m, int line) {
        Map<String, Object> c = asMap(m.get("condition"));
        VerifyCondition.Operator operator = enumValue(VerifyCondition.Operator.class, str(c, "operator"));
        Object value = c.get("value");
        VerifyCondition condition;
        VerifyCondition.State state = value instanceof String s ? enumValue(VerifyCondition.State.class, s) : null;
        if (state != null) {
            condition = new VerifyCondition(operator, state, null);
        } else {
            condition = new VerifyCondition(operator, null, expr(value));
        }
        Object target = m.get("target");
        if (target instanceof Map<?, ?> t && t.containsKey("type") && !"Target".equals(t.get("type"))) {
            return new Statement.Verify(null, expr(target), condition, line);
        }
        return new Statement.Verify(target(target), null, condition, line);
    }

    private static Statement verifyVariable(Map<String, Object> m, int line) {
        Map<String, Object> c = asMap(m.get("condition"));
        VariableCondition.Kind kind = switch (String.valueOf(c.get("type"))) {
            case "IsTrue" -> VariableCondition.Kind.IS_TRUE;
            case "IsFalse" -> VariableCondition.Kind.IS_FALSE;
            case "IsNotTrue" -> VariableCondition.Kind.IS_NOT_TRUE;
            case "IsNotFalse" -> VariableCondition.Kind.IS_NOT_FALSE;
            case "Contains" -> VariableCondition.Kind.CONTAINS;
            case "NotContains" -> VariableCondition.Kind.NOT_CONTAINS;
            case "NotEquals" -> VariableCondition.Kind.NOT_EQUALS;
            default -> VariableCondition.Kind.EQUALS;
        };
        Map<String, Object> variable = asMap(m.get("variable"));
        Expression.VariableReference ref = new Expression.VariableReference(str(variable, "page"), str(variable, "name"));
        return new Statement.VerifyVariable(ref, new VariableCondition(kind, expr(c.get("value"))), line);
    }

    private static Statement verifyResponse(Map<String, Object> m, int line) {
        Map<String, Object> c = asMap(m.get("condition"));
        ResponseCondition.Operator operator = switch (String.valueOf(c.get("operator"))) {
            case "contains" -> ResponseCondition.Operator.CONTAINS;
            case "!=" -> ResponseCondition.Operator.NOT_EQUALS;
            case ">" -> ResponseCondition.Operator.GREATER_THAN;
            case "<" -> ResponseCondition.Operator.LESS_THAN;
            case ">=" -> ResponseCondition.Operator.GREATER_OR_EQUAL;
            case "<=" -> ResponseCondition.Operator.LESS_OR_EQUAL;
            default -> ResponseCondition.Operator.EQUALS;
        };
        ResponseCondition.Subject subject = enumValue(ResponseCondition.Subject.class, str(c, "type"));
        return new Statement.VerifyResponse(new ResponseCondition(subject == null ? ResponseCondition.Subject.STATUS : subject,
                operator, expr(c.get("value"))), line);
    }

    private static Statement load(Map<String, Object> m, int line) {
        Map<String, Object> w = asMap(m.get("whereClause"));
        LoadFilter filter = w.isEmpty() ? null : new LoadFilter(str(w, "field"), str(w, "operator"), expr(w.get("value")));
        return new Statement.Load(str(m, "variable"), str(m, "tableName"), str(m, "projectName"), filter, line);
    }

    static ActionCall actionCall(Map<String, Object> m) {
        return new ActionCall(str(m, "page"), str(m, "action"), exprs(rawList(m, "arguments")));
    }

    static HasCondition hasCondition(Map<String, Object> m) {
        String type = String.valueOf(m.get("type"));
        HasCondition.Kind kind = switch (type) {
            case "HasCount" -> HasCondition.Kind.COUNT;
            case "HasValue" -> HasCondition.Kind.VALUE;
            case "HasAttribute" -> HasCondition.Kind.ATTRIBUTE;
            case "ContainsText" -> HasCondition.Kind.CONTAINS_TEXT;
            case "HasClass" -> HasCondition.Kind.CLASS;
            default -> HasCondition.Kind.TEXT;
        };
        Object value = kind == HasCondition.Kind.COUNT ? m.get("count")
                : kind == HasCondition.Kind.CLASS ? m.get("className") : m.get("value");
        return new HasCondition(kind, expr(m.get("attribute")), expr(value));
    }

    static ScreenshotOptions screenshotOptions(Map<String, Object> m) {
        if (m.isEmpty()) {
            return null;
        }
        Object threshold = m.get("threshold");
        Object ratio = m.get("maxDiffPixelRatio");
        return new ScreenshotOptions(enumValue(ScreenshotOptions.Preset.class, str(m, "preset")),
                threshold instanceof Number n ? n.doubleValue() : null, integer(m, "maxDiffPixels"),
                ratio instanceof Number n ? n.doubleValue() : null);
    }

    static BooleanCondition booleanCondition(Map<String, Object> m) {
        if ("VariableTruthy".equals(m.get("type"))) {
            return new BooleanCondition.VariableTruthy(str(m, "variableName"));
        }
        BooleanCondition.State state = enumValue(BooleanCondition.State.class, str(m, "state"));
        return new BooleanCondition.ElementState(target(m.get("target")), state == null ? BooleanCondition.State.VISIBLE : state,
                bool(m, "negated"));
    }

    // ========== Data ==========

    static TableReference tableReference(Map<String, Object> m) {
        return new TableReference(str(m, "tableName"), str(m, "projectName"), str(m, "column"), integer(m, "rowIndex"),
                integer(m, "rangeStart"), integer(m, "rangeEnd"), integer(m, "cellRow"), integer(m, "cellCol"));
    }

    static List<OrderBy> orderBy(Map<String, Object> m) {
        return list(m, "orderBy", o -> new OrderBy(str(o, "column"), enumValue(OrderBy.Direction.class, str(o, "direction"))));
    }

    static Query query(Map<String, Object> m) {
        TableReference table = tableReference(asMap(m.get("tableRef")));
        if ("AggregationQuery".equals(m.get("type"))) {
            return new Query.AggregationQuery(enumValue(Query.Function.class, str(m, "function")), table, str(m, "column"),
                    bool(m, "distinct"), condition(m.get("where")));
        }
        return new Query.TableQuery(enumValue(Query.Position.class, str(m, "position")), table, strings(m, "columns"),
                condition(m.get("where")), orderBy(m), integer(m, "limit"), integer(m, "offset"), expr(m.get("defaultValue")));
    }

    static DataCondition condition(Object raw) {
        if (!(raw instanceof Map)) {
            return null;
        }
        Map<String, Object> m = asMap(raw);
        return switch (String.valueOf(m.get("type"))) {
            case "And" -> new DataCondition.And(condition(m.get("left")), condition(m.get("right")));
            case "Or" -> new DataCondition.Or(condition(m.get("left")), condition(m.get("right")));
            case "Not" -> new DataCondition.Not(condition(m.get("condition")));
            default -> new DataCondition.Comparison(str(m, "column"), ComparisonOperator.fromSymbol(str(m, "operator")),
                    expr(m.get("value")), exprs(rawList(m, "values")));
        };
    }

    // ========== Targets and selectors ==========

    static Target target(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof String s) {
            return new Target.Text(s);
        }
        Map<String, Object> m = asMap(raw);
        if (m.get("field") != null) {
            return new Target.Field(str(m, "page"), str(m, "field"));
        }
        if (m.get("selector") != null) {
            return new Target.Locator(selector(m.get("selector")));
        }
        return new Target.Text(str(m, "text"));
    }

    static Selector selector(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof String s) {
            return Selector.auto(s);
        }
        Map<String, Object> m = asMap(raw);
        Selector.Kind kind = enumValue(Selector.Kind.class, str(m, "selectorType"));
        List<SelectorModifier> modifiers = list(m, "modifiers", AstReader::modifier);
        modifiers.removeIf(java.util.Objects::isNull);
        return new Selector(kind, str(m, "value"), str(m, "nameParam"), modifiers);
    }

    static SelectorModifier modifier(Map<String, Object> m) {
        return switch (String.valueOf(m.get("type"))) {
            case "first" -> new SelectorModifier.First();
            case "last" -> new SelectorModifier.Last();
            case "nth" -> new SelectorModifier.Nth((int) dbl(m, "index", 0));
            case "withText" -> new SelectorModifier.WithText(str(m, "text"));
            case "withoutText" -> new SelectorModifier.WithoutText(str(m, "text"));
            case "has" -> new SelectorModifier.Has(selector(m.get("selector")));
            case "hasNot" -> new SelectorModifier.HasNot(selector(m.get("selector")));
            default -> {
                logger.debug("ignoring unknown selector modifier: {}", m.get("type"));
                yield null;
            }
        };
    }

    // ========== Expressions ==========

    static List<Expression> exprs(List<Object> raw) {
        List<Expression> list = new ArrayList<>(raw.size());
        for (Object o : raw) {
            list.add(expr(o));
        }
        return list;
    }

    static Expression expr(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof String s) {
            return new Expression.StringLiteral(s);
        }
        if (raw instanceof Number n) {
            return new Expression.NumberLiteral(n.doubleValue());
        }
        if (raw instanceof Boolean b) {
            return new Expression.BooleanLiteral(b);
        }
        Map<String, Object> m = asMap(raw);
        String type = String.valueOf(m.get("type"));
        return switch (type) {
            case "StringLiteral" -> new Expression.StringLiteral(str(m, "value"));
            case "NumberLiteral" -> new Expression.NumberLiteral(dbl(m, "value", 0));
            case "BooleanLiteral" -> new Expression.BooleanLiteral(bool(m, "value"));
            case "VariableReference" -> new Expression.VariableReference(str(m, "page"), str(m, "name"));
            case "EnvVarReference" -> new Expression.EnvVarReference(str(m, "name"));
            case "Trim" -> new Expression.Trim(expr(m.get("value")));
            case "Convert" -> new Expression.Convert(enumValue(Expression.ConvertType.class, str(m, "targetType")), expr(m.get("value")));
            case "Extract" -> new Expression.Extract(expr(m.get("value")), expr(m.get("start")), expr(m.get("end")));
            case "Replace" -> new Expression.Replace(expr(m.get("value")), expr(m.get("search")), expr(m.get("replacement")));
            case "Split" -> new Expression.Split(expr(m.get("value")), expr(m.get("delimiter")));
            case "Join" -> new Expression.Join(expr(m.get("value")), expr(m.get("delimiter")));
            case "Length" -> new Expression.Length(expr(m.get("value")));
            case "Pad" -> new Expression.Pad(expr(m.get("value")), expr(m.get("length")), expr(m.get("padChar")));
            case "Today" -> new Expression.Today();
            case "Now" -> new Expression.Now();
            case "AddDate" -> new Expression.AddDate(expr(m.get("amount")), dateUnit(str(m, "unit")), expr(m.get("date")));
            case "SubtractDate" -> new Expression.SubtractDate(expr(m.get("amount")), dateUnit(str(m, "unit")), expr(m.get("date")));
            case "Format" -> new Expression.Format(expr(m.get("value")), formatType(str(m, "formatType")), str(m, "pattern"),
                    str(m, "currency"));
            case "DatePart" -> new Expression.DatePart(enumValue(Expression.DatePartType.class, str(m, "part")), expr(m.get("date")));
            case "Round" -> new Expression.Round(expr(m.get("value")), roundDecimals(m.get("decimals")),
                    enumValue(Expression.RoundDirection.class, str(m, "direction")));
            case "Absolute" -> new Expression.Absolute(expr(m.get("value")));
            case "Generate" -> new Expression.Generate(str(m, "pattern"));
            case "RandomNumber" -> new Expression.RandomNumber(expr(m.get("min")), expr(m.get("max")));
            case "Chained" -> new Expression.Chained(expr(m.get("first")), expr(m.get("second")));
            default -> {
                logger.debug("unknown expression type: {}", type);
                yield null;
            }
        };
    }

    private static Integer roundDecimals(Object raw) {
        if (raw instanceof Number n) {
            return n.intValue();
        }
        if (raw instanceof Map<?, ?> m && m.get("value") instanceof Number n) {
            return n.intValue();
        }
        return null;
    }

    private static Expression.DateUnit dateUnit(String unit) {
        if (unit == null) {
            return Expression.DateUnit.DAY;
        }
        String u = unit.toUpperCase(Locale.ROOT);
        return u.startsWith("MONTH") ? Expression.DateUnit.MONTH : u.startsWith("YEAR") ? Expression.DateUnit.YEAR : Expression.DateUnit.DAY;
    }

    private static Expression.FormatType formatType(String type) {
        if ("currency".equalsIgnoreCase(type)) {
            return Expression.FormatType.CURRENCY;
        }
        if ("percent".equalsIgnoreCase(type)) {
            return Expression.FormatType.PERCENT;
        }
        return Expression.FormatType.DATE;
    }

    private static Statement.Match match(String condition) {
        Statement.Match match = enumValue(Statement.Match.class, condition);
        return match == null ? Statement.Match.CONTAINS : match;
    }

    private static VarType varType(String name) {
        return enumValue(VarType.class, name);
    }

    // ========== Raw access ==========

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object o) {
        return o instanceof Map ? (Map<String, Object>) o : Map.of();
    }

    @SuppressWarnings("unchecked")
    static List<Object> rawList(Map<String, Object> map, String key) {
        Object o = map.get(key);
        return o instanceof List ? (List<Object>) o : List.of();
    }

    static <T> List<T> list(Map<String, Object> map, String key, Function<Map<String, Object>, T> fn) {
        List<T> list = new ArrayList<>();
        for (Object o : rawList(map, key)) {
            list.add(fn.apply(asMap(o)));
        }
        return list;
    }

    static List<String> strings(Map<String, Object> map, String key) {
        List<String> list = new ArrayList<>();
        for (Object o : rawList(map, key)) {
            list.add(String.valueOf(o));
        }
        return list;
    }

    static String str(Map<String, Object> map, String key) {
        Object o = map.get(key);
        return o == null ? null : o.toString();
    }

    static boolean bool(Map<String, Object> map, String key) {
        Object o = map.get(key);
        return o instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(o));
    }

    static double dbl(Map<String, Object> map, String key, double defaultValue) {
        Object o = map.get(key);
        if (o instanceof Number n) {
            return n.doubleValue();
        }
        if (o instanceof Map<?, ?> m && m.get("value") instanceof Number n) {
            return n.doubleValue();
        }
        return defaultValue;
    }

    static Integer integer(Map<String, Object> map, String key) {
        Object o = map.get(key);
        if (o instanceof Number n) {
            return n.intValue();
        }
        if (o instanceof Map<?, ?> m && m.get("value") instanceof Number n) {
            return n.intValue();
        }
        return null;
    }

    static int line(Map<String, Object> map) {
        Object o = map.get("line");
        return o instanceof Number n ? n.intValue() : 0;
    }

    static <E extends Enum<E>> E enumValue(Class<E> type, String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (E e : type.getEnumConstants()) {
            if (e.name().equals(normalized)) {
                return e;
            }
        }
        return null;
    }

    static <E extends Enum<E>> Set<E> enumSet(Class<E> type, List<Object> names) {
        Set<E> set = EnumSet.noneOf(type);
        for (Object o : names) {
            E e = enumValue(type, String.valueOf(o));
            if (e != null) {
                set.add(e);
            }
        }
        return set;
    }

}
