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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AstReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testReadPage() {
        Program program = AstReader.parse("""
            {
              "pages": [{
                "name": "LoginPage", "line": 1,
                "fields": [
                  { "name": "email", "selector": { "selectorType": "label", "value": "Email" } },
                  { "name": "submit", "selector": { "selectorType": "button", "value": "Sign in",
                    "modifiers": [{ "type": "first" }, { "type": "nth", "index": 2 }] } }
                ],
                "variables": [{ "name": "baseUrl", "varType": "TEXT", "value": "https://example.com" }],
                "actions": [{
                  "name": "login", "parameters": ["user", { "name": "password" }], "returnType": "FLAG",
                  "statements": [{ "type": "Fill", "line": 5, "target": { "field": "email" }, "value": { "type": "VariableReference", "name": "user" } }]
                }]
              }]
            }
            """);
        Page page = program.findPage("LoginPage");
        assertNotNull(page);
        assertEquals(2, page.fields().size());
        Selector submit = page.fields().get(1).selector();
        assertEquals(Selector.Kind.BUTTON, submit.kind());
        assertEquals(List.of(new SelectorModifier.First(), new SelectorModifier.Nth(2)), submit.modifiers());
        assertEquals(VarType.TEXT, page.variables().get(0).type());
        ActionDefinition login = page.actions().get(0);
        assertEquals(List.of("user", "password"), login.parameters());
        assertEquals(VarType.FLAG, login.returnType());
        Statement.Fill fill = (Statement.Fill) login.statements().get(0);
        assertEquals(new Target.Field(null, "email"), fill.target());
        assertEquals(new Expression.VariableReference(null, "user"), fill.value());
        assertEquals(5, fill.line());
    }

    @Test
    void testReadFeature() {
        Program program = AstReader.parse("""
            {
              "features": [{
                "name": "Login", "annotations": ["serial"], "uses": ["LoginPage"],
                "fixtures": [{ "fixtureName": "auth", "options": [{ "name": "role", "value": "admin" }] }],
                "hooks": [{ "hookType": "BEFORE_EACH", "statements": [{ "type": "Open", "url": "/login" }] }],
                "scenarios": [{
                  "name": "valid login", "tags": ["@smoke", "regression"], "annotations": ["slow"],
                  "statements": [
                    { "type": "Click", "target": { "page": "LoginPage", "field": "submit" } },
                    { "type": "Wait", "duration": 500, "unit": "milliseconds" },
                    { "type": "Verify", "target": { "text": "Welcome" }, "condition": { "operator": "IS", "value": "VISIBLE" } }
                  ]
                }]
              }]
            }
            """);
        Feature feature = program.features().get(0);
        assertEquals(Set.of(Feature.Annotation.SERIAL), feature.annotations());
        assertEquals(List.of("LoginPage"), feature.uses());
        assertEquals("auth", feature.fixtures().get(0).fixtureName());
        assertEquals(new Expression.StringLiteral("admin"), feature.fixtures().get(0).options().get("role"));
        assertEquals(Feature.Hook.Type.BEFORE_EACH, feature.hooks().get(0).type());
        Scenario scenario = feature.scenarios().get(0);
        assertEquals(List.of("smoke", "regression"), scenario.tags());
        assertEquals(Set.of(Scenario.Annotation.SLOW), scenario.annotations());
        Statement.Wait wait = (Statement.Wait) scenario.statements().get(1);
        assertEquals(Statement.WaitUnit.MILLISECONDS, wait.unit());
        assertEquals(500, wait.duration());
        Statement.Verify verify = (Statement.Verify) scenario.statements().get(2);
        assertEquals(new Target.Text("Welcome"), verify.target());
        assertEquals(VerifyCondition.is(VerifyCondition.State.VISIBLE), verify.condition());
    }

    @Test
    void testUnknownStatementBecomesUnsupported() {
        Program program = AstReader.parse("""
            { "features": [{ "name": "F", "scenarios": [{ "name": "S", "statements": [
                { "type": "Teleport", "line": 7 },
                { "line": 8 }
            ] }] }] }
            """);
        List<Statement> statements = program.features().get(0).scenarios().get(0).statements();
        assertEquals(new Statement.Unsupported("Teleport", 7), statements.get(0));
        assertEquals(new Statement.Unsupported("<missing>", 8), statements.get(1));
    }

    @Test
    void testReadWhereAndQuery() {
        Program program = AstReader.parse("""
            { "features": [{ "name": "F", "scenarios": [{ "name": "S", "statements": [
                { "type": "Row", "variableName": "user", "modifier": "FIRST", "tableRef": { "tableName": "Users", "projectName": "Crm" },
                  "where": { "type": "And",
                    "left": { "type": "Comparison", "column": "age", "operator": ">=", "value": 18 },
                    "right": { "type": "Not", "condition": { "type": "Comparison", "column": "state", "operator": "==", "value": "TX" } } },
                  "orderBy": [{ "column": "age", "direction": "DESC" }] },
                { "type": "DataQuery", "resultType": "NUMBER", "variableName": "total",
                  "query": { "type": "AggregationQuery", "function": "SUM", "column": "amount", "tableRef": { "tableName": "Orders" } } }
            ] }] }] }
            """);
        List<Statement> statements = program.features().get(0).scenarios().get(0).statements();
        Statement.Row row = (Statement.Row) statements.get(0);
        assertEquals("Crm.Users", row.table().qualifiedName());
        DataCondition expected = new DataCondition.And(
                DataCondition.Comparison.of("age", ComparisonOperator.GTE, new Expression.NumberLiteral(18)),
                new DataCondition.Not(DataCondition.Comparison.of("state", ComparisonOperator.EQ, new Expression.StringLiteral("TX"))));
        assertEquals(expected, row.where());
        assertEquals(List.of(new OrderBy("age", OrderBy.Direction.DESC)), row.orderBy());
        Statement.DataQuery query = (Statement.DataQuery) statements.get(1);
        Query.AggregationQuery aggregation = (Query.AggregationQuery) query.query();
        assertEquals(Query.Function.SUM, aggregation.function());
        assertEquals("Orders", aggregation.table().tableName());
    }

    @Test
    void testReadChainedUtility() {
        Program program = AstReader.parse("""
            { "features": [{ "name": "F", "scenarios": [{ "name": "S", "statements": [
                { "type": "UtilityAssignment", "varType": "TEXT", "variableName": "code",
                  "expression": { "type": "Chained",
                    "first": { "type": "Trim", "value": "  abc " },
                    "second": { "type": "Convert", "targetType": "UPPERCASE" } } }
            ] }] }] }
            """);
        Statement.UtilityAssignment assignment =
                (Statement.UtilityAssignment) program.features().get(0).scenarios().get(0).statements().get(0);
        Expression.Chained chained = (Expression.Chained) assignment.expression();
        assertEquals(new Expression.Trim(new Expression.StringLiteral("  abc ")), chained.first());
        assertEquals(new Expression.Convert(Expression.ConvertType.UPPERCASE, null), chained.second());
    }

    @Test
    void testReadFixture() {
        Program program = AstReader.parse("""
            { "fixtures": [{ "name": "auth", "scope": "worker", "auto": true, "dependencies": ["db"],
                "options": [{ "name": "role", "defaultValue": "user" }],
                "setup": [{ "type": "Open", "url": "/login" }], "teardown": [{ "type": "ClearCookies" }] }] }
            """);
        Fixture fixture = program.fixtures().get(0);
        assertEquals(Fixture.Scope.WORKER, fixture.scope());
        assertTrue(fixture.auto());
        assertEquals(List.of("db"), fixture.dependencies());
        assertEquals("role", fixture.options().get(0).name());
        assertInstanceOf(Statement.ClearCookies.class, fixture.teardown().get(0));
    }

    @Test
    void testLoadFromFile() throws Exception {
        Path file = tempDir.resolve("ast.json");
        Files.writeString(file, "{ \"pages\": [{ \"name\": \"Home\" }] }");
        Program program = AstReader.load(file);
        assertEquals("Home", program.pages().get(0).name());
    }

    @Test
    void testInvalidInput() {
        Exception e = assertThrows(RuntimeException.class, () -> AstReader.parse("[1, 2]"));
        assertTrue(e.getMessage().contains("expected JSON object"));
        assertThrows(RuntimeException.class, () -> AstReader.load(tempDir.resolve("missing.json")));
    }

}
