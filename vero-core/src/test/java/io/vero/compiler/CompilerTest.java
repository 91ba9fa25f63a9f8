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
package io.vero.compiler;

import io.vero.ast.AstReader;
import io.vero.ast.Program;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompilerTest {

    static final String PROGRAM = """
            {
              "pages": [{ "name": "LoginPage", "fields": [{ "name": "email", "selector": "#email" }],
                "actions": [{ "name": "login", "parameters": ["user"], "statements": [
                  { "type": "Fill", "target": { "field": "email" }, "value": { "type": "VariableReference", "name": "user" } }
                ] }] }],
              "pageActions": [{ "name": "LoginActions", "forPage": "LoginPage", "actions": [] }],
              "fixtures": [{ "name": "auth" }],
              "features": [{ "name": "user login", "uses": ["LoginPage", "LoginActions"],
                "fixtures": [{ "fixtureName": "auth" }],
                "scenarios": [{ "name": "nested data", "statements": [
                  { "type": "Repeat", "count": 2, "statements": [
                    { "type": "TryCatch", "tryStatements": [
                      { "type": "Count", "variableName": "n", "tableRef": { "tableName": "Users" } }
                    ], "catchStatements": [
                      { "type": "Row", "variableName": "item", "tableRef": { "tableName": "Items", "projectName": "Shop" } }
                    ] }
                  ] },
                  { "type": "DataQuery", "resultType": "DATA", "variableName": "orders",
                    "query": { "type": "TableQuery", "tableRef": { "tableName": "Orders" } } },
                  { "type": "Perform", "action": { "page": "LoginPage", "action": "login", "arguments": ["bob"] } },
                  { "type": "Click", "target": { "field": "submit", "page": "LoginPage" }, "line": 9 }
                ] }] }]
            }
            """;

    @Test
    void testCompileProgram() {
        Program program = AstReader.parse(PROGRAM);
        CompileResult result = new Compiler().compile(program);
        assertEquals(List.of("LoginPage"), List.copyOf(result.getPages().keySet()));
        assertEquals(List.of("LoginActions"), List.copyOf(result.getPageActions().keySet()));
        assertEquals(List.of("auth"), List.copyOf(result.getFixtures().keySet()));
        assertEquals(List.of("user login"), List.copyOf(result.getFeatures().keySet()));
        assertNotNull(result.getFixtureIndex());
        assertEquals(5, result.getUnitCount());
        String feature = result.getFeatures().get("user login");
        assertTrue(feature.contains("await dataManager.preloadTables(['Orders', 'Shop.Items', 'Users']);"), feature);
        assertTrue(feature.contains("import { LoginActions } from '../pageActions/LoginActions';"), feature);
        assertTrue(feature.contains("await loginPage.login('bob');"), feature);
    }

    @Test
    void testWarningsAggregated() {
        CompileResult result = new Compiler().compile(AstReader.parse(PROGRAM));
        assertTrue(result.hasWarnings());
        // the validator reports the unknown field
        CompileWarning field = result.getWarnings().stream()
                .filter(w -> w.code().equals(CompileWarning.UNKNOWN_FIELD)).findFirst().orElseThrow();
        assertEquals("user login", field.unit());
        assertEquals(9, field.line());
        assertEquals("VERO2003 user login:9 unknown field 'LoginPage.submit'", field.toString());
    }

    @Test
    void testDeterministic() {
        Compiler compiler = new Compiler(CompileOptions.builder().debug(true).build());
        CompileResult first = compiler.compile(AstReader.parse(PROGRAM));
        CompileResult second = compiler.compile(AstReader.parse(PROGRAM));
        assertEquals(first.getPages(), second.getPages());
        assertEquals(first.getPageActions(), second.getPageActions());
        assertEquals(first.getFixtures(), second.getFixtures());
        assertEquals(first.getFeatures(), second.getFeatures());
        assertEquals(first.getFixtureIndex(), second.getFixtureIndex());
        assertEquals(first.getWarnings(), second.getWarnings());
    }

    @Test
    void testEmptyProgram() {
        CompileResult result = new Compiler().compile(AstReader.parse("{}"));
        assertEquals(0, result.getUnitCount());
        assertNull(result.getFixtureIndex());
        assertFalse(result.hasWarnings());
    }

}
