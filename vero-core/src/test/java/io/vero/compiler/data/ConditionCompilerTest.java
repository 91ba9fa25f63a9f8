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
package io.vero.compiler.data;

import io.vero.ast.ComparisonOperator;
import io.vero.ast.DataCondition;
import io.vero.ast.Expression;
import io.vero.compiler.Scope;
import io.vero.compiler.expr.ExpressionCompiler;
import io.vero.compiler.scan.ScenarioCapabilities;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConditionCompilerTest {

    static final Scope SCOPE = Scope.scenario(Map.of(), List.of(), ScenarioCapabilities.NONE);

    final ConditionCompiler compiler = new ConditionCompiler(new ExpressionCompiler());

    private static DataCondition cmp(String column, ComparisonOperator op, Expression value) {
        return DataCondition.Comparison.of(column, op, value);
    }

    private static Expression str(String value) {
        return new Expression.StringLiteral(value);
    }

    private String compile(DataCondition condition) {
        return compiler.compile(condition, "row", SCOPE);
    }

    @Test
    void testAndOverOr() {
        DataCondition where = DataCondition.and(
                cmp("age", ComparisonOperator.GTE, new Expression.NumberLiteral(18)),
                DataCondition.or(cmp("state", ComparisonOperator.EQ, str("CA")), cmp("state", ComparisonOperator.EQ, str("NY"))));
        assertEquals("(row['age'] >= 18 && (row['state'] === 'CA' || row['state'] === 'NY'))", compile(where));
    }

    @Test
    void testGroupingIsKeptAsWritten() {
        DataCondition a = cmp("a", ComparisonOperator.EQ, new Expression.NumberLiteral(1));
        DataCondition b = cmp("b", ComparisonOperator.EQ, new Expression.NumberLiteral(2));
        DataCondition c = cmp("c", ComparisonOperator.EQ, new Expression.NumberLiteral(3));
        assertEquals("((row['a'] === 1 || row['b'] === 2) && row['c'] === 3)",
                compile(DataCondition.and(DataCondition.or(a, b), c)));
        assertEquals("(row['a'] === 1 || (row['b'] === 2 && row['c'] === 3))",
                compile(DataCondition.or(a, DataCondition.and(b, c))));
    }

    @Test
    void testNot() {
        DataCondition where = new DataCondition.Not(cmp("active", ComparisonOperator.EQ, new Expression.BooleanLiteral(true)));
        assertEquals("!(row['active'] === true)", compile(where));
    }

    @Test
    void testTextOperators() {
        assertEquals("String(row['email'] ?? '').includes('@corp')",
                compile(cmp("email", ComparisonOperator.CONTAINS, str("@corp"))));
        assertEquals("String(row['name'] ?? '').startsWith('A')",
                compile(cmp("name", ComparisonOperator.STARTS_WITH, str("A"))));
        assertEquals("String(row['name'] ?? '').endsWith('z')",
                compile(cmp("name", ComparisonOperator.ENDS_WITH, str("z"))));
        assertEquals("new RegExp('^\\\\d+$').test(String(row['zip'] ?? ''))",
                compile(cmp("zip", ComparisonOperator.MATCHES, str("^\\d+$"))));
        assertEquals("row['status'] !== 'closed'", compile(cmp("status", ComparisonOperator.NE, str("closed"))));
    }

    @Test
    void testListOperators() {
        DataCondition in = new DataCondition.Comparison("state", ComparisonOperator.IN, null, List.of(str("CA"), str("NY")));
        assertEquals("['CA', 'NY'].includes(row['state'])", compile(in));
        DataCondition notIn = new DataCondition.Comparison("state", ComparisonOperator.NOT_IN, null, List.of(str("TX")));
        assertEquals("!['TX'].includes(row['state'])", compile(notIn));
    }

    @Test
    void testEmptinessOperators() {
        assertEquals("(row['note'] === null || row['note'] === undefined)", compile(cmp("note", ComparisonOperator.IS_NULL, null)));
        assertEquals("(row['note'] === null || row['note'] === undefined || row['note'] === '')",
                compile(cmp("note", ComparisonOperator.IS_EMPTY, null)));
        assertEquals("(row['note'] !== null && row['note'] !== undefined && row['note'] !== '')",
                compile(cmp("note", ComparisonOperator.IS_NOT_EMPTY, null)));
    }

    @Test
    void testValuesFromVariablesAndEnv() {
        assertEquals("row['region'] === __env__['REGION']",
                compile(cmp("region", ComparisonOperator.EQ, new Expression.EnvVarReference("REGION"))));
        assertEquals("row['min'] < limit",
                compile(cmp("min", ComparisonOperator.LT, new Expression.VariableReference(null, "limit"))));
    }

    @Test
    void testMissingOperatorIsAlwaysTrue() {
        assertEquals(ConditionCompiler.ALWAYS_TRUE, compile(cmp("x", null, str("y"))));
        assertEquals(ConditionCompiler.ALWAYS_TRUE, compile(null));
    }

    @Test
    void testPredicate() {
        assertEquals("(row) => row['age'] > 21",
                compiler.predicate(cmp("age", ComparisonOperator.GT, new Expression.NumberLiteral(21)), SCOPE));
    }

    @Test
    void testPureFunctionOfTree() {
        DataCondition where = DataCondition.or(cmp("a", ComparisonOperator.EQ, str("x")), cmp("b", ComparisonOperator.NE, str("y")));
        assertEquals(compile(where), compile(where));
    }

}
