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
import io.vero.ast.OrderBy;
import io.vero.ast.Query;
import io.vero.ast.Statement;
import io.vero.ast.TableReference;
import io.vero.compiler.Scope;
import io.vero.compiler.expr.ExpressionCompiler;
import io.vero.compiler.scan.ScenarioCapabilities;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DataQueryCompilerTest {

    static final Scope SCOPE = Scope.scenario(Map.of(), List.of(), ScenarioCapabilities.NONE);

    final DataQueryCompiler compiler;

    DataQueryCompilerTest() {
        ExpressionCompiler expressions = new ExpressionCompiler();
        compiler = new DataQueryCompiler(new ConditionCompiler(expressions), expressions);
    }

    private static Query.TableQuery query(Query.Position position, TableReference table, List<String> columns,
                                          DataCondition where, List<OrderBy> orderBy, Integer limit, Integer offset,
                                          Expression defaultValue) {
        return new Query.TableQuery(position, table, columns, where, orderBy, limit, offset, defaultValue);
    }

    @Test
    void testDataResultExecutes() {
        DataCondition where = DataCondition.Comparison.of("status", ComparisonOperator.EQ, new Expression.StringLiteral("active"));
        Query q = query(null, TableReference.of("Users"), List.of(), where,
                List.of(new OrderBy("name", OrderBy.Direction.ASC)), 10, 5, null);
        Statement.DataQuery s = new Statement.DataQuery(Statement.ResultType.DATA, "users", q, 1);
        assertEquals(List.of("const users = await dataManager.query('Users').where((row) => row['status'] === 'active')"
                + ".orderBy([{ column: 'name', direction: 'ASC' }]).offset(5).limit(10).execute();"), compiler.compile(s, SCOPE));
    }

    @Test
    void testScalarResultTakesFirst() {
        Query q = query(null, TableReference.of("Users"), List.of("email"), null, List.of(), null, null, null);
        assertEquals("await dataManager.query('Users').select('email').first()",
                compiler.expression(q, Statement.ResultType.TEXT, SCOPE));
    }

    @Test
    void testListResultExecutes() {
        Query q = query(null, TableReference.of("Users"), List.of("email", "name"), null, List.of(), null, null, null);
        assertEquals("await dataManager.query('Users').select(['email', 'name']).execute()",
                compiler.expression(q, Statement.ResultType.LIST, SCOPE));
    }

    @Test
    void testPositionAndDefault() {
        Query q = query(Query.Position.LAST, TableReference.of("Shop", "Orders"), List.of("total"), null, List.of(), null, null,
                new Expression.NumberLiteral(0));
        assertEquals("(await dataManager.query('Shop.Orders').select('total').last()) ?? 0",
                compiler.expression(q, Statement.ResultType.NUMBER, SCOPE));
    }

    @Test
    void testCellRangeAndRowIndex() {
        TableReference cell = new TableReference("Grid", null, null, null, null, null, 2, 3);
        assertEquals("await dataManager.query('Grid').cell(2, 3)",
                compiler.expression(query(null, cell, List.of(), null, List.of(), null, null, null), Statement.ResultType.TEXT, SCOPE));
        TableReference range = new TableReference("Grid", null, null, null, 1, 4, null, null);
        assertEquals("await dataManager.query('Grid').range(1, 4).execute()",
                compiler.expression(query(null, range, List.of(), null, List.of(), null, null, null), Statement.ResultType.DATA, SCOPE));
        TableReference row = new TableReference("Grid", null, "name", 2, null, null, null, null);
        assertEquals("await dataManager.query('Grid').select('name').row(2).first()",
                compiler.expression(query(null, row, List.of(), null, List.of(), null, null, null), Statement.ResultType.TEXT, SCOPE));
    }

    @Test
    void testAggregations() {
        TableReference orders = TableReference.of("Orders");
        assertEquals("await dataManager.query('Orders').count()",
                compiler.expression(new Query.AggregationQuery(null, orders, null, false, null), Statement.ResultType.NUMBER, SCOPE));
        assertEquals("await dataManager.query('Orders').countDistinct('customer')",
                compiler.expression(new Query.AggregationQuery(Query.Function.COUNT, orders, "customer", true, null),
                        Statement.ResultType.NUMBER, SCOPE));
        DataCondition paid = DataCondition.Comparison.of("paid", ComparisonOperator.EQ, new Expression.BooleanLiteral(true));
        assertEquals("await dataManager.query('Orders').where((row) => row['paid'] === true).sum('total')",
                compiler.expression(new Query.AggregationQuery(Query.Function.SUM, orders, "total", false, paid),
                        Statement.ResultType.NUMBER, SCOPE));
        assertEquals("await dataManager.query('Orders').headers()",
                compiler.expression(new Query.AggregationQuery(Query.Function.HEADERS, orders, null, false, null),
                        Statement.ResultType.LIST, SCOPE));
    }

    @Test
    void testMissingTable() {
        assertEquals("null", compiler.expression(null, Statement.ResultType.DATA, SCOPE));
    }

}
