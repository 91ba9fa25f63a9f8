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

import io.vero.ast.ActionCall;
import io.vero.ast.BooleanCondition;
import io.vero.ast.ComparisonOperator;
import io.vero.ast.DataCondition;
import io.vero.ast.Expression;
import io.vero.ast.Feature;
import io.vero.ast.Query;
import io.vero.ast.Scenario;
import io.vero.ast.Statement;
import io.vero.ast.TableReference;
import io.vero.ast.Target;
import io.vero.ast.VarType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceCollectorTest {

    @Test
    void testTablesFromEveryQueryStyle() {
        Statement row = new Statement.Row("user", Statement.RowModifier.FIRST, TableReference.of("Users"), null, List.of(), 1);
        Statement count = new Statement.Count("n", TableReference.of("Shop", "Orders"), null, 2);
        Statement query = new Statement.DataQuery(Statement.ResultType.DATA, "products",
                new Query.TableQuery(null, TableReference.of("Products"), List.of(), null, List.of(), null, null, null), 3);
        Statement load = new Statement.Load("rows", "Legacy", null, null, 4);
        Statement nested = new Statement.ForEach("p", "products", List.of(
                new Statement.IfElse(new BooleanCondition.VariableTruthy("p"),
                        List.of(new Statement.ColumnAccess("emails", false, TableReference.of("Contacts"), "email", null, 6)),
                        List.of(), 5)), 4);
        References refs = ReferenceCollector.collect(List.of(row, count, query, load, nested));
        assertEquals(List.of("Contacts", "Legacy", "Products", "Shop.Orders", "Users"), List.copyOf(refs.tables()));
        assertTrue(refs.usesTables());
    }

    @Test
    void testEnvUtilitiesAndPages() {
        Statement fill = new Statement.Fill(new Target.Field("LoginPage", "email"),
                new Expression.Trim(new Expression.EnvVarReference("USER")), 1);
        Statement perform = new Statement.Perform(new ActionCall("CheckoutActions", "pay", List.of()), 2);
        Statement assign = new Statement.UtilityAssignment(VarType.TEXT, "title",
                new Expression.VariableReference("HomePage", "heading"), 3);
        References refs = ReferenceCollector.collect(List.of(fill, perform, assign));
        assertTrue(refs.env());
        assertTrue(refs.utilities());
        assertFalse(refs.api());
        assertEquals(Set.of("LoginPage", "CheckoutActions", "HomePage"), refs.pages());
        assertFalse(refs.usesTables());
    }

    @Test
    void testWhereValuesAreScanned() {
        DataCondition where = DataCondition.and(
                DataCondition.Comparison.of("region", ComparisonOperator.EQ, new Expression.EnvVarReference("REGION")),
                DataCondition.Comparison.of("active", ComparisonOperator.EQ, new Expression.BooleanLiteral(true)));
        Statement rows = new Statement.Rows("users", TableReference.of("Users"), where, List.of(), null, null, 1);
        assertTrue(ReferenceCollector.collect(List.of(rows)).env());
    }

    @Test
    void testFeatureCollectsHooksScenariosAndFixtureOptions() {
        Feature.Hook hook = new Feature.Hook(Feature.Hook.Type.BEFORE_ALL,
                List.of(new Statement.Count("n", TableReference.of("Seed"), null, 2)));
        Scenario scenario = Scenario.of("api", List.of(new Statement.ApiRequest(Statement.HttpMethod.GET,
                new Expression.StringLiteral("/health"), null, null, 5)));
        Feature.FixtureUse use = new Feature.FixtureUse("auth", Map.of("token", new Expression.EnvVarReference("TOKEN")));
        Feature feature = new Feature("Health", Set.of(), List.of(), List.of(use), List.of(hook), List.of(scenario), 1);
        References refs = ReferenceCollector.collect(feature);
        assertEquals(Set.of("Seed"), refs.tables());
        assertTrue(refs.api());
        assertTrue(refs.env());
    }

}
