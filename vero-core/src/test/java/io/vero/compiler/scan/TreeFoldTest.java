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

import io.vero.ast.AstNode;
import io.vero.ast.BooleanCondition;
import io.vero.ast.Expression;
import io.vero.ast.Statement;
import io.vero.ast.Target;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeFoldTest {

    private static final Target BUTTON = new Target.Text("Save");

    @Test
    void testPreOrderVisitsSiblingsInSourceOrder() {
        List<Statement> statements = List.of(
                new Statement.Click(BUTTON, 1),
                new Statement.Repeat(new Expression.NumberLiteral(2), List.of(new Statement.Refresh(3)), 2),
                new Statement.Log(new Expression.StringLiteral("done"), 4));
        List<String> seen = TreeFold.<List<String>>fold(statements, new ArrayList<>(), (acc, node) -> {
            acc.add(node.getClass().getSimpleName());
            return acc;
        }, TreeFold.DESCEND_ALL);
        assertEquals(List.of("Click", "Text", "Repeat", "NumberLiteral", "Refresh", "Log", "StringLiteral"), seen);
    }

    @Test
    void testDescendPredicateStopsAtNode() {
        Statement nested = new Statement.ForEach("item", "items", List.of(new Statement.Refresh(2)), 1);
        int count = TreeFold.fold(List.of(nested), 0, (acc, node) -> acc + 1,
                node -> !(node instanceof Statement.ForEach));
        assertEquals(1, count);
    }

    @Test
    void testAnyMatchFindsDeeplyNestedNode() {
        Statement inner = new Statement.SwitchToTab(new Expression.NumberLiteral(2), 5);
        Statement tree = new Statement.IfElse(new BooleanCondition.VariableTruthy("ready"),
                List.of(new Statement.TryCatch(List.of(), List.of(inner), 3)), List.of(), 2);
        assertTrue(TreeFold.anyMatch(List.of(tree), node -> node instanceof Statement.SwitchToTab));
        assertFalse(TreeFold.anyMatch(List.of(tree), node -> node instanceof Statement.CloseTab));
    }

    @Test
    void testNullChildrenAreSkipped() {
        Statement open = new Statement.Open(null, 1);
        List<AstNode> seen = TreeFold.<List<AstNode>>fold(List.of(open), new ArrayList<>(), (acc, node) -> {
            acc.add(node);
            return acc;
        }, TreeFold.DESCEND_ALL);
        assertEquals(List.of(open), seen);
    }

    @Test
    void testEmptyRoots() {
        assertFalse(TreeFold.anyMatch(List.of(), node -> true));
    }

}
