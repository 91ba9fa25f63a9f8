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
package io.vero.compiler.expr;

import io.vero.ast.Expression;
import io.vero.compiler.Scope;
import io.vero.compiler.scan.ScenarioCapabilities;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionCompilerTest {

    static final Scope SCOPE = Scope.scenario(Map.of("LoginPage", "loginPage"), List.of(), ScenarioCapabilities.NONE);

    final ExpressionCompiler compiler = new ExpressionCompiler();

    private String compile(Expression e) {
        return compiler.compile(e, SCOPE);
    }

    private static Expression str(String value) {
        return new Expression.StringLiteral(value);
    }

    private static Expression num(double value) {
        return new Expression.NumberLiteral(value);
    }

    @Test
    void testTerminals() {
        assertEquals("'it\\'s'", compile(str("it's")));
        assertEquals("42", compile(num(42)));
        assertEquals("1.5", compile(num(1.5)));
        assertEquals("true", compile(new Expression.BooleanLiteral(true)));
        assertEquals("total", compile(new Expression.VariableReference(null, "total")));
        assertEquals("loginPage.greeting", compile(new Expression.VariableReference("LoginPage", "greeting")));
        assertEquals("__env__['BASE_URL']", compile(new Expression.EnvVarReference("BASE_URL")));
        assertEquals("null", compile(null));
    }

    @Test
    void testVariableOfCurrentPage() {
        Scope page = Scope.pageObject("LoginPage", Map.of(), ScenarioCapabilities.NONE);
        assertEquals("this.greeting", compiler.compile(new Expression.VariableReference("LoginPage", "greeting"), page));
    }

    @Test
    void testStrings() {
        Expression name = new Expression.VariableReference(null, "name");
        assertEquals("veroString.trim(name)", compile(new Expression.Trim(name)));
        assertEquals("veroString.lowercase(name)", compile(new Expression.Convert(Expression.ConvertType.LOWERCASE, name)));
        assertEquals("veroConvert.toNumber('12')", compile(new Expression.Convert(Expression.ConvertType.NUMBER, str("12"))));
        assertEquals("veroString.substring(name, 0, 3)", compile(new Expression.Extract(name, num(0), num(3))));
        assertEquals("veroString.substring(name, 2)", compile(new Expression.Extract(name, num(2), null)));
        assertEquals("veroString.replace(name, '-', '_')", compile(new Expression.Replace(name, str("-"), str("_"))));
        assertEquals("veroString.split(name, ',')", compile(new Expression.Split(name, str(","))));
        assertEquals("veroString.join(name, ', ')", compile(new Expression.Join(name, str(", "))));
        assertEquals("veroString.length(name)", compile(new Expression.Length(name)));
        assertEquals("veroString.padStart(name, 5, '0')", compile(new Expression.Pad(name, num(5), str("0"))));
        assertEquals("veroString.padStart(name, 5, ' ')", compile(new Expression.Pad(name, num(5), null)));
    }

    @Test
    void testDatesAndNumbers() {
        assertEquals("veroDate.today()", compile(new Expression.Today()));
        assertEquals("veroDate.now()", compile(new Expression.Now()));
        assertEquals("veroDate.addDays(veroDate.today(), 3)",
                compile(new Expression.AddDate(num(3), Expression.DateUnit.DAY, null)));
        assertEquals("veroDate.subtractMonths(veroDate.now(), 1)",
                compile(new Expression.SubtractDate(num(1), Expression.DateUnit.MONTH, new Expression.Now())));
        assertEquals("veroDate.formatDate(veroDate.today(), 'DD/MM/YYYY')",
                compile(new Expression.Format(new Expression.Today(), Expression.FormatType.DATE, "DD/MM/YYYY", null)));
        assertEquals("veroNumber.formatCurrency(9.5, 'EUR')",
                compile(new Expression.Format(num(9.5), Expression.FormatType.CURRENCY, null, "EUR")));
        assertEquals("veroDate.year(veroDate.today())",
                compile(new Expression.DatePart(Expression.DatePartType.YEAR, new Expression.Today())));
        assertEquals("veroNumber.round(2.345, 2)", compile(new Expression.Round(num(2.345), 2, null)));
        assertEquals("veroNumber.ceiling(2.1)", compile(new Expression.Round(num(2.1), null, Expression.RoundDirection.UP)));
        assertEquals("veroNumber.abs(-4)", compile(new Expression.Absolute(num(-4))));
    }

    @Test
    void testGenerators() {
        assertEquals("veroGenerate.uuid()", compile(new Expression.Generate(null)));
        assertEquals("veroGenerate.uuid()", compile(new Expression.Generate("uuid")));
        assertEquals("veroGenerate.fromRegex('[A-Z]{3}')", compile(new Expression.Generate("[A-Z]{3}")));
        assertEquals("veroGenerate.randomInt(1, 6)", compile(new Expression.RandomNumber(num(1), num(6))));
    }

    @Test
    void testChainThreadsLeftIntoRight() {
        Expression chain = new Expression.Chained(new Expression.Trim(str("  abc ")),
                new Expression.Convert(Expression.ConvertType.UPPERCASE, null));
        assertEquals("veroString.uppercase(veroString.trim('  abc '))", compile(chain));
    }

    @Test
    void testLongChainGrowsLinearly() {
        Expression chain = new Expression.Chained(
                new Expression.Chained(new Expression.Trim(new Expression.VariableReference(null, "raw")),
                        new Expression.Replace(null, str(" "), str("-"))),
                new Expression.Convert(Expression.ConvertType.LOWERCASE, null));
        String code = compile(chain);
        assertEquals("veroString.lowercase(veroString.replace(veroString.trim(raw), ' ', '-'))", code);
        assertEquals(1, code.split("raw", -1).length - 1);
    }

    @Test
    void testDateChain() {
        Expression chain = new Expression.Chained(new Expression.Today(),
                new Expression.AddDate(num(7), Expression.DateUnit.DAY, null));
        assertEquals("veroDate.addDays(veroDate.today(), 7)", compile(chain));
    }

    @Test
    void testFormatNumber() {
        assertEquals("0", ExpressionCompiler.formatNumber(0));
        assertEquals("-3", ExpressionCompiler.formatNumber(-3));
        assertEquals("0.25", ExpressionCompiler.formatNumber(0.25));
    }

    @Test
    void testDescribe() {
        assertEquals("hello", ExpressionCompiler.describe(str("hello")));
        assertEquals("{{HOST}}", ExpressionCompiler.describe(new Expression.EnvVarReference("HOST")));
        assertEquals("Page.x", ExpressionCompiler.describe(new Expression.VariableReference("Page", "x")));
        assertEquals("Trim", ExpressionCompiler.describe(new Expression.Trim(str("a"))));
    }

}
