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
import io.vero.ast.ComparisonOperator;
import io.vero.ast.DataCondition;
import io.vero.ast.Expression;
import io.vero.ast.HasCondition;
import io.vero.ast.LoadFilter;
import io.vero.ast.Program;
import io.vero.ast.Query;
import io.vero.ast.ResponseCondition;
import io.vero.ast.ScreenshotOptions;
import io.vero.ast.Selector;
import io.vero.ast.Statement;
import io.vero.ast.TableReference;
import io.vero.ast.Target;
import io.vero.ast.VarType;
import io.vero.ast.VariableCondition;
import io.vero.ast.VerifyCondition;
import io.vero.compiler.CompileContext;
import io.vero.compiler.CompileOptions;
import io.vero.compiler.CompileWarning;
import io.vero.compiler.Scope;
import io.vero.compiler.scan.ScenarioCapabilities;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StatementCompilerTest {

    static final Target SUBMIT = new Target.Field("LoginPage", "submit");
    static final Target EMAIL = new Target.Field("LoginPage", "email");

    CompileContext context;
    StatementCompiler compiler;
    Scope scenario;

    @BeforeEach
    void beforeEach() {
        init(CompileOptions.defaults());
    }

    private void init(CompileOptions options) {
        context = new CompileContext(new Program(null, null, null, null), options, "Login");
        compiler = new StatementCompiler(context);
        scenario = Scope.scenario(Map.of("LoginPage", "loginPage"), List.of(), ScenarioCapabilities.NONE);
    }

    /**
     * Same scope without the {@code test.step} wrapper, for single-line assertions.
     */
    private Scope plain() {
        return new Scope("page", null, null, Map.of("LoginPage", "loginPage"), List.of(), ScenarioCapabilities.NONE, false, false);
    }

    private String one(Statement statement) {
        List<String> lines = compiler.compile(statement, plain());
        assertEquals(1, lines.size(), lines.toString());
        return lines.get(0);
    }

    private static Expression str(String value) {
        return new Expression.StringLiteral(value);
    }

    private static Expression num(double value) {
        return new Expression.NumberLiteral(value);
    }

    private static Expression var(String name) {
        return new Expression.VariableReference(null, name);
    }

    @Test
    void testClickWrappedInStep() {
        assertEquals(List.of(
                "await test.step('Click LoginPage.submit', async () => {",
                "  await loginPage.submit.click();",
                "});"), compiler.compile(new Statement.Click(SUBMIT, 1), scenario));
    }

    @Test
    void testInteractions() {
        assertEquals("await loginPage.submit.click({ button: 'right' });", one(new Statement.RightClick(SUBMIT, 1)));
        assertEquals("await loginPage.submit.dblclick();", one(new Statement.DoubleClick(SUBMIT, 1)));
        assertEquals("await loginPage.submit.click({ force: true });", one(new Statement.ForceClick(SUBMIT, 1)));
        assertEquals("await loginPage.email.fill(__env__['USER']);",
                one(new Statement.Fill(EMAIL, new Expression.EnvVarReference("USER"), 1)));
        assertEquals("await page.goto('/login');", one(new Statement.Open(str("/login"), 1)));
        assertEquals("await page.getByText('Remember me').check();", one(new Statement.Check(new Target.Text("Remember me"), 1)));
        assertEquals("await loginPage.submit.hover();", one(new Statement.Hover(SUBMIT, 1)));
        assertEquals("await page.keyboard.press('Enter');", one(new Statement.Press("Enter", 1)));
        assertEquals("await page.reload();", one(new Statement.Refresh(1)));
        assertEquals("await loginPage.submit.waitFor({ state: 'visible' });", one(new Statement.WaitFor(SUBMIT, 1)));
    }

    @Test
    void testDrag() {
        assertEquals("await loginPage.email.dragTo(loginPage.submit);", one(new Statement.Drag(EMAIL, SUBMIT, null, null, 1)));
        assertEquals(List.of(
                "await loginPage.email.hover();",
                "await page.mouse.down();",
                "await page.mouse.move(100, 50);",
                "await page.mouse.up();"), compiler.compile(new Statement.Drag(EMAIL, null, 100, 50, 1), plain()));
    }

    @Test
    void testWaitTitlesAndDurations() {
        assertEquals(List.of(
                "await test.step('Wait 2 seconds', async () => {",
                "  await page.waitForTimeout(2000);",
                "});"), compiler.compile(new Statement.Wait(2, Statement.WaitUnit.SECONDS, 1), scenario));
        assertEquals("await test.step('Wait 1 second', async () => {",
                compiler.compile(new Statement.Wait(1, Statement.WaitUnit.SECONDS, 1), scenario).get(0));
        assertEquals("await page.waitForTimeout(1500);", one(new Statement.Wait(1.5, Statement.WaitUnit.SECONDS, 1)));
        assertEquals("await page.waitForTimeout(250);", one(new Statement.Wait(250, Statement.WaitUnit.MILLISECONDS, 1)));
    }

    @Test
    void testReturnInsidePage() {
        Scope page = Scope.pageObject("LoginPage", Map.of(), ScenarioCapabilities.NONE);
        Target heading = new Target.Field(null, "heading");
        assertEquals(List.of("return await this.heading.isVisible();"),
                compiler.compile(new Statement.Return(Statement.ReturnType.VISIBLE, heading, null, 1), page));
        assertEquals(List.of("return (await this.heading.textContent()) ?? '';"),
                compiler.compile(new Statement.Return(Statement.ReturnType.TEXT, heading, null, 1), page));
        assertEquals(List.of("return await this.heading.inputValue();"),
                compiler.compile(new Statement.Return(Statement.ReturnType.VALUE, heading, null, 1), page));
        assertEquals(List.of("return total;"),
                compiler.compile(new Statement.Return(Statement.ReturnType.EXPRESSION, null, var("total"), 1), page));
        assertEquals(List.of("return;"), compiler.compile(new Statement.Return(null, null, null, 1), page));
    }

    @Test
    void testTabsRebindPageObjects() {
        Scope tabs = new Scope("page", null, null, Map.of("LoginPage", "loginPage"), List.of("loginPage = new LoginPage(page);"),
                new ScenarioCapabilities(true, false, false), true, false);
        assertEquals(List.of(
                "page = context.pages()[context.pages().length - 1];",
                "await page.bringToFront();",
                "loginPage = new LoginPage(page);"), compiler.compile(new Statement.SwitchToNewTab(null, 1), tabs));
        assertEquals(List.of(
                "page = await context.newPage();",
                "await page.goto('/help');",
                "loginPage = new LoginPage(page);"), compiler.compile(new Statement.OpenInNewTab(str("/help"), 1), tabs));
        assertEquals("page = context.pages()[1];", compiler.compile(new Statement.SwitchToTab(num(2), 1), tabs).get(0));
        assertEquals("page = context.pages()[(n) - 1];", compiler.compile(new Statement.SwitchToTab(var("n"), 1), tabs).get(0));
        assertEquals(List.of(
                "await page.close();",
                "page = context.pages()[context.pages().length - 1];",
                "await page.bringToFront();",
                "loginPage = new LoginPage(page);"), compiler.compile(new Statement.CloseTab(1), tabs));
    }

    @Test
    void testTabsInsidePageClass() {
        Scope page = Scope.pageObject("LoginPage", Map.of(), new ScenarioCapabilities(true, false, false));
        assertEquals(List.of("this.page = await this.page.context().newPage();", "await this.page.goto('/x');"),
                compiler.compile(new Statement.SwitchToNewTab(str("/x"), 1), page));
    }

    @Test
    void testDialogsAndFrames() {
        assertEquals("page.once('dialog', (dialog) => dialog.accept());", one(new Statement.AcceptDialog(null, 1)));
        assertEquals("page.once('dialog', (dialog) => dialog.accept('yes'));", one(new Statement.AcceptDialog(str("yes"), 1)));
        assertEquals("page.once('dialog', (dialog) => dialog.dismiss());", one(new Statement.DismissDialog(1)));
        Scope frames = Scope.scenario(Map.of(), List.of(), new ScenarioCapabilities(false, true, false));
        assertEquals(List.of("__frame = (__frame ?? page).locator('#editor').contentFrame();"),
                compiler.compile(new Statement.SwitchToFrame(Selector.auto("#editor"), 1), frames));
        assertEquals(List.of("__frame = null;"), compiler.compile(new Statement.SwitchToMainFrame(2), frames));
    }

    @Test
    void testBrowserState() {
        List<String> download = compiler.compile(new Statement.Download(SUBMIT, str("report.pdf"), 1), plain());
        assertEquals(List.of(
                "const [__download1] = await Promise.all([page.waitForEvent('download'), loginPage.submit.click()]);",
                "await __download1.saveAs('report.pdf');"), download);
        assertEquals("await page.context().addCookies([{ name: 'session', value: 'abc', url: page.url() }]);",
                one(new Statement.SetCookie(str("session"), str("abc"), 1)));
        assertEquals("await page.context().clearCookies();", one(new Statement.ClearCookies(1)));
        assertEquals("await page.evaluate(([key, value]) => localStorage.setItem(key, value), ['theme', 'dark']);",
                one(new Statement.SetStorage(str("theme"), str("dark"), 1)));
        assertEquals("const theme = await page.evaluate((key) => localStorage.getItem(key), 'theme');",
                one(new Statement.GetStorage(str("theme"), "theme", 1)));
        assertEquals("await page.evaluate(() => localStorage.clear());", one(new Statement.ClearStorage(1)));
        assertEquals("await page.mouse.wheel(0, -500);", one(new Statement.Scroll(Statement.ScrollDirection.UP, null, 1)));
        assertEquals("await loginPage.submit.scrollIntoViewIfNeeded();", one(new Statement.Scroll(null, SUBMIT, 1)));
        assertEquals("await page.waitForLoadState('load');", one(new Statement.WaitForNavigation(1)));
        assertEquals("await page.waitForLoadState('networkidle');", one(new Statement.WaitForNetworkIdle(1)));
        assertEquals("await page.waitForURL((url) => url.toString().includes('/home'));",
                one(new Statement.WaitForUrl(Statement.Match.CONTAINS, str("/home"), 1)));
        assertEquals("await page.waitForURL(new RegExp('^/u/\\\\d+'));",
                one(new Statement.WaitForUrl(Statement.Match.MATCHES, str("^/u/\\d+"), 1)));
        assertEquals("console.log('hi');", one(new Statement.Log(str("hi"), 1)));
        assertEquals("await page.screenshot({ path: 'screenshot-9.png', fullPage: true });",
                one(new Statement.TakeScreenshot(null, null, 9)));
        assertEquals("await loginPage.email.setInputFiles(['a.txt', 'b.txt']);",
                one(new Statement.Upload(List.of(str("a.txt"), str("b.txt")), EMAIL, 1)));
    }

    @Test
    void testPerform() {
        ActionCall call = new ActionCall("LoginPage", "login", List.of(str("bob"), var("password")));
        assertEquals(List.of(
                "await test.step('Perform LoginPage.login', async () => {",
                "  await loginPage.login('bob', password);",
                "});"), compiler.compile(new Statement.Perform(call, 1), scenario));
        assertEquals(List.of("const greeting = await loginPage.greet();"),
                compiler.compile(new Statement.PerformAssignment(VarType.TEXT, "greeting",
                        new ActionCall("LoginPage", "greet", List.of()), 2), scenario));
    }

    @Test
    void testPerformWithoutOwnerWarns() {
        assertEquals("const x = await refresh();",
                one(new Statement.PerformAssignment(null, "x", new ActionCall(null, "refresh", null), 4)));
        assertEquals(CompileWarning.UNKNOWN_ACTION, context.getWarnings().get(0).code());
    }

    @Test
    void testVerify() {
        assertEquals("await expect(loginPage.submit).toBeVisible();",
                one(new Statement.Verify(SUBMIT, null, VerifyCondition.is(VerifyCondition.State.VISIBLE), 1)));
        assertEquals("await expect(loginPage.submit).not.toBeEnabled();",
                one(new Statement.Verify(SUBMIT, null, VerifyCondition.isNot(VerifyCondition.State.ENABLED), 1)));
        assertEquals("await expect(page.getByText('Welcome')).toBeVisible();",
                one(new Statement.Verify(null, str("Welcome"), null, 1)));
        assertEquals("await expect(loginPage.email).toContainText('@');",
                one(new Statement.Verify(EMAIL, null, new VerifyCondition(VerifyCondition.Operator.CONTAINS, null, str("@")), 1)));
        assertEquals("await expect(loginPage.email).not.toContainText('x');",
                one(new Statement.Verify(EMAIL, null, new VerifyCondition(VerifyCondition.Operator.NOT_CONTAINS, null, str("x")), 1)));
        assertEquals("await expect(loginPage.email).toHaveText('Hi');",
                one(new Statement.Verify(EMAIL, null, new VerifyCondition(VerifyCondition.Operator.IS, null, str("Hi")), 1)));
    }

    @Test
    void testVerifyUrlAndTitle() {
        assertEquals("await expect(page).toHaveURL(new RegExp('dashboard'));",
                one(new Statement.VerifyUrl(Statement.Match.CONTAINS, str("dashboard"), 1)));
        assertEquals("await expect(page).toHaveURL(new RegExp('a\\\\.b'));",
                one(new Statement.VerifyUrl(null, str("a.b"), 1)));
        assertEquals("await expect(page).toHaveURL('https://x.test/');",
                one(new Statement.VerifyUrl(Statement.Match.EQUALS, str("https://x.test/"), 1)));
        assertEquals("await expect(page).toHaveTitle(new RegExp('^Home'));",
                one(new Statement.VerifyTitle(Statement.Match.MATCHES, str("^Home"), 1)));
    }

    @Test
    void testEscapeRegex() {
        assertEquals("a\\.b\\*c", StatementCompiler.escapeRegex("a.b*c"));
        assertEquals("plain", StatementCompiler.escapeRegex("plain"));
    }

    @Test
    void testVerifyHas() {
        assertEquals("await expect(loginPage.submit).toHaveCount(3);",
                one(new Statement.VerifyHas(SUBMIT, HasCondition.of(HasCondition.Kind.COUNT, num(3)), 1)));
        assertEquals("await expect(loginPage.email).toHaveAttribute('type', 'email');",
                one(new Statement.VerifyHas(EMAIL, new HasCondition(HasCondition.Kind.ATTRIBUTE, str("type"), str("email")), 1)));
        assertEquals("await expect(loginPage.email).toHaveClass(new RegExp('active'));",
                one(new Statement.VerifyHas(EMAIL, HasCondition.of(HasCondition.Kind.CLASS, str("active")), 1)));
    }

    @Test
    void testVerifyScreenshot() {
        assertEquals("await expect(page).toHaveScreenshot('home.png');", one(new Statement.VerifyScreenshot(null, "home", null, 1)));
        assertEquals("await expect(loginPage.submit).toHaveScreenshot('btn.png', { threshold: 0, maxDiffPixels: 0 });",
                one(new Statement.VerifyScreenshot(SUBMIT, "btn.png",
                        new ScreenshotOptions(ScreenshotOptions.Preset.STRICT, null, null, null), 1)));
        assertEquals("await expect(page).toHaveScreenshot('screenshot-4.png', { threshold: 0.3, maxDiffPixelRatio: 0.05 });",
                one(new Statement.VerifyScreenshot(null, null,
                        new ScreenshotOptions(ScreenshotOptions.Preset.RELAXED, null, null, null), 4)));
    }

    @Test
    void testVerifyVariableAndResponse() {
        Expression.VariableReference items = new Expression.VariableReference(null, "items");
        assertEquals("expect(items).toContain('apple');",
                one(new Statement.VerifyVariable(items, new VariableCondition(VariableCondition.Kind.CONTAINS, str("apple")), 1)));
        assertEquals("expect(items).not.toBeTruthy();",
                one(new Statement.VerifyVariable(items, new VariableCondition(VariableCondition.Kind.IS_NOT_TRUE, null), 1)));
        assertEquals("expect(__vero_apiResponse.status()).toBe(201);",
                one(new Statement.VerifyResponse(new ResponseCondition(ResponseCondition.Subject.STATUS, null, num(201)), 1)));
        assertEquals("expect(await __vero_apiResponse.text()).toContain('ok');",
                one(new Statement.VerifyResponse(new ResponseCondition(ResponseCondition.Subject.BODY,
                        ResponseCondition.Operator.CONTAINS, str("ok")), 1)));
    }

    @Test
    void testApi() {
        assertEquals(List.of(
                "await test.step('POST /users', async () => {",
                "  __vero_apiResponse = await request.post('/users', { data: payload });",
                "});"), compiler.compile(new Statement.ApiRequest(Statement.HttpMethod.POST, str("/users"), var("payload"), null, 1), scenario));
        assertEquals("await page.route('**/api/items', (route) => route.fulfill({ status: 200, body: '[]' }));",
                one(new Statement.MockApi(str("**/api/items"), 200, str("[]"), 1)));
    }

    @Test
    void testControlFlow() {
        Statement forEach = new Statement.ForEach("user", "users", List.of(new Statement.Fill(EMAIL, var("user"), 2)), 1);
        assertEquals(List.of(
                "for (const user of users) {",
                "  await loginPage.email.fill(user);",
                "}"), compiler.compile(forEach, plain()));
        Statement ifElse = new Statement.IfElse(new BooleanCondition.ElementState(SUBMIT, BooleanCondition.State.VISIBLE, true),
                List.of(new Statement.Refresh(2)), List.of(new Statement.Click(SUBMIT, 3)), 1);
        assertEquals(List.of(
                "if (!(await loginPage.submit.isVisible())) {",
                "  await page.reload();",
                "} else {",
                "  await loginPage.submit.click();",
                "}"), compiler.compile(ifElse, plain()));
        Statement repeat = new Statement.Repeat(num(3), List.of(new Statement.Press("Tab", 2)), 1);
        assertEquals(List.of(
                "for (let __i1 = 0; __i1 < 3; __i1++) {",
                "  await page.keyboard.press('Tab');",
                "}"), compiler.compile(repeat, plain()));
        Statement tryCatch = new Statement.TryCatch(List.of(new Statement.Refresh(2)), List.of(new Statement.Log(str("retry"), 4)), 1);
        assertEquals(List.of(
                "try {",
                "  await page.reload();",
                "} catch (__error) {",
                "  console.log('retry');",
                "}"), compiler.compile(tryCatch, plain()));
    }

    @Test
    void testIfVariableTruthyWithoutElse() {
        Statement ifElse = new Statement.IfElse(new BooleanCondition.VariableTruthy("loggedIn"),
                List.of(new Statement.Refresh(2)), List.of(), 1);
        assertEquals(List.of("if (loggedIn) {", "  await page.reload();", "}"), compiler.compile(ifElse, plain()));
    }

    @Test
    void testUtilityAssignment() {
        Statement assign = new Statement.UtilityAssignment(VarType.TEXT, "slug",
                new Expression.Chained(new Expression.Trim(var("title")), new Expression.Convert(Expression.ConvertType.LOWERCASE, null)), 1);
        assertEquals("const slug = veroString.lowercase(veroString.trim(title));", one(assign));
    }

    @Test
    void testUnsupportedStatementWarns() {
        assertEquals("// Unsupported statement: Teleport", one(new Statement.Unsupported("Teleport", 7)));
        CompileWarning warning = context.getWarnings().get(0);
        assertEquals(CompileWarning.UNSUPPORTED_STATEMENT, warning.code());
        assertEquals(7, warning.line());
        assertEquals("Login", warning.unit());
    }

    @Test
    void testDebugBodyHoistsDeclarations() {
        init(CompileOptions.builder().debug(true).build());
        List<String> lines = compiler.compileBody(List.of(
                new Statement.UtilityAssignment(VarType.NUMBER, "n", num(1), 5),
                new Statement.Refresh(6)), scenario);
        assertEquals("let n: any;", lines.get(0));
        assertTrue(lines.contains("  n = 1;"));
        assertTrue(lines.contains("await __debug__.beforeStep(6, 'Refresh', undefined);"));
        assertFalse(lines.stream().anyMatch(line -> line.contains("const n")));
    }

    @Test
    void testNonDebugBodyIsPlain() {
        List<String> lines = compiler.compileBody(List.of(new Statement.UtilityAssignment(VarType.NUMBER, "n", num(1), 5)), scenario);
        assertEquals(List.of("const n = 1;"), lines);
    }

    /**
     * One instance of every statement variant; each must compile to at least one line.
     */
    static List<Statement> everyStatement() {
        TableReference users = TableReference.of("Users");
        DataCondition active = DataCondition.Comparison.of("active", ComparisonOperator.EQ, new Expression.BooleanLiteral(true));
        return List.of(
                new Statement.Click(SUBMIT, 1),
                new Statement.RightClick(SUBMIT, 2),
                new Statement.DoubleClick(SUBMIT, 3),
                new Statement.ForceClick(SUBMIT, 4),
                new Statement.Drag(EMAIL, SUBMIT, null, null, 5),
                new Statement.Fill(EMAIL, str("a"), 6),
                new Statement.Open(str("/"), 7),
                new Statement.Check(SUBMIT, 8),
                new Statement.Uncheck(SUBMIT, 9),
                new Statement.Hover(SUBMIT, 10),
                new Statement.Press("Enter", 11),
                new Statement.Wait(1, Statement.WaitUnit.SECONDS, 12),
                new Statement.WaitFor(SUBMIT, 13),
                new Statement.Return(Statement.ReturnType.EXPRESSION, null, num(1), 14),
                new Statement.Refresh(15),
                new Statement.SwitchToNewTab(null, 16),
                new Statement.SwitchToTab(num(1), 17),
                new Statement.OpenInNewTab(str("/x"), 18),
                new Statement.CloseTab(19),
                new Statement.AcceptDialog(null, 20),
                new Statement.DismissDialog(21),
                new Statement.SwitchToFrame(Selector.auto("#f"), 22),
                new Statement.SwitchToMainFrame(23),
                new Statement.Download(SUBMIT, null, 24),
                new Statement.SetCookie(str("a"), str("b"), 25),
                new Statement.ClearCookies(26),
                new Statement.SetStorage(str("k"), str("v"), 27),
                new Statement.GetStorage(str("k"), "v", 28),
                new Statement.ClearStorage(29),
                new Statement.Scroll(Statement.ScrollDirection.DOWN, null, 30),
                new Statement.WaitForNavigation(31),
                new Statement.WaitForNetworkIdle(32),
                new Statement.WaitForUrl(null, str("/a"), 33),
                new Statement.Log(str("m"), 34),
                new Statement.TakeScreenshot(SUBMIT, "s.png", 35),
                new Statement.Upload(List.of(str("f")), EMAIL, 36),
                new Statement.Perform(new ActionCall("LoginPage", "login", List.of()), 37),
                new Statement.PerformAssignment(VarType.TEXT, "r", new ActionCall("LoginPage", "read", List.of()), 38),
                new Statement.Verify(SUBMIT, null, null, 39),
                new Statement.VerifyUrl(null, str("/a"), 40),
                new Statement.VerifyTitle(Statement.Match.EQUALS, str("T"), 41),
                new Statement.VerifyHas(SUBMIT, HasCondition.of(HasCondition.Kind.TEXT, str("x")), 42),
                new Statement.VerifyScreenshot(null, null, null, 43),
                new Statement.VerifyVariable(new Expression.VariableReference(null, "r"),
                        new VariableCondition(VariableCondition.Kind.EQUALS, str("x")), 44),
                new Statement.VerifyResponse(new ResponseCondition(ResponseCondition.Subject.HEADERS,
                        ResponseCondition.Operator.CONTAINS, str("json")), 45),
                new Statement.ApiRequest(null, str("/api"), null, null, 46),
                new Statement.MockApi(str("/api"), 404, null, 47),
                new Statement.Load("rows", "Users", null, new LoadFilter("age", ">", num(3)), 48),
                new Statement.ForEach("u", "rows", List.of(), 49),
                new Statement.IfElse(new BooleanCondition.VariableTruthy("u"), List.of(), List.of(), 50),
                new Statement.Repeat(num(2), List.of(), 51),
                new Statement.TryCatch(List.of(), List.of(), 52),
                new Statement.Row("row", Statement.RowModifier.LAST, users, active, List.of(), 53),
                new Statement.Rows("all", users, null, List.of(), 5, null, 54),
                new Statement.ColumnAccess("emails", false, users, "email", null, 55),
                new Statement.Count("n", users, active, 56),
                new Statement.DataQuery(Statement.ResultType.LIST, "q",
                        new Query.TableQuery(null, users, List.of("email"), active, List.of(), null, null, null), 57),
                new Statement.UtilityAssignment(VarType.TEXT, "id", new Expression.Generate(null), 58),
                new Statement.Unsupported("Teleport", 59));
    }

    @Test
    void testEveryVariantCompiles() {
        Scope full = Scope.scenario(Map.of("LoginPage", "loginPage"), List.of(), new ScenarioCapabilities(true, true, true));
        List<Statement> statements = everyStatement();
        Set<Class<?>> kinds = new HashSet<>();
        for (Statement statement : statements) {
            List<String> lines = compiler.compile(statement, full);
            assertFalse(lines.isEmpty(), statement.toString());
            kinds.add(statement.getClass());
        }
        assertEquals(Statement.class.getPermittedSubclasses().length, kinds.size());
        // only the unsupported statement warns
        assertEquals(1, context.getWarnings().size());
    }

    @Test
    void testEveryVariantCompilesInsidePageClass() {
        Scope page = Scope.pageObject("LoginPage", Map.of(), new ScenarioCapabilities(true, true, true));
        for (Statement statement : everyStatement()) {
            for (String line : compiler.compile(statement, page)) {
                assertFalse(line.contains("test.step"), line);
            }
        }
    }

}
