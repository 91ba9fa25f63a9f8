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
package io.vero.compiler.output;

import io.vero.ast.Expression;
import io.vero.ast.Feature;
import io.vero.ast.Program;
import io.vero.ast.Scenario;
import io.vero.common.StringUtils;
import io.vero.compiler.CodeBuilder;
import io.vero.compiler.CompileOptions;
import io.vero.compiler.Scope;
import io.vero.compiler.data.TableAccessCompiler;
import io.vero.compiler.debug.DebugInstrumenter;
import io.vero.compiler.expr.ExpressionCompiler;
import io.vero.compiler.scan.ReferenceCollector;
import io.vero.compiler.scan.References;
import io.vero.compiler.scan.ScenarioCapabilities;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.vero.common.StringUtils.quote;

/**
 * Compiles a feature into one Playwright spec: a {@code test.describe} block holding the
 * page-object bindings, the data preload, the hooks and one {@code test} per scenario.
 * <p>
 * Everything that shapes the output ahead of the body (imports, env block, preload, function
 * signatures) is derived from a single reference scan and a capability pre-scan per function,
 * so no statement is compiled before its enclosing signature is known.
 */
public class FeatureCompiler extends UnitCompiler {

    public static final String ENV_BLOCK =
            "const " + ExpressionCompiler.ENV + ": Record<string, string> = JSON.parse(process.env.VERO_ENV_VARS || '{}');";

    private final Feature feature;

    public FeatureCompiler(Program program, CompileOptions options, Feature feature) {
        super(program, options, feature.name());
        this.feature = feature;
    }

    @Override
    public String compile() {
        References refs = ReferenceCollector.collect(feature);
        Set<String> candidates = new LinkedHashSet<>(feature.uses());
        candidates.addAll(refs.pages());
        Set<String> pages = knownPages(candidates);
        List<String> fixtures = usedFixtures();

        ScenarioCapabilities all = ScenarioCapabilities.NONE;
        for (Feature.Hook hook : feature.hooks()) {
            all = all.or(ScenarioCapabilities.detect(hook.statements()));
        }
        for (Scenario scenario : feature.scenarios()) {
            all = all.or(ScenarioCapabilities.detect(scenario.statements()));
        }

        Imports imports = new Imports();
        if (fixtures.isEmpty()) {
            imports.add(PLAYWRIGHT, "test", "expect");
        } else {
            imports.add(sibling(options.getFixtureDir(), FixtureIndex.INDEX), "test", "expect");
        }
        capabilityTypes(imports, all);
        pages.forEach(name -> classImport(imports, options.getTestDir(), name));
        runtimeImports(imports, refs);

        CodeBuilder cb = new CodeBuilder();
        cb.lines(imports.toLines());
        cb.blank();
        if (refs.env()) {
            cb.line(ENV_BLOCK);
            cb.blank();
        }
        if (options.isDebug()) {
            cb.lines(DebugInstrumenter.preamble());
            cb.blank();
        }
        cb.open(describe() + "(" + quote(feature.name()) + ", () => {");
        if (feature.annotations().contains(Feature.Annotation.SERIAL)) {
            cb.line("test.describe.configure({ mode: 'serial' });");
            cb.blank();
        }
        fixtureOptions(cb);
        if (!pages.isEmpty()) {
            for (String name : pages) {
                cb.line("let " + StringUtils.toCamelCase(name) + ": " + name + ";");
            }
            cb.blank();
        }
        if (refs.usesTables()) {
            cb.lines(TableAccessCompiler.preload(refs.tables()));
            cb.blank();
        }

        Scope base = Scope.scenario(camelBindings(pages), rebinds(pages), ScenarioCapabilities.NONE);
        boolean beforeEach = false;
        for (Feature.Hook hook : feature.hooks()) {
            if (hook.type() == Feature.Hook.Type.BEFORE_EACH && !beforeEach) {
                beforeEach = true;
                cb.lines(eachHook(hook, base, pages));
            } else if (hook.type() == Feature.Hook.Type.BEFORE_EACH || hook.type() == Feature.Hook.Type.AFTER_EACH) {
                cb.lines(eachHook(hook, base, Set.of()));
            } else {
                cb.lines(allHook(hook, base, pages));
            }
            cb.blank();
        }
        if (!beforeEach && !pages.isEmpty()) {
            cb.lines(eachHook(new Feature.Hook(Feature.Hook.Type.BEFORE_EACH, List.of()), base, pages));
            cb.blank();
        }
        for (Scenario scenario : feature.scenarios()) {
            cb.lines(scenario(scenario, base, fixtures));
            cb.blank();
        }
        cb.close("});");
        return cb.toString();
    }

    private String describe() {
        Set<Feature.Annotation> annotations = feature.annotations();
        if (annotations.contains(Feature.Annotation.SKIP)) {
            return "test.describe.skip";
        }
        if (annotations.contains(Feature.Annotation.ONLY)) {
            return "test.describe.only";
        }
        return "test.describe";
    }

    private List<String> usedFixtures() {
        List<String> names = new ArrayList<>();
        for (Feature.FixtureUse use : feature.fixtures()) {
            boolean known = program.fixtures().stream().anyMatch(f -> f.name().equals(use.fixtureName()));
            if (known && !names.contains(use.fixtureName())) {
                names.add(use.fixtureName());
            }
        }
        return names;
    }

    private void fixtureOptions(CodeBuilder cb) {
        Scope scope = Scope.scenario(Map.of(), List.of(), ScenarioCapabilities.NONE);
        boolean any = false;
        for (Feature.FixtureUse use : feature.fixtures()) {
            if (use.options().isEmpty()) {
                continue;
            }
            List<String> entries = new ArrayList<>();
            for (Map.Entry<String, Expression> entry : use.options().entrySet()) {
                entries.add(entry.getKey() + ": " + statements.getExpressions().compile(entry.getValue(), scope));
            }
            cb.line("test.use({ " + String.join(", ", entries) + " });");
            any = true;
        }
        if (any) {
            cb.blank();
        }
    }

    private static List<String> rebinds(Set<String> pages) {
        List<String> lines = new ArrayList<>();
        for (String name : pages) {
            lines.add(StringUtils.toCamelCase(name) + " = new " + name + "(page);");
        }
        return lines;
    }

    private List<String> eachHook(Feature.Hook hook, Scope base, Set<String> pages) {
        ScenarioCapabilities caps = ScenarioCapabilities.detect(hook.statements());
        String name = hook.type() == Feature.Hook.Type.BEFORE_EACH ? "test.beforeEach" : "test.afterEach";
        List<String> body = new ArrayList<>(TestFunction.prologue(caps));
        body.addAll(rebinds(pages));
        body.addAll(statements.compileAll(hook.statements(), base.withCapabilities(caps)));
        return new CodeBuilder()
                .block(name + "(async (" + TestFunction.parameters(caps, List.of()) + ") => {", body, "});")
                .toLines();
    }

    /**
     * {@code beforeAll} and {@code afterAll} get no page fixture, so they open a page of their
     * own and shadow the page objects with local instances.
     */
    private List<String> allHook(Feature.Hook hook, Scope base, Set<String> pages) {
        ScenarioCapabilities caps = ScenarioCapabilities.detect(hook.statements());
        String name = hook.type() == Feature.Hook.Type.BEFORE_ALL ? "test.beforeAll" : "test.afterAll";
        List<String> body = new ArrayList<>();
        body.add((caps.tabs() ? "let" : "const") + " page = await browser.newPage();");
        if (caps.tabs()) {
            body.add("const context = page.context();");
        }
        if (caps.api()) {
            body.add("const request = page.request;");
        }
        TestFunction.locals(caps, body);
        for (String page : pages) {
            body.add((caps.tabs() ? "let " : "const ") + StringUtils.toCamelCase(page) + " = new " + page + "(page);");
        }
        body.addAll(statements.compileAll(hook.statements(), base.withCapabilities(caps)));
        body.add("await page.close();");
        return new CodeBuilder().block(name + "(async ({ browser }) => {", body, "});").toLines();
    }

    private List<String> scenario(Scenario scenario, Scope base, List<String> fixtures) {
        ScenarioCapabilities caps = ScenarioCapabilities.detect(scenario.statements());
        Scope scope = base.withCapabilities(caps);
        boolean evidence = options.isEvidenceScreenshots();
        String title = scenario.name();
        for (String tag : scenario.tags()) {
            title = title + " @" + tag;
        }
        String params = TestFunction.parameters(caps, fixtures) + (evidence ? ", testInfo" : "");
        List<String> body = new ArrayList<>();
        if (scenario.annotations().contains(Scenario.Annotation.SLOW)) {
            body.add("test.slow();");
        }
        body.addAll(TestFunction.prologue(caps));
        body.addAll(statements.compileBody(scenario.statements(), scope));
        if (evidence) {
            body.add("await testInfo.attach('evidence', { body: await page.screenshot({ fullPage: true }), contentType: 'image/png' });");
        }
        return new CodeBuilder()
                .block(testFunction(scenario) + "(" + quote(title) + ", async (" + params + ") => {", body, "});")
                .toLines();
    }

    private static String testFunction(Scenario scenario) {
        Set<Scenario.Annotation> annotations = scenario.annotations();
        if (annotations.contains(Scenario.Annotation.FIXME)) {
            return "test.fixme";
        }
        if (annotations.contains(Scenario.Annotation.SKIP)) {
            return "test.skip";
        }
        if (annotations.contains(Scenario.Annotation.ONLY)) {
            return "test.only";
        }
        return "test";
    }

}
