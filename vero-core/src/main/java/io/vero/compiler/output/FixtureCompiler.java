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

import io.vero.ast.Fixture;
import io.vero.ast.Program;
import io.vero.ast.Statement;
import io.vero.common.StringUtils;
import io.vero.compiler.CodeBuilder;
import io.vero.compiler.CompileOptions;
import io.vero.compiler.CompileWarning;
import io.vero.compiler.Scope;
import io.vero.compiler.data.TableAccessCompiler;
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
 * Compiles a fixture into a {@code test.extend} unit. Setup runs before {@code use}, teardown
 * after it. Options become Playwright option fixtures that features override with
 * {@code test.use}; the fixture value is an object carrying the resolved option values.
 */
public class FixtureCompiler extends UnitCompiler {

    private final Fixture fixture;

    public FixtureCompiler(Program program, CompileOptions options, Fixture fixture) {
        super(program, options, fixture.name());
        this.fixture = fixture;
    }

    /**
     * Import alias of a fixture's {@code test} export.
     */
    static String alias(String fixtureName) {
        return StringUtils.toCamelCase(fixtureName) + "Fixture";
    }

    @Override
    public String compile() {
        List<Statement> all = new ArrayList<>(fixture.setup());
        all.addAll(fixture.teardown());
        References refs = ReferenceCollector.collect(all);
        ScenarioCapabilities caps = ScenarioCapabilities.detect(all);
        boolean worker = fixture.scope() == Fixture.Scope.WORKER;
        List<String> dependencies = new ArrayList<>();
        for (String dependency : fixture.dependencies()) {
            if (program.fixtures().stream().anyMatch(f -> f.name().equals(dependency))) {
                dependencies.add(dependency);
            } else {
                context.warn(CompileWarning.UNKNOWN_FIXTURE, 0, "fixture '" + fixture.name()
                        + "' depends on unknown fixture '" + dependency + "'");
            }
        }
        Set<String> pages = knownPages(refs.pages());

        Imports imports = new Imports();
        if (dependencies.isEmpty()) {
            imports.add(PLAYWRIGHT, "test as base", "expect");
        } else {
            imports.add(PLAYWRIGHT, "test as playwrightTest", "expect", "mergeTests");
            dependencies.forEach(d -> imports.add("./" + d, "test as " + alias(d)));
        }
        capabilityTypes(imports, caps);
        pages.forEach(name -> classImport(imports, options.getFixtureDir(), name));
        runtimeImports(imports, refs);

        CodeBuilder cb = new CodeBuilder();
        cb.lines(imports.toLines());
        cb.blank();
        modulePrelude(cb, refs);
        if (!dependencies.isEmpty()) {
            List<String> merged = new ArrayList<>();
            merged.add("playwrightTest");
            dependencies.forEach(d -> merged.add(alias(d)));
            cb.line("const base = mergeTests(" + String.join(", ", merged) + ");");
            cb.blank();
        }
        List<String> types = new ArrayList<>();
        for (Fixture.Option option : fixture.options()) {
            types.add(option.name() + ": any");
        }
        types.add(fixture.name() + ": any");
        String typeArg = "{ " + String.join("; ", types) + " }";
        cb.open("export const test = base.extend<" + (worker ? "{}, " + typeArg : typeArg) + ">({");
        Scope optionScope = Scope.scenario(Map.of(), List.of(), ScenarioCapabilities.NONE);
        for (Fixture.Option option : fixture.options()) {
            String value = statements.getExpressions().compile(option.defaultValue(), optionScope);
            cb.line(option.name() + ": [" + value + ", { option: true" + (worker ? ", scope: 'worker'" : "") + " }],");
        }
        cb.lines(body(caps, worker, dependencies, pages, refs));
        cb.close("});");
        cb.blank();
        cb.line("export { expect };");
        return cb.toString();
    }

    private List<String> body(ScenarioCapabilities caps, boolean worker, List<String> dependencies, Set<String> pages,
                              References refs) {
        Set<String> extra = new LinkedHashSet<>(fixture.parameters());
        extra.addAll(dependencies);
        for (Fixture.Option option : fixture.options()) {
            extra.add(option.name());
        }
        List<String> lines = new ArrayList<>();
        String params;
        if (worker) {
            extra.remove("page");
            extra.add("browser");
            params = "{ " + String.join(", ", extra) + " }";
            lines.add((caps.tabs() ? "let" : "const") + " page = await browser.newPage();");
            if (caps.tabs()) {
                lines.add("const context = page.context();");
            }
            if (caps.api()) {
                lines.add("const request = page.request;");
            }
            TestFunction.locals(caps, lines);
        } else {
            extra.remove("page");
            if (caps.tabs()) {
                extra.remove("context");
            }
            if (caps.api()) {
                extra.remove("request");
            }
            params = TestFunction.parameters(caps, new ArrayList<>(extra));
            lines.addAll(TestFunction.prologue(caps));
        }
        for (String page : pages) {
            lines.add((caps.tabs() ? "let " : "const ") + StringUtils.toCamelCase(page) + " = new " + page + "(page);");
        }
        List<String> rebinds = new ArrayList<>();
        for (String page : pages) {
            rebinds.add(StringUtils.toCamelCase(page) + " = new " + page + "(page);");
        }
        Scope scope = new Scope("page", null, null, camelBindings(pages), rebinds, caps, false, false);
        if (refs.usesTables()) {
            lines.addAll(TableAccessCompiler.load(refs.tables()));
        }
        lines.addAll(statements.compileAll(fixture.setup(), scope));
        List<String> values = new ArrayList<>();
        for (Fixture.Option option : fixture.options()) {
            values.add(option.name());
        }
        lines.add("await use({" + (values.isEmpty() ? "" : " " + String.join(", ", values) + " ") + "});");
        lines.addAll(statements.compileAll(fixture.teardown(), scope));
        if (worker) {
            lines.add("await page.close();");
        }
        String settings = "{ scope: " + quote(worker ? "worker" : "test") + (fixture.auto() ? ", auto: true" : "") + " }";
        return new CodeBuilder()
                .block(fixture.name() + ": [async (" + params + ", use) => {", lines, "}, " + settings + "],")
                .toLines();
    }

}
