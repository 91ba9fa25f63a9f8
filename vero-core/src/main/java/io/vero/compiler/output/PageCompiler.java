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

import io.vero.ast.ActionDefinition;
import io.vero.ast.Page;
import io.vero.ast.Program;
import io.vero.ast.Statement;
import io.vero.ast.VarType;
import io.vero.compiler.CodeBuilder;
import io.vero.compiler.CompileOptions;
import io.vero.compiler.Scope;
import io.vero.compiler.data.TableAccessCompiler;
import io.vero.compiler.locator.SelectorResolver;
import io.vero.compiler.scan.ReferenceCollector;
import io.vero.compiler.scan.References;
import io.vero.compiler.scan.ScenarioCapabilities;
import io.vero.compiler.statement.StatementCompiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles a page into a page-object class: one readonly locator per field, one property per
 * variable and one async method per action.
 */
public class PageCompiler extends UnitCompiler {

    private final Page page;
    private final SelectorResolver selectors;

    public PageCompiler(Program program, CompileOptions options, Page page) {
        super(program, options, page.name());
        this.page = page;
        this.selectors = new SelectorResolver(context);
    }

    @Override
    public String compile() {
        List<Statement> all = new ArrayList<>();
        page.actions().forEach(a -> all.addAll(a.statements()));
        References refs = ReferenceCollector.collect(all);
        ScenarioCapabilities caps = ScenarioCapabilities.detect(all);
        Set<String> others = knownPages(refs.pages());
        others.remove(page.name());
        Map<String, String> bindings = new LinkedHashMap<>();
        for (String other : others) {
            bindings.put(other, "new " + other + "(this.page)");
        }
        Imports imports = new Imports().add(PLAYWRIGHT, "Page", "Locator");
        capabilityTypes(imports, caps);
        others.forEach(other -> classImport(imports, options.getPageObjectDir(), other));
        runtimeImports(imports, refs);

        Scope scope = Scope.pageObject(page.name(), bindings, ScenarioCapabilities.NONE);
        CodeBuilder cb = new CodeBuilder();
        cb.lines(imports.toLines());
        cb.blank();
        modulePrelude(cb, refs);
        cb.open("export class " + page.name() + " {");
        // tab switching reassigns the handle
        cb.line((caps.tabs() ? "" : "readonly ") + "page: Page;");
        for (Page.Field field : page.fields()) {
            cb.line("readonly " + field.name() + ": Locator;");
        }
        for (Page.Variable variable : page.variables()) {
            cb.line(variable.name() + ": " + tsType(variable.type()) + ";");
        }
        cb.blank();
        cb.open("constructor(page: Page) {");
        cb.line("this.page = page;");
        for (Page.Field field : page.fields()) {
            cb.line("this." + field.name() + " = " + selectors.resolve(field.selector(), "this.page") + ";");
        }
        for (Page.Variable variable : page.variables()) {
            cb.line("this." + variable.name() + " = " + statements.getExpressions().compile(variable.value(), scope) + ";");
        }
        cb.close("}");
        for (ActionDefinition action : page.actions()) {
            cb.blank();
            cb.lines(action(action, scope, statements));
        }
        cb.close("}");
        return cb.toString();
    }

    static String tsType(VarType type) {
        return type == null ? "string" : type.getTsType();
    }

    /**
     * An async method; frame and API locals are declared only when the body needs them.
     */
    static List<String> action(ActionDefinition action, Scope base, StatementCompiler statements) {
        List<String> params = new ArrayList<>();
        for (String parameter : action.parameters()) {
            params.add(parameter + ": string");
        }
        String returns = action.returnType() == null ? "void" : action.returnType().getTsType();
        ScenarioCapabilities caps = ScenarioCapabilities.detect(action.statements());
        Scope scope = base.withCapabilities(caps);
        List<String> body = new ArrayList<>();
        TestFunction.locals(caps, body);
        References refs = ReferenceCollector.collect(action.statements());
        if (refs.usesTables()) {
            body.addAll(TableAccessCompiler.load(refs.tables()));
        }
        body.addAll(statements.compileAll(action.statements(), scope));
        return new CodeBuilder()
                .block("async " + action.name() + "(" + String.join(", ", params) + "): Promise<" + returns + "> {", body, "}")
                .toLines();
    }

}
