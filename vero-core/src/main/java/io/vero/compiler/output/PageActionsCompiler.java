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
import io.vero.ast.PageActions;
import io.vero.ast.Program;
import io.vero.ast.Statement;
import io.vero.common.StringUtils;
import io.vero.compiler.CodeBuilder;
import io.vero.compiler.CompileOptions;
import io.vero.compiler.CompileWarning;
import io.vero.compiler.Scope;
import io.vero.compiler.scan.ReferenceCollector;
import io.vero.compiler.scan.References;
import io.vero.compiler.scan.ScenarioCapabilities;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles a page-action group into a helper class that owns an instance of the page it is
 * bound to. Bare field references resolve against that instance.
 */
public class PageActionsCompiler extends UnitCompiler {

    private final PageActions pageActions;

    public PageActionsCompiler(Program program, CompileOptions options, PageActions pageActions) {
        super(program, options, pageActions.name());
        this.pageActions = pageActions;
    }

    @Override
    public String compile() {
        String forPage = pageActions.forPage();
        List<Statement> all = new ArrayList<>();
        pageActions.actions().forEach(a -> all.addAll(a.statements()));
        References refs = ReferenceCollector.collect(all);
        ScenarioCapabilities caps = ScenarioCapabilities.detect(all);
        boolean bound = forPage != null && program.findPage(forPage) != null;
        if (forPage != null && !bound) {
            context.warn(CompileWarning.UNKNOWN_PAGE, pageActions.line(), "page actions '" + pageActions.name()
                    + "' are bound to unknown page '" + forPage + "'");
        }
        Set<String> others = knownPages(refs.pages());
        others.remove(pageActions.name());
        if (forPage != null) {
            others.remove(forPage);
        }
        Map<String, String> bindings = new LinkedHashMap<>();
        for (String other : others) {
            bindings.put(other, "new " + other + "(this.page)");
        }
        Imports imports = new Imports().add(PLAYWRIGHT, "Page");
        capabilityTypes(imports, caps);
        if (bound) {
            classImport(imports, options.getPageActionsDir(), forPage);
        }
        others.forEach(other -> classImport(imports, options.getPageActionsDir(), other));
        runtimeImports(imports, refs);

        Scope scope = bound
                ? Scope.pageActions(forPage, bindings, ScenarioCapabilities.NONE)
                : new Scope("this.page", null, null, bindings, List.of(), ScenarioCapabilities.NONE, false, false);
        String owner = bound ? StringUtils.toCamelCase(forPage) : null;
        CodeBuilder cb = new CodeBuilder();
        cb.lines(imports.toLines());
        cb.blank();
        modulePrelude(cb, refs);
        cb.open("export class " + pageActions.name() + " {");
        cb.line((caps.tabs() ? "" : "readonly ") + "page: Page;");
        if (owner != null) {
            cb.line("readonly " + owner + ": " + forPage + ";");
        }
        cb.blank();
        cb.open("constructor(page: Page) {");
        cb.line("this.page = page;");
        if (owner != null) {
            cb.line("this." + owner + " = new " + forPage + "(page);");
        }
        cb.close("}");
        for (ActionDefinition action : pageActions.actions()) {
            cb.blank();
            cb.lines(PageCompiler.action(action, scope, statements));
        }
        cb.close("}");
        return cb.toString();
    }

}
