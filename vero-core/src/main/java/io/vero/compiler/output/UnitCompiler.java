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

import io.vero.ast.Program;
import io.vero.common.StringUtils;
import io.vero.compiler.CodeBuilder;
import io.vero.compiler.CompileContext;
import io.vero.compiler.CompileOptions;
import io.vero.compiler.CompileWarning;
import io.vero.compiler.data.TableAccessCompiler;
import io.vero.compiler.scan.References;
import io.vero.compiler.scan.ScenarioCapabilities;
import io.vero.compiler.statement.StatementCompiler;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Base of the per-unit compilers. Each instance compiles exactly one unit with its own
 * {@link CompileContext}.
 */
public abstract class UnitCompiler {

    public static final String PLAYWRIGHT = "@playwright/test";
    public static final String UTILS_MODULE = "vero-utils";
    public static final String DATA_MODULE = "DataManager";

    protected final Program program;
    protected final CompileOptions options;
    protected final CompileContext context;
    protected final StatementCompiler statements;

    protected UnitCompiler(Program program, CompileOptions options, String unitName) {
        this.program = program;
        this.options = options;
        this.context = new CompileContext(program, options, unitName);
        this.statements = new StatementCompiler(context);
    }

    public abstract String compile();

    public List<CompileWarning> getWarnings() {
        return context.getWarnings();
    }

    /**
     * Module path from a sibling output directory, e.g. {@code ../pages/LoginPage}.
     */
    protected static String sibling(String dir, String module) {
        return "../" + dir + "/" + module;
    }

    protected void runtimeImports(Imports imports, References refs) {
        String runtime = options.getRuntimeDir();
        if (refs.utilities()) {
            imports.add(sibling(runtime, UTILS_MODULE), "veroString", "veroDate", "veroNumber", "veroConvert", "veroGenerate");
        }
        if (refs.usesTables()) {
            imports.add(sibling(runtime, DATA_MODULE), "createDataManager");
            imports.addType(sibling(runtime, DATA_MODULE), "DataRow");
        }
    }

    /**
     * Module-level env block and data bindings for units whose bodies read them.
     */
    protected static void modulePrelude(CodeBuilder cb, References refs) {
        if (refs.env()) {
            cb.line(FeatureCompiler.ENV_BLOCK);
            cb.blank();
        }
        if (refs.usesTables()) {
            cb.lines(TableAccessCompiler.bindings(refs.tables()));
            cb.blank();
        }
    }

    protected static void capabilityTypes(Imports imports, ScenarioCapabilities caps) {
        if (caps.frames()) {
            imports.addType(PLAYWRIGHT, "FrameLocator");
        }
        if (caps.api()) {
            imports.addType(PLAYWRIGHT, "APIResponse");
        }
    }

    /**
     * Names among {@code candidates} declared in the program as a page or page-action group,
     * in first-seen order.
     */
    protected Set<String> knownPages(Collection<String> candidates) {
        Set<String> known = new LinkedHashSet<>();
        for (String name : candidates) {
            if (program.findPage(name) != null || program.findPageActions(name) != null) {
                known.add(name);
            }
        }
        return known;
    }

    protected Map<String, String> camelBindings(Collection<String> names) {
        Map<String, String> bindings = new LinkedHashMap<>();
        for (String name : names) {
            bindings.put(name, StringUtils.toCamelCase(name));
        }
        return bindings;
    }

    /**
     * Import for a page or page-action class as seen from {@code fromDir}.
     */
    protected void classImport(Imports imports, String fromDir, String name) {
        String dir = program.findPage(name) != null ? options.getPageObjectDir() : options.getPageActionsDir();
        imports.add(dir.equals(fromDir) ? "./" + name : sibling(dir, name), name);
    }

}
