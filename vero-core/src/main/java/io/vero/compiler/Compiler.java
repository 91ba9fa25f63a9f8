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
package io.vero.compiler;

import io.vero.ast.Feature;
import io.vero.ast.Fixture;
import io.vero.ast.Page;
import io.vero.ast.PageActions;
import io.vero.ast.Program;
import io.vero.compiler.output.FeatureCompiler;
import io.vero.compiler.output.FixtureCompiler;
import io.vero.compiler.output.FixtureIndex;
import io.vero.compiler.output.PageActionsCompiler;
import io.vero.compiler.output.PageCompiler;
import io.vero.compiler.output.UnitCompiler;
import io.vero.compiler.validate.ReferenceValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point: compiles a whole {@link Program} into Playwright TypeScript units.
 *
 * <pre>
 * CompileResult result = new Compiler(CompileOptions.defaults()).compile(program);
 * result.getFeatures().get("Login");
 * </pre>
 *
 * Instances hold no mutable state and may be reused; every unit gets a fresh context.
 */
public class Compiler {

    private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

    private final CompileOptions options;

    public Compiler() {
        this(CompileOptions.defaults());
    }

    public Compiler(CompileOptions options) {
        this.options = options;
    }

    public CompileOptions getOptions() {
        return options;
    }

    public CompileResult compile(Program program) {
        long start = System.currentTimeMillis();
        List<CompileWarning> warnings = new ArrayList<>(ReferenceValidator.validate(program));
        Map<String, String> pages = new LinkedHashMap<>();
        for (Page page : program.pages()) {
            pages.put(page.name(), run(new PageCompiler(program, options, page), warnings));
        }
        Map<String, String> pageActions = new LinkedHashMap<>();
        for (PageActions group : program.pageActions()) {
            pageActions.put(group.name(), run(new PageActionsCompiler(program, options, group), warnings));
        }
        Map<String, String> fixtures = new LinkedHashMap<>();
        for (Fixture fixture : program.fixtures()) {
            fixtures.put(fixture.name(), run(new FixtureCompiler(program, options, fixture), warnings));
        }
        Map<String, String> features = new LinkedHashMap<>();
        for (Feature feature : program.features()) {
            features.put(feature.name(), run(new FeatureCompiler(program, options, feature), warnings));
        }
        String fixtureIndex = FixtureIndex.compile(program.fixtures());
        CompileResult result = new CompileResult(pages, pageActions, features, fixtures, fixtureIndex, warnings);
        logger.debug("compiled {} units with {} warnings in {} ms", result.getUnitCount(), warnings.size(),
                System.currentTimeMillis() - start);
        return result;
    }

    private static String run(UnitCompiler unit, List<CompileWarning> warnings) {
        String code = unit.compile();
        warnings.addAll(unit.getWarnings());
        return code;
    }

}
