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
package io.vero.compiler.validate;

import io.vero.ast.ActionCall;
import io.vero.ast.ActionDefinition;
import io.vero.ast.AstNode;
import io.vero.ast.Expression;
import io.vero.ast.Feature;
import io.vero.ast.Fixture;
import io.vero.ast.Page;
import io.vero.ast.PageActions;
import io.vero.ast.Program;
import io.vero.ast.Statement;
import io.vero.ast.Target;
import io.vero.common.StringUtils;
import io.vero.compiler.CompileWarning;
import io.vero.compiler.scan.TreeFold;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Checks page, action, field and fixture names against the program before code is generated.
 * Findings are warnings; generation proceeds regardless.
 */
public class ReferenceValidator {

    private static final int MAX_SUGGESTION_DISTANCE = 3;

    private final Program program;
    private final List<CompileWarning> warnings = new ArrayList<>();

    private String unit;
    private String ownPage;
    private int line;

    private ReferenceValidator(Program program) {
        this.program = program;
    }

    public static List<CompileWarning> validate(Program program) {
        ReferenceValidator validator = new ReferenceValidator(program);
        for (Page page : program.pages()) {
            validator.walk(page.name(), page.name(), actionStatements(page.actions()));
        }
        for (PageActions pageActions : program.pageActions()) {
            validator.walk(pageActions.name(), pageActions.forPage(), actionStatements(pageActions.actions()));
        }
        for (Fixture fixture : program.fixtures()) {
            List<Statement> all = new ArrayList<>(fixture.setup());
            all.addAll(fixture.teardown());
            validator.walk(fixture.name(), null, all);
        }
        for (Feature feature : program.features()) {
            validator.feature(feature);
        }
        return validator.warnings;
    }

    private static List<Statement> actionStatements(List<ActionDefinition> actions) {
        List<Statement> all = new ArrayList<>();
        actions.forEach(a -> all.addAll(a.statements()));
        return all;
    }

    private void feature(Feature feature) {
        unit = feature.name();
        line = feature.line();
        for (String use : feature.uses()) {
            if (program.findPage(use) == null && program.findPageActions(use) == null) {
                warn(CompileWarning.UNKNOWN_PAGE, "unknown page '" + use + "'" + suggest(use, pageNames()));
            }
        }
        List<String> fixtureNames = program.fixtures().stream().map(Fixture::name).toList();
        for (Feature.FixtureUse use : feature.fixtures()) {
            if (!fixtureNames.contains(use.fixtureName())) {
                warn(CompileWarning.UNKNOWN_FIXTURE, "unknown fixture '" + use.fixtureName() + "'"
                        + suggest(use.fixtureName(), fixtureNames));
            }
        }
        List<Statement> all = new ArrayList<>();
        feature.hooks().forEach(h -> all.addAll(h.statements()));
        feature.scenarios().forEach(s -> all.addAll(s.statements()));
        walk(feature.name(), null, all);
    }

    private void walk(String unitName, String pageName, List<Statement> statements) {
        unit = unitName;
        ownPage = pageName;
        line = 0;
        TreeFold.fold(statements, this, ReferenceValidator::visit, TreeFold.DESCEND_ALL);
    }

    private ReferenceValidator visit(AstNode node) {
        if (node instanceof Statement s) {
            line = s.line();
        }
        if (node instanceof ActionCall call) {
            checkAction(call.page(), call.action());
        } else if (node instanceof Target.Field field) {
            checkField(field.page(), field.field());
        } else if (node instanceof Expression.VariableReference ref && ref.page() != null) {
            checkPage(ref.page());
        }
        return this;
    }

    private boolean checkPage(String name) {
        if (program.findPage(name) != null || program.findPageActions(name) != null) {
            return true;
        }
        warn(CompileWarning.UNKNOWN_PAGE, "unknown page '" + name + "'" + suggest(name, pageNames()));
        return false;
    }

    private void checkAction(String pageName, String action) {
        String owner = pageName == null ? ownPage : pageName;
        if (owner == null || !checkPage(owner)) {
            return;
        }
        List<String> actions = new ArrayList<>();
        Page page = program.findPage(owner);
        if (page != null) {
            page.actions().forEach(a -> actions.add(a.name()));
        }
        PageActions pageActions = program.findPageActions(owner);
        if (pageActions != null) {
            pageActions.actions().forEach(a -> actions.add(a.name()));
        }
        if (!actions.contains(action)) {
            warn(CompileWarning.UNKNOWN_ACTION, "unknown action '" + owner + "." + action + "'" + suggest(action, actions));
        }
    }

    private void checkField(String pageName, String field) {
        String owner = pageName == null ? ownPage : pageName;
        if (owner == null || !checkPage(owner)) {
            return;
        }
        Page page = program.findPage(owner);
        if (page != null && !page.hasField(field)) {
            List<String> fields = page.fields().stream().map(Page.Field::name).toList();
            warn(CompileWarning.UNKNOWN_FIELD, "unknown field '" + owner + "." + field + "'" + suggest(field, fields));
        }
    }

    private List<String> pageNames() {
        List<String> names = new ArrayList<>();
        program.pages().forEach(p -> names.add(p.name()));
        program.pageActions().forEach(p -> names.add(p.name()));
        return names;
    }

    /**
     * @return a {@code did you mean} suffix for the closest candidate, or empty when none is close
     */
    static String suggest(String name, Collection<String> candidates) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            int distance = StringUtils.levenshtein(name, candidate);
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        if (best == null || bestDistance > MAX_SUGGESTION_DISTANCE) {
            return StringUtils.EMPTY;
        }
        return ", did you mean '" + best + "'?";
    }

    private void warn(String code, String message) {
        warnings.add(new CompileWarning(code, unit, line, message));
    }

}
