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

import io.vero.ast.*;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects what a compilation unit refers to, so that imports, preload code and the env block
 * can be emitted before the body.
 */
public class ReferenceCollector {

    private final Set<String> tables = new TreeSet<>();
    private final Set<String> pages = new LinkedHashSet<>();
    private boolean env;
    private boolean utilities;
    private boolean api;

    public static References collect(Feature feature) {
        List<AstNode> roots = new ArrayList<>();
        for (Feature.Hook hook : feature.hooks()) {
            roots.addAll(hook.statements());
        }
        for (Scenario scenario : feature.scenarios()) {
            roots.addAll(scenario.statements());
        }
        for (Feature.FixtureUse use : feature.fixtures()) {
            roots.addAll(use.options().values());
        }
        return collect(roots);
    }

    public static References collect(Collection<? extends AstNode> roots) {
        ReferenceCollector collector = new ReferenceCollector();
        TreeFold.fold(roots, collector, ReferenceCollector::visit, TreeFold.DESCEND_ALL);
        return collector.toReferences();
    }

    private ReferenceCollector visit(AstNode node) {
        if (node instanceof TableReference t && t.tableName() != null) {
            tables.add(t.qualifiedName());
        } else if (node instanceof Statement.Load l && l.tableName() != null) {
            tables.add(l.projectName() == null ? l.tableName() : l.projectName() + "." + l.tableName());
        } else if (node instanceof Expression.EnvVarReference) {
            env = true;
        } else if (node instanceof Expression.Utility) {
            utilities = true;
        } else if (node instanceof Expression.VariableReference v && v.page() != null) {
            pages.add(v.page());
        } else if (node instanceof Target.Field f && f.page() != null) {
            pages.add(f.page());
        } else if (node instanceof ActionCall c && c.page() != null) {
            pages.add(c.page());
        }
        if (ScenarioCapabilities.API_USE.test(node)) {
            api = true;
        }
        return this;
    }

    private References toReferences() {
        return new References(Collections.unmodifiableSet(tables), Collections.unmodifiableSet(pages), env, utilities, api);
    }

}
