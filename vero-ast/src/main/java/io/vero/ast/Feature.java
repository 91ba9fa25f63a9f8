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
package io.vero.ast;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A test suite: hooks plus scenarios, with the pages and fixtures it relies on.
 *
 * @param uses pages or page-action groups named explicitly; others are inferred from use
 */
public record Feature(String name, Set<Annotation> annotations, List<String> uses, List<FixtureUse> fixtures,
                      List<Hook> hooks, List<Scenario> scenarios, int line) {

    public enum Annotation {SERIAL, SKIP, ONLY}

    public Feature {
        annotations = annotations == null ? Set.of() : Set.copyOf(annotations);
        uses = AstNode.list(uses);
        fixtures = AstNode.list(fixtures);
        hooks = AstNode.list(hooks);
        scenarios = AstNode.list(scenarios);
    }

    public record FixtureUse(String fixtureName, Map<String, Expression> options) {

        public FixtureUse {
            options = AstNode.map(options);
        }

    }

    public record Hook(Type type, List<Statement> statements) {

        public enum Type {BEFORE_ALL, BEFORE_EACH, AFTER_ALL, AFTER_EACH}

        public Hook {
            statements = AstNode.list(statements);
        }

    }

}
