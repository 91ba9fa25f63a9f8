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
import io.vero.compiler.CodeBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * The combined fixture unit features import {@code test} and {@code expect} from.
 */
public final class FixtureIndex {

    public static final String INDEX = "index";

    private FixtureIndex() {
        // only static methods
    }

    /**
     * @return the index source, or null when there are no fixtures
     */
    public static String compile(List<Fixture> fixtures) {
        if (fixtures.isEmpty()) {
            return null;
        }
        CodeBuilder cb = new CodeBuilder();
        cb.line("import { mergeTests } from '" + UnitCompiler.PLAYWRIGHT + "';");
        List<String> aliases = new ArrayList<>();
        for (Fixture fixture : fixtures) {
            String alias = FixtureCompiler.alias(fixture.name());
            cb.line("import { test as " + alias + " } from './" + fixture.name() + "';");
            aliases.add(alias);
        }
        cb.blank();
        cb.line("export const test = mergeTests(" + String.join(", ", aliases) + ");");
        cb.line("export { expect } from '" + UnitCompiler.PLAYWRIGHT + "';");
        return cb.toString();
    }

}
