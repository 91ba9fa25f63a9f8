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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generated TypeScript units keyed by unit name, in program order.
 */
public class CompileResult {

    private final Map<String, String> pages;
    private final Map<String, String> pageActions;
    private final Map<String, String> features;
    private final Map<String, String> fixtures;
    private final String fixtureIndex;
    private final List<CompileWarning> warnings;

    public CompileResult(Map<String, String> pages, Map<String, String> pageActions, Map<String, String> features,
                  Map<String, String> fixtures, String fixtureIndex, List<CompileWarning> warnings) {
        this.pages = Collections.unmodifiableMap(new LinkedHashMap<>(pages));
        this.pageActions = Collections.unmodifiableMap(new LinkedHashMap<>(pageActions));
        this.features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
        this.fixtures = Collections.unmodifiableMap(new LinkedHashMap<>(fixtures));
        this.fixtureIndex = fixtureIndex;
        this.warnings = List.copyOf(warnings);
    }

    public Map<String, String> getPages() {
        return pages;
    }

    public Map<String, String> getPageActions() {
        return pageActions;
    }

    public Map<String, String> getFeatures() {
        return features;
    }

    public Map<String, String> getFixtures() {
        return fixtures;
    }

    /**
     * @return the combined fixture module, null when the program declares no fixtures
     */
    public String getFixtureIndex() {
        return fixtureIndex;
    }

    public List<CompileWarning> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int getUnitCount() {
        return pages.size() + pageActions.size() + features.size() + fixtures.size() + (fixtureIndex == null ? 0 : 1);
    }

}
