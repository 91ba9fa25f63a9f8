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

import io.vero.ast.AstNode;
import io.vero.ast.Statement;

import java.util.Collection;
import java.util.function.Predicate;

/**
 * What the enclosing function of a statement list must provide: a reassignable page binding
 * for tab switching, a nullable frame handle for frame switching, and the API request fixture.
 */
public record ScenarioCapabilities(boolean tabs, boolean frames, boolean api) {

    public static final ScenarioCapabilities NONE = new ScenarioCapabilities(false, false, false);

    public static final Predicate<AstNode> TAB_SWITCH = node ->
            node instanceof Statement.SwitchToNewTab || node instanceof Statement.SwitchToTab
                    || node instanceof Statement.OpenInNewTab || node instanceof Statement.CloseTab;

    public static final Predicate<AstNode> FRAME_SWITCH = node ->
            node instanceof Statement.SwitchToFrame || node instanceof Statement.SwitchToMainFrame;

    public static final Predicate<AstNode> API_USE = node ->
            node instanceof Statement.ApiRequest || node instanceof Statement.VerifyResponse;

    public static ScenarioCapabilities detect(Collection<? extends Statement> statements) {
        return new ScenarioCapabilities(
                TreeFold.anyMatch(statements, TAB_SWITCH),
                TreeFold.anyMatch(statements, FRAME_SWITCH),
                TreeFold.anyMatch(statements, API_USE));
    }

    public ScenarioCapabilities or(ScenarioCapabilities other) {
        return new ScenarioCapabilities(tabs || other.tabs, frames || other.frames, api || other.api);
    }

}
