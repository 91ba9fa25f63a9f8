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

import io.vero.compiler.Scope;
import io.vero.compiler.scan.ScenarioCapabilities;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameter lists and local bindings of generated test and fixture functions.
 */
final class TestFunction {

    private TestFunction() {
        // only static methods
    }

    static String parameters(ScenarioCapabilities caps, List<String> extra) {
        List<String> parts = new ArrayList<>();
        parts.add(caps.tabs() ? "page: __initialPage, context" : "page");
        if (caps.api()) {
            parts.add("request");
        }
        parts.addAll(extra);
        return "{ " + String.join(", ", parts) + " }";
    }

    static List<String> prologue(ScenarioCapabilities caps) {
        List<String> lines = new ArrayList<>();
        if (caps.tabs()) {
            lines.add("let page = __initialPage;");
        }
        locals(caps, lines);
        return lines;
    }

    /**
     * Frame and API locals, shared by every kind of function body.
     */
    static void locals(ScenarioCapabilities caps, List<String> lines) {
        if (caps.frames()) {
            lines.add("let " + Scope.FRAME + ": FrameLocator | null = null;");
        }
        if (caps.api()) {
            lines.add("let " + Scope.API_RESPONSE + ": APIResponse;");
        }
    }

}
