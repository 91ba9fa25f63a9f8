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

import io.vero.common.StringUtils;
import io.vero.compiler.scan.ScenarioCapabilities;

import java.util.List;
import java.util.Map;

/**
 * Where a statement list is being compiled: how the page is spelled, which page objects are
 * in reach, and what the enclosing function provides.
 *
 * @param pageHandle expression for the active page, {@code page} or {@code this.page}
 * @param currentPage page whose fields resolve to {@link #selfRef}, null outside pages
 * @param selfRef expression for the current page object, {@code this} inside a page class
 * @param bindings page or page-action name to the expression holding its instance
 * @param rebinds statements re-creating page objects after the page handle changed
 * @param wrapSteps wrap interactions in {@code test.step}
 * @param hoisted declarations are hoisted, so statements assign instead of declaring
 */
public record Scope(String pageHandle, String currentPage, String selfRef, Map<String, String> bindings,
                    List<String> rebinds, ScenarioCapabilities capabilities, boolean wrapSteps, boolean hoisted) {

    public static final String FRAME = "__frame";
    public static final String API_RESPONSE = "__vero_apiResponse";

    public Scope {
        bindings = Map.copyOf(bindings);
        rebinds = List.copyOf(rebinds);
    }

    public static Scope scenario(Map<String, String> bindings, List<String> rebinds, ScenarioCapabilities capabilities) {
        return new Scope("page", null, null, bindings, rebinds, capabilities, true, false);
    }

    public static Scope pageObject(String pageName, Map<String, String> bindings, ScenarioCapabilities capabilities) {
        return new Scope("this.page", pageName, "this", bindings, List.of(), capabilities, false, false);
    }

    public static Scope pageActions(String forPage, Map<String, String> bindings, ScenarioCapabilities capabilities) {
        return new Scope("this.page", forPage, "this." + StringUtils.toCamelCase(forPage), bindings, List.of(), capabilities,
                false, false);
    }

    public Scope withCapabilities(ScenarioCapabilities value) {
        return new Scope(pageHandle, currentPage, selfRef, bindings, rebinds, value, wrapSteps, hoisted);
    }

    public Scope withHoisted(boolean value) {
        return new Scope(pageHandle, currentPage, selfRef, bindings, rebinds, capabilities, wrapSteps, value);
    }

    /**
     * Root every inline locator hangs off; the frame handle wins while one is active.
     */
    public String locatorRoot() {
        return capabilities.frames() ? "(" + FRAME + " ?? " + pageHandle + ")" : pageHandle;
    }

    public String contextHandle() {
        return capabilities.tabs() && "page".equals(pageHandle) ? "context" : pageHandle + ".context()";
    }

    public String requestHandle() {
        return "page".equals(pageHandle) ? "request" : pageHandle + ".request";
    }

    /**
     * @return expression for the named page object; the current page resolves to {@link #selfRef}
     */
    public String resolvePage(String page) {
        if (page == null || page.equals(currentPage)) {
            return selfRef;
        }
        String bound = bindings.get(page);
        return bound != null ? bound : StringUtils.toCamelCase(page);
    }

    public String declare(String name) {
        return hoisted ? name : "const " + name;
    }

}
