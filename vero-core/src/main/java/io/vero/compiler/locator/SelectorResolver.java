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
package io.vero.compiler.locator;

import io.vero.ast.Selector;
import io.vero.ast.SelectorModifier;
import io.vero.ast.Target;
import io.vero.common.StringUtils;
import io.vero.compiler.CompileContext;
import io.vero.compiler.CompileWarning;
import io.vero.compiler.Scope;

import java.util.Locale;
import java.util.regex.Pattern;

import static io.vero.common.StringUtils.quote;

/**
 * Turns selectors and targets into Playwright locator expressions.
 */
public class SelectorResolver {

    private static final String[] STRUCTURAL_PREFIXES = {"#", ".", "//", "/html"};
    private static final Pattern PSEUDO_PATTERN = Pattern.compile(":[a-z-]+(\\(|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG_SELECTOR_PATTERN = Pattern.compile("^[a-z]+[.#\\[].*", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final CompileContext context;

    public SelectorResolver(CompileContext context) {
        this.context = context;
    }

    /**
     * Heuristic for legacy AUTO selectors: true when the value looks like CSS or XPath rather
     * than visible text.
     */
    public static boolean isStructural(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (String prefix : STRUCTURAL_PREFIXES) {
            if (value.startsWith(prefix)) {
                return true;
            }
        }
        if (value.startsWith("[") && value.contains("]")) {
            return true;
        }
        if (value.contains(">") || value.contains("~") || value.contains("+")) {
            return true;
        }
        if (value.contains(":") && PSEUDO_PATTERN.matcher(value).find()) {
            return true;
        }
        return TAG_SELECTOR_PATTERN.matcher(value).matches();
    }

    /**
     * A missing selector falls back to the page body with a warning.
     */
    public String resolve(Selector selector, String root) {
        if (selector == null) {
            context.warn(CompileWarning.MISSING_SELECTOR, 0, "missing selector, using the page body");
            return root + ".locator('body')";
        }
        StringBuilder sb = new StringBuilder(base(selector, root));
        for (SelectorModifier modifier : selector.modifiers()) {
            sb.append(modifier(modifier, root));
        }
        return sb.toString();
    }

    private String base(Selector selector, String root) {
        String value = selector.value() == null ? "" : selector.value();
        Selector.Kind kind = selector.kind();
        if (kind.isRoleShorthand()) {
            return root + ".getByRole(" + quote(kind.name().toLowerCase(Locale.ROOT)) + ", { name: " + quote(value) + ", exact: true })";
        }
        return switch (kind) {
            case ROLE -> selector.name() == null
                    ? root + ".getByRole(" + quote(value) + ")"
                    : root + ".getByRole(" + quote(value) + ", { name: " + quote(selector.name()) + ", exact: true })";
            case LABEL -> root + ".getByLabel(" + quote(value) + ")";
            case PLACEHOLDER -> root + ".getByPlaceholder(" + quote(value) + ")";
            case TESTID -> root + ".getByTestId(" + quote(value) + ")";
            case TEXT -> root + ".getByText(" + quote(value) + ")";
            case ALT -> root + ".getByAltText(" + quote(value) + ")";
            case TITLE -> root + ".getByTitle(" + quote(value) + ")";
            case CSS -> root + ".locator(" + quote(value) + ")";
            case XPATH -> root + ".locator(" + quote(value.startsWith("xpath=") ? value : "xpath=" + value) + ")";
            default -> isStructural(value)
                    ? root + ".locator(" + quote(value) + ")"
                    : root + ".getByText(" + quote(value) + ")";
        };
    }

    private String modifier(SelectorModifier modifier, String root) {
        if (modifier instanceof SelectorModifier.First) {
            return ".first()";
        } else if (modifier instanceof SelectorModifier.Last) {
            return ".last()";
        } else if (modifier instanceof SelectorModifier.Nth n) {
            return ".nth(" + n.index() + ")";
        } else if (modifier instanceof SelectorModifier.WithText w) {
            return ".filter({ hasText: " + quote(w.text()) + " })";
        } else if (modifier instanceof SelectorModifier.WithoutText w) {
            return ".filter({ hasNotText: " + quote(w.text()) + " })";
        } else if (modifier instanceof SelectorModifier.Has h && h.selector() != null) {
            return ".filter({ has: " + resolve(h.selector(), root) + " })";
        } else if (modifier instanceof SelectorModifier.HasNot h && h.selector() != null) {
            return ".filter({ hasNot: " + resolve(h.selector(), root) + " })";
        }
        return "";
    }

    /**
     * Locator for a target. Page fields resolve through the scope so that the page being
     * compiled refers to itself.
     */
    public String resolve(Target target, Scope scope, int line) {
        if (target instanceof Target.Locator l) {
            return resolve(l.selector(), scope.locatorRoot());
        } else if (target instanceof Target.Field f) {
            String owner = scope.resolvePage(f.page());
            if (owner == null) {
                context.warn(CompileWarning.UNRESOLVED_FIELD, line,
                        "field '" + f.field() + "' has no page and no current page, using it as text");
                return scope.locatorRoot() + ".getByText(" + quote(f.field()) + ")";
            }
            return owner + "." + f.field();
        } else if (target instanceof Target.Text t) {
            return scope.locatorRoot() + ".getByText(" + quote(t.text()) + ")";
        }
        return scope.locatorRoot() + ".locator('body')";
    }

    /**
     * Short human readable name used in step titles and debug events.
     */
    public static String describe(Target target) {
        if (target instanceof Target.Field f) {
            return f.describe();
        } else if (target instanceof Target.Locator l && l.selector() != null) {
            return StringUtils.trimToNull(l.selector().value()) == null ? l.selector().kind().name() : l.selector().value();
        } else if (target instanceof Target.Text t) {
            return t.text();
        }
        return "page";
    }

}
