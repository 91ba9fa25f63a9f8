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

/**
 * A selector description: kind, raw value and an ordered modifier chain.
 *
 * @param name accessible-name qualifier, only used by {@link Kind#ROLE}
 */
public record Selector(Kind kind, String value, String name, List<SelectorModifier> modifiers) implements AstNode {

    public enum Kind {
        AUTO, BUTTON, TEXTBOX, LINK, CHECKBOX, HEADING, COMBOBOX, RADIO, ROLE,
        LABEL, PLACEHOLDER, TESTID, TEXT, ALT, TITLE, CSS, XPATH;

        public boolean isRoleShorthand() {
            return switch (this) {
                case BUTTON, TEXTBOX, LINK, CHECKBOX, HEADING, COMBOBOX, RADIO -> true;
                default -> false;
            };
        }
    }

    public Selector {
        kind = kind == null ? Kind.AUTO : kind;
        modifiers = AstNode.list(modifiers);
    }

    public static Selector of(Kind kind, String value) {
        return new Selector(kind, value, null, List.of());
    }

    public static Selector auto(String value) {
        return of(Kind.AUTO, value);
    }

    public Selector with(SelectorModifier... more) {
        List<SelectorModifier> list = new java.util.ArrayList<>(modifiers);
        list.addAll(List.of(more));
        return new Selector(kind, value, name, list);
    }

}
