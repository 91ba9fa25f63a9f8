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

/**
 * Suffix refinements applied to a base locator, in declaration order.
 */
public sealed interface SelectorModifier extends AstNode permits
        SelectorModifier.First, SelectorModifier.Last, SelectorModifier.Nth, SelectorModifier.WithText,
        SelectorModifier.WithoutText, SelectorModifier.Has, SelectorModifier.HasNot {

    record First() implements SelectorModifier {
    }

    record Last() implements SelectorModifier {
    }

    record Nth(int index) implements SelectorModifier {
    }

    record WithText(String text) implements SelectorModifier {
    }

    record WithoutText(String text) implements SelectorModifier {
    }

    record Has(Selector selector) implements SelectorModifier {
    }

    record HasNot(Selector selector) implements SelectorModifier {
    }

}
