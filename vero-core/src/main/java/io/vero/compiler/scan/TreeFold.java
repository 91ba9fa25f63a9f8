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

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * Pre-order fold over the node tree. Every structural pre-scan (tables, environment variables,
 * utilities, API use, tab and frame switching) is an instance of this fold with a different step.
 */
public final class TreeFold {

    public static final Predicate<AstNode> DESCEND_ALL = node -> true;

    private TreeFold() {
        // only static methods
    }

    /**
     * @param descend decides whether the children of a visited node are folded as well
     */
    public static <A> A fold(Collection<? extends AstNode> roots, A seed, BiFunction<A, AstNode, A> step,
                             Predicate<AstNode> descend) {
        Deque<AstNode> stack = new ArrayDeque<>();
        pushAll(stack, List.copyOf(roots));
        A acc = seed;
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            acc = step.apply(acc, node);
            if (descend.test(node)) {
                pushAll(stack, AstChildren.of(node));
            }
        }
        return acc;
    }

    public static boolean anyMatch(Collection<? extends AstNode> roots, Predicate<AstNode> predicate) {
        return fold(roots, false, (found, node) -> found || predicate.test(node), DESCEND_ALL);
    }

    private static void pushAll(Deque<AstNode> stack, List<? extends AstNode> nodes) {
        // reverse so that siblings pop in source order
        for (int i = nodes.size() - 1; i >= 0; i--) {
            AstNode node = nodes.get(i);
            if (node != null) {
                stack.push(node);
            }
        }
    }

}
