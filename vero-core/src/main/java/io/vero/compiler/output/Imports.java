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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Import statements of one generated unit, grouped per module in insertion order.
 */
class Imports {

    private final Map<String, Set<String>> values = new LinkedHashMap<>();
    private final Map<String, Set<String>> types = new LinkedHashMap<>();

    Imports add(String module, String... names) {
        Set<String> set = values.computeIfAbsent(module, k -> new LinkedHashSet<>());
        for (String name : names) {
            set.add(name);
        }
        return this;
    }

    Imports addType(String module, String... names) {
        Set<String> set = types.computeIfAbsent(module, k -> new LinkedHashSet<>());
        for (String name : names) {
            set.add(name);
        }
        return this;
    }

    List<String> toLines() {
        List<String> lines = new ArrayList<>();
        values.forEach((module, names) -> lines.add("import { " + String.join(", ", names) + " } from '" + module + "';"));
        types.forEach((module, names) -> {
            if (!names.isEmpty()) {
                lines.add("import type { " + String.join(", ", names) + " } from '" + module + "';");
            }
        });
        return lines;
    }

}
