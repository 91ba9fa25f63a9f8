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

import java.util.ArrayList;
import java.util.List;

/**
 * Line buffer with symmetric indentation. Blocks opened with {@link #open(String)} must be
 * closed with {@link #close(String)}.
 */
public class CodeBuilder {

    public static final String INDENT = "  ";

    private final List<String> lines = new ArrayList<>();
    private int depth;

    public CodeBuilder line(String text) {
        lines.add(text.isEmpty() ? text : INDENT.repeat(depth) + text);
        return this;
    }

    public CodeBuilder blank() {
        lines.add("");
        return this;
    }

    public CodeBuilder lines(List<String> more) {
        for (String text : more) {
            line(text);
        }
        return this;
    }

    public CodeBuilder open(String header) {
        line(header);
        depth++;
        return this;
    }

    public CodeBuilder close(String footer) {
        if (depth == 0) {
            throw new IllegalStateException("unbalanced block: " + footer);
        }
        depth--;
        line(footer);
        return this;
    }

    /**
     * Closes the current block and opens a sibling, as in {@code } else {}.
     */
    public CodeBuilder reopen(String text) {
        close(text);
        depth++;
        return this;
    }

    public CodeBuilder block(String header, List<String> body, String footer) {
        open(header);
        lines(body);
        return close(footer);
    }

    public int getDepth() {
        return depth;
    }

    public List<String> toLines() {
        return List.copyOf(lines);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (String text : lines) {
            sb.append(text).append('\n');
        }
        return sb.toString();
    }

}
