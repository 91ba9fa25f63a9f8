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

/**
 * A non-fatal finding reported next to the generated code.
 *
 * @param unit name of the page, feature or fixture being compiled
 * @param line source line, 0 when unknown
 */
public record CompileWarning(String code, String unit, int line, String message) {

    public static final String UNSUPPORTED_STATEMENT = "VERO1001";
    public static final String UNRESOLVED_FIELD = "VERO1002";
    public static final String MISSING_SELECTOR = "VERO1003";
    public static final String UNKNOWN_PAGE = "VERO2001";
    public static final String UNKNOWN_ACTION = "VERO2002";
    public static final String UNKNOWN_FIELD = "VERO2003";
    public static final String UNKNOWN_FIXTURE = "VERO2004";

    @Override
    public String toString() {
        return code + " " + unit + (line > 0 ? ":" + line : "") + " " + message;
    }

}
