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

import io.vero.ast.Program;
import io.vero.log.LogContext;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * State of one compilation pass over one unit (page, page-action group, fixture or feature).
 * A fresh instance is created per unit and discarded afterwards.
 */
public class CompileContext {

    private static final Logger logger = LogContext.COMPILER_LOGGER;

    private final Program program;
    private final CompileOptions options;
    private final String unitName;
    private final List<CompileWarning> warnings = new ArrayList<>();
    private int tempCounter;

    public CompileContext(Program program, CompileOptions options, String unitName) {
        this.program = program;
        this.options = options;
        this.unitName = unitName;
    }

    public Program getProgram() {
        return program;
    }

    public CompileOptions getOptions() {
        return options;
    }

    public String getUnitName() {
        return unitName;
    }

    /**
     * @return a unit-unique temporary identifier such as {@code __rows3}
     */
    public String nextTemp(String prefix) {
        tempCounter++;
        return "__" + prefix + tempCounter;
    }

    public void warn(String code, int line, String message) {
        CompileWarning warning = new CompileWarning(code, unitName, line, message);
        logger.debug("{}", warning);
        warnings.add(warning);
    }

    public List<CompileWarning> getWarnings() {
        return warnings;
    }

}
