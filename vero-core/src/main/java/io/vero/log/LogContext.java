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
package io.vero.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Category loggers. All of them live under the {@code vero} logger so one level setting
 * controls every category.
 */
public final class LogContext {

    private LogContext() {
        // only constants
    }

    /** Logger for compilation passes, warnings and unit statistics */
    public static final Logger COMPILER_LOGGER = LoggerFactory.getLogger("vero.compiler");

    /** Logger for CLI commands, configuration loading and file output */
    public static final Logger CLI_LOGGER = LoggerFactory.getLogger("vero.cli");

    /** Logger for console output (compile summary) */
    public static final Logger CONSOLE_LOGGER = LoggerFactory.getLogger("vero.console");

    /**
     * Sets the level of the root {@code vero} logger when Logback is the SLF4J backend.
     *
     * @param level trace, debug, info, warn or error
     * @return false if the backend is not Logback
     */
    public static boolean setLogLevel(String level) {
        Logger root = LoggerFactory.getLogger("vero");
        if (root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(ch.qos.logback.classic.Level.toLevel(level, ch.qos.logback.classic.Level.INFO));
            return true;
        }
        return false;
    }

}
