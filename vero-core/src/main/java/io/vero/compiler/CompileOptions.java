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
 * Compiler settings. Directories are only used to compute relative import paths between units;
 * the compiler itself never touches the file system.
 */
public class CompileOptions {

    public static final String DEFAULT_OUTPUT_DIR = "./generated";
    public static final String DEFAULT_PAGE_OBJECT_DIR = "pages";
    public static final String DEFAULT_PAGE_ACTIONS_DIR = "pageActions";
    public static final String DEFAULT_TEST_DIR = "tests";
    public static final String DEFAULT_FIXTURE_DIR = "fixtures";
    public static final String DEFAULT_RUNTIME_DIR = "runtime";

    private final String outputDir;
    private final String pageObjectDir;
    private final String pageActionsDir;
    private final String testDir;
    private final String fixtureDir;
    private final String runtimeDir;
    private final boolean debug;
    private final boolean evidenceScreenshots;

    private CompileOptions(Builder builder) {
        outputDir = builder.outputDir;
        pageObjectDir = builder.pageObjectDir;
        pageActionsDir = builder.pageActionsDir;
        testDir = builder.testDir;
        fixtureDir = builder.fixtureDir;
        runtimeDir = builder.runtimeDir;
        debug = builder.debug;
        evidenceScreenshots = builder.evidenceScreenshots;
    }

    public static CompileOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getOutputDir() {
        return outputDir;
    }

    public String getPageObjectDir() {
        return pageObjectDir;
    }

    public String getPageActionsDir() {
        return pageActionsDir;
    }

    public String getTestDir() {
        return testDir;
    }

    public String getFixtureDir() {
        return fixtureDir;
    }

    public String getRuntimeDir() {
        return runtimeDir;
    }

    public boolean isDebug() {
        return debug;
    }

    public boolean isEvidenceScreenshots() {
        return evidenceScreenshots;
    }

    public static class Builder {

        private String outputDir = DEFAULT_OUTPUT_DIR;
        private String pageObjectDir = DEFAULT_PAGE_OBJECT_DIR;
        private String pageActionsDir = DEFAULT_PAGE_ACTIONS_DIR;
        private String testDir = DEFAULT_TEST_DIR;
        private String fixtureDir = DEFAULT_FIXTURE_DIR;
        private String runtimeDir = DEFAULT_RUNTIME_DIR;
        private boolean debug;
        private boolean evidenceScreenshots = true;

        public Builder outputDir(String value) {
            outputDir = value;
            return this;
        }

        public Builder pageObjectDir(String value) {
            pageObjectDir = value;
            return this;
        }

        public Builder pageActionsDir(String value) {
            pageActionsDir = value;
            return this;
        }

        public Builder testDir(String value) {
            testDir = value;
            return this;
        }

        public Builder fixtureDir(String value) {
            fixtureDir = value;
            return this;
        }

        public Builder runtimeDir(String value) {
            runtimeDir = value;
            return this;
        }

        public Builder debug(boolean value) {
            debug = value;
            return this;
        }

        public Builder evidenceScreenshots(boolean value) {
            evidenceScreenshots = value;
            return this;
        }

        public CompileOptions build() {
            return new CompileOptions(this);
        }

    }

}
