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
package io.vero.core;

import io.vero.common.Json;
import io.vero.compiler.CompileOptions;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Project configuration loaded from vero-pom.json.
 * <p>
 * Example vero-pom.json:
 * <pre>
 * {
 *   "input": "build/vero-ast.json",
 *   "outputDir": "./generated",
 *   "pageObjectDir": "pages",
 *   "pageActionsDir": "pageActions",
 *   "testDir": "tests",
 *   "fixtureDir": "fixtures",
 *   "debug": false,
 *   "evidenceScreenshots": true,
 *   "logLevel": "info"
 * }
 * </pre>
 */
public class VeroPom {

    public static final String DEFAULT_FILE = "vero-pom.json";

    private String input;
    private String outputDir;
    private String pageObjectDir;
    private String pageActionsDir;
    private String testDir;
    private String fixtureDir;
    private Boolean debug;
    private Boolean evidenceScreenshots;
    private String logLevel;

    /**
     * @throws RuntimeException if the file cannot be read or parsed
     */
    public static VeroPom load(Path configPath) {
        try {
            String content = Files.readString(configPath);
            return parse(content);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load config from: " + configPath, e);
        }
    }

    /**
     * @throws RuntimeException if the JSON is invalid or not an object
     */
    public static VeroPom parse(String json) {
        Json j = Json.of(json);
        if (!j.isObject()) {
            throw new RuntimeException("Invalid config: expected JSON object");
        }
        VeroPom config = new VeroPom();
        j.<String>getOptional("input").ifPresent(config::setInput);
        j.<String>getOptional("outputDir").ifPresent(config::setOutputDir);
        j.<String>getOptional("pageObjectDir").ifPresent(config::setPageObjectDir);
        j.<String>getOptional("pageActionsDir").ifPresent(config::setPageActionsDir);
        j.<String>getOptional("testDir").ifPresent(config::setTestDir);
        j.<String>getOptional("fixtureDir").ifPresent(config::setFixtureDir);
        j.<Boolean>getOptional("debug").ifPresent(config::setDebug);
        j.<Boolean>getOptional("evidenceScreenshots").ifPresent(config::setEvidenceScreenshots);
        j.<String>getOptional("logLevel").ifPresent(config::setLogLevel);
        return config;
    }

    /**
     * Copies the configured values onto a builder. CLI options override pom values, so call
     * this before applying them.
     */
    public CompileOptions.Builder applyTo(CompileOptions.Builder builder) {
        if (outputDir != null) {
            builder.outputDir(outputDir);
        }
        if (pageObjectDir != null) {
            builder.pageObjectDir(pageObjectDir);
        }
        if (pageActionsDir != null) {
            builder.pageActionsDir(pageActionsDir);
        }
        if (testDir != null) {
            builder.testDir(testDir);
        }
        if (fixtureDir != null) {
            builder.fixtureDir(fixtureDir);
        }
        if (debug != null) {
            builder.debug(debug);
        }
        if (evidenceScreenshots != null) {
            builder.evidenceScreenshots(evidenceScreenshots);
        }
        return builder;
    }

    // ========== Getters and Setters ==========

    public String getInput() {
        return input;
    }

    public void setInput(String input) {
        this.input = input;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getPageObjectDir() {
        return pageObjectDir;
    }

    public void setPageObjectDir(String pageObjectDir) {
        this.pageObjectDir = pageObjectDir;
    }

    public String getPageActionsDir() {
        return pageActionsDir;
    }

    public void setPageActionsDir(String pageActionsDir) {
        this.pageActionsDir = pageActionsDir;
    }

    public String getTestDir() {
        return testDir;
    }

    public void setTestDir(String testDir) {
        this.testDir = testDir;
    }

    public String getFixtureDir() {
        return fixtureDir;
    }

    public void setFixtureDir(String fixtureDir) {
        this.fixtureDir = fixtureDir;
    }

    public Boolean getDebug() {
        return debug;
    }

    public void setDebug(Boolean debug) {
        this.debug = debug;
    }

    public Boolean getEvidenceScreenshots() {
        return evidenceScreenshots;
    }

    public void setEvidenceScreenshots(Boolean evidenceScreenshots) {
        this.evidenceScreenshots = evidenceScreenshots;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public void setLogLevel(String logLevel) {
        this.logLevel = logLevel;
    }

}
