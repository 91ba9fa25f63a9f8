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
package io.vero.cli;

import io.vero.compiler.CompileOptions;
import io.vero.core.OutputWriter;
import io.vero.core.VeroPom;
import io.vero.log.LogContext;
import io.vero.output.Console;
import org.slf4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * The 'clean' subcommand: deletes the generated output directory.
 * <p>
 * Usage examples:
 * <pre>
 * # Clean default output directory (honors vero-pom.json if present)
 * vero clean
 *
 * # Clean specific output directory
 * vero clean -o out
 * </pre>
 */
@Command(
        name = "clean",
        mixinStandardHelpOptions = true,
        description = "Clean the generated output directory"
)
public class CleanCommand implements Callable<Integer> {

    private static final Logger logger = LogContext.CLI_LOGGER;

    @Option(
            names = {"-o", "--output"},
            description = "Output directory to clean (default: from vero-pom.json or ./generated)"
    )
    String outputDir;

    @Option(
            names = {"-w", "--workdir"},
            description = "Working directory for relative path resolution (default: current directory)"
    )
    String workingDir;

    @Option(
            names = {"-p", "--pom"},
            description = "Path to project file (default: vero-pom.json)"
    )
    String pomFile;

    @Option(
            names = {"--no-pom"},
            description = "Ignore vero-pom.json even if present"
    )
    boolean noPom;

    private VeroPom pom;

    @Override
    public Integer call() {
        if (!noPom) {
            loadPom();
        }
        Path output = resolve(resolveOutputDir());
        if (!Files.exists(output)) {
            Console.println(Console.info("Nothing to clean: " + output + " does not exist"));
            return 0;
        }
        try {
            OutputWriter.deleteDirectory(output);
            Console.println(Console.info("Cleaned: " + output));
            return 0;
        } catch (Exception e) {
            logger.error("clean failed", e);
            Console.println(Console.fail("Failed to clean output directory: " + e.getMessage()));
            return 1;
        }
    }

    private void loadPom() {
        Path pomPath = resolve(pomFile != null ? pomFile : VeroPom.DEFAULT_FILE);
        if (Files.exists(pomPath)) {
            try {
                pom = VeroPom.load(pomPath);
            } catch (Exception e) {
                // a broken pom does not stop a clean
                logger.warn("ignoring project file: {}", e.getMessage());
            }
        }
    }

    private String resolveOutputDir() {
        if (outputDir != null) {
            return outputDir;
        }
        if (pom != null && pom.getOutputDir() != null) {
            return pom.getOutputDir();
        }
        return CompileOptions.DEFAULT_OUTPUT_DIR;
    }

    private Path resolve(String path) {
        return workingDir != null ? Path.of(workingDir).resolve(path) : Path.of(path);
    }

}
