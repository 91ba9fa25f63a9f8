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

import io.vero.Main;
import io.vero.ast.AstReader;
import io.vero.ast.Program;
import io.vero.compiler.CompileOptions;
import io.vero.compiler.CompileResult;
import io.vero.compiler.CompileWarning;
import io.vero.compiler.Compiler;
import io.vero.core.OutputWriter;
import io.vero.core.VeroPom;
import io.vero.log.LogContext;
import io.vero.output.Console;
import org.slf4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * The 'compile' subcommand: reads an AST document and writes the generated TypeScript.
 * <p>
 * Usage examples:
 * <pre>
 * # Compile using vero-pom.json
 * vero compile
 *
 * # Compile a specific AST file into a custom directory
 * vero compile build/vero-ast.json -o out
 *
 * # Debug build, ignoring vero-pom.json
 * vero compile --debug --no-pom build/vero-ast.json
 * </pre>
 */
@Command(
        name = "compile",
        mixinStandardHelpOptions = true,
        description = "Compile a Vero AST into Playwright tests"
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger logger = LogContext.CLI_LOGGER;

    public static final String DEFAULT_INPUT = "vero-ast.json";

    @Parameters(
            description = "AST JSON file (default: from vero-pom.json or vero-ast.json)",
            arity = "0..1"
    )
    String input;

    @Option(
            names = {"-o", "--output"},
            description = "Output directory (default: ./generated)"
    )
    String outputDir;

    @Option(
            names = {"-w", "--workdir"},
            description = "Working directory for relative path resolution (default: current directory)"
    )
    String workingDir;

    @Option(
            names = {"--debug"},
            description = "Instrument scenarios for step debugging"
    )
    Boolean debug;

    @Option(
            names = {"--no-evidence"},
            description = "Do not attach a screenshot at the end of each scenario"
    )
    boolean noEvidence;

    @Option(
            names = {"-C", "--clean"},
            description = "Clean output directory before compiling"
    )
    boolean clean;

    @Option(
            names = {"-l", "--log-level"},
            description = "Log level: trace, debug, info, warn, error"
    )
    String logLevel;

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
        Console.println();
        Console.println(Console.bold("Vero " + Main.VERSION));
        Console.println();
        try {
            if (!noPom) {
                loadPom();
            }
            String level = logLevel != null ? logLevel : pom != null ? pom.getLogLevel() : null;
            if (level != null) {
                LogContext.setLogLevel(level);
            }
            CompileOptions options = resolveOptions();
            Path inputPath = resolve(resolveInput());
            if (!Files.exists(inputPath)) {
                Console.println(Console.fail("Input not found: " + inputPath));
                return 1;
            }
            Path root = resolve(options.getOutputDir());
            if (clean && Files.exists(root)) {
                OutputWriter.deleteDirectory(root);
                Console.println(Console.info("Cleaned: " + root));
            }
            Program program = AstReader.load(inputPath);
            CompileResult result = new Compiler(options).compile(program);
            List<Path> written = new OutputWriter(root, options).write(result);
            report(result, written, root);
            return 0;
        } catch (Exception e) {
            logger.error("compile failed", e);
            Console.println(Console.fail("Error: " + e.getMessage()));
            return 1;
        }
    }

    private void loadPom() {
        String file = pomFile != null ? pomFile : VeroPom.DEFAULT_FILE;
        Path pomPath = resolve(file);
        if (Files.exists(pomPath)) {
            pom = VeroPom.load(pomPath);
            Console.println(Console.info("Loaded: " + pomPath));
        } else if (pomFile != null) {
            throw new RuntimeException("Project file not found: " + pomPath);
        }
    }

    CompileOptions resolveOptions() {
        CompileOptions.Builder builder = CompileOptions.builder();
        if (pom != null) {
            pom.applyTo(builder);
        }
        if (outputDir != null) {
            builder.outputDir(outputDir);
        }
        if (debug != null) {
            builder.debug(debug);
        }
        if (noEvidence) {
            builder.evidenceScreenshots(false);
        }
        return builder.build();
    }

    private String resolveInput() {
        if (input != null) {
            return input;
        }
        if (pom != null && pom.getInput() != null) {
            return pom.getInput();
        }
        return DEFAULT_INPUT;
    }

    private Path resolve(String path) {
        return workingDir != null ? Path.of(workingDir).resolve(path) : Path.of(path);
    }

    private static void report(CompileResult result, List<Path> written, Path root) {
        for (CompileWarning warning : result.getWarnings()) {
            Console.println(Console.warn(warning.toString()));
        }
        String summary = "Compiled " + result.getPages().size() + " pages, " + result.getPageActions().size()
                + " page actions, " + result.getFixtures().size() + " fixtures, " + result.getFeatures().size()
                + " features into " + root + " (" + written.size() + " files)";
        Console.println(result.hasWarnings()
                ? Console.warn(summary + " with " + result.getWarnings().size() + " warnings")
                : Console.pass(summary));
    }

    public String getInput() {
        return input;
    }

}
