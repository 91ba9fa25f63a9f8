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
package io.vero;

import io.vero.cli.CleanCommand;
import io.vero.cli.CompileCommand;
import io.vero.core.VeroPom;
import io.vero.output.Console;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Main entry point for the Vero CLI.
 * <p>
 * When invoked without a subcommand, compiles using {@code vero-pom.json} from the current
 * directory if present, otherwise prints usage.
 */
@Command(
        name = "vero",
        mixinStandardHelpOptions = true,
        versionProvider = Main.VersionProvider.class,
        description = "Compiles Vero programs to Playwright tests",
        subcommands = {
                CompileCommand.class,
                CleanCommand.class
        }
)
public class Main implements Callable<Integer> {

    public static final String VERSION = "1.0.0";

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[]{"Vero " + VERSION};
        }
    }

    @Option(
            names = {"--no-color"},
            description = "Disable colored output"
    )
    boolean noColor;

    public static void main(String[] args) {
        // handle color settings before any output
        for (String arg : args) {
            if ("--no-color".equals(arg)) {
                Console.setColorsEnabled(false);
                break;
            }
        }
        System.exit(execute(args));
    }

    /**
     * Runs the command line without exiting the JVM.
     */
    public static int execute(String... args) {
        return new CommandLine(new Main())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    @Override
    public Integer call() {
        if (noColor) {
            Console.setColorsEnabled(false);
        }
        if (Files.exists(Path.of(VeroPom.DEFAULT_FILE))) {
            return new CompileCommand().call();
        }
        CommandLine.usage(this, System.out);
        return 0;
    }

}
