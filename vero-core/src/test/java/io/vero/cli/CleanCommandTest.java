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
import io.vero.output.Console;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CleanCommandTest {

    @TempDir
    Path tempDir;

    ByteArrayOutputStream console;

    @BeforeEach
    void beforeEach() {
        console = new ByteArrayOutputStream();
        Console.setColorsEnabled(false);
        Console.setOutput(new PrintStream(console, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void afterEach() {
        Console.setOutput(System.out);
    }

    @Test
    void testCleanDefaultDir() throws Exception {
        Path file = tempDir.resolve("generated/pages/LoginPage.ts");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "// page");
        assertEquals(0, Main.execute("clean", "-w", tempDir.toString()));
        assertFalse(Files.exists(tempDir.resolve("generated")));
    }

    @Test
    void testCleanDirFromPom() throws Exception {
        Files.writeString(tempDir.resolve("vero-pom.json"), """
                { "outputDir": "out" }
                """);
        Files.createDirectories(tempDir.resolve("out/tests"));
        assertEquals(0, Main.execute("clean", "-w", tempDir.toString()));
        assertFalse(Files.exists(tempDir.resolve("out")));
    }

    @Test
    void testNothingToClean() {
        assertEquals(0, Main.execute("clean", "-w", tempDir.toString(), "-o", "absent"));
        assertTrue(console.toString(StandardCharsets.UTF_8).contains("Nothing to clean"));
    }

}
