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

import io.vero.compiler.CompileOptions;
import io.vero.compiler.CompileResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OutputWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testWriteLayout() throws Exception {
        CompileResult result = new CompileResult(
                Map.of("LoginPage", "// page\n"),
                Map.of("LoginActions", "// actions\n"),
                Map.of("user login flow", "// feature\n"),
                Map.of("auth", "// fixture\n"),
                "// index\n",
                List.of());
        Path root = tempDir.resolve("generated");
        List<Path> written = new OutputWriter(root, CompileOptions.defaults()).write(result);
        assertEquals(List.of(
                root.resolve("pages/LoginPage.ts"),
                root.resolve("pageActions/LoginActions.ts"),
                root.resolve("fixtures/auth.ts"),
                root.resolve("fixtures/index.ts"),
                root.resolve("tests/UserLoginFlow.spec.ts")), written);
        assertEquals("// feature\n", Files.readString(root.resolve("tests/UserLoginFlow.spec.ts")));
    }

    @Test
    void testCustomDirectories() {
        CompileOptions options = CompileOptions.builder().pageObjectDir("po").testDir("e2e").build();
        CompileResult result = new CompileResult(Map.of("Home", ""), Map.of(), Map.of("Home", ""), Map.of(), null, List.of());
        List<Path> written = new OutputWriter(tempDir, options).write(result);
        assertEquals(List.of(tempDir.resolve("po/Home.ts"), tempDir.resolve("e2e/Home.spec.ts")), written);
    }

    @Test
    void testFeatureFileName() {
        assertEquals("UserLoginFlow.spec.ts", OutputWriter.featureFileName("user login flow"));
        assertEquals("Checkout.spec.ts", OutputWriter.featureFileName("Checkout"));
        assertEquals("CartItems.spec.ts", OutputWriter.featureFileName("cart: items!"));
        assertEquals("Feature.spec.ts", OutputWriter.featureFileName("???"));
    }

    @Test
    void testDeleteDirectory() throws Exception {
        Path dir = tempDir.resolve("out");
        Files.createDirectories(dir.resolve("a/b"));
        Files.writeString(dir.resolve("a/b/c.ts"), "x");
        OutputWriter.deleteDirectory(dir);
        assertFalse(Files.exists(dir));
    }

}
