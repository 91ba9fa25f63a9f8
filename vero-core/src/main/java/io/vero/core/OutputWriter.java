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

import io.vero.common.StringUtils;
import io.vero.compiler.CompileOptions;
import io.vero.compiler.CompileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Writes a {@link CompileResult} below the output directory, one file per unit:
 * <pre>
 * generated/
 *   pages/LoginPage.ts
 *   pageActions/LoginActions.ts
 *   fixtures/Auth.ts, fixtures/index.ts
 *   tests/UserLogin.spec.ts
 * </pre>
 */
public class OutputWriter {

    private static final Logger logger = LoggerFactory.getLogger(OutputWriter.class);

    private final Path root;
    private final CompileOptions options;

    public OutputWriter(Path root, CompileOptions options) {
        this.root = root;
        this.options = options;
    }

    public Path getRoot() {
        return root;
    }

    /**
     * @return the written files in write order
     * @throws RuntimeException if a file cannot be written
     */
    public List<Path> write(CompileResult result) {
        List<Path> written = new ArrayList<>();
        try {
            writeAll(result.getPages(), options.getPageObjectDir(), ".ts", written);
            writeAll(result.getPageActions(), options.getPageActionsDir(), ".ts", written);
            writeAll(result.getFixtures(), options.getFixtureDir(), ".ts", written);
            if (result.getFixtureIndex() != null) {
                written.add(writeFile(root.resolve(options.getFixtureDir()).resolve("index.ts"), result.getFixtureIndex()));
            }
            for (Map.Entry<String, String> entry : result.getFeatures().entrySet()) {
                Path file = root.resolve(options.getTestDir()).resolve(featureFileName(entry.getKey()));
                written.add(writeFile(file, entry.getValue()));
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write output to: " + root, e);
        }
        return written;
    }

    private void writeAll(Map<String, String> units, String dir, String extension, List<Path> written) throws IOException {
        for (Map.Entry<String, String> entry : units.entrySet()) {
            written.add(writeFile(root.resolve(dir).resolve(entry.getKey() + extension), entry.getValue()));
        }
    }

    private static Path writeFile(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        logger.debug("wrote {}", file);
        return file;
    }

    /**
     * {@code user login flow} becomes {@code UserLoginFlow.spec.ts}.
     */
    public static String featureFileName(String featureName) {
        String words = featureName.replaceAll("[^A-Za-z0-9_-]+", " ").trim();
        String name = StringUtils.toPascalCase(words);
        return (StringUtils.isBlank(name) ? "Feature" : name) + ".spec.ts";
    }

    /**
     * Deletes a directory tree, children first.
     *
     * @throws RuntimeException if any entry cannot be deleted
     */
    public static void deleteDirectory(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete: " + dir, e);
        }
    }

}
