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
package io.vero.common;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import net.minidev.json.JSONValue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thin JsonPath facade used for reading AST documents and project configuration.
 */
public class Json {

    private final DocumentContext doc;
    private final boolean object;
    private final String prefix;

    private String prefix(String path) {
        return path.charAt(0) == '$' ? path : prefix + path;
    }

    /**
     * @param json a JSON object or array, keys kept in document order
     * @throws IllegalArgumentException if the input is null or blank
     * @throws RuntimeException if the input is not a JSON object or array
     */
    public static Json of(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("input string must not be null or blank");
        }
        return new Json(JsonPath.parse(parseLenient(json)));
    }

    private static Object parseLenient(String json) {
        try {
            Object result = JSONValue.parseKeepingOrder(json);
            if (!(result instanceof Map || result instanceof List)) {
                throw new RuntimeException("invalid json: not a JSON object or array");
            }
            return result;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("invalid json: " + e.getMessage(), e);
        }
    }

    private Json(DocumentContext doc) {
        this.doc = doc;
        object = (doc.json() instanceof Map);
        prefix = object ? "$." : "$";
    }

    public <T> T get(String path) {
        return doc.read(prefix(path));
    }

    public <T> Optional<T> getOptional(String path) {
        try {
            return Optional.ofNullable(get(path));
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    public boolean isObject() {
        return object;
    }

    public Map<String, Object> asMap() {
        return doc.read("$");
    }

}
