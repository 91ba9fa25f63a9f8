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
package io.vero.ast;

/**
 * Visual comparison settings. Explicit values win over the preset.
 */
public record ScreenshotOptions(Preset preset, Double threshold, Integer maxDiffPixels, Double maxDiffPixelRatio) {

    public enum Preset {

        STRICT(0.0, 0, null),
        BALANCED(0.2, null, null),
        RELAXED(0.3, null, 0.05);

        public final Double threshold;
        public final Integer maxDiffPixels;
        public final Double maxDiffPixelRatio;

        Preset(Double threshold, Integer maxDiffPixels, Double maxDiffPixelRatio) {
            this.threshold = threshold;
            this.maxDiffPixels = maxDiffPixels;
            this.maxDiffPixelRatio = maxDiffPixelRatio;
        }

    }

    public Double effectiveThreshold() {
        return threshold != null ? threshold : preset == null ? null : preset.threshold;
    }

    public Integer effectiveMaxDiffPixels() {
        return maxDiffPixels != null ? maxDiffPixels : preset == null ? null : preset.maxDiffPixels;
    }

    public Double effectiveMaxDiffPixelRatio() {
        return maxDiffPixelRatio != null ? maxDiffPixelRatio : preset == null ? null : preset.maxDiffPixelRatio;
    }

}
