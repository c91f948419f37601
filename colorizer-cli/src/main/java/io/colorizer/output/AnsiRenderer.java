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
package io.colorizer.output;

import io.colorizer.brackets.HighlightedRange;
import io.colorizer.brackets.ScanResult;
import io.colorizer.config.RgbColor;
import io.colorizer.preprocessor.InactiveRegions;

import java.util.List;

/**
 * Renders source text for a terminal: every highlighted bracket in the color
 * of its level, inactive preprocessor regions dimmed. When colors are off the
 * text comes back unchanged.
 */
public class AnsiRenderer {

    private final List<RgbColor> palette;

    public AnsiRenderer(List<RgbColor> palette) {
        if (palette == null || palette.isEmpty()) {
            throw new IllegalArgumentException("palette must not be empty");
        }
        this.palette = List.copyOf(palette);
    }

    public String render(String text, ScanResult result) {
        List<HighlightedRange> ranges = result.ranges();
        InactiveRegions inactive = result.inactive();
        StringBuilder sb = new StringBuilder(text.length() + ranges.size() * 24);
        StringBuilder run = new StringBuilder();
        boolean runDim = false;
        int next = 0; // ranges are offset-ordered
        for (int i = 0; i < text.length(); i++) {
            while (next < ranges.size() && ranges.get(next).start() < i) {
                next++;
            }
            HighlightedRange range = next < ranges.size() && ranges.get(next).start() == i ? ranges.get(next) : null;
            boolean dim = inactive.contains(i);
            if (range != null || dim != runDim) {
                flush(sb, run, runDim);
                runDim = dim;
            }
            if (range != null) {
                sb.append(Console.color(text.substring(range.start(), range.end()), colorFor(range.level()).toAnsi()));
            } else {
                run.append(text.charAt(i));
            }
        }
        flush(sb, run, runDim);
        return sb.toString();
    }

    public RgbColor colorFor(int level) {
        return palette.get(Math.floorMod(level, palette.size()));
    }

    private static void flush(StringBuilder sb, StringBuilder run, boolean dim) {
        if (run.length() == 0) {
            return;
        }
        String segment = run.toString();
        sb.append(dim ? Console.dim(segment) : segment);
        run.setLength(0);
    }

}
