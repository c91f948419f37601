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
package io.colorizer.preprocessor;

import java.util.HashMap;
import java.util.Map;

/**
 * Symbols seen by {@code #define} and {@code #undef} during one scan. A symbol
 * that was never mentioned is unknown rather than undefined: it may well come
 * from a header or the compiler command line.
 */
public class DefinedSymbols {

    private final Map<String, Boolean> known = new HashMap<>();

    public void define(String name) {
        known.put(name, true);
    }

    public void undef(String name) {
        known.put(name, false);
    }

    public ConditionResult lookup(String name) {
        Boolean defined = known.get(name);
        return defined == null ? ConditionResult.UNKNOWN : ConditionResult.of(defined);
    }

    public boolean isKnown(String name) {
        return known.containsKey(name);
    }

}
