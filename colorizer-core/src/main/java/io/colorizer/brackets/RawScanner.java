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
package io.colorizer.brackets;

import io.colorizer.preprocessor.InactiveRegions;
import io.colorizer.preprocessor.PreprocessorScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fallback used when no tokenizer is available. Every character is a
 * candidate, so brackets inside comments and strings get colored too; the
 * angle heuristic, nesting and inactive-region filtering are the same as on
 * the token path.
 */
public class RawScanner {

    private static final Logger logger = LoggerFactory.getLogger(RawScanner.class);

    private RawScanner() {
    }

    public static List<HighlightedRange> scan(String text, String languageId, ScanOptions options) {
        String source = text == null ? "" : text;
        InactiveRegions inactive = options.isPreprocessor()
                ? PreprocessorScanner.scan(source, languageId)
                : InactiveRegions.EMPTY;
        return scan(source, inactive, options);
    }

    static List<HighlightedRange> scan(String text, InactiveRegions inactive, ScanOptions options) {
        logger.debug("no tokens, scanning {} chars of raw text", text.length());
        ScanPass pass = new ScanPass(text, options, inactive);
        pass.visit(0, text.length());
        return pass.finish();
    }

}
