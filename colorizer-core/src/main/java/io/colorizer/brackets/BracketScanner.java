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

import io.colorizer.common.Resource;
import io.colorizer.parser.Lexers;
import io.colorizer.parser.Token;
import io.colorizer.preprocessor.InactiveRegions;
import io.colorizer.preprocessor.PreprocessorScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point: text and optional tokens in, colored bracket ranges out.
 * <p>
 * Each call is a pure, synchronous computation over its arguments. The bracket
 * stack, defined symbols and preprocessor frames are local to the call, so any
 * number of documents can be scanned concurrently and a scan can be abandoned
 * at any point without side effects.
 * <pre>
 * List&lt;HighlightedRange&gt; ranges = BracketScanner.classifyAndScan(
 *         "List&lt;Item&gt; items = f(a[0]);", null, "java",
 *         EnumSet.allOf(BracketKind.class), 9);
 * </pre>
 */
public class BracketScanner {

    private static final Logger logger = LoggerFactory.getLogger(BracketScanner.class);

    private BracketScanner() {
    }

    /**
     * @param tokens       tokens covering the text, or null to scan raw text
     * @param languageId   language of the text, or null if unknown
     * @param enabledKinds kinds to paint, null for all
     * @param levelCount   number of color levels, must be positive
     * @throws IllegalArgumentException if levelCount is not positive
     */
    public static List<HighlightedRange> classifyAndScan(String text, List<Token> tokens, String languageId,
                                                         Set<BracketKind> enabledKinds, int levelCount) {
        ScanOptions options = ScanOptions.builder()
                .levelCount(levelCount)
                .enabledKinds(enabledKinds == null ? EnumSet.allOf(BracketKind.class) : enabledKinds)
                .build();
        return classifyAndScan(text, tokens, languageId, options);
    }

    public static List<HighlightedRange> classifyAndScan(String text, List<Token> tokens, String languageId,
                                                         ScanOptions options) {
        return scan(text, tokens, languageId, options).ranges();
    }

    public static ScanResult scan(String text, List<Token> tokens, String languageId, ScanOptions options) {
        String source = text == null ? "" : text;
        InactiveRegions inactive = inactiveRegions(source, languageId, options);
        List<HighlightedRange> ranges;
        if (tokens == null) {
            ranges = RawScanner.scan(source, inactive, options);
        } else {
            ScanPass pass = new ScanPass(source, options, inactive);
            TokenClassifier.feed(tokens, pass);
            ranges = pass.finish();
        }
        return new ScanResult(ranges, inactive, languageId, tokens != null);
    }

    /**
     * Scans a resource, tokenizing it with the built-in lexer when one exists
     * for the language.
     *
     * @param languageId overrides the language guessed from the resource path, may be null
     * @param useLexer   false to force the raw-text fallback
     */
    public static ScanResult scan(Resource resource, String languageId, ScanOptions options, boolean useLexer) {
        String language = languageId != null ? languageId : resource.getLanguageId();
        List<Token> tokens = useLexer ? Lexers.tokenize(language, resource) : null;
        if (tokens == null && logger.isDebugEnabled()) {
            logger.debug("{}: no tokenizer for language '{}', using raw scan", resource, language);
        }
        return scan(resource.getText(), tokens, language, options);
    }

    public static InactiveRegions inactiveRegions(String text, String languageId, ScanOptions options) {
        if (!options.isPreprocessor()) {
            return InactiveRegions.EMPTY;
        }
        return PreprocessorScanner.scan(text, languageId);
    }

}
