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

import io.colorizer.parser.Token;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides which tokens can contain brackets. The test is a deliberately coarse
 * substring match on the tokenizer's category names, so that it works across
 * tokenizers that name their categories differently ("DEFAULT_LINE_COMMENT",
 * "JS.STRING", "KDOC", ...).
 */
public class TokenClassifier {

    private static final String[] EXCLUDED = {"COMMENT", "STRING", "DOC"};

    private TokenClassifier() {
    }

    public static boolean isExcluded(Token token) {
        return isExcluded(token.tags);
    }

    public static boolean isExcluded(Set<String> tags) {
        for (String tag : tags) {
            if (tag == null) {
                continue;
            }
            String name = tag.toUpperCase(Locale.ROOT);
            for (String excluded : EXCLUDED) {
                if (name.contains(excluded)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Feeds the characters of every token that is not excluded into the pass.
     * Tokens are expected in document order; overlap and gaps are tolerated.
     */
    static void feed(List<Token> tokens, ScanPass pass) {
        for (Token token : tokens) {
            if (token == null || token.end <= token.start || isExcluded(token)) {
                continue;
            }
            pass.visit(token.start, token.end);
        }
    }

}
