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
package io.colorizer.parser;

import java.util.Set;

/**
 * One lexical unit: the half-open range {@code [start, end)} of the document
 * and the category tags the tokenizer assigned to it. Tokens for a document are
 * contiguous and gapless. Tokens built by an external tokenizer have no
 * {@link TokenType} and carry only their tags.
 */
public class Token {

    public final int start;
    public final int end;
    public final Set<String> tags;
    // null when supplied by an external tokenizer
    public final TokenType type;

    public Token(int start, int end, Set<String> tags) {
        this(null, start, end, tags);
    }

    public Token(TokenType type, int start, int end) {
        this(type, start, end, type.tags);
    }

    private Token(TokenType type, int start, int end, Set<String> tags) {
        this.type = type;
        this.start = start;
        this.end = end;
        this.tags = tags == null ? Set.of() : tags;
    }

    public static Token of(int start, int end, String... tags) {
        return new Token(start, end, Set.of(tags));
    }

    public int length() {
        return end - start;
    }

    public String getText(String source) {
        return source.substring(start, end);
    }

    @Override
    public String toString() {
        String name = type == null ? tags.toString() : type.name();
        return name + "[" + start + "," + end + ")";
    }

}
