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
 * Token types produced by the built-in lexer. Each type carries the category
 * tags a host highlighter would report for it, named the way IntelliJ names
 * its default text attribute keys, so that tokens from this lexer and tokens
 * from an external tokenizer go through the same classification.
 */
public enum TokenType {

    WS_LF(false),
    WS(false),
    EOF,
    L_PAREN("DEFAULT_PARENTHESES"),
    R_PAREN("DEFAULT_PARENTHESES"),
    L_CURLY("DEFAULT_BRACES"),
    R_CURLY("DEFAULT_BRACES"),
    L_BRACKET("DEFAULT_BRACKETS"),
    R_BRACKET("DEFAULT_BRACKETS"),
    COMMA("DEFAULT_COMMA"),
    SEMI("DEFAULT_SEMICOLON"),
    DOT("DEFAULT_DOT"),
    // runs of operator characters, including '<' and '>'
    OPERATOR("DEFAULT_OPERATION_SIGN"),
    HASH("DEFAULT_METADATA"),
    //====
    L_COMMENT(false, "DEFAULT_LINE_COMMENT"),
    B_COMMENT(false, "DEFAULT_BLOCK_COMMENT"),
    DOC_COMMENT(false, "DEFAULT_DOC_COMMENT", "DEFAULT_BLOCK_COMMENT"),
    D_STRING("DEFAULT_STRING"),
    S_STRING("DEFAULT_STRING"),
    CHAR_LITERAL("DEFAULT_STRING"),
    T_STRING("DEFAULT_STRING"),
    TEXT_BLOCK("DEFAULT_STRING"),
    //====
    NUMBER("DEFAULT_NUMBER"),
    KEYWORD("DEFAULT_KEYWORD"),
    IDENT("DEFAULT_IDENTIFIER"),
    OTHER;

    public final Set<String> tags;
    public final boolean primary;

    TokenType(String... tags) {
        this(true, tags);
    }

    // comments and whitespace are not primary
    TokenType(boolean primary, String... tags) {
        this.primary = primary;
        this.tags = Set.of(tags);
    }

    public boolean oneOf(TokenType... types) {
        for (TokenType type : types) {
            if (this == type) {
                return true;
            }
        }
        return false;
    }

}
