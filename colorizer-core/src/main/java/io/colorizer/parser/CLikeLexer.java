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

import io.colorizer.common.Resource;

import java.util.Set;

import static io.colorizer.parser.TokenType.*;

/**
 * Hand-rolled lexer for the curly-brace family (C, C++, C#, Objective-C, Java,
 * Kotlin, JavaScript, Go, Rust ...). It does not try to understand any one of
 * these grammars; it only has to find comments and string literals reliably,
 * because those are what bracket classification must skip.
 */
public class CLikeLexer extends BaseLexer {

    static final Set<String> KEYWORDS = Set.of(
            "if", "else", "for", "while", "do", "switch", "case", "default", "break", "continue",
            "return", "goto", "try", "catch", "finally", "throw", "throws", "new", "delete",
            "class", "struct", "union", "enum", "interface", "namespace", "template", "typename",
            "public", "private", "protected", "static", "final", "const", "volatile", "extern",
            "void", "int", "char", "short", "long", "float", "double", "boolean", "bool", "unsigned",
            "signed", "auto", "var", "val", "let", "fun", "fn", "func", "function", "import", "package",
            "using", "this", "super", "null", "nullptr", "true", "false", "sizeof", "typedef",
            "instanceof", "typeof", "extends", "implements", "abstract", "override", "virtual"
    );

    private final boolean backtickStrings;
    private final boolean singleQuoteStrings;

    public CLikeLexer(Resource resource) {
        this(resource, false, false);
    }

    /**
     * @param backtickStrings    whether {@code `...`} is a string literal (JavaScript, Go)
     * @param singleQuoteStrings whether {@code '...'} is a full string rather than a
     *                           character literal (JavaScript, Groovy, Dart)
     */
    public CLikeLexer(Resource resource, boolean backtickStrings, boolean singleQuoteStrings) {
        super(resource);
        this.backtickStrings = backtickStrings;
        this.singleQuoteStrings = singleQuoteStrings;
    }

    // ========== Main Scanner ==========

    @Override
    protected TokenType scanToken() {
        if (isAtEnd()) {
            return EOF;
        }
        char c = source.charAt(pos);

        // Whitespace (most common in typical code)
        if (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f') {
            return scanWhitespace();
        }

        // Comments and slash
        if (c == '/') {
            if (peek(1) == '/') {
                return scanLineComment();
            }
            if (peek(1) == '*') {
                return scanBlockComment();
            }
            return scanOperator();
        }

        // Strings
        if (c == '"') {
            if (peek(1) == '"' && peek(2) == '"') {
                return scanTextBlock();
            }
            return scanQuoted('"', D_STRING);
        }
        if (c == '\'') {
            if (singleQuoteStrings) {
                return scanQuoted('\'', S_STRING);
            }
            return scanCharLiteral();
        }
        if (c == '`') {
            if (backtickStrings) {
                return scanBacktick();
            }
            advance();
            return OTHER;
        }

        // Identifiers and keywords (very common - check before numbers)
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$') {
            return scanIdentifier();
        }

        // Numbers
        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            return scanNumber();
        }

        // Unicode identifiers (rare)
        if (c > 127 && isIdentifierStart(c)) {
            return scanIdentifier();
        }

        return scanPunctuation(c);
    }

    // ========== Whitespace ==========

    private TokenType scanWhitespace() {
        boolean hasNewline = false;
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '\n') {
                pos++;
                line++;
                hasNewline = true;
            } else if (c == '\r') {
                pos++;
                hasNewline = true;
            } else {
                break;
            }
        }
        return hasNewline ? WS_LF : WS;
    }

    // ========== Comments ==========

    private TokenType scanLineComment() {
        // Fast scan to end of line
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == '\n' || c == '\r') break;
            pos++;
        }
        return L_COMMENT;
    }

    private TokenType scanBlockComment() {
        pos += 2; // consume '/*'
        // "/**/" is an empty block comment, not the start of a doc comment
        boolean doc = peek() == '*' && peek(1) != '/';
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == '*' && pos + 1 < length && source.charAt(pos + 1) == '/') {
                pos += 2;
                break;
            }
            advance();
        }
        return doc ? DOC_COMMENT : B_COMMENT;
    }

    // ========== Strings ==========

    /**
     * Scans a single-line quoted literal. An unterminated literal ends at the
     * line break so that one stray quote does not swallow the rest of the file.
     */
    private TokenType scanQuoted(char quote, TokenType type) {
        advance(); // opening quote
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos++;
                if (pos < length && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (c == quote) {
                pos++;
                break;
            } else if (c == '\n' || c == '\r') {
                break;
            } else {
                pos++;
            }
        }
        return type;
    }

    /**
     * A character literal is only recognized when it closes right away
     * ({@code 'a'}, {@code '\n'}, {@code 'A'}); otherwise the quote is a
     * lone apostrophe, as in Rust lifetimes ({@code <'a>}).
     */
    private TokenType scanCharLiteral() {
        if (peek(1) == '\\') {
            int i = pos + 2;
            // escapes are short: '\n', '\'', '\x41', or a braced Rust unicode escape
            int limit = Math.min(length, pos + 12);
            if (i < length) {
                i++;
            }
            while (i < limit) {
                char c = source.charAt(i);
                if (c == '\'') {
                    pos = i + 1;
                    return CHAR_LITERAL;
                }
                if (c == '\n') {
                    break;
                }
                i++;
            }
        } else if (peek(1) != '\0' && peek(1) != '\n' && peek(2) == '\'') {
            pos += 3;
            return CHAR_LITERAL;
        }
        advance();
        return OPERATOR;
    }

    private TokenType scanTextBlock() {
        pos += 3; // opening """
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == '\\') {
                advance();
                if (pos < length) {
                    advance();
                }
            } else if (c == '"' && peek(1) == '"' && peek(2) == '"') {
                pos += 3;
                break;
            } else {
                advance();
            }
        }
        return TEXT_BLOCK;
    }

    /**
     * Template literals may span lines. Placeholders ({@code ${...}}) are kept
     * inside the string token; brackets in them are not colorized.
     */
    private TokenType scanBacktick() {
        advance(); // opening backtick
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == '\\') {
                advance();
                if (pos < length) {
                    advance();
                }
            } else if (c == '`') {
                pos++;
                break;
            } else {
                advance();
            }
        }
        return T_STRING;
    }

    // ========== Identifiers and Numbers ==========

    private TokenType scanIdentifier() {
        pos++;
        while (pos < length) {
            char c = source.charAt(pos);
            if (c < 128) {
                if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || isDigit(c) || c == '_' || c == '$') {
                    pos++;
                } else {
                    break;
                }
            } else if (isIdentifierPart(c)) {
                pos++;
            } else {
                break;
            }
        }
        String text = source.substring(tokenStart, pos);
        return KEYWORDS.contains(text) ? KEYWORD : IDENT;
    }

    private TokenType scanNumber() {
        pos++;
        while (pos < length) {
            char c = source.charAt(pos);
            if (isDigit(c) || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '.' || c == '\'') {
                // digit separators: 1_000 (Java), 1'000 (C++14)
                if (c == '\'' && !isDigit(peek(1))) {
                    break;
                }
                pos++;
            } else {
                break;
            }
        }
        return NUMBER;
    }

    // ========== Punctuation and Operators ==========

    private TokenType scanPunctuation(char c) {
        switch (c) {
            case '(':
                advance();
                return L_PAREN;
            case ')':
                advance();
                return R_PAREN;
            case '{':
                advance();
                return L_CURLY;
            case '}':
                advance();
                return R_CURLY;
            case '[':
                advance();
                return L_BRACKET;
            case ']':
                advance();
                return R_BRACKET;
            case ',':
                advance();
                return COMMA;
            case ';':
                advance();
                return SEMI;
            case '.':
                advance();
                return DOT;
            case '#':
                advance();
                return HASH;
            default:
                if (isOperatorChar(c)) {
                    return scanOperator();
                }
                advance();
                return OTHER;
        }
    }

    /**
     * Consumes a run of operator characters ({@code <<=}, {@code ->}, {@code >>}).
     * Angle brackets stay inside operator runs; telling generics from operators
     * is left to bracket classification, character by character.
     */
    private TokenType scanOperator() {
        pos++;
        while (pos < length) {
            char c = source.charAt(pos);
            if (!isOperatorChar(c)) {
                break;
            }
            if (c == '/' && (peek(1) == '/' || peek(1) == '*')) {
                break;
            }
            pos++;
        }
        return OPERATOR;
    }

    private static boolean isOperatorChar(char c) {
        return switch (c) {
            case '+', '-', '*', '/', '%', '=', '!', '<', '>', '&', '|', '^', '~', '?', ':', '@', '\\' -> true;
            default -> false;
        };
    }

}
