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

import java.util.Locale;

/**
 * Decides whether a {@code <} or {@code >} is a generic/template delimiter or an
 * operator ({@code <=}, {@code <<}, {@code ->}, comparisons, shifts). Both tiers
 * are heuristics over the surrounding text, since telling the two apart
 * properly takes a parser per language.
 * <p>
 * {@link #STRICT} is the default. {@link #LOOSE} only looks at immediate
 * neighbours and is kept as a compatibility mode.
 */
public enum AngleHeuristic {

    LOOSE {
        @Override
        public boolean isOperator(String text, int offset) {
            return isAdjacentOperator(text, offset);
        }

        @Override
        public boolean isGenericOpen(String text, int offset) {
            return !isAdjacentOperator(text, offset) && hasTypeishNeighbours(text, offset);
        }
    },

    STRICT {
        @Override
        public boolean isOperator(String text, int offset) {
            return isAdjacentOperator(text, offset) || hasOperandsOnBothSides(text, offset);
        }

        @Override
        public boolean isGenericOpen(String text, int offset) {
            return LOOSE.isGenericOpen(text, offset)
                    && !isSpacedComparison(text, offset)
                    && closesOnSameLine(text, offset);
        }
    };

    private static final String SPAN_OPERATORS = "|&=+-*/:!";

    /**
     * Used for {@code >} when the innermost open bracket is not {@code <}, and
     * as part of {@link #isGenericOpen} for {@code <}.
     */
    public abstract boolean isOperator(String text, int offset);

    public abstract boolean isGenericOpen(String text, int offset);

    public static AngleHeuristic of(String name) {
        if (name == null || name.isBlank()) {
            return STRICT;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }

    // ========== Neighbour tests ==========

    static boolean isAdjacentOperator(String text, int offset) {
        char prev = offset > 0 ? text.charAt(offset - 1) : '\0';
        char next = offset + 1 < text.length() ? text.charAt(offset + 1) : '\0';
        return switch (text.charAt(offset)) {
            case '<' -> next == '=' || next == '<' || prev == '<' || prev == '=';
            case '>' -> prev == '-' || prev == '=' || prev == '>' || next == '=' || next == '>';
            default -> false;
        };
    }

    static boolean hasTypeishNeighbours(String text, int offset) {
        int p = prevNonSpace(text, offset);
        int n = nextNonSpace(text, offset);
        if (n < 0) {
            return false;
        }
        char next = text.charAt(n);
        boolean nextTypeish = Character.isLetterOrDigit(next) || next == '_' || next == '?' || next == '(';
        if (p < 0) {
            return nextTypeish;
        }
        char prev = text.charAt(p);
        boolean prevTypeish = Character.isLetterOrDigit(prev) || prev == '_' || prev == ')' || prev == ']' || prev == '>';
        return nextTypeish && prevTypeish;
    }

    /**
     * {@code a>b}, {@code x > y}, {@code f() > 0}: operand characters on both
     * sides. Only asked for a {@code >} that has no open {@code <} to close.
     */
    static boolean hasOperandsOnBothSides(String text, int offset) {
        int p = prevNonSpace(text, offset);
        int n = nextNonSpace(text, offset);
        if (p < 0 || n < 0) {
            return false;
        }
        return isOperand(text.charAt(p)) && isOperand(text.charAt(n));
    }

    /**
     * {@code a < b}: operands on both sides with whitespace next
     * to the angle. A tight {@code List<Item>} has operands on both sides too,
     * which is why the whitespace is required.
     */
    static boolean isSpacedComparison(String text, int offset) {
        int p = prevNonSpace(text, offset);
        int n = nextNonSpace(text, offset);
        if (p < 0 || n < 0) {
            return false;
        }
        if (p == offset - 1 && n == offset + 1) {
            return false;
        }
        return isOperand(text.charAt(p)) && isOperand(text.charAt(n));
    }

    /**
     * Scans forward on the same line to the matching {@code >}. The span must
     * close before the line ends, must not start with a digit, must hold at
     * least one letter and none of the arithmetic or logical operator characters.
     */
    static boolean closesOnSameLine(String text, int offset) {
        int n = nextNonSpace(text, offset);
        if (n >= 0 && Character.isDigit(text.charAt(n))) {
            return false;
        }
        int depth = 1;
        boolean letter = false;
        for (int i = offset + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                return false;
            }
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
                if (depth == 0) {
                    return letter;
                }
            } else if (SPAN_OPERATORS.indexOf(c) >= 0) {
                return false;
            } else if (Character.isLetter(c)) {
                letter = true;
            }
        }
        return false;
    }

    static boolean isOperand(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == ')' || c == ']' || c == '}'
                || c == '"' || c == '\'' || c == '`';
    }

    static int prevNonSpace(String text, int offset) {
        int i = offset - 1;
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
            i--;
        }
        return i;
    }

    static int nextNonSpace(String text, int offset) {
        int i = offset + 1;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i < text.length() ? i : -1;
    }

}
