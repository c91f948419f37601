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

public enum BracketKind {

    ROUND('(', ')'),
    CURLY('{', '}'),
    SQUARE('[', ']'),
    ANGLE('<', '>');

    public final char open;
    public final char close;

    BracketKind(char open, char close) {
        this.open = open;
        this.close = close;
    }

    /**
     * @return the kind the character opens or closes, or null if it is not a bracket
     */
    public static BracketKind of(char c) {
        return switch (c) {
            case '(', ')' -> ROUND;
            case '{', '}' -> CURLY;
            case '[', ']' -> SQUARE;
            case '<', '>' -> ANGLE;
            default -> null;
        };
    }

    public static boolean isBracket(char c) {
        return of(c) != null;
    }

    public static boolean isOpen(char c) {
        return c == '(' || c == '{' || c == '[' || c == '<';
    }

    public static boolean isClose(char c) {
        return c == ')' || c == '}' || c == ']' || c == '>';
    }

    public String pair() {
        return "" + open + close;
    }

}
