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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates only the condition shapes that can be decided without macro
 * expansion: {@code 0}, {@code 1}, {@code true}, {@code false},
 * {@code defined(NAME)}, {@code defined NAME}, {@code NAME} and {@code !NAME}.
 * Everything else is {@link ConditionResult#UNKNOWN}.
 */
public class ConditionEvaluator {

    private static final Pattern DEFINED_PAREN = Pattern.compile("defined\\s*\\(\\s*([A-Za-z_]\\w*)\\s*\\)");
    private static final Pattern DEFINED_BARE = Pattern.compile("defined\\s+([A-Za-z_]\\w*)");
    private static final Pattern NAME = Pattern.compile("(!?)\\s*([A-Za-z_]\\w*)");

    private ConditionEvaluator() {
    }

    public static ConditionResult evalConditionish(String expr, DefinedSymbols symbols) {
        if (expr == null) {
            return ConditionResult.UNKNOWN;
        }
        String text = unwrap(expr.trim());
        switch (text) {
            case "0", "false":
                return ConditionResult.FALSE;
            case "1", "true":
                return ConditionResult.TRUE;
            default:
                break;
        }
        Matcher m = DEFINED_PAREN.matcher(text);
        if (m.matches()) {
            return symbols.lookup(m.group(1));
        }
        m = DEFINED_BARE.matcher(text);
        if (m.matches()) {
            return symbols.lookup(m.group(1));
        }
        m = NAME.matcher(text);
        if (m.matches()) {
            ConditionResult result = symbols.lookup(m.group(2));
            return m.group(1).isEmpty() ? result : result.negate();
        }
        return ConditionResult.UNKNOWN;
    }

    /**
     * Argument of {@code #ifdef}: the first word, looked up as is.
     */
    public static ConditionResult evalIfdef(String argument, DefinedSymbols symbols) {
        String name = firstWord(argument);
        return name == null ? ConditionResult.UNKNOWN : symbols.lookup(name);
    }

    public static ConditionResult evalIfndef(String argument, DefinedSymbols symbols) {
        return evalIfdef(argument, symbols).negate();
    }

    static String firstWord(String argument) {
        if (argument == null) {
            return null;
        }
        String trimmed = argument.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        int end = 0;
        while (end < trimmed.length() && (Character.isLetterOrDigit(trimmed.charAt(end)) || trimmed.charAt(end) == '_')) {
            end++;
        }
        return end == 0 ? null : trimmed.substring(0, end);
    }

    // "(0)" is still the literal 0
    private static String unwrap(String text) {
        while (text.length() >= 2 && text.charAt(0) == '(' && text.charAt(text.length() - 1) == ')'
                && text.indexOf('(', 1) < 0 && text.indexOf(')') == text.length() - 1) {
            text = text.substring(1, text.length() - 1).trim();
        }
        return text;
    }

}
