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
 * The preprocessor directives that matter for conditional compilation.
 * Any other directive ({@code #include}, {@code #pragma}, ...) is ignored.
 */
public enum Directive {

    DEFINE("define"),
    UNDEF("undef"),
    IF("if"),
    IFDEF("ifdef"),
    IFNDEF("ifndef"),
    ELIF("elif"),
    ELSE("else"),
    ENDIF("endif");

    private static final Pattern LINE = Pattern.compile("^\\s*#\\s*([A-Za-z_]\\w*)(.*)$", Pattern.DOTALL);

    public final String keyword;

    Directive(String keyword) {
        this.keyword = keyword;
    }

    public static Directive fromKeyword(String keyword) {
        for (Directive directive : values()) {
            if (directive.keyword.equals(keyword)) {
                return directive;
            }
        }
        return null;
    }

    /**
     * A recognized directive line with its argument, trailing comments removed.
     */
    public record Line(Directive directive, String argument) {

    }

    /**
     * @param text one logical line, continuation backslashes already joined
     * @return the parsed directive, or null if the line is not one we track
     */
    public static Line parse(String text) {
        Matcher m = LINE.matcher(text);
        if (!m.matches()) {
            return null;
        }
        Directive directive = fromKeyword(m.group(1));
        if (directive == null) {
            return null;
        }
        return new Line(directive, stripComments(m.group(2)).trim());
    }

    static String stripComments(String argument) {
        StringBuilder sb = new StringBuilder(argument.length());
        int i = 0;
        int n = argument.length();
        while (i < n) {
            char c = argument.charAt(i);
            if (c == '/' && i + 1 < n && argument.charAt(i + 1) == '/') {
                break;
            }
            if (c == '/' && i + 1 < n && argument.charAt(i + 1) == '*') {
                int close = argument.indexOf("*/", i + 2);
                if (close < 0) {
                    break;
                }
                sb.append(' ');
                i = close + 2;
                continue;
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

}
