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
package io.colorizer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A 24-bit color written as {@code #RRGGBB}.
 */
public record RgbColor(int red, int green, int blue) {

    private static final Logger logger = LoggerFactory.getLogger(RgbColor.class);

    public static final RgbColor GREY = new RgbColor(0x80, 0x80, 0x80);

    public RgbColor {
        if (red < 0 || red > 255 || green < 0 || green > 255 || blue < 0 || blue > 255) {
            throw new IllegalArgumentException("color component out of range: " + red + "," + green + "," + blue);
        }
    }

    /**
     * @param text {@code #RRGGBB}, case-insensitive, surrounding whitespace ignored
     * @throws IllegalArgumentException if the text is not a six-digit hex color
     */
    public static RgbColor parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("color must not be null");
        }
        String s = text.trim();
        if (s.length() != 7 || s.charAt(0) != '#') {
            throw new IllegalArgumentException("expected #RRGGBB: " + text);
        }
        int rgb = 0;
        for (int i = 1; i < 7; i++) {
            int digit = Character.digit(s.charAt(i), 16);
            if (digit < 0) {
                throw new IllegalArgumentException("expected #RRGGBB: " + text);
            }
            rgb = (rgb << 4) | digit;
        }
        return new RgbColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }

    public static RgbColor parseOrGrey(String text) {
        try {
            return parse(text);
        } catch (IllegalArgumentException e) {
            logger.warn("invalid color '{}', using {}", text, GREY.toHex());
            return GREY;
        }
    }

    public String toHex() {
        return String.format("#%02X%02X%02X", red, green, blue);
    }

    /**
     * ANSI 24-bit foreground escape sequence.
     */
    public String toAnsi() {
        return "\u001B[38;2;" + red + ";" + green + ";" + blue + "m";
    }

    @Override
    public String toString() {
        return toHex();
    }

}
