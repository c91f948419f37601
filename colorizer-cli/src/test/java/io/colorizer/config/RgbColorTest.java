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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RgbColorTest {

    @Test
    void testParse() {
        RgbColor color = RgbColor.parse("#ff8c00");
        assertEquals(new RgbColor(255, 140, 0), color);
        assertEquals("#FF8C00", color.toHex());
        assertEquals("#FF8C00", color.toString());
        assertEquals("\u001B[38;2;255;140;0m", color.toAnsi());
        assertEquals(new RgbColor(0, 0xCE, 0xD1), RgbColor.parse(" #00CED1 "));
    }

    @Test
    void testParseInvalid() {
        assertThrows(IllegalArgumentException.class, () -> RgbColor.parse("FF8C00"));
        assertThrows(IllegalArgumentException.class, () -> RgbColor.parse("#FFF"));
        assertThrows(IllegalArgumentException.class, () -> RgbColor.parse("#GGGGGG"));
        assertThrows(IllegalArgumentException.class, () -> RgbColor.parse("#+12345"));
        assertThrows(IllegalArgumentException.class, () -> RgbColor.parse(null));
        assertThrows(IllegalArgumentException.class, () -> new RgbColor(256, 0, 0));
    }

    @Test
    void testParseOrGrey() {
        assertEquals(RgbColor.GREY, RgbColor.parseOrGrey("DarkOrange"));
        assertEquals("#808080", RgbColor.GREY.toHex());
        assertEquals(new RgbColor(1, 2, 3), RgbColor.parseOrGrey("#010203"));
    }

}
