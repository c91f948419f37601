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
package io.colorizer.output;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleTest {

    @AfterEach
    void afterEach() {
        Console.setColorsEnabled(false);
        Console.setOutput(System.out);
    }

    @Test
    void testColorFormatting() {
        Console.setColorsEnabled(true);
        String red = Console.red("error");
        assertTrue(red.contains("\u001B[31m"));
        assertTrue(red.contains("error"));
        assertTrue(red.endsWith(Console.RESET));
        assertEquals("\u001B[2mx\u001B[0m", Console.dim("x"));
        assertEquals("", Console.bold(""));
    }

    @Test
    void testColorFormattingDisabled() {
        Console.setColorsEnabled(false);
        assertEquals("error", Console.red("error"));
        assertEquals("warning", Console.warn("warning"));
        assertEquals("x", Console.color("x", "\u001B[38;2;1;2;3m"));
    }

    @Test
    void testStripAnsi() {
        Console.setColorsEnabled(true);
        String text = Console.fail("a") + Console.color("(", "\u001B[38;2;255;140;0m") + Console.dim("b");
        assertEquals("a(b", Console.stripAnsi(text));
    }

    @Test
    void testOutput() {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        Console.setOutput(new PrintStream(baos, true, StandardCharsets.UTF_8));
        Console.print("a");
        Console.println("b");
        Console.println();
        assertEquals("ab" + System.lineSeparator() + System.lineSeparator(), baos.toString(StandardCharsets.UTF_8));
    }

}
