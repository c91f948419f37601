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
package io.colorizer.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LanguageIdsTest {

    @Test
    void testFromFileName() {
        assertEquals(LanguageIds.C, LanguageIds.fromFileName("src/main.c"));
        assertEquals(LanguageIds.C, LanguageIds.fromFileName("stdio.h"));
        assertEquals(LanguageIds.JAVA, LanguageIds.fromFileName("Foo.JAVA"));
        assertEquals(LanguageIds.CPP, LanguageIds.fromFileName("a/b\\x.hpp"));
        assertEquals(LanguageIds.OBJECTIVE_C, LanguageIds.fromFileName("View.m"));
        assertEquals(LanguageIds.TEXT, LanguageIds.fromFileName("notes.txt"));
        assertNull(LanguageIds.fromFileName("README"));
        assertNull(LanguageIds.fromFileName(".gitignore"));
        assertNull(LanguageIds.fromFileName("foo."));
        assertNull(LanguageIds.fromFileName("x.py"));
        assertNull(LanguageIds.fromFileName(""));
        assertNull(LanguageIds.fromFileName(null));
    }

    @Test
    void testNormalize() {
        assertEquals("c++", LanguageIds.normalize(" C++ "));
        assertNull(LanguageIds.normalize("  "));
        assertNull(LanguageIds.normalize(null));
    }

    @Test
    void testMemoryResource() {
        Resource resource = Resource.text("a(\r\nb)\n", "lib/x.rs");
        assertEquals(LanguageIds.RUST, resource.getLanguageId());
        assertTrue(resource.isInMemory());
        assertFalse(resource.isFile());
        assertEquals("a(", resource.getLine(0));
        assertEquals("b)", resource.getLine(1));
        assertEquals("", resource.getLine(5));
        assertNull(Resource.text("x").getLanguageId());
        assertEquals("", Resource.text(null).getText());
    }

    @Test
    void testPathResource(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("demo.go");
        Files.writeString(file, "func f() {}\n");
        Resource resource = Resource.from(file);
        assertTrue(resource.isFile());
        assertEquals(LanguageIds.GO, resource.getLanguageId());
        assertEquals("func f() {}\n", resource.getText());
        assertEquals("func f() {}", resource.getLine(0));
        Resource missing = Resource.from(tempDir.resolve("missing.c"));
        assertThrows(RuntimeException.class, missing::getText);
    }

}
