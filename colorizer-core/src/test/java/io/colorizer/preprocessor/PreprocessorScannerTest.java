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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PreprocessorScannerTest {

    private static List<InactiveRange> scan(String text) {
        return PreprocessorScanner.scan(text).asList();
    }

    private static InactiveRange range(int start, int end) {
        return new InactiveRange(start, end);
    }

    @Test
    void testIfZero() {
        String text = "#if 0\nfoo(bar)\n#endif\n";
        List<InactiveRange> ranges = scan(text);
        assertEquals(List.of(range(6, 14)), ranges);
        assertEquals("foo(bar)\n", text.substring(6, 15));
    }

    @Test
    void testIfOneElse() {
        assertEquals(List.of(range(14, 15)), scan("#if 1\na\n#else\nb\n#endif\n"));
    }

    @Test
    void testElifChain() {
        String text = "#if 0\na\n#elif 1\nb\n#else\nc\n#endif\n";
        assertEquals(List.of(range(6, 7), range(24, 25)), scan(text));
    }

    @Test
    void testElifAfterTakenBranch() {
        // "#if 1" taken, "#elif 1" is dead anyway
        String text = "#if 1\na\n#elif 1\nb\n#endif\n";
        assertEquals(List.of(range(16, 17)), scan(text));
    }

    @Test
    void testUnknownConditionFailsOpen() {
        assertTrue(scan("#ifdef FOO\na\n#else\nb\n#endif\n").isEmpty());
        assertTrue(scan("#if VERSION > 2\na\n#elif 0\nb\n#else\nc\n#endif\n").isEmpty());
        assertTrue(scan("#if defined(A) && defined(B)\na\n#endif\n").isEmpty());
    }

    @Test
    void testUnknownElifAfterFalse() {
        // "#elif FOO" cannot be decided, so it and everything after stays live
        String text = "#if 0\na\n#elif FOO\nb\n#else\nc\n#endif\n";
        assertEquals(List.of(range(6, 7)), scan(text));
    }

    @Test
    void testDefineThenIfdef() {
        String text = "#define FOO\n#ifdef FOO\na\n#else\nb\n#endif\n";
        assertEquals(List.of(range(31, 32)), scan(text));
    }

    @Test
    void testIfndef() {
        assertTrue(scan("#undef FOO\n#ifndef FOO\nx\n#endif\n").isEmpty());
        assertEquals(List.of(range(24, 25)), scan("#define FOO\n#ifndef FOO\nx\n#endif\n"));
    }

    @Test
    void testUndefAfterDefine() {
        String text = "#define FOO\n#undef FOO\n#if FOO\nx\n#endif\n";
        // "#if FOO" is known false after the undef
        assertEquals(List.of(range(31, 32)), scan(text));
    }

    @Test
    void testDefinedForms() {
        String text = "#define DEBUG 1\n#if defined(DEBUG)\na\n#else\nb\n#endif\n";
        assertEquals(List.of(range(43, 44)), scan(text));
        String bare = "#define DEBUG\n#if !DEBUG\na\n#endif\n";
        assertEquals(List.of(range(25, 26)), scan(bare));
    }

    @Test
    void testNestedBlocksDoNotOverlap() {
        String text = "#if 0\n#if 1\na\n#endif\nb\n#endif\nc\n";
        assertEquals(List.of(range(6, 22)), scan(text));
        String inner = "#if 1\n#if 0\na\n#endif\nb\n#endif\n";
        assertEquals(List.of(range(12, 13)), scan(inner));
    }

    @Test
    void testDefineInsideDeadBranchIgnored() {
        String text = "#if 0\n#define FOO\n#endif\n#ifdef FOO\nx\n#endif\n";
        assertEquals(List.of(range(6, 17)), scan(text));
    }

    @Test
    void testUnterminatedBlockRunsToEnd() {
        assertEquals(List.of(range(6, 10)), scan("#if 0\nfoo(\n"));
        assertEquals(List.of(range(6, 9)), scan("#if 0\nfoo("));
        assertTrue(scan("#if 0").isEmpty());
    }

    @Test
    void testStrayDirectivesIgnored() {
        assertTrue(scan("#endif\nx(\n#else\n#elif 0\n").isEmpty());
    }

    @Test
    void testContinuationLines() {
        assertEquals(List.of(range(9, 10)), scan("#if \\\n 0\nx\n#endif\n"));
    }

    @Test
    void testTrailingComments() {
        assertEquals(List.of(range(18, 19)), scan("#if 0 // disabled\nx\n#endif // 0\n"));
        assertEquals(List.of(range(14, 15)), scan("#if /* x */ 0\ny\n#endif\n"));
    }

    @Test
    void testIndentedDirectives() {
        assertEquals(List.of(range(10, 11)), scan("  #  if 0\nx\n\t# endif\n"));
    }

    @Test
    void testCrLf() {
        assertEquals(List.of(range(7, 9)), scan("#if 0\r\nx\r\n#endif\r\n"));
    }

    @Test
    void testRangesSortedAndDisjoint() {
        String text = "#if 0\na\n#endif\nb\n#if 0\nc\n#endif\n#if 1\n#else\nd\n#endif\n";
        List<InactiveRange> ranges = scan(text);
        assertEquals(3, ranges.size());
        for (int i = 1; i < ranges.size(); i++) {
            assertTrue(ranges.get(i - 1).end() < ranges.get(i).start());
        }
    }

    @Test
    void testAppliesTo() {
        assertTrue(PreprocessorScanner.appliesTo("c"));
        assertTrue(PreprocessorScanner.appliesTo("C++"));
        assertTrue(PreprocessorScanner.appliesTo("cpp"));
        assertTrue(PreprocessorScanner.appliesTo("csharp"));
        assertTrue(PreprocessorScanner.appliesTo("Objective-C"));
        assertTrue(PreprocessorScanner.appliesTo(null));
        assertTrue(PreprocessorScanner.appliesTo(" "));
        assertFalse(PreprocessorScanner.appliesTo("java"));
        assertFalse(PreprocessorScanner.appliesTo("python"));
        assertFalse(PreprocessorScanner.appliesTo("rust"));
        assertTrue(PreprocessorScanner.scan("#if 0\nx\n#endif\n", "go").isEmpty());
        assertEquals(1, PreprocessorScanner.scan("#if 0\nx\n#endif\n", "cpp").size());
    }

    @Test
    void testRegionsLookup() {
        InactiveRegions regions = PreprocessorScanner.scan("#if 0\na\n#endif\nb\n#if 0\nc\n#endif\n");
        assertFalse(regions.contains(0));
        assertTrue(regions.contains(6));
        assertTrue(regions.contains(7));
        assertFalse(regions.contains(8));
        assertTrue(regions.contains(23));
        assertFalse(regions.contains(100));
        assertTrue(InactiveRegions.EMPTY.isEmpty());
    }

}
