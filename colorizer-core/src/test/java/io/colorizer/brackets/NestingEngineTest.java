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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NestingEngineTest {

    private static List<BracketEvent> events(String brackets) {
        return brackets.chars()
                .mapToObj(c -> BracketKind.isOpen((char) c) ? BracketEvent.open(0, (char) c) : BracketEvent.close(0, (char) c))
                .toList();
    }

    private static List<Integer> levels(NestingEngine engine, String brackets) {
        return engine.acceptAll(events(brackets)).stream().map(HighlightedRange::level).toList();
    }

    @Test
    void testBalanced() {
        NestingEngine engine = new NestingEngine(9);
        assertEquals(List.of(0, 1, 2, 2, 1, 0), levels(engine, "({[]})"));
        assertEquals(0, engine.depth());
        assertEquals(0, engine.getUnmatchedCloses());
    }

    @Test
    void testWraparound() {
        NestingEngine engine = new NestingEngine(2);
        assertEquals(List.of(0, 1, 0, 1, 1, 0, 1, 0), levels(engine, "(((())))"));
    }

    @Test
    void testCloseOnEmptyStack() {
        NestingEngine engine = new NestingEngine(9);
        assertEquals(List.of(0, 0), levels(engine, ")]"));
        assertEquals(2, engine.getUnmatchedCloses());
        assertEquals(0, engine.depth());
    }

    @Test
    void testMismatchWithoutMatchEmptiesStack() {
        NestingEngine engine = new NestingEngine(9);
        assertEquals(List.of(0, 0), levels(engine, "(]"));
        assertEquals(0, engine.depth());
        assertNull(engine.topKind());

        engine = new NestingEngine(9);
        assertEquals(List.of(0, 1, 0, 0), levels(engine, "{(]}"));
        assertEquals(0, engine.depth());
        assertEquals(2, engine.getDroppedOpens());
    }

    @Test
    void testMismatchFindsNearestMatch() {
        NestingEngine engine = new NestingEngine(9);
        assertEquals(List.of(0, 1, 2, 1), levels(engine, "{([)"));
        assertEquals(1, engine.depth());
        assertEquals(BracketKind.CURLY, engine.topKind());
        assertEquals(1, engine.getDroppedOpens());
    }

    @Test
    void testStackEntries() {
        NestingEngine engine = new NestingEngine(9);
        engine.accept(BracketEvent.open(3, '('));
        engine.accept(BracketEvent.open(7, '<'));
        List<BracketStack.Entry> entries = engine.getStack().toList();
        assertEquals(List.of(new BracketStack.Entry(BracketKind.ROUND, 0, 3), new BracketStack.Entry(BracketKind.ANGLE, 1, 7)), entries);
        assertEquals("(<", engine.getStack().toString());
    }

    @Test
    void testRangeIsOneCharacter() {
        NestingEngine engine = new NestingEngine(9);
        HighlightedRange range = engine.accept(BracketEvent.open(42, '{'));
        assertEquals(42, range.start());
        assertEquals(43, range.end());
        assertEquals(BracketKind.CURLY, range.kind());
    }

    @Test
    void testInvalidLevelCount() {
        assertThrows(IllegalArgumentException.class, () -> new NestingEngine(0));
    }

}
