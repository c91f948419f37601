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

import io.colorizer.brackets.BracketScanner;
import io.colorizer.brackets.ScanOptions;
import io.colorizer.brackets.ScanResult;
import io.colorizer.config.ColorizerConfig;
import io.colorizer.config.Json;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonRendererTest {

    private final JsonRenderer renderer = new JsonRenderer(new ColorizerConfig().getPalette());

    @Test
    void testRanges() {
        ScanResult result = BracketScanner.scan("f(a[0]);", null, "c", ScanOptions.defaults());
        Json json = Json.of(renderer.render("src/main.c", result));
        assertEquals("src/main.c", json.get("file"));
        assertEquals("c", json.get("language"));
        List<Object> ranges = json.get("ranges");
        assertEquals(4, ranges.size());
        assertEquals(1, (Integer) json.get("ranges[0].start"));
        assertEquals(2, (Integer) json.get("ranges[0].end"));
        assertEquals(0, (Integer) json.get("ranges[0].level"));
        assertEquals("round", json.get("ranges[0].kind"));
        assertEquals("#FF8C00", json.get("ranges[0].color"));
        assertEquals(1, (Integer) json.get("ranges[1].level"));
        assertEquals("square", json.get("ranges[1].kind"));
        assertEquals("#EE82EE", json.get("ranges[1].color"));
        assertEquals(6, (Integer) json.get("ranges[3].start"));
        List<Object> inactive = json.get("inactive");
        assertTrue(inactive.isEmpty());
    }

    @Test
    void testInactive() {
        ScanResult result = BracketScanner.scan("#if 0\n(\n#endif\n", null, "c", ScanOptions.defaults());
        Map<String, Object> map = renderer.toMap("a.c", result);
        assertEquals(List.of(), map.get("ranges"));
        assertEquals(List.of(Map.of("start", 6, "end", 7)), map.get("inactive"));
    }

    @Test
    void testUnknownLanguage() {
        ScanResult result = BracketScanner.scan("()", null, null, ScanOptions.defaults());
        Map<String, Object> map = renderer.toMap("notes", result);
        assertNull(map.get("language"));
        assertTrue(renderer.render("notes", result).contains("\"language\":null"));
    }

}
