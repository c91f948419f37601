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

import io.colorizer.brackets.AngleHeuristic;
import io.colorizer.brackets.BracketKind;
import io.colorizer.brackets.ScanOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColorizerConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        ColorizerConfig config = new ColorizerConfig();
        assertEquals(9, config.getLevelCount());
        assertEquals(ColorizerConfig.DEFAULT_COLORS, config.getColors());
        assertEquals("strict", config.getHeuristic());
        List<RgbColor> palette = config.getPalette();
        assertEquals(9, palette.size());
        assertEquals("#FF8C00", palette.get(0).toHex());
        assertEquals("#3CB371", palette.get(8).toHex());

        ScanOptions options = config.toScanOptions();
        assertEquals(9, options.getLevelCount());
        assertEquals(EnumSet.allOf(BracketKind.class), options.getEnabledKinds());
        assertEquals(AngleHeuristic.STRICT, options.getHeuristic());
        assertTrue(options.isPreprocessor());
    }

    @Test
    void testParseMinimalConfig() {
        ColorizerConfig config = ColorizerConfig.parse("{}");
        assertEquals(9, config.getLevelCount());
        assertTrue(config.isRound());
        assertTrue(config.isAngle());
        assertTrue(config.isPreprocessor());
    }

    @Test
    void testParseFullConfig() {
        String json = """
            {
              "levelCount": 3,
              "colors": ["#111111", "#222222", "#333333"],
              "round": true,
              "curly": false,
              "square": true,
              "angle": false,
              "heuristic": "loose",
              "preprocessor": false
            }
            """;
        ColorizerConfig config = ColorizerConfig.parse(json);
        assertEquals(3, config.getLevelCount());
        assertEquals(List.of("#111111", "#222222", "#333333"), config.getColors());
        assertFalse(config.isCurly());
        assertFalse(config.isAngle());
        assertEquals("loose", config.getHeuristic());

        ScanOptions options = config.toScanOptions();
        assertEquals(3, options.getLevelCount());
        assertEquals(EnumSet.of(BracketKind.ROUND, BracketKind.SQUARE), options.getEnabledKinds());
        assertEquals(AngleHeuristic.LOOSE, options.getHeuristic());
        assertFalse(options.isPreprocessor());
        assertEquals(new RgbColor(0x22, 0x22, 0x22), config.colorFor(1));
    }

    @Test
    void testPaletteIsPaddedFromDefaults() {
        ColorizerConfig config = ColorizerConfig.parse("""
            { "levelCount": 4, "colors": ["#000000"] }
            """);
        List<String> hex = config.getPalette().stream().map(RgbColor::toHex).toList();
        assertEquals(List.of("#000000", "#EE82EE", "#9ACD32", "#7B68EE"), hex);

        ColorizerConfig many = new ColorizerConfig();
        many.setLevelCount(11);
        List<RgbColor> palette = many.getPalette();
        assertEquals(11, palette.size());
        assertEquals("#FF8C00", palette.get(9).toHex());
        assertEquals("#EE82EE", palette.get(10).toHex());
    }

    @Test
    void testInvalidColorFallsBackToGrey() {
        ColorizerConfig config = ColorizerConfig.parse("""
            { "levelCount": 2, "colors": ["orange", "#00FF00"] }
            """);
        assertEquals(List.of(RgbColor.GREY, new RgbColor(0, 255, 0)), config.getPalette());
    }

    @Test
    void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> ColorizerConfig.parse("{ \"levelCount\": 0 }"));
        assertThrows(IllegalArgumentException.class, () -> ColorizerConfig.parse("{ \"heuristic\": \"fuzzy\" }"));
        assertThrows(IllegalArgumentException.class, () -> new ColorizerConfig().setLevelCount(-1));
        assertThrows(RuntimeException.class, () -> ColorizerConfig.parse("[1, 2]"));
    }

    @Test
    void testLoadFromFile() throws Exception {
        Path file = tempDir.resolve(ColorizerConfig.DEFAULT_CONFIG_FILE);
        Files.writeString(file, """
            { "levelCount": 5, "square": false }
            """);
        ColorizerConfig config = ColorizerConfig.load(file);
        assertEquals(5, config.getLevelCount());
        assertFalse(config.isSquare());
        assertEquals(5, ColorizerConfig.load(file.toString()).getLevelCount());
    }

    @Test
    void testLoadFailures() throws Exception {
        RuntimeException missing = assertThrows(RuntimeException.class,
                () -> ColorizerConfig.load(tempDir.resolve("missing.json")));
        assertTrue(missing.getMessage().startsWith("Failed to load config from: "));

        Path bad = tempDir.resolve("bad.json");
        Files.writeString(bad, "{ \"levelCount\": -3 }");
        RuntimeException invalid = assertThrows(RuntimeException.class, () -> ColorizerConfig.load(bad));
        assertInstanceOf(IllegalArgumentException.class, invalid.getCause());
    }

}
