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

import io.colorizer.brackets.HighlightedRange;
import io.colorizer.brackets.ScanResult;
import io.colorizer.config.RgbColor;
import io.colorizer.preprocessor.InactiveRange;
import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes a scan result as one JSON document:
 * <pre>
 * {
 *   "file": "src/main.c",
 *   "language": "c",
 *   "ranges": [{"start": 3, "end": 4, "level": 0, "kind": "round", "color": "#FF8C00"}],
 *   "inactive": [{"start": 20, "end": 41}]
 * }
 * </pre>
 */
public class JsonRenderer {

    private final List<RgbColor> palette;

    public JsonRenderer(List<RgbColor> palette) {
        if (palette == null || palette.isEmpty()) {
            throw new IllegalArgumentException("palette must not be empty");
        }
        this.palette = List.copyOf(palette);
    }

    public Map<String, Object> toMap(String file, ScanResult result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", file);
        map.put("language", result.languageId());
        List<Map<String, Object>> ranges = new ArrayList<>(result.ranges().size());
        for (HighlightedRange range : result.ranges()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("start", range.start());
            item.put("end", range.end());
            item.put("level", range.level());
            item.put("kind", range.kind().name().toLowerCase(Locale.ROOT));
            item.put("color", palette.get(Math.floorMod(range.level(), palette.size())).toHex());
            ranges.add(item);
        }
        map.put("ranges", ranges);
        List<Map<String, Object>> inactive = new ArrayList<>();
        for (InactiveRange range : result.inactive().asList()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("start", range.start());
            item.put("end", range.end());
            inactive.add(item);
        }
        map.put("inactive", inactive);
        return map;
    }

    public String render(String file, ScanResult result) {
        return JSONValue.toJSONString(toMap(file, result), JSONStyle.LT_COMPRESS);
    }

}
