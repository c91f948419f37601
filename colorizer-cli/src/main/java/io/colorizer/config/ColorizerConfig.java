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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Colorizer settings loaded from colorizer.json.
 * <p>
 * Example colorizer.json:
 * <pre>
 * {
 *   "levelCount": 9,
 *   "colors": ["#FF8C00", "#EE82EE", "#9ACD32"],
 *   "round": true,
 *   "curly": true,
 *   "square": true,
 *   "angle": true,
 *   "heuristic": "strict",
 *   "preprocessor": true
 * }
 * </pre>
 * Keys that are missing keep their defaults. When there are fewer colors than
 * levels, the remaining levels take the default colors in order.
 */
public class ColorizerConfig {

    public static final String DEFAULT_CONFIG_FILE = "colorizer.json";

    public static final List<String> DEFAULT_COLORS = List.of(
            "#FF8C00", // DarkOrange
            "#EE82EE", // Violet
            "#9ACD32", // YellowGreen
            "#7B68EE", // MediumSlateBlue
            "#DAA520", // Goldenrod
            "#4169E1", // RoyalBlue
            "#FF00FF", // Fuchsia
            "#00CED1", // DarkTurquoise
            "#3CB371"  // MediumSeaGreen
    );

    private int levelCount = ScanOptions.DEFAULT_LEVEL_COUNT;
    private List<String> colors = new ArrayList<>(DEFAULT_COLORS);
    private boolean round = true;
    private boolean curly = true;
    private boolean square = true;
    private boolean angle = true;
    private String heuristic = "strict";
    private boolean preprocessor = true;

    /**
     * Load configuration from a JSON file.
     *
     * @throws RuntimeException if the file cannot be read or parsed
     */
    public static ColorizerConfig load(String configPath) {
        return load(Path.of(configPath));
    }

    public static ColorizerConfig load(Path configPath) {
        try {
            String content = Files.readString(configPath);
            return parse(content);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load config from: " + configPath, e);
        }
    }

    /**
     * Parse configuration from a JSON string.
     *
     * @throws RuntimeException if the JSON is invalid or not an object
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ColorizerConfig parse(String json) {
        Json j = Json.of(json);
        if (!j.isObject()) {
            throw new RuntimeException("Invalid config: expected JSON object");
        }
        ColorizerConfig config = new ColorizerConfig();
        j.<Number>getOptional("levelCount").ifPresent(n -> config.setLevelCount(n.intValue()));
        j.<List<String>>getOptional("colors").ifPresent(config::setColors);
        j.<Boolean>getOptional("round").ifPresent(config::setRound);
        j.<Boolean>getOptional("curly").ifPresent(config::setCurly);
        j.<Boolean>getOptional("square").ifPresent(config::setSquare);
        j.<Boolean>getOptional("angle").ifPresent(config::setAngle);
        j.<String>getOptional("heuristic").ifPresent(config::setHeuristic);
        j.<Boolean>getOptional("preprocessor").ifPresent(config::setPreprocessor);
        return config;
    }

    /**
     * One color per level, padded from {@link #DEFAULT_COLORS}. A color that
     * does not parse is replaced with {@link RgbColor#GREY}.
     */
    public List<RgbColor> getPalette() {
        List<RgbColor> palette = new ArrayList<>(levelCount);
        for (int i = 0; i < levelCount; i++) {
            String color = i < colors.size() ? colors.get(i) : DEFAULT_COLORS.get(i % DEFAULT_COLORS.size());
            palette.add(RgbColor.parseOrGrey(color));
        }
        return palette;
    }

    public RgbColor colorFor(int level) {
        List<RgbColor> palette = getPalette();
        return palette.get(Math.floorMod(level, palette.size()));
    }

    public ScanOptions toScanOptions() {
        return ScanOptions.builder()
                .levelCount(levelCount)
                .kind(BracketKind.ROUND, round)
                .kind(BracketKind.CURLY, curly)
                .kind(BracketKind.SQUARE, square)
                .kind(BracketKind.ANGLE, angle)
                .heuristic(AngleHeuristic.of(heuristic))
                .preprocessor(preprocessor)
                .build();
    }

    // ========== Getters and Setters ==========

    public int getLevelCount() {
        return levelCount;
    }

    public void setLevelCount(int levelCount) {
        if (levelCount <= 0) {
            throw new IllegalArgumentException("level count must be positive: " + levelCount);
        }
        this.levelCount = levelCount;
    }

    public List<String> getColors() {
        return colors;
    }

    public void setColors(List<String> colors) {
        this.colors = colors != null ? new ArrayList<>(colors) : new ArrayList<>();
    }

    public boolean isRound() {
        return round;
    }

    public void setRound(boolean round) {
        this.round = round;
    }

    public boolean isCurly() {
        return curly;
    }

    public void setCurly(boolean curly) {
        this.curly = curly;
    }

    public boolean isSquare() {
        return square;
    }

    public void setSquare(boolean square) {
        this.square = square;
    }

    public boolean isAngle() {
        return angle;
    }

    public void setAngle(boolean angle) {
        this.angle = angle;
    }

    public String getHeuristic() {
        return heuristic;
    }

    public void setHeuristic(String heuristic) {
        AngleHeuristic.of(heuristic); // validate
        this.heuristic = heuristic;
    }

    public boolean isPreprocessor() {
        return preprocessor;
    }

    public void setPreprocessor(boolean preprocessor) {
        this.preprocessor = preprocessor;
    }

}
