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

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable scan settings. Validation happens here, when settings are built,
 * so that a scan itself never fails on configuration.
 */
public class ScanOptions {

    public static final int DEFAULT_LEVEL_COUNT = 9;

    private static final ScanOptions DEFAULTS = builder().build();

    private final int levelCount;
    private final Set<BracketKind> enabledKinds;
    private final AngleHeuristic heuristic;
    private final boolean preprocessor;

    private ScanOptions(Builder builder) {
        this.levelCount = builder.levelCount;
        this.enabledKinds = Set.copyOf(builder.enabledKinds);
        this.heuristic = builder.heuristic;
        this.preprocessor = builder.preprocessor;
    }

    public static ScanOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getLevelCount() {
        return levelCount;
    }

    public Set<BracketKind> getEnabledKinds() {
        return enabledKinds;
    }

    public boolean isEnabled(BracketKind kind) {
        return enabledKinds.contains(kind);
    }

    public AngleHeuristic getHeuristic() {
        return heuristic;
    }

    public boolean isPreprocessor() {
        return preprocessor;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.levelCount = levelCount;
        builder.enabledKinds = enabledKinds.isEmpty() ? EnumSet.noneOf(BracketKind.class) : EnumSet.copyOf(enabledKinds);
        builder.heuristic = heuristic;
        builder.preprocessor = preprocessor;
        return builder;
    }

    @Override
    public String toString() {
        return "ScanOptions[levels=" + levelCount + ", kinds=" + enabledKinds + ", heuristic=" + heuristic
                + ", preprocessor=" + preprocessor + "]";
    }

    public static class Builder {

        private int levelCount = DEFAULT_LEVEL_COUNT;
        private EnumSet<BracketKind> enabledKinds = EnumSet.allOf(BracketKind.class);
        private AngleHeuristic heuristic = AngleHeuristic.STRICT;
        private boolean preprocessor = true;

        Builder() {
        }

        public Builder levelCount(int levelCount) {
            this.levelCount = levelCount;
            return this;
        }

        public Builder enabledKinds(Collection<BracketKind> kinds) {
            this.enabledKinds = kinds.isEmpty() ? EnumSet.noneOf(BracketKind.class) : EnumSet.copyOf(kinds);
            return this;
        }

        public Builder kind(BracketKind kind, boolean enabled) {
            if (enabled) {
                enabledKinds.add(kind);
            } else {
                enabledKinds.remove(kind);
            }
            return this;
        }

        public Builder heuristic(AngleHeuristic heuristic) {
            this.heuristic = heuristic == null ? AngleHeuristic.STRICT : heuristic;
            return this;
        }

        public Builder preprocessor(boolean preprocessor) {
            this.preprocessor = preprocessor;
            return this;
        }

        public ScanOptions build() {
            if (levelCount <= 0) {
                throw new IllegalArgumentException("level count must be positive: " + levelCount);
            }
            return new ScanOptions(this);
        }

    }

}
