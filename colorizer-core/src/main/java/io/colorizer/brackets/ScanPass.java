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

import io.colorizer.preprocessor.InactiveRegions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * One scan over one text snapshot: candidate offsets go in, in ascending
 * order, and highlighted ranges accumulate in a local list that is handed out
 * only when the pass finishes.
 */
class ScanPass {

    private static final Logger logger = LoggerFactory.getLogger(ScanPass.class);

    private final String text;
    private final ScanOptions options;
    private final InactiveRegions inactive;
    private final NestingEngine engine;
    private final List<HighlightedRange> ranges = new ArrayList<>();

    // lowest offset not yet visited, keeps offsets strictly increasing
    private int next;

    ScanPass(String text, ScanOptions options, InactiveRegions inactive) {
        this.text = text;
        this.options = options;
        this.inactive = inactive == null ? InactiveRegions.EMPTY : inactive;
        this.engine = new NestingEngine(options.getLevelCount());
    }

    void visit(int from, int to) {
        int start = Math.max(Math.max(from, 0), next);
        int end = Math.min(to, text.length());
        for (int i = start; i < end; i++) {
            char c = text.charAt(i);
            if (BracketKind.isBracket(c) && !inactive.contains(i)) {
                BracketEvent event = classify(c, i);
                if (event != null) {
                    HighlightedRange range = engine.accept(event);
                    // disabled kinds still count for depth, they are only not painted
                    if (options.isEnabled(range.kind())) {
                        ranges.add(range);
                    }
                }
            }
        }
        next = Math.max(next, end);
    }

    /**
     * @return the event for a bracket character, or null if an angle is an operator
     */
    BracketEvent classify(char c, int offset) {
        AngleHeuristic heuristic = options.getHeuristic();
        return switch (c) {
            case '(', '{', '[' -> BracketEvent.open(offset, c);
            case ')', '}', ']' -> BracketEvent.close(offset, c);
            case '<' -> heuristic.isGenericOpen(text, offset) ? BracketEvent.open(offset, c) : null;
            case '>' -> {
                if (engine.topKind() == BracketKind.ANGLE || !heuristic.isOperator(text, offset)) {
                    yield BracketEvent.close(offset, c);
                }
                yield null;
            }
            default -> null;
        };
    }

    List<HighlightedRange> finish() {
        if (logger.isTraceEnabled()) {
            logger.trace("scan done: {} ranges, {} unmatched closes, {} dropped opens, {} left open",
                    ranges.size(), engine.getUnmatchedCloses(), engine.getDroppedOpens(), engine.depth());
        }
        return ranges;
    }

}
