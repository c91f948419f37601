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

import io.colorizer.common.LanguageIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Line-oriented scanner that finds the dead branches of {@code #if}-family
 * blocks in C-like source, so that brackets inside them are not colored as if
 * they were live code.
 * <p>
 * Conditions it cannot decide are treated as true (fail open): losing colors
 * in valid code is worse than coloring a branch that is actually dead. A region
 * is opened when the document goes from live to dead and closed when it comes
 * back, always on line boundaries.
 */
public class PreprocessorScanner {

    private static final Logger logger = LoggerFactory.getLogger(PreprocessorScanner.class);

    private static final String[] C_FAMILY = {"c", "c++", "cpp", "c#", "csharp", "objective"};

    private final String text;
    private final int length;
    private final DefinedSymbols symbols = new DefinedSymbols();
    private final Deque<PreprocessorFrame> frames = new ArrayDeque<>();
    private final List<InactiveRange> ranges = new ArrayList<>();

    private int regionStart = -1;
    private int lineNumber;

    private PreprocessorScanner(String text) {
        this.text = text == null ? "" : text;
        this.length = this.text.length();
    }

    /**
     * True for C-family language ids and for unknown ones. Scanning text that
     * is not C is harmless: a stray {@code #if 0} line is rare, and the worst
     * outcome is a region that is left uncolored.
     */
    public static boolean appliesTo(String languageId) {
        String id = LanguageIds.normalize(languageId);
        if (id == null) {
            return true;
        }
        for (String marker : C_FAMILY) {
            if (id.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    public static InactiveRegions scan(String text) {
        PreprocessorScanner scanner = new PreprocessorScanner(text);
        scanner.run();
        return new InactiveRegions(scanner.ranges);
    }

    public static InactiveRegions scan(String text, String languageId) {
        return appliesTo(languageId) ? scan(text) : InactiveRegions.EMPTY;
    }

    private void run() {
        int pos = 0;
        while (pos < length) {
            int lineStart = pos;
            int firstLine = lineNumber;
            int next = nextLine(pos);
            String physical = physicalLine(pos, next);
            lineNumber++;
            if (startsWithHash(physical)) {
                // a directive continues while its physical lines end with a backslash
                StringBuilder logical = new StringBuilder();
                while (physical.endsWith("\\") && next < length) {
                    logical.append(physical, 0, physical.length() - 1).append(' ');
                    int start = next;
                    next = nextLine(start);
                    physical = physicalLine(start, next);
                    lineNumber++;
                }
                logical.append(physical);
                Directive.Line directive = Directive.parse(logical.toString());
                if (directive != null) {
                    apply(directive, lineStart, next, firstLine);
                }
            }
            pos = next;
        }
        if (isDead()) {
            closeRegion(length - 1);
        }
        if (!frames.isEmpty() && logger.isDebugEnabled()) {
            logger.debug("{} conditional block(s) still open at end of text, innermost: {}", frames.size(), frames.peek());
        }
    }

    private void apply(Directive.Line directive, int lineStart, int nextLineStart, int line) {
        boolean wasDead = isDead();
        String arg = directive.argument();
        switch (directive.directive()) {
            case DEFINE -> {
                String name = ConditionEvaluator.firstWord(arg);
                if (!wasDead && name != null) {
                    symbols.define(name);
                }
            }
            case UNDEF -> {
                String name = ConditionEvaluator.firstWord(arg);
                if (!wasDead && name != null) {
                    symbols.undef(name);
                }
            }
            case IF -> push(ConditionEvaluator.evalConditionish(arg, symbols), arg, line);
            case IFDEF -> push(ConditionEvaluator.evalIfdef(arg, symbols), arg, line);
            case IFNDEF -> push(ConditionEvaluator.evalIfndef(arg, symbols), arg, line);
            case ELIF -> {
                PreprocessorFrame frame = frames.peek();
                if (frame != null) {
                    ConditionResult condition = ConditionEvaluator.evalConditionish(arg, symbols);
                    if (frame.conditionKnown && !frame.trueBranchTaken && condition == ConditionResult.UNKNOWN) {
                        logUnknown(arg, line);
                    }
                    frame.branch(condition);
                }
            }
            case ELSE -> {
                PreprocessorFrame frame = frames.peek();
                if (frame != null) {
                    frame.branch(ConditionResult.TRUE);
                }
            }
            case ENDIF -> {
                if (!frames.isEmpty()) {
                    frames.pop();
                }
            }
        }
        boolean nowDead = isDead();
        if (!wasDead && nowDead) {
            regionStart = nextLineStart;
        } else if (wasDead && !nowDead) {
            closeRegion(lineStart - 1);
        }
    }

    private void push(ConditionResult condition, String arg, int line) {
        if (condition == ConditionResult.UNKNOWN && !isDead()) {
            logUnknown(arg, line);
        }
        frames.push(new PreprocessorFrame(condition, line));
    }

    private boolean isDead() {
        for (PreprocessorFrame frame : frames) {
            if (!frame.active) {
                return true;
            }
        }
        return false;
    }

    private void closeRegion(int end) {
        if (regionStart >= 0 && end >= regionStart) {
            ranges.add(new InactiveRange(regionStart, end));
        }
        regionStart = -1;
    }

    private static void logUnknown(String arg, int line) {
        if (logger.isDebugEnabled()) {
            logger.debug("line {}: cannot evaluate '{}', treating branch as active", line + 1, arg);
        }
    }

    private static boolean startsWithHash(String line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '#') {
                return true;
            }
            if (c != ' ' && c != '\t' && c != '\f') {
                return false;
            }
        }
        return false;
    }

    private int nextLine(int pos) {
        int lf = text.indexOf('\n', pos);
        return lf < 0 ? length : lf + 1;
    }

    private String physicalLine(int start, int next) {
        int end = next;
        if (end > start && text.charAt(end - 1) == '\n') {
            end--;
        }
        if (end > start && text.charAt(end - 1) == '\r') {
            end--;
        }
        return text.substring(start, end);
    }

}
