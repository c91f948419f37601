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

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns color levels to classified bracket events. This is a best-effort
 * recovery policy, not a validator: documents are routinely unbalanced while
 * being edited, so every close gets a level and nothing ever throws.
 * <p>
 * An open takes {@code depth mod levelCount} and pushes. A close reuses the
 * level of its matching open; on a kind mismatch the stack is unwound to the
 * nearest open of the same kind, dropping the opens in between. A close with
 * nothing to match is painted at level 0.
 * <p>
 * One instance serves one scan pass and is not thread-safe.
 */
public class NestingEngine {

    private final int levelCount;
    private final BracketStack stack = new BracketStack();

    private int unmatchedCloses;
    private int droppedOpens;

    public NestingEngine(int levelCount) {
        if (levelCount <= 0) {
            throw new IllegalArgumentException("level count must be positive: " + levelCount);
        }
        this.levelCount = levelCount;
    }

    public HighlightedRange accept(BracketEvent event) {
        BracketKind kind = event.kind();
        if (event.isOpen()) {
            int level = stack.size() % levelCount;
            stack.push(kind, level, event.offset());
            return HighlightedRange.of(event.offset(), level, kind);
        }
        if (stack.isEmpty()) {
            unmatchedCloses++;
            return HighlightedRange.of(event.offset(), 0, kind);
        }
        if (stack.peekKind() == kind) {
            return HighlightedRange.of(event.offset(), stack.pop().level(), kind);
        }
        int before = stack.size();
        BracketStack.Entry found = stack.popUntil(kind);
        if (found == null) {
            droppedOpens += before;
            unmatchedCloses++;
            return HighlightedRange.of(event.offset(), 0, kind);
        }
        droppedOpens += before - stack.size() - 1;
        return HighlightedRange.of(event.offset(), found.level(), kind);
    }

    public List<HighlightedRange> acceptAll(List<BracketEvent> events) {
        List<HighlightedRange> ranges = new ArrayList<>(events.size());
        for (BracketEvent event : events) {
            ranges.add(accept(event));
        }
        return ranges;
    }

    public BracketKind topKind() {
        return stack.peekKind();
    }

    public int depth() {
        return stack.size();
    }

    public BracketStack getStack() {
        return stack;
    }

    public int getLevelCount() {
        return levelCount;
    }

    public int getUnmatchedCloses() {
        return unmatchedCloses;
    }

    public int getDroppedOpens() {
        return droppedOpens;
    }

}
