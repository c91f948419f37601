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

/**
 * State of one open {@code #if} / {@code #ifdef} / {@code #ifndef} block.
 */
class PreprocessorFrame {

    boolean active;
    boolean conditionKnown;
    boolean trueBranchTaken;
    final int line;

    PreprocessorFrame(ConditionResult condition, int line) {
        this.active = condition != ConditionResult.FALSE;
        this.conditionKnown = condition != ConditionResult.UNKNOWN;
        this.trueBranchTaken = condition == ConditionResult.TRUE;
        this.line = line;
    }

    /**
     * {@code #elif} and {@code #else} ({@code #else} evaluates as TRUE). A block
     * whose condition was never known stays as it is; once a branch was taken,
     * every later branch is dead.
     *
     * @return true if the frame changed
     */
    boolean branch(ConditionResult condition) {
        if (!conditionKnown) {
            return false;
        }
        if (trueBranchTaken) {
            boolean changed = active;
            active = false;
            return changed;
        }
        boolean was = active;
        switch (condition) {
            case TRUE -> {
                active = true;
                trueBranchTaken = true;
            }
            case FALSE -> active = false;
            default -> {
                active = true;
                conditionKnown = false;
            }
        }
        return was != active;
    }

    @Override
    public String toString() {
        return "frame@" + (line + 1) + "[active=" + active + ", known=" + conditionKnown + ", taken=" + trueBranchTaken + "]";
    }

}
