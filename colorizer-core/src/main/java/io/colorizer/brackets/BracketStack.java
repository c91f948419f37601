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
 * Still-unmatched opens of one scan pass, innermost last.
 */
public class BracketStack {

    public record Entry(BracketKind kind, int level, int offset) {

    }

    private final List<Entry> entries = new ArrayList<>();

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void push(BracketKind kind, int level, int offset) {
        entries.add(new Entry(kind, level, offset));
    }

    public Entry peek() {
        return entries.isEmpty() ? null : entries.get(entries.size() - 1);
    }

    public BracketKind peekKind() {
        Entry top = peek();
        return top == null ? null : top.kind;
    }

    public Entry pop() {
        return entries.isEmpty() ? null : entries.remove(entries.size() - 1);
    }

    /**
     * Pops entries until one of the given kind is popped. Entries above it are
     * discarded. When no entry of that kind exists the stack ends up empty.
     *
     * @return the matching entry, or null if none was found
     */
    public Entry popUntil(BracketKind kind) {
        while (!entries.isEmpty()) {
            Entry entry = pop();
            if (entry.kind == kind) {
                return entry;
            }
        }
        return null;
    }

    public List<Entry> toList() {
        return List.copyOf(entries);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Entry entry : entries) {
            sb.append(entry.kind.open);
        }
        return sb.toString();
    }

}
