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
package io.colorizer.common;

import java.nio.file.Path;

/**
 * An immutable text snapshot to be colorized, optionally backed by a file.
 * The text is read once and never changes for the lifetime of the resource,
 * so one resource can be handed to any number of concurrent scans.
 */
public interface Resource {

    String getText();

    /**
     * Path used for display and language detection, empty for in-memory text.
     */
    String getRelativePath();

    /**
     * Returns true if this resource is backed by the file system.
     */
    boolean isFile();

    default boolean isInMemory() {
        return !isFile();
    }

    /**
     * Returns the 0-indexed line, or an empty string when out of range.
     */
    String getLine(int index);

    default String getLanguageId() {
        return LanguageIds.fromFileName(getRelativePath());
    }

    static Resource text(String text) {
        return new MemoryResource(text);
    }

    static Resource text(String text, String relativePath) {
        return new MemoryResource(text, relativePath);
    }

    static Resource from(Path path) {
        return new PathResource(path);
    }

}
