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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps file names to the language identifiers the scanners understand.
 * Identifiers are lower-case and follow the common editor naming
 * ("c", "cpp", "csharp", "objective-c", "java", ...).
 */
public class LanguageIds {

    public static final String C = "c";
    public static final String CPP = "cpp";
    public static final String CSHARP = "csharp";
    public static final String OBJECTIVE_C = "objective-c";
    public static final String JAVA = "java";
    public static final String KOTLIN = "kotlin";
    public static final String SCALA = "scala";
    public static final String GROOVY = "groovy";
    public static final String JAVASCRIPT = "javascript";
    public static final String TYPESCRIPT = "typescript";
    public static final String GO = "go";
    public static final String RUST = "rust";
    public static final String SWIFT = "swift";
    public static final String DART = "dart";
    public static final String TEXT = "text";

    private static final Map<String, String> EXTENSIONS = new HashMap<>();

    static {
        for (String ext : new String[]{"c", "h"}) {
            EXTENSIONS.put(ext, C);
        }
        for (String ext : new String[]{"cpp", "cc", "cxx", "c++", "hpp", "hh", "hxx", "ino"}) {
            EXTENSIONS.put(ext, CPP);
        }
        EXTENSIONS.put("cs", CSHARP);
        EXTENSIONS.put("m", OBJECTIVE_C);
        EXTENSIONS.put("mm", OBJECTIVE_C);
        EXTENSIONS.put("java", JAVA);
        EXTENSIONS.put("kt", KOTLIN);
        EXTENSIONS.put("kts", KOTLIN);
        EXTENSIONS.put("scala", SCALA);
        EXTENSIONS.put("groovy", GROOVY);
        EXTENSIONS.put("gradle", GROOVY);
        EXTENSIONS.put("js", JAVASCRIPT);
        EXTENSIONS.put("mjs", JAVASCRIPT);
        EXTENSIONS.put("cjs", JAVASCRIPT);
        EXTENSIONS.put("ts", TYPESCRIPT);
        EXTENSIONS.put("tsx", TYPESCRIPT);
        EXTENSIONS.put("go", GO);
        EXTENSIONS.put("rs", RUST);
        EXTENSIONS.put("swift", SWIFT);
        EXTENSIONS.put("dart", DART);
        EXTENSIONS.put("txt", TEXT);
    }

    private LanguageIds() {
    }

    /**
     * @return the language id for the extension of the given name, or null
     * when the extension is missing or not recognized
     */
    public static String fromFileName(String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return null;
        }
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        String name = fileName.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return null;
        }
        return EXTENSIONS.get(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    public static String normalize(String languageId) {
        if (languageId == null) {
            return null;
        }
        String trimmed = languageId.trim();
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }

}
