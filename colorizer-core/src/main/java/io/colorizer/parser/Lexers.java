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
package io.colorizer.parser;

import io.colorizer.common.LanguageIds;
import io.colorizer.common.Resource;

import java.util.List;

/**
 * Picks the built-in tokenizer for a language. Languages without one get
 * {@code null}, which sends bracket scanning down the raw-text fallback.
 */
public class Lexers {

    private Lexers() {
    }

    public static BaseLexer forLanguage(String languageId, Resource resource) {
        String id = LanguageIds.normalize(languageId);
        if (id == null) {
            return null;
        }
        return switch (canonical(id)) {
            case LanguageIds.C, LanguageIds.CPP, LanguageIds.CSHARP, LanguageIds.OBJECTIVE_C,
                 LanguageIds.JAVA, LanguageIds.KOTLIN, LanguageIds.SCALA, LanguageIds.SWIFT,
                 LanguageIds.RUST -> new CLikeLexer(resource);
            case LanguageIds.GROOVY, LanguageIds.DART -> new CLikeLexer(resource, false, true);
            case LanguageIds.GO -> new CLikeLexer(resource, true, false);
            case LanguageIds.JAVASCRIPT, LanguageIds.TYPESCRIPT -> new CLikeLexer(resource, true, true);
            default -> null;
        };
    }

    public static boolean isSupported(String languageId) {
        return forLanguage(languageId, Resource.text("")) != null;
    }

    /**
     * @return the tokens for the resource, or null when the language has no tokenizer
     */
    public static List<Token> tokenize(String languageId, Resource resource) {
        BaseLexer lexer = forLanguage(languageId, resource);
        return lexer == null ? null : BaseLexer.tokenize(lexer);
    }

    private static String canonical(String id) {
        return switch (id) {
            case "c++", "cxx", "cc" -> LanguageIds.CPP;
            case "c#", "cs" -> LanguageIds.CSHARP;
            case "objc", "objectivec", "objective-c++", "objcpp" -> LanguageIds.OBJECTIVE_C;
            case "js", "jsx", "ecmascript" -> LanguageIds.JAVASCRIPT;
            case "ts" -> LanguageIds.TYPESCRIPT;
            case "kt" -> LanguageIds.KOTLIN;
            case "golang" -> LanguageIds.GO;
            case "rs" -> LanguageIds.RUST;
            default -> id;
        };
    }

}
