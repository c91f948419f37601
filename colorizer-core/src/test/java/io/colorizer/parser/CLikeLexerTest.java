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

import io.colorizer.common.Resource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.colorizer.parser.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

class CLikeLexerTest {

    private static List<Token> tokenize(String text) {
        return BaseLexer.tokenize(new CLikeLexer(Resource.text(text)));
    }

    private static List<TokenType> types(String text) {
        return tokenize(text).stream().map(t -> t.type).toList();
    }

    private static List<String> texts(String text) {
        return tokenize(text).stream().map(t -> t.getText(text)).toList();
    }

    @Test
    void testBasics() {
        assertEquals(List.of(KEYWORD, WS, IDENT, WS, OPERATOR, WS, NUMBER, SEMI), types("int x = 1;"));
        assertEquals(List.of(IDENT, L_PAREN, IDENT, COMMA, WS, IDENT, R_PAREN), types("foo(a, b)"));
        assertEquals(List.of(L_CURLY, WS_LF, L_BRACKET, R_BRACKET, WS_LF, R_CURLY), types("{\n[]\r\n}"));
        assertEquals(List.of(), types(""));
    }

    @Test
    void testPrimaryFlags() {
        for (TokenType type : TokenType.values()) {
            boolean skipped = type == WS || type == WS_LF || type == L_COMMENT || type == B_COMMENT || type == DOC_COMMENT;
            assertEquals(!skipped, type.primary, type.name());
        }
        assertTrue(DOC_COMMENT.tags.contains("DEFAULT_BLOCK_COMMENT"));
        assertEquals(List.of(IDENT, NUMBER), tokenize("a /* b */ 1").stream().map(t -> t.type).filter(t -> t.primary).toList());
    }

    @Test
    void testComments() {
        assertEquals(List.of(L_COMMENT, WS_LF, IDENT), types("// hi (\nx"));
        assertEquals(List.of(B_COMMENT, WS, DOC_COMMENT, WS, B_COMMENT), types("/* a */ /** b */ /**/"));
        assertEquals(List.of("/* never closed {"), texts("/* never closed {"));
        assertEquals(List.of(IDENT, L_COMMENT), types("x//c"));
        assertEquals(List.of(IDENT, OPERATOR, B_COMMENT, IDENT), types("a+/*c*/b"));
    }

    @Test
    void testStrings() {
        assertEquals(List.of(D_STRING, WS, CHAR_LITERAL, WS, CHAR_LITERAL), types("\"a(b\" 'c' '\\n'"));
        assertEquals(List.of("\"a\\\"b\""), texts("\"a\\\"b\""));
        // unterminated literal stops at the line break
        assertEquals(List.of("\"abc", "\n", "x"), texts("\"abc\nx"));
        assertEquals(List.of(TEXT_BLOCK), types("\"\"\"\n(x\n\"\"\""));
    }

    @Test
    void testLoneApostrophe() {
        assertEquals(List.of(OPERATOR, OPERATOR, IDENT, OPERATOR), types("<'a>"));
        assertEquals(List.of("<", "'", "a", ">"), texts("<'a>"));
    }

    @Test
    void testBacktickAndSingleQuoteStrings() {
        assertEquals(List.of(OTHER, IDENT, OTHER), types("`a`"));
        List<Token> go = BaseLexer.tokenize(new CLikeLexer(Resource.text("`a\n(b`"), true, false));
        assertEquals(1, go.size());
        assertEquals(T_STRING, go.get(0).type);
        List<Token> js = BaseLexer.tokenize(new CLikeLexer(Resource.text("'a(b'"), true, true));
        assertEquals(1, js.size());
        assertEquals(S_STRING, js.get(0).type);
    }

    @Test
    void testOperatorRuns() {
        assertEquals(List.of("a", "<<=", "b"), texts("a<<=b"));
        assertEquals(List.of("x", "->", "y"), texts("x->y"));
        assertEquals(List.of("Map", "<", "K", ",", " ", "List", "<", "V", ">>"), texts("Map<K, List<V>>"));
    }

    @Test
    void testDirective() {
        assertEquals(List.of(HASH, IDENT, WS, OPERATOR, IDENT, DOT, IDENT, OPERATOR), types("#include <stdio.h>"));
    }

    @Test
    void testNumbers() {
        assertEquals(List.of(NUMBER, WS, NUMBER, WS, NUMBER, WS, NUMBER, WS, NUMBER), types("0x1F 1_000 3.14 1'000 .5"));
    }

    @Test
    void testTagsAndGapless() {
        String text = "void f() { /* c */ return \"s\"; } // end\n";
        List<Token> tokens = tokenize(text);
        int pos = 0;
        for (Token token : tokens) {
            assertEquals(pos, token.start);
            assertTrue(token.end > token.start);
            pos = token.end;
        }
        assertEquals(text.length(), pos);
        Token comment = tokens.stream().filter(t -> t.type == B_COMMENT).findFirst().orElseThrow();
        assertTrue(comment.tags.contains("DEFAULT_BLOCK_COMMENT"));
        assertTrue(DOC_COMMENT.tags.contains("DEFAULT_DOC_COMMENT"));
        assertFalse(L_COMMENT.primary);
        assertTrue(IDENT.primary);
        assertTrue(WS.tags.isEmpty());
    }

    @Test
    void testLexers() {
        assertInstanceOf(CLikeLexer.class, Lexers.forLanguage("java", Resource.text("")));
        assertNull(Lexers.forLanguage("python", Resource.text("")));
        assertNull(Lexers.forLanguage(null, Resource.text("")));
        assertTrue(Lexers.isSupported("C++"));
        assertTrue(Lexers.isSupported(" TypeScript "));
        assertTrue(Lexers.isSupported("rs"));
        assertFalse(Lexers.isSupported("text"));
        assertNull(Lexers.tokenize("text", Resource.text("(a)")));
        List<Token> tokens = Lexers.tokenize("js", Resource.text("`(`"));
        assertNotNull(tokens);
        assertEquals(1, tokens.size());
        assertEquals(T_STRING, tokens.get(0).type);
    }

}
