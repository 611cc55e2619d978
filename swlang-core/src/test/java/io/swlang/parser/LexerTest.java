/*
 * The MIT License
 *
 * Copyright 2024 Karate Labs Inc.
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
package io.swlang.parser;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.swlang.parser.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static List<Token> tokenize(String text) {
        Lexer lexer = new Lexer(text);
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            tokens.add(token);
        } while (token.type != EOF);
        return tokens;
    }

    private static List<TokenType> types(String text) {
        return tokenize(text).stream().map(t -> t.type).toList();
    }

    private static List<String> texts(String text) {
        return Lexer.getTokens(text).stream().map(t -> t.text).toList();
    }

    @Test
    void testOperatorLongestMatch() {
        assertEquals(List.of(LT_LT, EOF), types("<<"));
        assertEquals(List.of(LT_EQ, EOF), types("<="));
        assertEquals(List.of(LT, EOF), types("<"));
        assertEquals(List.of(GT_GT, EOF), types(">>"));
        assertEquals(List.of(GT_EQ, EOF), types(">="));
        assertEquals(List.of(GT, EOF), types(">"));
        assertEquals(List.of(EQ_EQ, EOF), types("=="));
        assertEquals(List.of(AMP_AMP, EOF), types("&&"));
        assertEquals(List.of(PIPE_PIPE, EOF), types("||"));
    }

    @Test
    void testWhitespaceIsNotPrimary() {
        assertEquals(List.of(NUMBER, WS, PLUS, WS, NUMBER, EOF), types("1 + 2"));
        assertEquals(List.of("1", "+", "2", ""), texts("1 + 2"));
    }

    @Test
    void testKeywordsAndIdentifiers() {
        assertEquals(List.of(TRUE, WS, FALSE, WS, EVAL, WS, IDENT, EOF), types("true false eval evaluate"));
        assertEquals(List.of(IDENT, DOT, LENGTH, EOF), types("xs.length"));
        assertEquals(List.of(IDENT, L_BRACKET, NUMBER, R_BRACKET, EOF), types("_x1[0]"));
    }

    @Test
    void testStrings() {
        assertEquals(List.of(D_STRING, EOF), types("\"a \\\" b\""));
        assertEquals(List.of(S_STRING, EOF), types("'it\\'s'"));
        assertEquals(List.of("'x'", ""), texts("'x'"));
    }

    @Test
    void testPositions() {
        List<Token> tokens = Lexer.getTokens("1 +\n  foo");
        Token foo = tokens.get(2);
        assertEquals("foo", foo.text);
        assertEquals(1, foo.line);
        assertEquals(2, foo.col);
        assertEquals("2:3", foo.getPositionDisplay());
    }

    @Test
    void testErrors() {
        ParserException e = assertThrows(ParserException.class, () -> tokenize("1 = 2"));
        assertEquals("unexpected character: '=' at 1:3", e.getMessage());
        assertThrows(ParserException.class, () -> tokenize("a & b"));
        assertThrows(ParserException.class, () -> tokenize("a | b"));
        assertThrows(ParserException.class, () -> tokenize("#"));
        e = assertThrows(ParserException.class, () -> tokenize("'abc"));
        assertEquals("unterminated string at 1:1", e.getMessage());
        assertThrows(ParserException.class, () -> tokenize("\"abc\\"));
    }

}
