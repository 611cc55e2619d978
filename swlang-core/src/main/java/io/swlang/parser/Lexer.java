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

import java.util.ArrayList;
import java.util.List;

import static io.swlang.parser.TokenType.*;

/**
 * Hand-rolled lexer for the expression language.
 */
public class Lexer {

    protected final String source;
    protected final int length;

    protected int pos;
    protected int line;
    protected int col;
    protected int tokenStart;
    protected int tokenLine;
    protected int tokenCol;

    public Lexer(String source) {
        this.source = source;
        this.length = source.length();
        this.pos = 0;
        this.line = 0;
        this.col = 0;
    }

    // ========== Public API ==========

    public Token nextToken() {
        tokenStart = pos;
        tokenLine = line;
        tokenCol = col;
        TokenType type = scanToken();
        String text = source.substring(tokenStart, pos);
        return new Token(type, tokenStart, tokenLine, tokenCol, text);
    }

    /**
     * @return primary tokens only (white-space dropped), always ending with EOF
     */
    public static List<Token> getTokens(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> list = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            if (token.type.primary) {
                list.add(token);
            }
        } while (token.type != EOF);
        return list;
    }

    // ========== Character Utilities ==========

    protected boolean isAtEnd() {
        return pos >= length;
    }

    protected char peek() {
        return pos >= length ? '\0' : source.charAt(pos);
    }

    protected char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 0;
        } else {
            col++;
        }
        return c;
    }

    protected boolean match(char expected) {
        if (pos >= length || source.charAt(pos) != expected) {
            return false;
        }
        advance();
        return true;
    }

    protected static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    protected static boolean isIdentifierStart(char c) {
        return Character.isJavaIdentifierStart(c);
    }

    protected static boolean isIdentifierPart(char c) {
        return Character.isJavaIdentifierPart(c);
    }

    // ========== Main Scanner ==========

    protected TokenType scanToken() {
        if (isAtEnd()) {
            return EOF;
        }
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r', '\n' -> {
                return scanWhitespace();
            }
            case '[' -> {
                return L_BRACKET;
            }
            case ']' -> {
                return R_BRACKET;
            }
            case '(' -> {
                return L_PAREN;
            }
            case ')' -> {
                return R_PAREN;
            }
            case ',' -> {
                return COMMA;
            }
            case '.' -> {
                return DOT;
            }
            case '+' -> {
                return PLUS;
            }
            case '-' -> {
                return MINUS;
            }
            case '*' -> {
                return STAR;
            }
            case '/' -> {
                return SLASH;
            }
            case '%' -> {
                return PERCENT;
            }
            case '!' -> {
                return NOT;
            }
            case '=' -> {
                if (match('=')) {
                    return EQ_EQ;
                }
            }
            case '<' -> {
                if (match('<')) {
                    return LT_LT;
                }
                return match('=') ? LT_EQ : LT;
            }
            case '>' -> {
                if (match('>')) {
                    return GT_GT;
                }
                return match('=') ? GT_EQ : GT;
            }
            case '&' -> {
                if (match('&')) {
                    return AMP_AMP;
                }
            }
            case '|' -> {
                if (match('|')) {
                    return PIPE_PIPE;
                }
            }
            case '"' -> {
                return scanString('"', D_STRING);
            }
            case '\'' -> {
                return scanString('\'', S_STRING);
            }
            default -> {
                if (isDigit(c)) {
                    return scanNumber();
                }
                if (isIdentifierStart(c)) {
                    return scanIdentifier();
                }
            }
        }
        throw error("unexpected character: '" + c + "'");
    }

    private TokenType scanWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else {
                break;
            }
        }
        return WS;
    }

    private TokenType scanNumber() {
        while (isDigit(peek())) {
            advance();
        }
        return NUMBER;
    }

    private TokenType scanIdentifier() {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        TokenType keyword = TokenType.keyword(source.substring(tokenStart, pos));
        return keyword == null ? IDENT : keyword;
    }

    private TokenType scanString(char quote, TokenType type) {
        while (!isAtEnd()) {
            char c = advance();
            if (c == quote) {
                return type;
            }
            if (c == '\\') {
                if (isAtEnd()) {
                    break;
                }
                advance();
            }
        }
        throw error("unterminated string");
    }

    private ParserException error(String message) {
        return new ParserException(message + " at " + (tokenLine + 1) + ":" + (tokenCol + 1));
    }

}
