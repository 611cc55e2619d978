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

public enum TokenType {

    WS,
    EOF,
    L_BRACKET,
    R_BRACKET,
    L_PAREN,
    R_PAREN,
    COMMA,
    DOT,
    //==== keywords
    TRUE,
    FALSE,
    EVAL,
    LENGTH,
    //====
    EQ_EQ,
    LT_LT,
    LT_EQ,
    LT,
    GT_GT,
    GT_EQ,
    GT,
    NOT,
    PIPE_PIPE,
    AMP_AMP,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    //====
    S_STRING,
    D_STRING,
    NUMBER,
    IDENT;

    public final boolean primary;

    TokenType() {
        // note that EOF is "primary" for parsing and not considered white-space
        this.primary = !"WS".equals(name());
    }

    static TokenType keyword(String text) {
        return switch (text) {
            case "true" -> TRUE;
            case "false" -> FALSE;
            case "eval" -> EVAL;
            case "length" -> LENGTH;
            default -> null;
        };
    }

}
