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

import io.swlang.ast.Expression;
import io.swlang.ast.Operator;
import io.swlang.value.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.swlang.parser.TokenType.*;

/**
 * Recursive descent parser producing an {@link Expression} tree. All binary
 * operators are left associative, precedence from lowest to highest:
 * <pre>
 * ||
 * &amp;&amp;
 * ==
 * &lt; &gt; &lt;= &gt;=
 * &lt;&lt; &gt;&gt;
 * + -
 * * / %
 * ! - (unary)
 * </pre>
 * Failures are reported by throwing {@link ParserException}.
 */
public class Parser {

    private static final TokenType[] T_COMPARE_EXPR = {LT, GT, LT_EQ, GT_EQ};
    private static final TokenType[] T_SHIFT_EXPR = {LT_LT, GT_GT};
    private static final TokenType[] T_ADD_EXPR = {PLUS, MINUS};
    private static final TokenType[] T_MUL_EXPR = {STAR, SLASH, PERCENT};

    private final List<Token> tokens;
    private final int size;

    private int position = 0;

    public Parser(String source) {
        tokens = Lexer.getTokens(source);
        size = tokens.size();
    }

    public static Expression parse(String source) {
        return new Parser(source).parse();
    }

    public Expression parse() {
        Expression result = expr();
        if (!peekIf(EOF)) {
            error("unexpected token");
        }
        return result;
    }

    // ========== Grammar ==========

    private Expression expr() {
        return orExpr();
    }

    private Expression orExpr() {
        Expression lhs = andExpr();
        while (consumeIf(PIPE_PIPE)) {
            lhs = Expression.binary(lhs, Operator.OR, andExpr());
        }
        return lhs;
    }

    private Expression andExpr() {
        Expression lhs = equalityExpr();
        while (consumeIf(AMP_AMP)) {
            lhs = Expression.binary(lhs, Operator.AND, equalityExpr());
        }
        return lhs;
    }

    private Expression equalityExpr() {
        Expression lhs = compareExpr();
        while (consumeIf(EQ_EQ)) {
            lhs = Expression.binary(lhs, Operator.EQUALITY, compareExpr());
        }
        return lhs;
    }

    private Expression compareExpr() {
        Expression lhs = shiftExpr();
        while (peekAnyOf(T_COMPARE_EXPR)) {
            Operator operator = switch (next().type) {
                case LT -> Operator.LESS_THAN;
                case GT -> Operator.GREATER_THAN;
                case LT_EQ -> Operator.LESS_THAN_EQUAL;
                default -> Operator.GREATER_THAN_EQUAL;
            };
            lhs = Expression.binary(lhs, operator, shiftExpr());
        }
        return lhs;
    }

    private Expression shiftExpr() {
        Expression lhs = addExpr();
        while (peekAnyOf(T_SHIFT_EXPR)) {
            Operator operator = next().type == LT_LT ? Operator.SHIFT_LEFT : Operator.SHIFT_RIGHT;
            lhs = Expression.binary(lhs, operator, addExpr());
        }
        return lhs;
    }

    private Expression addExpr() {
        Expression lhs = mulExpr();
        while (peekAnyOf(T_ADD_EXPR)) {
            Operator operator = next().type == PLUS ? Operator.ADD : Operator.SUBTRACT;
            lhs = Expression.binary(lhs, operator, mulExpr());
        }
        return lhs;
    }

    private Expression mulExpr() {
        Expression lhs = unaryExpr();
        while (peekAnyOf(T_MUL_EXPR)) {
            Operator operator = switch (next().type) {
                case STAR -> Operator.MULTIPLY;
                case SLASH -> Operator.DIVIDE;
                default -> Operator.MODULUS;
            };
            lhs = Expression.binary(lhs, operator, unaryExpr());
        }
        return lhs;
    }

    private Expression unaryExpr() {
        if (consumeIf(NOT)) {
            return new Expression.Not(unaryExpr());
        }
        if (consumeIf(MINUS)) {
            if (peekIf(NUMBER)) {
                return Expression.literal(number(next(), true));
            }
            // no negation node, so "-x" is "0 - x"
            return Expression.binary(Expression.literal(0), Operator.SUBTRACT, unaryExpr());
        }
        return primaryExpr();
    }

    private Expression primaryExpr() {
        switch (peek()) {
            case NUMBER, S_STRING, D_STRING, TRUE, FALSE, L_BRACKET -> {
                return Expression.literal(constant());
            }
            case EVAL -> {
                next();
                consume(L_PAREN);
                Expression inner = expr();
                consume(R_PAREN);
                return new Expression.Eval(inner);
            }
            case L_PAREN -> {
                next();
                Expression inner = expr();
                consume(R_PAREN);
                return inner;
            }
            case IDENT -> {
                return refExpr(next().text);
            }
            default -> {
                error("expected: expression");
                return null; // unreachable
            }
        }
    }

    private Expression refExpr(String name) {
        if (consumeIf(L_PAREN)) {
            List<Expression> args = new ArrayList<>();
            if (!consumeIf(R_PAREN)) {
                do {
                    args.add(expr());
                } while (consumeIf(COMMA));
                consume(R_PAREN);
            }
            return new Expression.FunctionCall(name, args);
        }
        if (consumeIf(L_BRACKET)) {
            Expression index = expr();
            consume(R_BRACKET);
            return new Expression.ListIndex(name, index);
        }
        if (consumeIf(DOT)) {
            consume(LENGTH);
            return new Expression.ListLength(name);
        }
        return new Expression.Variable(name);
    }

    private Value constant() {
        Token token = next();
        switch (token.type) {
            case NUMBER -> {
                return number(token, false);
            }
            case MINUS -> {
                if (!peekIf(NUMBER)) {
                    error(NUMBER);
                }
                return number(next(), true);
            }
            case TRUE -> {
                return Value.of(true);
            }
            case FALSE -> {
                return Value.of(false);
            }
            case S_STRING, D_STRING -> {
                return Value.of(unescape(token));
            }
            case L_BRACKET -> {
                List<Value> list = new ArrayList<>();
                if (!consumeIf(R_BRACKET)) {
                    do {
                        list.add(constant());
                    } while (consumeIf(COMMA));
                    consume(R_BRACKET);
                }
                return Value.of(list);
            }
            default -> {
                position--;
                error("expected: constant");
                return null; // unreachable
            }
        }
    }

    private Value number(Token token, boolean negative) {
        String text = negative ? "-" + token.text : token.text;
        try {
            return Value.of(Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new ParserException("number out of range: " + text + " at " + token.getPositionDisplay(), e);
        }
    }

    private static String unescape(Token token) {
        String s = token.text.substring(1, token.text.length() - 1);
        if (s.indexOf('\\') == -1) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            char next = s.charAt(++i); // lexer guarantees an escaped char
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '0' -> sb.append('\0');
                case '\\', '"', '\'' -> sb.append(next);
                default -> throw new ParserException("invalid escape: \\" + next + " at " + token.getPositionDisplay());
            }
        }
        return sb.toString();
    }

    // ========== Token Utilities ==========

    private void error(String message) {
        Token token = peekToken();
        throw new ParserException(message + " at " + token.getPositionDisplay() + ", found: " + token);
    }

    private void error(TokenType... expected) {
        error("expected: " + Arrays.asList(expected));
    }

    private TokenType peek() {
        return peekToken().type;
    }

    private Token peekToken() {
        return position == size ? Token.EMPTY : tokens.get(position);
    }

    private boolean peekIf(TokenType token) {
        return peek() == token;
    }

    private boolean peekAnyOf(TokenType[] tokens) {
        TokenType current = peek();
        for (TokenType token : tokens) {
            if (current == token) {
                return true;
            }
        }
        return false;
    }

    private void consume(TokenType token) {
        if (!consumeIf(token)) {
            error(token);
        }
    }

    private boolean consumeIf(TokenType token) {
        if (peekIf(token)) {
            next();
            return true;
        }
        return false;
    }

    private Token next() {
        return position == size ? Token.EMPTY : tokens.get(position++);
    }

}
