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
package io.swlang.ast;

import io.swlang.value.Value;

public enum Operator {

    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    EQUALITY("=="),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_THAN_EQUAL("<="),
    GREATER_THAN_EQUAL(">="),
    SHIFT_LEFT("<<"),
    SHIFT_RIGHT(">>"),
    AND("&&"),
    OR("||"),
    MODULUS("%");

    public final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Both operands are expected to be already evaluated, there is no
     * short-circuit for {@link #AND} or {@link #OR}.
     */
    public Value apply(Value lhs, Value rhs) {
        return switch (this) {
            case ADD -> lhs.add(rhs);
            case SUBTRACT -> lhs.subtract(rhs);
            case MULTIPLY -> lhs.multiply(rhs);
            case DIVIDE -> lhs.divide(rhs);
            case EQUALITY -> lhs.equalTo(rhs);
            case LESS_THAN -> lhs.lessThan(rhs);
            case GREATER_THAN -> lhs.greaterThan(rhs);
            case LESS_THAN_EQUAL -> lhs.lessThanEqual(rhs);
            case GREATER_THAN_EQUAL -> lhs.greaterThanEqual(rhs);
            case SHIFT_LEFT -> lhs.shiftLeft(rhs);
            case SHIFT_RIGHT -> lhs.shiftRight(rhs);
            case AND -> lhs.and(rhs);
            case OR -> lhs.or(rhs);
            case MODULUS -> lhs.modulus(rhs);
        };
    }

    @Override
    public String toString() {
        return symbol;
    }

}
