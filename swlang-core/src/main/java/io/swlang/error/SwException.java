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
package io.swlang.error;

import io.swlang.value.Type;
import io.swlang.value.Value;

/**
 * The single failure type of evaluation. The {@link ErrorKind} tells which
 * component raised it and why, the kind-specific details are available via
 * the getters (null when not applicable).
 * <p>
 * Instances are created through the static factories so that messages stay
 * consistent across the code base.
 */
public class SwException extends RuntimeException {

    private final ErrorKind kind;
    private final Type expected;
    private final Type actual;
    private final String name;

    private SwException(ErrorKind kind, String message, Type expected, Type actual, String name) {
        super(message);
        this.kind = kind;
        this.expected = expected;
        this.actual = actual;
        this.name = name;
    }

    private SwException(ErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    public static SwException unexpectedType(Type expected, Type actual) {
        return new SwException(ErrorKind.UNEXPECTED_TYPE,
                "unexpected type, expected: " + expected + ", actual: " + actual, expected, actual, null);
    }

    public static SwException indexUnindexable(Type actual) {
        return new SwException(ErrorKind.INDEX_UNINDEXABLE,
                "type is not indexable: " + actual, null, actual, null);
    }

    public static SwException syntaxError(String message) {
        return new SwException(ErrorKind.SYNTAX_ERROR, message);
    }

    public static SwException recursionLimit(int limit) {
        return new SwException(ErrorKind.RECURSION_LIMIT, "evaluation depth limit exceeded: " + limit);
    }

    public static SwException invalidOperation(String operator, Value lhs, Value rhs) {
        return new SwException(ErrorKind.INVALID_OPERATION,
                "invalid operation: " + lhs.getType() + " " + operator + " " + rhs.getType(), null, null, operator);
    }

    public static SwException divideByZero() {
        return new SwException(ErrorKind.DIVIDE_BY_ZERO, "divide by zero");
    }

    public static SwException integerOverflow(String operation) {
        return new SwException(ErrorKind.INTEGER_OVERFLOW, "integer overflow: " + operation);
    }

    public static SwException invalidShift(long amount) {
        return new SwException(ErrorKind.INVALID_SHIFT, "invalid shift amount: " + amount);
    }

    public static SwException unknownVariable(String name) {
        return new SwException(ErrorKind.UNKNOWN_VARIABLE, name + " is not defined", null, null, name);
    }

    public static SwException unknownFunction(String name) {
        return new SwException(ErrorKind.UNKNOWN_FUNCTION, name + " is not a function", null, null, name);
    }

    public static SwException arityMismatch(String name, int expected, int actual) {
        return new SwException(ErrorKind.ARITY_MISMATCH,
                name + " expects " + expected + " argument(s), got: " + actual, null, null, name);
    }

    public static SwException indexOutOfBounds(String name, long index, int length) {
        return new SwException(ErrorKind.INDEX_OUT_OF_BOUNDS,
                "index out of bounds: " + name + "[" + index + "], length: " + length, null, null, name);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Type getExpected() {
        return expected;
    }

    public Type getActual() {
        return actual;
    }

    /**
     * @return the variable or function name, or the operator symbol for
     * {@link ErrorKind#INVALID_OPERATION}
     */
    public String getName() {
        return name;
    }

}
