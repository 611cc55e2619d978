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
package io.swlang.value;

import io.swlang.error.ErrorKind;
import io.swlang.error.SwException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValueTest {

    static final Value ONE = Value.of(1);
    static final Value TWO = Value.of(2);
    static final Value STR = Value.of("a");
    static final Value LIST = ListValue.of(ONE, TWO);

    private static SwException error(ErrorKind kind, Executable executable) {
        SwException e = assertThrows(SwException.class, executable);
        assertEquals(kind, e.getKind(), e.getMessage());
        return e;
    }

    @Test
    void testTypes() {
        assertEquals(Type.INT, ONE.getType());
        assertEquals(Type.BOOL, Value.of(true).getType());
        assertEquals(Type.STR, STR.getType());
        assertEquals(Type.LIST, LIST.getType());
        assertEquals("Int", Type.INT.toString());
        assertEquals("Str", Type.STR.toString());
    }

    @Test
    void testAdd() {
        assertEquals(Value.of(3), ONE.add(TWO));
        assertEquals(Value.of("ab"), STR.add(Value.of("b")));
        assertEquals(ListValue.of(ONE, TWO, STR), LIST.add(ListValue.of(STR)));
        SwException e = error(ErrorKind.INVALID_OPERATION, () -> ONE.add(LIST));
        assertEquals("+", e.getName());
        assertEquals("invalid operation: Int + List", e.getMessage());
        error(ErrorKind.INVALID_OPERATION, () -> STR.add(ONE));
        error(ErrorKind.INVALID_OPERATION, () -> Value.of(true).add(Value.of(true)));
    }

    @Test
    void testArithmetic() {
        assertEquals(Value.of(-1), ONE.subtract(TWO));
        assertEquals(Value.of(6), TWO.multiply(Value.of(3)));
        assertEquals(Value.of(3), Value.of(7).divide(TWO));
        assertEquals(Value.of(-3), Value.of(-7).divide(TWO));
        assertEquals(Value.of(1), Value.of(7).modulus(Value.of(3)));
        assertEquals(Value.of(-1), Value.of(-7).modulus(Value.of(3)));
        assertEquals(Value.of(0), Value.of(Long.MIN_VALUE).modulus(Value.of(-1)));
        error(ErrorKind.INVALID_OPERATION, () -> STR.subtract(ONE));
        error(ErrorKind.INVALID_OPERATION, () -> LIST.multiply(TWO));
    }

    @Test
    void testDivideByZero() {
        error(ErrorKind.DIVIDE_BY_ZERO, () -> ONE.divide(Value.of(0)));
        error(ErrorKind.DIVIDE_BY_ZERO, () -> ONE.modulus(Value.of(0)));
    }

    @Test
    void testOverflow() {
        Value max = Value.of(Long.MAX_VALUE);
        Value min = Value.of(Long.MIN_VALUE);
        error(ErrorKind.INTEGER_OVERFLOW, () -> max.add(ONE));
        error(ErrorKind.INTEGER_OVERFLOW, () -> min.subtract(ONE));
        error(ErrorKind.INTEGER_OVERFLOW, () -> max.multiply(TWO));
        error(ErrorKind.INTEGER_OVERFLOW, () -> min.divide(Value.of(-1)));
    }

    @Test
    void testComparison() {
        assertEquals(Value.of(true), ONE.lessThan(TWO));
        assertEquals(Value.of(false), ONE.greaterThan(TWO));
        assertEquals(Value.of(true), ONE.lessThanEqual(ONE));
        assertEquals(Value.of(true), TWO.greaterThanEqual(ONE));
        assertEquals(Value.of(true), Value.of("abc").lessThan(Value.of("abd")));
        assertEquals(Value.of(false), Value.of("b").lessThanEqual(Value.of("a")));
        error(ErrorKind.INVALID_OPERATION, () -> ONE.lessThan(STR));
        error(ErrorKind.INVALID_OPERATION, () -> LIST.greaterThan(LIST));
        error(ErrorKind.INVALID_OPERATION, () -> Value.of(true).greaterThanEqual(Value.of(false)));
    }

    @Test
    void testShift() {
        assertEquals(Value.of(8), ONE.shiftLeft(Value.of(3)));
        assertEquals(Value.of(-4), Value.of(-16).shiftRight(TWO));
        assertEquals(Value.of(1), ONE.shiftLeft(Value.of(0)));
        error(ErrorKind.INVALID_SHIFT, () -> ONE.shiftLeft(Value.of(64)));
        error(ErrorKind.INVALID_SHIFT, () -> ONE.shiftRight(Value.of(-1)));
        error(ErrorKind.INVALID_OPERATION, () -> STR.shiftLeft(ONE));
    }

    @Test
    void testLogic() {
        Value t = Value.of(true);
        Value f = Value.of(false);
        assertEquals(f, t.and(f));
        assertEquals(t, t.and(t));
        assertEquals(t, f.or(t));
        assertEquals(f, f.or(f));
        error(ErrorKind.INVALID_OPERATION, () -> ONE.and(t));
        error(ErrorKind.INVALID_OPERATION, () -> t.or(ONE));
    }

    @Test
    void testNot() {
        assertEquals(Value.of(false), Value.of(true).not());
        assertEquals(Value.of(true), Value.of(false).not());
        SwException e = error(ErrorKind.UNEXPECTED_TYPE, ONE::not);
        assertEquals(Type.BOOL, e.getExpected());
        assertEquals(Type.INT, e.getActual());
    }

    @Test
    void testEqualityIsTotal() {
        List<Value> values = List.of(ONE, Value.of(true), STR, LIST, ListValue.of());
        for (Value lhs : values) {
            for (Value rhs : values) {
                boolean expected = lhs == rhs;
                assertEquals(Value.of(expected), lhs.equalTo(rhs), lhs + " == " + rhs);
            }
        }
        assertEquals(Value.of(false), ONE.equalTo(Value.of("1")));
        assertEquals(Value.of(true), ListValue.of(ONE, STR).equalTo(ListValue.of(Value.of(1), Value.of("a"))));
        assertEquals(Value.of(false), ListValue.of(ONE).equalTo(ListValue.of(ONE, ONE)));
    }

    @Test
    void testListIsImmutable() {
        List<Value> source = new ArrayList<>();
        source.add(ONE);
        ListValue list = Value.of(source);
        source.add(TWO);
        assertEquals(1, list.size());
        assertThrows(UnsupportedOperationException.class, () -> list.values().add(TWO));
    }

    @Test
    void testStrLengthCountsCodePoints() {
        StrValue s = Value.of("a😀b");
        assertEquals(3, s.length());
        assertEquals(Value.of("😀"), s.charAt(1));
        assertEquals(Value.of("b"), s.charAt(2));
    }

    @Test
    void testToString() {
        assertEquals("42", Value.of(42).toString());
        assertEquals("true", Value.of(true).toString());
        assertEquals("\"a\\\"b\\n\"", Value.of("a\"b\n").toString());
        assertEquals("[1, \"x\", [false]]", ListValue.of(ONE, Value.of("x"), ListValue.of(Value.of(false))).toString());
    }

}
