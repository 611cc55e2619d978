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

import io.swlang.error.SwException;

import java.util.List;

/**
 * Runtime value of the language. The set of kinds is closed:
 * <pre>
 * Value (sealed)
 * ├── IntValue  - 64 bit signed integer
 * ├── BoolValue
 * ├── StrValue
 * └── ListValue - immutable list of values
 * </pre>
 * All kinds are immutable, so a value can be shared freely between the
 * environment and evaluation results.
 * <p>
 * Each binary operator of the language maps to exactly one method here.
 * Every method other than {@link #equalTo(Value)} throws {@link SwException}
 * when the operand kinds have no defined meaning for the operation.
 */
public sealed interface Value permits IntValue, BoolValue, StrValue, ListValue {

    Type getType();

    static IntValue of(long value) {
        return new IntValue(value);
    }

    static BoolValue of(boolean value) {
        return BoolValue.of(value);
    }

    static StrValue of(String value) {
        return new StrValue(value);
    }

    static ListValue of(List<Value> values) {
        return new ListValue(values);
    }

    default Value add(Value other) {
        if (this instanceof IntValue l && other instanceof IntValue r) {
            try {
                return of(Math.addExact(l.value(), r.value()));
            } catch (ArithmeticException e) {
                throw SwException.integerOverflow(l + " + " + r);
            }
        }
        if (this instanceof StrValue l && other instanceof StrValue r) {
            return of(l.value() + r.value());
        }
        if (this instanceof ListValue l && other instanceof ListValue r) {
            return l.concat(r);
        }
        throw SwException.invalidOperation("+", this, other);
    }

    default Value subtract(Value other) {
        long[] ints = ints("-", other);
        try {
            return of(Math.subtractExact(ints[0], ints[1]));
        } catch (ArithmeticException e) {
            throw SwException.integerOverflow(ints[0] + " - " + ints[1]);
        }
    }

    default Value multiply(Value other) {
        long[] ints = ints("*", other);
        try {
            return of(Math.multiplyExact(ints[0], ints[1]));
        } catch (ArithmeticException e) {
            throw SwException.integerOverflow(ints[0] + " * " + ints[1]);
        }
    }

    default Value divide(Value other) {
        long[] ints = ints("/", other);
        if (ints[1] == 0) {
            throw SwException.divideByZero();
        }
        if (ints[0] == Long.MIN_VALUE && ints[1] == -1) {
            throw SwException.integerOverflow(ints[0] + " / " + ints[1]);
        }
        return of(ints[0] / ints[1]);
    }

    default Value modulus(Value other) {
        long[] ints = ints("%", other);
        if (ints[1] == 0) {
            throw SwException.divideByZero();
        }
        return of(ints[0] % ints[1]);
    }

    default Value lessThan(Value other) {
        return of(compare("<", other) < 0);
    }

    default Value greaterThan(Value other) {
        return of(compare(">", other) > 0);
    }

    default Value lessThanEqual(Value other) {
        return of(compare("<=", other) <= 0);
    }

    default Value greaterThanEqual(Value other) {
        return of(compare(">=", other) >= 0);
    }

    default Value shiftLeft(Value other) {
        long[] ints = ints("<<", other);
        return of(ints[0] << shiftAmount(ints[1]));
    }

    default Value shiftRight(Value other) {
        long[] ints = ints(">>", other);
        return of(ints[0] >> shiftAmount(ints[1]));
    }

    default Value and(Value other) {
        if (this instanceof BoolValue l && other instanceof BoolValue r) {
            return of(l.value() && r.value());
        }
        throw SwException.invalidOperation("&&", this, other);
    }

    default Value or(Value other) {
        if (this instanceof BoolValue l && other instanceof BoolValue r) {
            return of(l.value() || r.value());
        }
        throw SwException.invalidOperation("||", this, other);
    }

    default Value not() {
        if (this instanceof BoolValue b) {
            return of(!b.value());
        }
        throw SwException.unexpectedType(Type.BOOL, getType());
    }

    /**
     * Structural equality, defined for every pair of kinds.
     *
     * @return false whenever the kinds differ
     */
    default BoolValue equalTo(Value other) {
        return BoolValue.of(equals(other));
    }

    private long[] ints(String operator, Value other) {
        if (this instanceof IntValue l && other instanceof IntValue r) {
            return new long[]{l.value(), r.value()};
        }
        throw SwException.invalidOperation(operator, this, other);
    }

    private int compare(String operator, Value other) {
        if (this instanceof IntValue l && other instanceof IntValue r) {
            return Long.compare(l.value(), r.value());
        }
        if (this instanceof StrValue l && other instanceof StrValue r) {
            return l.value().compareTo(r.value());
        }
        throw SwException.invalidOperation(operator, this, other);
    }

    private static int shiftAmount(long amount) {
        if (amount < 0 || amount >= Long.SIZE) {
            throw SwException.invalidShift(amount);
        }
        return (int) amount;
    }

}
