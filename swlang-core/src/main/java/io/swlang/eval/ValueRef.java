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
package io.swlang.eval;

import io.swlang.value.Value;

import java.util.Objects;

/**
 * Result of evaluating an expression. {@link Borrowed} is a value that
 * already existed (a variable, a literal embedded in the tree, a list
 * element), {@link Owned} is a value computed by the evaluation. Both are
 * read-only views and compare by the value they hold.
 */
public sealed interface ValueRef permits ValueRef.Borrowed, ValueRef.Owned {

    Value get();

    default boolean isBorrowed() {
        return this instanceof Borrowed;
    }

    static ValueRef borrowed(Value value) {
        return new Borrowed(value);
    }

    static ValueRef owned(Value value) {
        return new Owned(value);
    }

    record Borrowed(Value value) implements ValueRef {

        public Borrowed {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Value get() {
            return value;
        }

    }

    record Owned(Value value) implements ValueRef {

        public Owned {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Value get() {
            return value;
        }

    }

}
