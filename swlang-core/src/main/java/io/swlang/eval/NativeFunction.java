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

import io.swlang.ast.Expression;
import io.swlang.error.SwException;
import io.swlang.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * A function implemented in Java. Arguments are evaluated left to right in
 * the caller's state before the body runs.
 */
public class NativeFunction implements Callable {

    private final String name;
    private final int arity;
    private final Function<List<Value>, Value> body;

    public NativeFunction(String name, int arity, Function<List<Value>, Value> body) {
        this.name = name;
        this.arity = arity;
        this.body = body;
    }

    @Override
    public Value call(Evaluator caller, List<Expression> args) {
        if (args.size() != arity) {
            throw SwException.arityMismatch(name, arity, args.size());
        }
        List<Value> values = new ArrayList<>(args.size());
        for (Expression arg : args) {
            values.add(caller.eval(arg).get());
        }
        return body.apply(values);
    }

    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    @Override
    public String toString() {
        return name + "/" + arity;
    }

}
