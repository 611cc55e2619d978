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

import java.util.List;

/**
 * A user function whose body is a single expression. Arguments are
 * evaluated in the caller's state, then bound to the parameter names in a
 * new scope enclosing the environment the function was defined in.
 */
public class ExpressionFunction implements Callable {

    private final String name;
    private final List<String> params;
    private final Expression body;
    private final Environment closure;

    public ExpressionFunction(String name, List<String> params, Expression body, Environment closure) {
        this.name = name;
        this.params = List.copyOf(params);
        this.body = body;
        this.closure = closure;
    }

    @Override
    public Value call(Evaluator caller, List<Expression> args) {
        if (args.size() != params.size()) {
            throw SwException.arityMismatch(name, params.size(), args.size());
        }
        Environment scope = new Environment(closure);
        for (int i = 0; i < args.size(); i++) {
            scope.define(params.get(i), caller.eval(args.get(i)).get());
        }
        return caller.withState(scope).eval(body).get();
    }

    public String getName() {
        return name;
    }

    public List<String> getParams() {
        return params;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public String toString() {
        return name + "(" + String.join(", ", params) + ") = " + body;
    }

}
