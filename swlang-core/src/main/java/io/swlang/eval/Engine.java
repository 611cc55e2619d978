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
import io.swlang.parser.Parser;
import io.swlang.value.Value;

import java.util.List;
import java.util.function.Function;

/**
 * Entry point for host code: owns a global {@link Environment} and wires the
 * parser into the evaluator.
 */
public class Engine {

    private final Environment environment;
    private final int maxDepth;

    public Engine() {
        this(new Environment(), Evaluator.MAX_DEPTH);
    }

    public Engine(Environment environment, int maxDepth) {
        this.environment = environment;
        this.maxDepth = maxDepth;
    }

    public Expression parse(String text) {
        return Parser.parse(text);
    }

    public Value eval(String text) {
        return evaluate(parse(text)).get();
    }

    public ValueRef evaluate(Expression expression) {
        return evaluator().eval(expression);
    }

    public boolean tryBool(Expression expression) {
        return evaluator().evalBool(expression);
    }

    public long tryInt(Expression expression) {
        return evaluator().evalInt(expression);
    }

    public Value get(String name) {
        return environment.get(name);
    }

    public void put(String name, Value value) {
        environment.define(name, value);
    }

    public void define(String name, Callable function) {
        environment.defineFunction(name, function);
    }

    public void defineNative(String name, int arity, Function<List<Value>, Value> body) {
        environment.defineFunction(name, new NativeFunction(name, arity, body));
    }

    /**
     * Defines a user function, for example
     * {@code defineFunction("twice", List.of("x"), "x * 2")}.
     */
    public void defineFunction(String name, List<String> params, String body) {
        environment.defineFunction(name, new ExpressionFunction(name, params, parse(body), environment));
    }

    public Environment getEnvironment() {
        return environment;
    }

    private Evaluator evaluator() {
        return new Evaluator(environment, Parser::parse, maxDepth);
    }

}
