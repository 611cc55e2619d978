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
import io.swlang.value.Value;

import java.util.List;

/**
 * The environment an expression is evaluated against. Implementations own
 * the variable store, indexing rules and function invocation, and raise
 * their own errors which the evaluator propagates unchanged.
 */
public interface State {

    /**
     * @throws io.swlang.error.SwException UNKNOWN_VARIABLE if not defined
     */
    Value get(String name);

    /**
     * Resolves {@code name[index]}. The implementation evaluates the index,
     * checks bounds and rejects kinds that cannot be indexed.
     *
     * @param evaluator the active evaluation, to evaluate the index with
     */
    ValueRef listIndex(String name, Expression index, Evaluator evaluator);

    /**
     * Invokes a function with unevaluated arguments, the callee decides how
     * and when to evaluate them.
     *
     * @param evaluator the active evaluation, passed on to the callee
     */
    Value callFunction(String name, List<Expression> args, Evaluator evaluator);

}
