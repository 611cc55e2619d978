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
import io.swlang.value.ListValue;
import io.swlang.value.StrValue;
import io.swlang.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Variable and function store. Variables are scoped: a lookup walks out
 * through the enclosing environments. Functions live in one table shared by
 * the whole scope chain.
 * <p>
 * Not thread-safe.
 */
public class Environment implements State {

    static final Logger logger = LoggerFactory.getLogger(Environment.class);

    private final Environment enclosing;
    private final Map<String, Value> variables = new HashMap<>();
    private final Map<String, Callable> functions;

    public Environment() {
        enclosing = null;
        functions = new HashMap<>();
    }

    public Environment(Environment enclosing) {
        this.enclosing = enclosing;
        functions = enclosing.functions;
    }

    public Environment getEnclosing() {
        return enclosing;
    }

    /**
     * Creates or overwrites a variable in this scope.
     */
    public void define(String name, Value value) {
        if (value == null) {
            throw new IllegalArgumentException("null value for: " + name);
        }
        variables.put(name, value);
    }

    /**
     * Updates the variable in the nearest scope that defines it.
     */
    public void assign(String name, Value value) {
        if (value == null) {
            throw new IllegalArgumentException("null value for: " + name);
        }
        if (variables.containsKey(name)) {
            variables.put(name, value);
        } else if (enclosing != null) {
            enclosing.assign(name, value);
        } else {
            throw SwException.unknownVariable(name);
        }
    }

    public boolean contains(String name) {
        if (variables.containsKey(name)) {
            return true;
        }
        return enclosing != null && enclosing.contains(name);
    }

    /**
     * @return names visible from this scope, inner scopes first
     */
    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>(variables.keySet());
        if (enclosing != null) {
            names.addAll(enclosing.names());
        }
        return names;
    }

    public void defineFunction(String name, Callable function) {
        Callable previous = functions.put(name, function);
        if (previous != null) {
            logger.debug("function redefined: {}", name);
        } else {
            logger.debug("function defined: {}", name);
        }
    }

    public boolean hasFunction(String name) {
        return functions.containsKey(name);
    }

    @Override
    public Value get(String name) {
        Value value = variables.get(name);
        if (value != null) {
            return value;
        }
        if (enclosing != null) {
            return enclosing.get(name);
        }
        throw SwException.unknownVariable(name);
    }

    @Override
    public ValueRef listIndex(String name, Expression index, Evaluator evaluator) {
        long i = evaluator.evalInt(index);
        Value value = get(name);
        if (value instanceof ListValue list) {
            checkBounds(name, i, list.size());
            return ValueRef.borrowed(list.get((int) i));
        }
        if (value instanceof StrValue str) {
            int length = str.length();
            checkBounds(name, i, length);
            return ValueRef.owned(str.charAt((int) i));
        }
        throw SwException.indexUnindexable(value.getType());
    }

    @Override
    public Value callFunction(String name, List<Expression> args, Evaluator evaluator) {
        Callable function = functions.get(name);
        if (function == null) {
            throw SwException.unknownFunction(name);
        }
        return function.call(evaluator, args);
    }

    private static void checkBounds(String name, long index, int length) {
        if (index < 0 || index >= length) {
            throw SwException.indexOutOfBounds(name, index, length);
        }
    }

}
