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
import io.swlang.parser.Parser;
import io.swlang.parser.ParserException;
import io.swlang.value.BoolValue;
import io.swlang.value.IntValue;
import io.swlang.value.ListValue;
import io.swlang.value.StrValue;
import io.swlang.value.Type;
import io.swlang.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces an {@link Expression} to a value against a {@link State}.
 * <p>
 * Evaluation is strict and left to right: both operands of every binary
 * operator are evaluated, including {@code &&} and {@code ||}. Failures of
 * the state or of value operators are propagated as-is.
 * <p>
 * An instance counts nested evaluations, including the ones started by
 * {@code eval(...)} re-entry, and fails with RECURSION_LIMIT beyond
 * {@link #MAX_DEPTH} (or the limit passed to the constructor). The active
 * evaluator is handed to {@link State#listIndex} and
 * {@link State#callFunction}, and evaluators derived from it with
 * {@link #withState(State)} share its count, so nesting through indexes and
 * function calls is bounded too. Instances are cheap and not thread-safe,
 * the static helpers create one per call.
 */
public class Evaluator implements Expression.Visitor<ValueRef> {

    static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

    /**
     * Can be configured via system property "swlang.eval.maxDepth".
     */
    public static final int MAX_DEPTH = Integer.parseInt(System.getProperty("swlang.eval.maxDepth", "512"));

    private final State state;
    private final SourceParser parser;
    private final int maxDepth;
    private final Frames frames;

    public Evaluator(State state) {
        this(state, Parser::parse, MAX_DEPTH);
    }

    public Evaluator(State state, SourceParser parser, int maxDepth) {
        this(state, parser, maxDepth, new Frames());
    }

    private Evaluator(State state, SourceParser parser, int maxDepth, Frames frames) {
        this.state = state;
        this.parser = parser;
        this.maxDepth = maxDepth;
        this.frames = frames;
    }

    /**
     * @return an evaluator over another state, with the same parser and
     * limit, that counts against the depth of this one
     */
    public Evaluator withState(State other) {
        return new Evaluator(other, parser, maxDepth, frames);
    }

    public State getState() {
        return state;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getDepth() {
        return frames.depth;
    }

    public static ValueRef evaluate(Expression expression, State state) {
        return new Evaluator(state).eval(expression);
    }

    public static boolean tryBool(Expression expression, State state) {
        return new Evaluator(state).evalBool(expression);
    }

    public static long tryInt(Expression expression, State state) {
        return new Evaluator(state).evalInt(expression);
    }

    public ValueRef eval(Expression expression) {
        if (frames.depth >= maxDepth) {
            throw SwException.recursionLimit(maxDepth);
        }
        frames.depth++;
        try {
            return expression.accept(this);
        } finally {
            frames.depth--;
        }
    }

    public boolean evalBool(Expression expression) {
        Value value = eval(expression).get();
        if (value instanceof BoolValue b) {
            return b.value();
        }
        throw SwException.unexpectedType(Type.BOOL, value.getType());
    }

    public long evalInt(Expression expression) {
        Value value = eval(expression).get();
        if (value instanceof IntValue i) {
            return i.value();
        }
        throw SwException.unexpectedType(Type.INT, value.getType());
    }

    @Override
    public ValueRef visitVariable(Expression.Variable node) {
        return ValueRef.borrowed(state.get(node.name()));
    }

    @Override
    public ValueRef visitBinaryOp(Expression.BinaryOp node) {
        Value lhs = eval(node.left()).get();
        Value rhs = eval(node.right()).get();
        return ValueRef.owned(node.operator().apply(lhs, rhs));
    }

    @Override
    public ValueRef visitLiteral(Expression.Literal node) {
        return ValueRef.borrowed(node.value());
    }

    @Override
    public ValueRef visitListIndex(Expression.ListIndex node) {
        return state.listIndex(node.name(), node.index(), this);
    }

    @Override
    public ValueRef visitListLength(Expression.ListLength node) {
        Value value = state.get(node.name());
        if (value instanceof ListValue list) {
            return ValueRef.owned(Value.of(list.size()));
        }
        if (value instanceof StrValue str) {
            return ValueRef.owned(Value.of(str.length()));
        }
        throw SwException.indexUnindexable(value.getType());
    }

    @Override
    public ValueRef visitNot(Expression.Not node) {
        return ValueRef.owned(eval(node.expression()).get().not());
    }

    @Override
    public ValueRef visitEval(Expression.Eval node) {
        Value value = eval(node.expression()).get();
        if (!(value instanceof StrValue source)) {
            throw SwException.unexpectedType(Type.STR, value.getType());
        }
        Expression parsed;
        try {
            parsed = parser.parse(source.value());
        } catch (ParserException e) {
            logger.debug("eval failed to parse: {} - {}", source, e.getMessage());
            SwException se = SwException.syntaxError(e.getMessage());
            se.initCause(e);
            throw se;
        }
        if (logger.isTraceEnabled()) {
            logger.trace("eval depth {}: {}", frames.depth, parsed);
        }
        // the parsed tree does not outlive this call
        return ValueRef.owned(eval(parsed).get());
    }

    @Override
    public ValueRef visitFunctionCall(Expression.FunctionCall node) {
        return ValueRef.owned(state.callFunction(node.name(), node.args(), this));
    }

    private static class Frames {

        int depth;

    }

}
