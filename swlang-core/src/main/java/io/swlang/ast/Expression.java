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
package io.swlang.ast;

import io.swlang.value.Value;

import java.util.List;
import java.util.Objects;

/**
 * Immutable expression tree. Nodes own their children exclusively and are
 * never mutated after construction.
 * <p>
 * Code that needs to handle every variant implements {@link Visitor}, so
 * that adding a variant breaks compilation at each dispatch site.
 */
public sealed interface Expression permits
        Expression.Variable,
        Expression.BinaryOp,
        Expression.Literal,
        Expression.ListIndex,
        Expression.ListLength,
        Expression.Not,
        Expression.Eval,
        Expression.FunctionCall {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {

        R visitVariable(Variable node);

        R visitBinaryOp(BinaryOp node);

        R visitLiteral(Literal node);

        R visitListIndex(ListIndex node);

        R visitListLength(ListLength node);

        R visitNot(Not node);

        R visitEval(Eval node);

        R visitFunctionCall(FunctionCall node);

    }

    static Literal literal(long value) {
        return new Literal(Value.of(value));
    }

    static Literal literal(boolean value) {
        return new Literal(Value.of(value));
    }

    static Literal literal(String value) {
        return new Literal(Value.of(value));
    }

    static Literal literal(Value value) {
        return new Literal(value);
    }

    static Variable variable(String name) {
        return new Variable(name);
    }

    static BinaryOp binary(Expression left, Operator operator, Expression right) {
        return new BinaryOp(left, operator, right);
    }

    static FunctionCall call(String name, Expression... args) {
        return new FunctionCall(name, List.of(args));
    }

    record Variable(String name) implements Expression {

        public Variable {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariable(this);
        }

        @Override
        public String toString() {
            return name;
        }

    }

    record BinaryOp(Expression left, Operator operator, Expression right) implements Expression {

        public BinaryOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator + " " + right + ")";
        }

    }

    record Literal(Value value) implements Expression {

        public Literal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public String toString() {
            return value.toString();
        }

    }

    record ListIndex(String name, Expression index) implements Expression {

        public ListIndex {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(index, "index");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitListIndex(this);
        }

        @Override
        public String toString() {
            return name + "[" + index + "]";
        }

    }

    record ListLength(String name) implements Expression {

        public ListLength {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitListLength(this);
        }

        @Override
        public String toString() {
            return name + ".length";
        }

    }

    record Not(Expression expression) implements Expression {

        public Not {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(this);
        }

        @Override
        public String toString() {
            return "!" + expression;
        }

    }

    record Eval(Expression expression) implements Expression {

        public Eval {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEval(this);
        }

        @Override
        public String toString() {
            return "eval(" + expression + ")";
        }

    }

    record FunctionCall(String name, List<Expression> args) implements Expression {

        public FunctionCall {
            Objects.requireNonNull(name, "name");
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(name).append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i != 0) {
                    sb.append(", ");
                }
                sb.append(args.get(i));
            }
            return sb.append(')').toString();
        }

    }

}
