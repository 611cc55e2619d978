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

import io.swlang.error.ErrorKind;
import io.swlang.error.SwException;
import io.swlang.parser.ParserException;
import io.swlang.value.ListValue;
import io.swlang.value.StrValue;
import io.swlang.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngineTest extends EvalBase {

    @BeforeEach
    void beforeEach() {
        engine.put("xs", ListValue.of(Value.of(1), Value.of(2), Value.of(3)));
        engine.put("name", Value.of("swlang"));
        engine.put("n", Value.of(7));
    }

    @Test
    void testArithmetic() {
        assertEquals(Value.of(7), eval("1 + 2 * 3"));
        assertEquals(Value.of(9), eval("(1 + 2) * 3"));
        assertEquals(Value.of(-4), eval("1 - 5"));
        assertEquals(Value.of(3), eval("n / 2"));
        assertEquals(Value.of(1), eval("n % 2"));
        assertEquals(Value.of(-7), eval("-n"));
        assertEquals(Value.of(56), eval("n << 3"));
    }

    @Test
    void testStringsAndLists() {
        matchEval("'hello ' + name", "\"hello swlang\"");
        matchEval("xs + [4]", "[1, 2, 3, 4]");
        matchEval("name[0]", "\"s\"");
        assertEquals(Value.of(6), eval("name.length"));
        assertEquals(Value.of(3), eval("xs[xs.length - 1]"));
        assertEquals(Value.of(true), eval("'abc' < 'abd'"));
    }

    @Test
    void testLogic() {
        assertEquals(Value.of(true), eval("n > 5 && n < 10"));
        assertEquals(Value.of(false), eval("!(n == 7) || false"));
        assertEquals(Value.of(true), eval("xs == [1, 2, 3]"));
        assertEquals(Value.of(false), eval("n == '7'"));
    }

    @Test
    void testEvalOfDynamicCode() {
        engine.put("expr", Value.of("n * 6"));
        assertEquals(Value.of(42), eval("eval(expr)"));
        assertEquals(Value.of(true), eval("eval(\"1 + 2\") == 3"));
        assertEquals(Value.of(10), eval("eval('eval(\"n + \" + \"3\")')"));
        SwException e = error("eval('1 +')", ErrorKind.SYNTAX_ERROR);
        assertTrue(e.getMessage().startsWith("expected: expression"), e.getMessage());
        error("eval(5)", ErrorKind.UNEXPECTED_TYPE);
    }

    @Test
    void testDepthLimitIsConfigurable() {
        Engine shallow = new Engine(new Environment(), 5);
        assertEquals(Value.of(3), shallow.eval("1 + 2"));
        SwException e = assertThrows(SwException.class, () -> shallow.eval("(((((1 + 2) + 3) + 4) + 5) + 6)"));
        assertEquals(ErrorKind.RECURSION_LIMIT, e.getKind());
        Engine tight = new Engine(new Environment(), 4);
        tight.put("xs", ListValue.of(Value.of(7)));
        tight.defineNative("id", 1, args -> args.get(0));
        tight.defineFunction("deep", List.of(), "0 + (0 + (0 + (0 + 0)))");
        assertEquals(Value.of(7), tight.eval("xs[0 + 0]"));
        assertEquals(Value.of(0), tight.eval("id(0 + 0)"));
        // nesting inside indexes and calls counts against the same limit
        for (String text : List.of("0 + (0 + (0 + (0 + 0)))", "xs[0 + (0 + (0 + (0 + 0)))]",
                "id(0 + (0 + (0 + (0 + 0))))", "deep()")) {
            e = assertThrows(SwException.class, () -> tight.eval(text), text);
            assertEquals(ErrorKind.RECURSION_LIMIT, e.getKind(), text);
        }
    }

    @Test
    void testFunctions() {
        engine.defineFunction("area", List.of("w", "h"), "w * h");
        assertEquals(Value.of(7), eval("area(2, 3) + 1"));
        engine.defineNative("upper", 1, args -> Value.of(((StrValue) args.get(0)).value().toUpperCase()));
        matchEval("upper(name)", "\"SWLANG\"");
        // calls inside a body are resolved when the body runs
        engine.defineFunction("double_area", List.of("s"), "area(s, s) * 2");
        assertEquals(Value.of(18), eval("double_area(3)"));
        error("area(1)", ErrorKind.ARITY_MISMATCH);
        error("missing(1)", ErrorKind.UNKNOWN_FUNCTION);
    }

    @Test
    void testTypedHelpers() {
        assertTrue(engine.tryBool(engine.parse("n >= 7")));
        assertEquals(3, engine.tryInt(engine.parse("xs.length")));
        error("xs.length + name", ErrorKind.INVALID_OPERATION);
        SwException e = assertThrows(SwException.class, () -> engine.tryInt(engine.parse("name")));
        assertEquals(ErrorKind.UNEXPECTED_TYPE, e.getKind());
    }

    @Test
    void testErrors() {
        error("nope", ErrorKind.UNKNOWN_VARIABLE);
        error("n / 0", ErrorKind.DIVIDE_BY_ZERO);
        error("xs[3]", ErrorKind.INDEX_OUT_OF_BOUNDS);
        error("n.length", ErrorKind.INDEX_UNINDEXABLE);
        error("!n", ErrorKind.UNEXPECTED_TYPE);
        error("1 << 99", ErrorKind.INVALID_SHIFT);
        assertThrows(ParserException.class, () -> eval("1 +"));
    }

    @Test
    void testGetAndPut() {
        engine.put("a", Value.of(1));
        assertEquals(Value.of(1), engine.get("a"));
        assertTrue(engine.getEnvironment().contains("a"));
        assertSame(engine.get("xs"), engine.evaluate(engine.parse("xs")).get());
    }

}
