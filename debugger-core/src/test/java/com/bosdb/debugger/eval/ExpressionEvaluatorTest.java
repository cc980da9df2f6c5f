package com.bosdb.debugger.eval;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionEvaluatorTest {

    private ExpressionEvaluator evaluator;
    private ExpressionEvaluator.EvaluationContext context;

    @BeforeEach
    void setUp() {
        evaluator = new ExpressionEvaluator();
        Map<String, Object> variables = new HashMap<>();
        variables.put("lineNumber", 3);
        variables.put("statement", "SELECT * FROM users");
        variables.put("ratio", 0.5);
        variables.put("missing", null);
        variables.put("row", Map.of("id", 42, "name", "O'Brien"));
        context = ExpressionEvaluator.EvaluationContext.of(variables);
    }

    private Value eval(String expression) {
        ExpressionEvaluator.EvalResult result = evaluator.evaluate(expression, context);
        assertInstanceOf(ExpressionEvaluator.EvalResult.Success.class, result, () -> result.toString());
        return ((ExpressionEvaluator.EvalResult.Success) result).value();
    }

    private String error(String expression) {
        ExpressionEvaluator.EvalResult result = evaluator.evaluate(expression, context);
        assertInstanceOf(ExpressionEvaluator.EvalResult.Error.class, result, () -> result.toString());
        return ((ExpressionEvaluator.EvalResult.Error) result).message();
    }

    @Test
    void arithmetic_respectsPrecedence() {
        assertEquals(Value.of(7L), eval("1 + 2 * 3"));
        assertEquals(Value.of(9L), eval("(1 + 2) * 3"));
        assertEquals(Value.of(1L), eval("7 mod 3"));
        assertEquals(Value.of(1L), eval("7 % 3"));
        assertEquals(Value.of(-2L), eval("-2"));
        assertEquals(Value.of(2.5), eval("5 / 2"));
    }

    @Test
    void comparisons_acceptBothSpellings() {
        assertTrue(eval("lineNumber = 3").isTruthy());
        assertTrue(eval("lineNumber == 3").isTruthy());
        assertTrue(eval("lineNumber <> 4").isTruthy());
        assertTrue(eval("lineNumber != 4").isTruthy());
        assertTrue(eval("ratio < 1 and ratio >= 0.5").isTruthy());
        assertTrue(eval("3 = 3.0").isTruthy(), "int and float compare numerically");
    }

    @Test
    void logicalOperators_shortCircuit() {
        // the right-hand side would fail on an unknown variable
        assertEquals(Value.FALSE, eval("false && nope > 1"));
        assertEquals(Value.TRUE, eval("true || nope > 1"));
        assertEquals(Value.TRUE, eval("not false"));
        assertEquals(Value.FALSE, eval("!true"));
    }

    @Test
    void strings_singleAndDoubleQuoted() {
        assertTrue(eval("statement = 'SELECT * FROM users'").isTruthy());
        assertEquals(Value.of("ab"), eval("\"a\" + 'b'"));
        assertEquals(Value.of("line 3"), eval("'line ' + lineNumber"));
    }

    @Test
    void propertyAccess_onMaps() {
        assertEquals(Value.of(42L), eval("row.id"));
        assertEquals(Value.of("O'Brien"), eval("row.name"));
        assertEquals(Value.NULL, eval("row.absent"));
    }

    @Test
    void nullHandling() {
        assertEquals(Value.NULL, eval("missing"));
        assertTrue(eval("missing = null").isTruthy());
        assertFalse(eval("missing = 0").isTruthy());
        assertFalse(eval("missing").isTruthy());
    }

    @Test
    void unknownVariable_isAnError() {
        assertTrue(error("nope > 1").contains("Unknown variable: nope"));
    }

    @Test
    void malformedInput_isAnError() {
        error("");
        error("1 +");
        error("(1 + 2");
        error("'unterminated");
        error("a & b");
        error("1 2");
    }

    @Test
    void badOperands_areErrors() {
        assertEquals("Division by zero", error("1 / 0"));
        error("row - 1");
        error("statement.length");
    }

    @Test
    void evaluateCondition_throwsOnError() {
        assertTrue(evaluator.evaluateCondition("lineNumber > 2", context));
        assertFalse(evaluator.evaluateCondition("lineNumber > 5", context));
        assertThrows(IllegalArgumentException.class, () -> evaluator.evaluateCondition("nope", context));
    }

    @Test
    void interpolateLogMessage_substitutesAndReportsErrors() {
        assertEquals("at 3: SELECT * FROM users",
            evaluator.interpolateLogMessage("at {lineNumber}: {statement}", context));
        assertEquals("value <Unknown variable: nope>",
            evaluator.interpolateLogMessage("value {nope}", context));
        assertEquals("no placeholders", evaluator.interpolateLogMessage("no placeholders", context));
    }

    @Test
    void valueOf_convertsHostTypes() {
        assertEquals(Value.NULL, Value.of((Object) null));
        assertEquals(Value.TRUE, Value.of((Object) Boolean.TRUE));
        assertEquals(Value.of(5L), Value.of((Object) 5));
        assertEquals(Value.of(5L), Value.of((Object) new java.math.BigDecimal("5")));
        assertEquals(Value.of(1.25), Value.of((Object) new java.math.BigDecimal("1.25")));
        assertEquals("map", Value.of((Object) Map.of("a", 1)).typeName());
    }

    @Test
    void nestingLimit_isAnErrorNotACrash() {
        String allowed = "(".repeat(ExpressionEvaluator.MAX_NESTING) + "1" + ")".repeat(ExpressionEvaluator.MAX_NESTING);
        assertEquals(Value.of(1L), eval(allowed));

        String tooDeep = "(".repeat(ExpressionEvaluator.MAX_NESTING + 1) + "1" + ")".repeat(ExpressionEvaluator.MAX_NESTING + 1);
        assertTrue(error(tooDeep).startsWith("Expression nested too deeply"));
        assertTrue(error("-".repeat(5000) + "1").startsWith("Expression"));
        assertTrue(error("not ".repeat(100) + "true").startsWith("Expression nested too deeply"));
    }

    @Test
    void tokenLimit_boundsOperatorChains() {
        assertTrue(error("1" + " + 1".repeat(20000)).startsWith("Expression too long"));
    }

    @Test
    void valueOf_cutsOffSelfReferencingMaps() {
        Map<String, Object> loop = new HashMap<>();
        loop.put("self", loop);

        Value value = Value.of((Object) loop);

        assertEquals("map", value.typeName());
    }
}
