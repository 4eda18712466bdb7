package com.sandy.aiot.warning.service;

import com.sandy.aiot.warning.rule.RuleConfigurationException;
import com.sandy.aiot.warning.rule.RuleEvaluationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    @Test
    void numericComparators() {
        assertTrue(evaluator.evaluate("> 25", 28));
        assertFalse(evaluator.evaluate("> 25", 25));
        assertTrue(evaluator.evaluate(">= 25", 25.0));
        assertTrue(evaluator.evaluate("< 10", 9.99));
        assertFalse(evaluator.evaluate("<= 10", 10.01));
        assertTrue(evaluator.evaluate("== 1", 1.0));
        assertTrue(evaluator.evaluate("!= 1", 2));
    }

    @Test
    void numericTextValuesAreCoerced() {
        assertTrue(evaluator.evaluate("> 220", "230.5"));
        assertTrue(evaluator.evaluate("== 1", true));
        assertFalse(evaluator.evaluate("== 1", false));
    }

    @Test
    void andOrCombinations() {
        assertTrue(evaluator.evaluate(">= 70 OR < 30", 75));
        assertTrue(evaluator.evaluate(">= 70 OR < 30", 20));
        assertFalse(evaluator.evaluate(">= 70 OR < 30", 50));
        assertTrue(evaluator.evaluate("> 10 and < 20", 15));
        assertFalse(evaluator.evaluate("> 10 and < 20", 25));
    }

    @Test
    void stringEquality() {
        assertTrue(evaluator.evaluate("== \"error\"", "error"));
        assertFalse(evaluator.evaluate("== \"error\"", "ok"));
        assertTrue(evaluator.evaluate("!= \"ok\"", "error"));
    }

    @Test
    void numericValueMatchesTextLiteralInPlainForm() {
        assertTrue(evaluator.evaluate("== \"5\"", 5.0));
        assertTrue(evaluator.evaluate("== \"5\"", 5));
        assertTrue(evaluator.evaluate("== \"2.5\"", 2.50));
        assertFalse(evaluator.evaluate("!= \"5\"", 5.0f));
        assertFalse(evaluator.evaluate("== \"5\"", "5.0"), "Text values are compared as sent");
    }

    @Test
    void malformedExpressionRaisesConfigurationError() {
        assertThrows(RuleConfigurationException.class, () -> evaluator.evaluate("supposed > ", 10));
    }

    @Test
    void nonNumericValueForNumericClauseIsNotComparable() {
        RuleEvaluationException ex = assertThrows(RuleEvaluationException.class, () -> evaluator.evaluate("> 25", "N/A"));
        assertFalse(ex instanceof RuleConfigurationException);
        assertThrows(RuleEvaluationException.class, () -> evaluator.evaluate("> 25", null));
    }
}
