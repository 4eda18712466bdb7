package com.sandy.aiot.warning.rule;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConditionParserTest {

    @Test
    void parsesSingleNumericClause() {
        ConditionExpression e = ConditionParser.parse("> 25");
        assertNull(e.connector());
        assertEquals(ComparisonOperator.GT, e.first().operator());
        assertEquals(25.0, e.first().number());
        assertEquals("25", e.first().literal());
    }

    @Test
    void twoCharOperatorsWinOverSingleChar() {
        assertEquals(ComparisonOperator.GE, ConditionParser.parse(">=70").first().operator());
        assertEquals(ComparisonOperator.LE, ConditionParser.parse("<= -3.5").first().operator());
        assertEquals(-3.5, ConditionParser.parse("<= -3.5").first().number());
    }

    @Test
    void connectorIsCaseInsensitive() {
        ConditionExpression e = ConditionParser.parse(">= 70 or < 30");
        assertEquals(LogicalOperator.OR, e.connector());
        assertEquals(ComparisonOperator.LT, e.second().operator());
        assertEquals(LogicalOperator.AND, ConditionParser.parse("> 1 And < 9").connector());
    }

    @Test
    void quotedTextLiteral() {
        ConditionExpression e = ConditionParser.parse("== \"error\"");
        assertTrue(e.first().isText());
        assertEquals("error", e.first().literal());
        assertEquals("off line", ConditionParser.parse("!= 'off line'").first().literal());
    }

    @Test
    void rejectsMalformedExpressions() {
        assertThrows(RuleConfigurationException.class, () -> ConditionParser.parse("supposed > "));
        assertThrows(RuleConfigurationException.class, () -> ConditionParser.parse(">"));
        assertThrows(RuleConfigurationException.class, () -> ConditionParser.parse(""));
        assertThrows(RuleConfigurationException.class, () -> ConditionParser.parse(null));
        assertThrows(RuleConfigurationException.class, () -> ConditionParser.parse("> abc"));
        assertThrows(RuleConfigurationException.class, () -> ConditionParser.parse("> 5 XOR < 3"));
        assertThrows(RuleConfigurationException.class, () -> ConditionParser.parse("> 5 AND"));
        assertThrows(RuleConfigurationException.class, () -> ConditionParser.parse("> 5 AND < 3 OR > 9"));
        assertThrows(RuleConfigurationException.class, () -> ConditionParser.parse("== \"unterminated"));
        assertThrows(RuleConfigurationException.class, () -> ConditionParser.parse("> NaN"));
    }

    @Test
    void textLiteralOnlyWithEquality() {
        RuleConfigurationException ex = assertThrows(RuleConfigurationException.class, () -> ConditionParser.parse("> \"high\""));
        assertTrue(ex.getMessage().contains("text literal"));
    }

    @Test
    void thresholdReportsMatchingOrClause() {
        ConditionExpression e = ConditionParser.parse(">= 70 OR < 30");
        assertEquals("30", e.thresholdFor(20));
        assertEquals("70", e.thresholdFor(75));
        assertEquals("70", e.thresholdFor(50));
    }
}
