package com.sandy.aiot.warning.service;

import com.sandy.aiot.warning.rule.ConditionExpression;
import com.sandy.aiot.warning.rule.ConditionParser;
import com.sandy.aiot.warning.rule.RuleConfigurationException;
import com.sandy.aiot.warning.rule.RuleEvaluationException;
import org.springframework.stereotype.Component;

/**
 * Stateless threshold check used by telemetry evaluation.
 */
@Component
public class ConditionEvaluator {

    /**
     * @throws RuleConfigurationException when the expression is malformed
     * @throws RuleEvaluationException when the value cannot be compared (missing, or text for a numeric clause)
     */
    public boolean evaluate(String expression, Object value) {
        return parse(expression).evaluate(value);
    }

    public ConditionExpression parse(String expression) {
        return ConditionParser.parse(expression);
    }
}
