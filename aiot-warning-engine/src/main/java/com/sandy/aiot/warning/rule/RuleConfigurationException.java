package com.sandy.aiot.warning.rule;

/**
 * Malformed condition expression or rule definition.
 */
public class RuleConfigurationException extends RuleEvaluationException {

    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
