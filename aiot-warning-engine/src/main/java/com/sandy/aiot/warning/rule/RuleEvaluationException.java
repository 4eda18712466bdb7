package com.sandy.aiot.warning.rule;

/**
 * A rule could not be evaluated against a measured value (e.g. text value for a numeric comparison).
 */
public class RuleEvaluationException extends RuntimeException {

    public RuleEvaluationException(String message) {
        super(message);
    }

    public RuleEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
