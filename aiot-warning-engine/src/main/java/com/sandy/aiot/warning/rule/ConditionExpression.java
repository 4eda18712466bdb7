package com.sandy.aiot.warning.rule;

/**
 * Parsed condition: a single clause, or two clauses joined by AND / OR.
 */
public record ConditionExpression(ComparisonClause first, LogicalOperator connector, ComparisonClause second) {

    public static ConditionExpression single(ComparisonClause clause) {
        return new ConditionExpression(clause, null, null);
    }

    public boolean evaluate(Object value) {
        boolean left = first.test(value);
        if (connector == null) return left;
        return switch (connector) {
            case AND -> left && second.test(value);
            case OR -> left || second.test(value);
        };
    }

    /**
     * Literal reported as threshold: for OR the clause that matched the value, otherwise the first clause.
     */
    public String thresholdFor(Object value) {
        if (connector == LogicalOperator.OR && !first.test(value) && second.test(value)) {
            return second.literal();
        }
        return first.literal();
    }

    @Override
    public String toString() {
        return connector == null ? first.toString() : first + " " + connector + " " + second;
    }
}
