package com.sandy.aiot.warning.rule;

import java.math.BigDecimal;

/**
 * One comparator + literal pair. {@code number} is null for a quoted text literal.
 * <p>
 * Text literals compare against the value's text; numeric values are written in plain form without trailing
 * zeros first, so {@code 5.0} equals {@code "5"} and {@code 2.50} equals {@code "2.5"}.
 */
public record ComparisonClause(ComparisonOperator operator, String literal, Double number) {

    public boolean isText() {
        return number == null;
    }

    public boolean test(Object value) {
        if (value == null) {
            throw new RuleEvaluationException("No value to compare with " + this);
        }
        if (isText()) {
            int cmp = textOf(value).equals(literal) ? 0 : 1;
            return operator.test(cmp);
        }
        Double actual = toDouble(value);
        if (actual == null || actual.isNaN()) {
            throw new RuleEvaluationException("Value '" + value + "' is not numeric for " + this);
        }
        return operator.test(Double.compare(actual, number));
    }

    static String textOf(Object v) {
        if (v instanceof Double d && (d.isNaN() || d.isInfinite())) return d.toString();
        if (v instanceof Float f && (f.isNaN() || f.isInfinite())) return f.toString();
        if (v instanceof Number n) {
            try {
                BigDecimal bd = n instanceof BigDecimal b ? b : new BigDecimal(n.toString());
                return bd.stripTrailingZeros().toPlainString();
            } catch (NumberFormatException e) {
                return n.toString();
            }
        }
        return String.valueOf(v);
    }

    static Double toDouble(Object v) {
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof CharSequence cs) {
            String s = cs.toString().trim();
            if (s.isEmpty()) return null;
            try { return Double.parseDouble(s); } catch (NumberFormatException e) { return null; }
        }
        if (v instanceof Boolean b) return b ? 1.0 : 0.0;
        return null;
    }

    @Override
    public String toString() {
        return operator.symbol() + " " + (isText() ? "\"" + literal + "\"" : literal);
    }
}
