package com.sandy.aiot.warning.rule;

import java.util.Locale;

/**
 * Parses rule conditions such as {@code > 25}, {@code >= 70 OR < 30}, {@code == "error"}.
 * <pre>
 * condition := clause [ (AND | OR) clause ]
 * clause    := ( &gt; | &gt;= | &lt; | &lt;= | == | != ) literal
 * literal   := number | "text" | 'text'
 * </pre>
 * Keywords are case-insensitive. Text literals are only allowed with == and !=.
 */
public final class ConditionParser {

    private final String src;
    private int pos;

    private ConditionParser(String src) {
        this.src = src;
    }

    public static ConditionExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new RuleConfigurationException("Empty condition expression");
        }
        ConditionParser p = new ConditionParser(expression);
        ComparisonClause first = p.clause();
        p.skipWhitespace();
        if (p.atEnd()) return ConditionExpression.single(first);
        LogicalOperator connector = p.connector();
        ComparisonClause second = p.clause();
        p.skipWhitespace();
        if (!p.atEnd()) {
            throw p.error("unexpected input after second clause");
        }
        return new ConditionExpression(first, connector, second);
    }

    private ComparisonClause clause() {
        skipWhitespace();
        ComparisonOperator op = ComparisonOperator.match(src, pos);
        if (op == null) throw error("expected comparator");
        pos += op.symbol().length();
        skipWhitespace();
        if (atEnd()) throw error("missing literal after '" + op.symbol() + "'");
        char c = src.charAt(pos);
        if (c == '"' || c == '\'') {
            String text = quoted(c);
            if (!op.supportsText()) {
                throw error("text literal not allowed with '" + op.symbol() + "'");
            }
            return new ComparisonClause(op, text, null);
        }
        String token = word();
        try {
            double d = Double.parseDouble(token);
            if (Double.isNaN(d) || Double.isInfinite(d)) throw error("literal is not a finite number: " + token);
            return new ComparisonClause(op, token, d);
        } catch (NumberFormatException e) {
            throw new RuleConfigurationException(describe("literal is not a number: '" + token + "'"), e);
        }
    }

    private LogicalOperator connector() {
        String w = word().toUpperCase(Locale.ROOT);
        if ("AND".equals(w)) return LogicalOperator.AND;
        if ("OR".equals(w)) return LogicalOperator.OR;
        throw error("expected AND / OR but found '" + w + "'");
    }

    private String quoted(char quote) {
        int start = ++pos;
        int end = src.indexOf(quote, start);
        if (end < 0) throw error("unterminated text literal");
        pos = end + 1;
        return src.substring(start, end);
    }

    private String word() {
        int start = pos;
        while (!atEnd() && !Character.isWhitespace(src.charAt(pos))) pos++;
        return src.substring(start, pos);
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(src.charAt(pos))) pos++;
    }

    private boolean atEnd() {
        return pos >= src.length();
    }

    private RuleConfigurationException error(String what) {
        return new RuleConfigurationException(describe(what));
    }

    private String describe(String what) {
        return "Invalid condition '" + src + "' at " + pos + ": " + what;
    }
}
