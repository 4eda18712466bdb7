package com.sandy.aiot.warning.rule;

public enum ComparisonOperator {
    GT(">"),
    GE(">="),
    LT("<"),
    LE("<="),
    EQ("=="),
    NE("!=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** Only equality operators accept a quoted text literal. */
    public boolean supportsText() {
        return this == EQ || this == NE;
    }

    /** @param cmp result of a {@code compareTo(value, literal)} style comparison */
    public boolean test(int cmp) {
        return switch (this) {
            case GT -> cmp > 0;
            case GE -> cmp >= 0;
            case LT -> cmp < 0;
            case LE -> cmp <= 0;
            case EQ -> cmp == 0;
            case NE -> cmp != 0;
        };
    }

    /** Longest symbol first so ">=" is not read as ">". */
    static ComparisonOperator match(String src, int pos) {
        for (ComparisonOperator op : new ComparisonOperator[]{GE, LE, EQ, NE, GT, LT}) {
            if (src.startsWith(op.symbol, pos)) return op;
        }
        return null;
    }
}
