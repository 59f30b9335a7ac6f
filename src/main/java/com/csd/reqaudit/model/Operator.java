package com.csd.reqaudit.model;

import java.util.Arrays;

/**
 * Comparison operators accepted in requirement lines and catalogue specs.
 */
public enum Operator {
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /** {@code >} or {@code >=}: unbounded upward. */
    public boolean isLowerBound() {
        return this == GT || this == GE;
    }

    /** {@code <} or {@code <=}: unbounded downward. */
    public boolean isUpperBound() {
        return this == LT || this == LE;
    }

    public static Operator fromSymbol(String symbol) {
        String trimmed = symbol == null ? "" : symbol.trim();
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(trimmed))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown comparison operator: '" + symbol + "'"));
    }

    @Override
    public String toString() {
        return symbol;
    }
}
