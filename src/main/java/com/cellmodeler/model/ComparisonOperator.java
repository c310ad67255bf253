package com.cellmodeler.model;

public enum ComparisonOperator {
    EQUALS("=="),
    NOT_EQUALS("!="),
    LESS_THAN("<"),
    LESS_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(int count, int threshold) {
        return switch (this) {
            case EQUALS -> count == threshold;
            case NOT_EQUALS -> count != threshold;
            case LESS_THAN -> count < threshold;
            case LESS_OR_EQUAL -> count <= threshold;
            case GREATER_THAN -> count > threshold;
            case GREATER_OR_EQUAL -> count >= threshold;
        };
    }

    public static ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator '" + symbol + "'");
    }

    @Override
    public String toString() {
        return symbol;
    }
}
