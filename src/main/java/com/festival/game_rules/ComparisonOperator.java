package com.festival.game_rules;

/**
 * Операторы сравнения атрибутов
 */
public enum ComparisonOperator {
    GREATER(">"),
    LESS("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean test(double value, double target) {
        return switch (this) {
            case GREATER -> value > target;
            case LESS -> value < target;
            case GREATER_OR_EQUAL -> value >= target;
            case LESS_OR_EQUAL -> value <= target;
            case EQUAL -> Double.compare(value, target) == 0;
            case NOT_EQUAL -> Double.compare(value, target) != 0;
        };
    }

    /**
     * Оператор по символу; неизвестный или отсутствующий символ означает ">="
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        if (symbol != null) {
            for (ComparisonOperator operator : values()) {
                if (operator.symbol.equals(symbol.trim())) {
                    return operator;
                }
            }
        }
        return GREATER_OR_EQUAL;
    }
}
