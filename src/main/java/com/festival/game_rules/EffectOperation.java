package com.festival.game_rules;

/**
 * Как эффект меняет атрибут
 */
public enum EffectOperation {
    ADD("add"),
    SET("set"),
    MULTIPLY("multiply");

    private final String value;

    EffectOperation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public double apply(double current, double operand) {
        return switch (this) {
            case ADD -> current + operand;
            case SET -> operand;
            case MULTIPLY -> current * operand;
        };
    }

    /**
     * Операция по строке; по умолчанию ADD
     */
    public static EffectOperation fromString(String value) {
        if (value != null) {
            for (EffectOperation operation : values()) {
                if (operation.value.equalsIgnoreCase(value)) {
                    return operation;
                }
            }
        }
        return ADD;
    }
}
