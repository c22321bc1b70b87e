package com.festival.game_rules;

/**
 * Изменение атрибута, которое применяет выбранный вариант ответа
 */
public class Effect {
    private final String attribute;
    private final EffectOperation operation;
    private final EffectValue value;
    private final Condition condition;

    public Effect(String attribute, EffectOperation operation, EffectValue value, Condition condition) {
        this.attribute = attribute;
        this.operation = operation != null ? operation : EffectOperation.ADD;
        this.value = value;
        this.condition = condition;
    }

    public static Effect add(String attribute, double value) {
        return new Effect(attribute, EffectOperation.ADD, EffectValue.of(value), null);
    }

    public String getAttribute() { return attribute; }
    public EffectOperation getOperation() { return operation; }
    public EffectValue getValue() { return value; }

    /**
     * Условие применения, null - применяется всегда
     */
    public Condition getCondition() { return condition; }
}
