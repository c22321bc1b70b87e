package com.festival.game_state;

/**
 * Итог применения одного эффекта
 */
public class EffectResult {
    private final String attribute;
    private final double oldValue;
    private final double newValue;

    public EffectResult(String attribute, double oldValue, double newValue) {
        this.attribute = attribute;
        this.oldValue = oldValue;
        this.newValue = newValue;
    }

    public String getAttribute() { return attribute; }
    public double getOldValue() { return oldValue; }
    public double getNewValue() { return newValue; }

    /**
     * Фактическое изменение с учетом ограничения границами
     */
    public double getChange() {
        return newValue - oldValue;
    }
}
