package com.festival.game_rules;

/**
 * Величина эффекта: фиксированное число или случайное целое из диапазона [min, max]
 */
public final class EffectValue {
    private final double fixed;
    private final Integer min;
    private final Integer max;

    private EffectValue(double fixed, Integer min, Integer max) {
        this.fixed = fixed;
        this.min = min;
        this.max = max;
    }

    public static EffectValue of(double value) {
        return new EffectValue(value, null, null);
    }

    public static EffectValue range(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("Неверный диапазон эффекта: " + min + ".." + max);
        }
        return new EffectValue(0, min, max);
    }

    public boolean isRange() {
        return min != null && max != null;
    }

    /**
     * Конкретное значение; для диапазона тратит один бросок
     */
    public double resolve(RandomSource random) {
        if (isRange()) {
            return DiceRoller.rollBetween(random, min, max);
        }
        return fixed;
    }

    public double getFixed() { return fixed; }
    public Integer getMin() { return min; }
    public Integer getMax() { return max; }

    @Override
    public String toString() {
        return isRange() ? min + ".." + max : String.valueOf(fixed);
    }
}
