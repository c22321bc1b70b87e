package com.festival.game_rules;

/**
 * Броски поверх RandomSource: целое из диапазона, проверка вероятности, взвешенный индекс
 */
public final class DiceRoller {

    private DiceRoller() {
    }

    /**
     * Равномерное целое из [min, max] включительно
     */
    public static int rollBetween(RandomSource random, int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("Неверный диапазон броска: " + min + ".." + max);
        }
        return (int) Math.floor(random.nextDouble() * (max - min + 1)) + min;
    }

    /**
     * Успех, если бросок меньше вероятности
     */
    public static boolean chance(RandomSource random, double probability) {
        return random.nextDouble() < probability;
    }

    /**
     * Выбор индекса пропорционально весам: бросок в [0, total), веса вычитаются по порядку,
     * выигрывает первый, на котором остаток стал <= 0
     */
    public static int rollWeighted(RandomSource random, double[] weights) {
        if (weights.length == 0) {
            throw new IllegalArgumentException("Нет кандидатов для взвешенного выбора");
        }
        double total = 0;
        for (double weight : weights) {
            total += weight;
        }

        double remainder = random.nextDouble() * total;
        for (int i = 0; i < weights.length; i++) {
            remainder -= weights[i];
            if (remainder <= 0) {
                return i;
            }
        }
        // погрешность double: остаток чуть больше нуля после последнего веса
        return 0;
    }
}
