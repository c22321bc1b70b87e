package com.festival.game_rules;

import java.util.Random;

/**
 * RandomSource поверх java.util.Random; с фиксированным seed прохождение воспроизводимо
 */
public class JdkRandomSource implements RandomSource {
    private final Random random;

    public JdkRandomSource() {
        this.random = new Random();
    }

    public JdkRandomSource(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }
}
