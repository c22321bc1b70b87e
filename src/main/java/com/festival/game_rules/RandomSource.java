package com.festival.game_rules;

/**
 * Единственный источник случайности движка: равномерные значения в [0, 1)
 */
@FunctionalInterface
public interface RandomSource {

    double nextDouble();
}
