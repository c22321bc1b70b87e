package com.festival.game_rules;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiceRollerTest {

    @Test
    void rollBetweenShouldCoverInclusiveRange() {
        assertEquals(-20, DiceRoller.rollBetween(() -> 0.0, -20, -5));
        assertEquals(-5, DiceRoller.rollBetween(() -> 0.9999, -20, -5));
        assertEquals(3, DiceRoller.rollBetween(() -> 0.5, 3, 3));
    }

    @Test
    void rollBetweenShouldRejectInvertedRange() {
        assertThrows(IllegalArgumentException.class, () -> DiceRoller.rollBetween(() -> 0.5, 10, 1));
    }

    @Test
    void chanceShouldSucceedOnlyBelowProbability() {
        assertTrue(DiceRoller.chance(() -> 0.29, 0.3));
        assertFalse(DiceRoller.chance(() -> 0.3, 0.3));
        assertFalse(DiceRoller.chance(() -> 0.0, 0.0));
        assertTrue(DiceRoller.chance(() -> 0.999, 1.0));
    }

    @Test
    void rollWeightedShouldPickByCumulativeWeight() {
        double[] weights = {10, 90};

        assertEquals(0, DiceRoller.rollWeighted(() -> 0.05, weights));
        assertEquals(1, DiceRoller.rollWeighted(() -> 0.95, weights));
        assertEquals(0, DiceRoller.rollWeighted(() -> 0.1, weights));
    }

    @Test
    void rollWeightedShouldFollowWeightsStatistically() {
        JdkRandomSource random = new JdkRandomSource(42);
        double[] weights = {10, 90};
        int first = 0;
        int draws = 100_000;

        for (int i = 0; i < draws; i++) {
            if (DiceRoller.rollWeighted(random, weights) == 0) {
                first++;
            }
        }

        assertEquals(0.10, (double) first / draws, 0.01);
    }

    @Test
    void rollWeightedShouldRejectEmptyCandidates() {
        assertThrows(IllegalArgumentException.class, () -> DiceRoller.rollWeighted(() -> 0.5, new double[0]));
    }
}
