package com.festival.endings;

import com.festival.game_rules.Condition;

/**
 * Надбавка к очкам концовки при выполнении условия
 */
public class ScoreModifier {
    private final Condition condition;
    private final double value;

    public ScoreModifier(Condition condition, double value) {
        this.condition = condition;
        this.value = value;
    }

    public Condition getCondition() { return condition; }
    public double getValue() { return value; }
}
