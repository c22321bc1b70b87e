package com.festival.game_state;

import com.festival.content.GameContent;
import com.festival.game_rules.Condition;
import com.festival.game_rules.ConditionEvaluator;
import com.festival.game_rules.Effect;
import com.festival.game_rules.EffectOperation;
import com.festival.game_rules.EffectValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AttributeStoreTest {

    private GameSession session;
    private AttributeStore store;

    @BeforeEach
    void setUp() {
        session = new GameSession(GameContent.empty());
        session.initNewGame(null, LocalDateTime.of(2026, 2, 16, 9, 0));
        store = session.getAttributes();
    }

    @Test
    void shouldClampKnownAttributesToBounds() {
        store.set("mood", 150);
        assertEquals(100, store.get("mood"));

        store.set("weight", 10);
        assertEquals(30, store.get("weight"));

        store.modify("face", -500);
        assertEquals(-100, store.get("face"));
    }

    @Test
    void shouldKeepUnknownAttributesUnclamped() {
        store.set("courage", 1234);
        assertEquals(1234, store.get("courage"));
        assertEquals(0, store.get("missing"));
    }

    @Test
    void shouldApplyOperations() {
        store.set("mood", 40);
        assertEquals(50, store.modify("mood", 10, EffectOperation.ADD));
        assertEquals(20, store.modify("mood", 20, EffectOperation.SET));
        assertEquals(30, store.modify("mood", 1.5, EffectOperation.MULTIPLY));
    }

    @Test
    void shouldTrackMoneySpentAndEarned() {
        store.modify("deposit", -300);
        store.modify("deposit", 1000);
        store.modify("deposit", 0);

        assertEquals(300, session.getStatistics().getMoneySpent());
        assertEquals(1000, session.getStatistics().getMoneyEarned());
    }

    @Test
    void shouldNotTrackMoneyForOtherAttributes() {
        store.modify("mood", -10);

        assertEquals(0, session.getStatistics().getMoneySpent());
        assertEquals(0, session.getStatistics().getMoneyEarned());
    }

    @Test
    void shouldComputeLinearPercentage() {
        store.set("mood", 75);
        store.set("face", 0);

        assertEquals(75, store.percentage("mood"), 1e-9);
        assertEquals(50, store.percentage("face"), 1e-9);
        assertEquals(50, store.percentage("courage"), 1e-9);
    }

    @Test
    void shouldComputeLogarithmicPercentageForMoney() {
        store.set("deposit", 10_000_000);
        assertEquals(100, store.percentage("deposit"), 1e-9);

        store.set("deposit", 100_000);
        double expected = (5 - Math.log10(50_000)) / (7 - Math.log10(50_000)) * 100;
        assertEquals(expected, store.percentage("deposit"), 1e-9);

        store.set("deposit", 100);
        assertEquals(0, store.percentage("deposit"), 1e-9);
    }

    @Test
    void shouldSkipConditionalEffectButStillConsumeRoll() {
        int[] draws = {0};
        ConditionEvaluator evaluator = new ConditionEvaluator(() -> {
            draws[0]++;
            return 0.5;
        });
        store.set("mood", 50);

        List<EffectResult> results = store.applyEffects(List.of(
            new Effect("mood", EffectOperation.ADD, EffectValue.range(1, 10), Condition.attribute("mood", "<", 0)),
            Effect.add("health", -5)
        ), evaluator);

        assertEquals(1, results.size());
        assertEquals("health", results.get(0).getAttribute());
        assertEquals(-5, results.get(0).getChange());
        assertEquals(1, draws[0]);
        assertEquals(50, store.get("mood"));
    }

    @Test
    void shouldReportClampedChange() {
        store.set("mood", 95);

        List<EffectResult> results = store.applyEffects(
            List.of(Effect.add("mood", 20)), new ConditionEvaluator(() -> 0.0));

        assertEquals(95, results.get(0).getOldValue());
        assertEquals(100, results.get(0).getNewValue());
        assertEquals(5, results.get(0).getChange());
    }

    @Test
    void shouldAverageWellbeing() {
        store.set("face", 60);
        store.set("mood", 70);
        store.set("health", 80);

        assertEquals(70, store.average(), 1e-9);
        assertEquals(0, store.average(List.of()));
    }
}
