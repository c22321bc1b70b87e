package com.festival.game_engine;

import com.festival.content.ContentLoader;
import com.festival.content.GameContent;
import com.festival.endings.EndingDefinition;
import com.festival.events.EventDefinition;
import com.festival.events.OptionDefinition;
import com.festival.events.SpecialOutcome;
import com.festival.game_rules.Condition;
import com.festival.game_rules.ConditionGroup;
import com.festival.game_rules.Effect;
import com.festival.game_rules.JdkRandomSource;
import com.festival.game_state.CharacterProfile;
import com.festival.game_state.GameConfig;
import com.festival.game_state.GameSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GameEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-16T08:00:00Z"), ZoneOffset.UTC);

    private GameEngine engine;

    @BeforeEach
    void setUp() {
        EventDefinition dinner = EventDefinition.builder("dinner")
            .options(
                OptionDefinition.builder("eat").effects(Effect.add("mood", 5)).build(),
                OptionDefinition.builder("secret")
                    .visibilityConditions(List.of(Condition.flag("knows_secret", true)))
                    .build(),
                OptionDefinition.builder("treat")
                    .availabilityConditions(List.of(Condition.attribute("deposit", ">=", 1_000_000)))
                    .unavailableText("钱不够")
                    .build(),
                OptionDefinition.builder("leave")
                    .specialOutcome(new SpecialOutcome(SpecialOutcome.GAME_OVER, "你离家出走了"))
                    .build())
            .build();
        EndingDefinition happy = EndingDefinition.builder("happy")
            .priority(10)
            .baseScore(800)
            .unlockConditions(ConditionGroup.of(Condition.attribute("mood", ">=", 90)))
            .build();
        CharacterProfile student = new CharacterProfile("student", "大学生", "", "", "🎓", Map.of("mood", 60.0));

        GameContent content = new GameContent(List.of(dinner), List.of(happy), List.of(student));
        engine = new GameEngine(content, new JdkRandomSource(1), CLOCK);
    }

    @Test
    void shouldStartRunForCatalogCharacter() {
        GameSession session = engine.startNewRun("student");

        assertEquals("student", session.getCharacter().getId());
        assertEquals(60, session.getAttributes().get("mood"));
        assertFalse(engine.isFinished(session));
    }

    @Test
    void shouldRejectUnknownCharacter() {
        assertThrows(IllegalArgumentException.class, () -> engine.startNewRun("ghost"));
    }

    @Test
    void shouldPresentSameEventUntilChoiceIsMade() {
        GameSession session = engine.startNewRun("student");

        EventPresentation first = engine.presentNextEvent(session);
        EventPresentation again = engine.presentNextEvent(session);

        assertEquals("dinner", first.getEvent().getId());
        assertSame(first.getEvent(), again.getEvent());
        assertEquals(3, first.getOptions().size());
        assertEquals("腊月二十九 早晨", first.getTimeDescription());
    }

    @Test
    void shouldApplyChoiceAndAdvanceTime() {
        GameSession session = engine.startNewRun("student");
        engine.presentNextEvent(session);

        TurnResult turn = engine.makeChoice(session, 0);

        assertEquals(TurnStatus.APPLIED, turn.getStatus());
        assertEquals(65, session.getAttributes().get("mood"));
        assertEquals(1, session.getProgress().getCurrentPeriod());
        assertNull(session.getCurrentEvent());
        assertEquals(1, session.getEventHistory().size());
    }

    @Test
    void shouldRefuseHiddenLockedAndMissingOptionsWithoutChangingSession() {
        GameSession session = engine.startNewRun("student");
        engine.presentNextEvent(session);

        assertEquals(TurnStatus.UNAVAILABLE, engine.makeChoice(session, 1).getStatus());
        TurnResult locked = engine.makeChoice(session, 2);
        assertEquals(TurnStatus.UNAVAILABLE, locked.getStatus());
        assertEquals("钱不够", locked.getMessage());
        assertEquals(TurnStatus.NOT_FOUND, engine.makeChoice(session, 9).getStatus());

        assertEquals(0, session.getProgress().getTotalPeriods());
        assertTrue(session.getEventHistory().isEmpty());
        assertNotNull(session.getCurrentEvent());
    }

    @Test
    void shouldRequirePresentedEvent() {
        GameSession session = engine.startNewRun("student");

        assertThrows(IllegalStateException.class, () -> engine.makeChoice(session, 0));
    }

    @Test
    void shouldEndAfterLastPeriod() {
        GameSession session = engine.startNewRun("student");
        int turns = GameConfig.TOTAL_DAYS * GameConfig.PERIODS_PER_DAY;
        TurnResult turn = null;

        for (int i = 0; i < turns; i++) {
            engine.presentNextEvent(session);
            turn = engine.makeChoice(session, 0);
        }

        assertEquals(TurnStatus.ENDED, turn.getStatus());
        assertTrue(turn.isNewDay());
        assertEquals("happy", turn.getEnding().getId());
        assertTrue(engine.isFinished(session));
        assertThrows(IllegalStateException.class, () -> engine.presentNextEvent(session));
    }

    @Test
    void shouldEndImmediatelyOnTerminalOutcome() {
        GameSession session = engine.startNewRun("student");
        engine.presentNextEvent(session);

        TurnResult turn = engine.makeChoice(session, 3);

        assertEquals(TurnStatus.ENDED, turn.getStatus());
        assertEquals(SpecialOutcome.GAME_OVER, session.getFlag(GameEngine.TERMINAL_FLAG));
        assertEquals(0, session.getProgress().getTotalPeriods());
        assertTrue(engine.isFinished(session));
        assertNotNull(engine.determineEnding(session));
    }

    @Test
    void shouldPlayFullRunOnBundledContent() {
        GameEngine bundled = new GameEngine(new ContentLoader("").loadBundled(), new JdkRandomSource(2026), CLOCK);
        GameSession session = bundled.startNewRun("hao_shitu");
        TurnResult turn = null;

        while (!bundled.isFinished(session)) {
            EventPresentation presentation = bundled.presentNextEvent(session);
            int choice = presentation.getOptions().stream()
                .filter(option -> option.isAvailable())
                .findFirst()
                .orElseThrow()
                .getIndex();
            turn = bundled.makeChoice(session, choice);
            assertNotEquals(TurnStatus.NOT_FOUND, turn.getStatus());
        }

        assertEquals(TurnStatus.ENDED, turn.getStatus());
        assertNotNull(turn.getEnding().getId());
        assertFalse(turn.getEnding().getStory().isEmpty());
    }
}
