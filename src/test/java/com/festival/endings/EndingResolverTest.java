package com.festival.endings;

import com.festival.content.GameContent;
import com.festival.game_rules.Condition;
import com.festival.game_rules.ConditionEvaluator;
import com.festival.game_rules.ConditionGroup;
import com.festival.game_state.CharacterProfile;
import com.festival.game_state.GameSession;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EndingResolverTest {

    private static final LocalDateTime START = LocalDateTime.of(2026, 2, 16, 9, 0);

    private static final EndingDefinition WEALTH_LEGEND = EndingDefinition.builder("wealth_legend")
        .title("财富传说")
        .category(EndingCategory.PERFECT)
        .priority(100)
        .baseScore(1000)
        .unlockConditions(ConditionGroup.of(
            Condition.attribute("deposit", ">=", 50000),
            Condition.attribute("face", ">=", 90)))
        .build();

    private static final EndingDefinition RICH = EndingDefinition.builder("rich")
        .title("小有积蓄")
        .category(EndingCategory.GOOD)
        .priority(50)
        .baseScore(700)
        .unlockConditions(ConditionGroup.of(Condition.attribute("deposit", ">=", 20000)))
        .build();

    private static final EndingDefinition STUDENT_GRADUATE = EndingDefinition.builder("student_graduate")
        .title("顺利毕业")
        .characterId("student")
        .priority(200)
        .baseScore(800)
        .build();

    private final ConditionEvaluator evaluator = new ConditionEvaluator(() -> 0.5);

    private static GameSession session(CharacterProfile character, EndingDefinition... endings) {
        GameSession session = new GameSession(new GameContent(List.of(), List.of(endings), List.of()));
        session.initNewGame(character, START);
        return session;
    }

    @Test
    void shouldPickHighestPriorityUnlockedEnding() {
        GameSession session = session(null, RICH, WEALTH_LEGEND);
        session.getAttributes().set("deposit", 60000);
        session.getAttributes().set("face", 95);

        EndingResult result = new EndingResolver(evaluator).determineEnding(session);

        assertEquals("wealth_legend", result.getId());
        assertEquals(EndingCategory.PERFECT, result.getCategory());
    }

    @Test
    void shouldFallThroughToLowerPriority() {
        GameSession session = session(null, WEALTH_LEGEND, RICH);
        session.getAttributes().set("deposit", 60000);
        session.getAttributes().set("face", 20);

        assertEquals("rich", new EndingResolver(evaluator).selectEnding(session).getId());
    }

    @Test
    void shouldAlwaysProduceEnding() {
        GameSession session = session(null, WEALTH_LEGEND);

        EndingResult result = new EndingResolver(evaluator).determineEnding(session);

        assertEquals(EndingResolver.DEFAULT_ENDING.getId(), result.getId());
        assertFalse(result.getStory().isEmpty());
    }

    @Test
    void shouldIgnoreEndingsOfOtherCharacters() {
        CharacterProfile worker = new CharacterProfile("worker", "打工人", "", "", "👔", Map.of());

        assertEquals(EndingResolver.DEFAULT_ENDING,
            new EndingResolver(evaluator).selectEnding(session(worker, STUDENT_GRADUATE)));
        assertEquals(EndingResolver.DEFAULT_ENDING,
            new EndingResolver(evaluator).selectEnding(session(null, STUDENT_GRADUATE)));

        CharacterProfile student = new CharacterProfile("student", "大学生", "", "", "🎓", Map.of());
        assertEquals("student_graduate",
            new EndingResolver(evaluator).selectEnding(session(student, STUDENT_GRADUATE, RICH)).getId());
    }

    @Test
    void shouldKeepCatalogOrderOnEqualPriority() {
        EndingDefinition first = EndingDefinition.builder("first").priority(10).build();
        EndingDefinition second = EndingDefinition.builder("second").priority(10).build();

        assertEquals("first", new EndingResolver(evaluator).selectEnding(session(null, first, second)).getId());
    }

    @Test
    void shouldScoreBaseModifiersAndAttributes() {
        EndingDefinition ending = EndingDefinition.builder("scored")
            .baseScore(500)
            .scoreModifiers(List.of(
                new ScoreModifier(Condition.flag("has_partner", true), 100),
                new ScoreModifier(Condition.attribute("luck", ">=", 90), 999)))
            .build();
        GameSession session = session(null, ending);
        session.setFlag("has_partner", true);
        session.getAttributes().set("deposit", 12345);
        session.getAttributes().set("face", 41);
        session.getAttributes().set("mood", 60);
        session.getAttributes().set("health", 80);

        // 500 + 100 + 12.345 + 20.5 + 30 + 40
        assertEquals(702, new EndingResolver(evaluator).calculateScore(ending, session));
    }

    @Test
    void shouldReportChangesAgainstCharacterStart() {
        CharacterProfile worker = new CharacterProfile("worker", "打工人", "", "", "👔",
            Map.of("deposit", 20000.0, "weight", 70.0));
        GameSession session = session(worker);
        session.getAttributes().modify("deposit", -3000);
        session.getAttributes().modify("weight", 2.5);
        session.recordEvent("dinner", 0, "dinner_0", START);

        EndingStats stats = new EndingResolver(evaluator).stats(session);

        assertEquals(-3000, stats.getDepositChange());
        assertEquals(2.5, stats.getWeightChange());
        assertEquals(0, stats.getMoodChange());
        assertEquals(1, stats.getTotalChoices());
    }

    @Test
    void shouldReportNoDepositChangeWhenProfileOmitsDeposit() {
        GameSession session = session(new CharacterProfile("auntie", "二姨", "", "", "👵", Map.of("mood", 70.0)));

        EndingStats stats = new EndingResolver(evaluator).stats(session);

        assertEquals(5000, session.getAttributes().get("deposit"));
        assertEquals(0, stats.getDepositChange());
        assertEquals(0, stats.getHealthChange());
        assertEquals(0, stats.getFaceChange());
    }
}
