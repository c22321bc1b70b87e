package com.festival.events;

import com.festival.content.GameContent;
import com.festival.game_rules.Condition;
import com.festival.game_rules.ConditionEvaluator;
import com.festival.game_rules.JdkRandomSource;
import com.festival.game_state.CharacterProfile;
import com.festival.game_state.GameSession;
import com.festival.game_state.PendingEvent;
import com.festival.testsupport.ScriptedRandom;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EventSchedulerTest {

    private static final LocalDateTime START = LocalDateTime.of(2026, 2, 16, 9, 0);

    private static EventDefinition event(String id, double weight) {
        return EventDefinition.builder(id)
            .weight(weight)
            .options(OptionDefinition.builder(id + "_0").text("好").build())
            .build();
    }

    private static GameSession session(List<EventDefinition> events) {
        GameSession session = new GameSession(new GameContent(events, List.of(), List.of()));
        session.initNewGame(null, START);
        return session;
    }

    @Test
    void shouldPickByWeight() {
        GameSession session = session(List.of(event("rare", 10), event("common", 90)));

        assertEquals("rare", new EventScheduler(new ConditionEvaluator(() -> 0.05)).nextEvent(session).getId());
        assertEquals("common", new EventScheduler(new ConditionEvaluator(() -> 0.95)).nextEvent(session).getId());
    }

    @Test
    void shouldFollowWeightsOverManyDraws() {
        GameSession session = session(List.of(event("rare", 10), event("common", 90)));
        EventScheduler scheduler = new EventScheduler(new ConditionEvaluator(new JdkRandomSource(7)));
        int rare = 0;
        int draws = 100_000;

        for (int i = 0; i < draws; i++) {
            if ("rare".equals(scheduler.nextEvent(session).getId())) {
                rare++;
            }
        }

        assertEquals(0.10, (double) rare / draws, 0.01);
    }

    @Test
    void shouldFallBackToDefaultEventWhenNothingQualifies() {
        EventDefinition late = EventDefinition.builder("late")
            .triggerConditions(List.of(Condition.time(Set.of(5), null, null, null)))
            .options(OptionDefinition.builder("late_0").build())
            .build();
        GameSession session = session(List.of(late));

        EventDefinition chosen = new EventScheduler(new ConditionEvaluator(() -> 0.5)).nextEvent(session);

        assertEquals(DefaultEvent.ID, chosen.getId());
        assertEquals(3, chosen.getOptions().size());
    }

    @Test
    void shouldExcludeTriggeredOnceOnlyEvents() {
        EventDefinition once = EventDefinition.builder("aunt_visit")
            .onceOnly(true)
            .options(OptionDefinition.builder("aunt_visit_0").build())
            .build();
        GameSession session = session(List.of(once));
        EventScheduler scheduler = new EventScheduler(new ConditionEvaluator(() -> 0.5));

        assertTrue(scheduler.isEventAvailable(once, session));
        session.markEventTriggered("aunt_visit");
        assertFalse(scheduler.isEventAvailable(once, session));
    }

    @Test
    void shouldApplyExclusionPrerequisitesAndCharacterFilters() {
        EventDefinition exclusive = EventDefinition.builder("blind_date")
            .mutuallyExclusive(List.of("bring_partner"))
            .options(OptionDefinition.builder("x").build())
            .build();
        EventDefinition sequel = EventDefinition.builder("aunt_returns")
            .prerequisiteEvents(List.of("aunt_visit"))
            .options(OptionDefinition.builder("x").build())
            .build();
        EventDefinition studentOnly = EventDefinition.builder("thesis")
            .exclusiveTo(List.of("student"))
            .options(OptionDefinition.builder("x").build())
            .build();
        GameSession session = session(List.of(exclusive, sequel, studentOnly));
        EventScheduler scheduler = new EventScheduler(new ConditionEvaluator(() -> 0.5));

        assertEquals(List.of(exclusive), scheduler.availableEvents(session));

        session.markEventTriggered("bring_partner");
        session.markEventTriggered("aunt_visit");
        assertEquals(List.of(sequel), scheduler.availableEvents(session));

        session.initNewGame(new CharacterProfile("student", "大学生", "", "", "🎓", Map.of()), START);
        assertTrue(scheduler.isEventAvailable(studentOnly, session));
    }

    @Test
    void shouldServeDuePendingEventExactlyOnce() {
        EventDefinition sequel = event("aunt_returns", 1);
        GameSession session = session(List.of(event("common", 100), sequel));
        session.addPendingEvent(new PendingEvent("aunt_returns", 1, 0, 0));
        EventScheduler scheduler = new EventScheduler(new ConditionEvaluator(() -> 0.0));

        assertEquals("aunt_returns", scheduler.nextEvent(session).getId());
        assertTrue(session.getPendingEvents().isEmpty());
        assertEquals("common", scheduler.nextEvent(session).getId());
    }

    @Test
    void shouldPreferHigherPriorityAndEarlierEntryOnTies() {
        GameSession session = session(List.of(event("a", 1), event("b", 1), event("c", 1)));
        session.addPendingEvent(new PendingEvent("a", null, null, 1));
        session.addPendingEvent(new PendingEvent("b", null, null, 5));
        session.addPendingEvent(new PendingEvent("c", null, null, 5));
        EventScheduler scheduler = new EventScheduler(new ConditionEvaluator(() -> 0.5));

        assertEquals("b", scheduler.nextEvent(session).getId());
        assertEquals("c", scheduler.nextEvent(session).getId());
        assertEquals("a", scheduler.nextEvent(session).getId());
    }

    @Test
    void shouldKeepPendingEventsThatAreNotDue() {
        GameSession session = session(List.of(event("common", 1)));
        session.addPendingEvent(new PendingEvent("tomorrow", 2, 0, 9));
        EventScheduler scheduler = new EventScheduler(new ConditionEvaluator(() -> 0.5));

        assertEquals("common", scheduler.nextEvent(session).getId());
        assertEquals(1, session.getPendingEvents().size());
    }

    @Test
    void shouldDropDuePendingEntryMissingFromCatalog() {
        GameSession session = session(List.of(event("common", 1)));
        session.addPendingEvent(new PendingEvent("ghost", null, null, 0));
        EventScheduler scheduler = new EventScheduler(new ConditionEvaluator(() -> 0.5));

        assertEquals("common", scheduler.nextEvent(session).getId());
        assertTrue(session.getPendingEvents().isEmpty());
    }

    @Test
    void shouldHideInvisibleOptionsAndMarkUnavailableOnes() {
        EventDefinition dinner = EventDefinition.builder("dinner")
            .options(
                OptionDefinition.builder("eat").text("吃").build(),
                OptionDefinition.builder("secret")
                    .visibilityConditions(List.of(Condition.flag("knows_secret", true)))
                    .build(),
                OptionDefinition.builder("treat")
                    .availabilityConditions(List.of(Condition.attribute("deposit", ">=", 10000)))
                    .unavailableText("钱不够")
                    .build(),
                OptionDefinition.builder("boast")
                    .availabilityConditions(List.of(Condition.attribute("face", ">=", 99)))
                    .build())
            .build();
        GameSession session = session(List.of(dinner));

        List<OptionView> views = new EventScheduler(new ConditionEvaluator(() -> 0.5)).availableOptions(dinner, session);

        assertEquals(3, views.size());
        assertEquals(0, views.get(0).getIndex());
        assertTrue(views.get(0).isAvailable());
        assertEquals(2, views.get(1).getIndex());
        assertFalse(views.get(1).isAvailable());
        assertEquals("钱不够", views.get(1).getUnavailableReason());
        assertEquals(OptionDefinition.DEFAULT_UNAVAILABLE_TEXT, views.get(2).getUnavailableReason());
    }

    @Test
    void shouldNotRollWhenOnlyPendingEventIsServed() {
        ScriptedRandom random = ScriptedRandom.of();
        GameSession session = session(List.of(event("x", 1)));
        session.addPendingEvent(new PendingEvent("x", 1, 0, 0));

        new EventScheduler(new ConditionEvaluator(random)).nextEvent(session);

        assertEquals(0, random.getCalls());
    }
}
