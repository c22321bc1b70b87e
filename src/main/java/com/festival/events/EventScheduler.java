package com.festival.events;

import com.festival.content.GameContent;
import com.festival.game_rules.ConditionEvaluator;
import com.festival.game_rules.DiceRoller;
import com.festival.game_state.CharacterProfile;
import com.festival.game_state.GameSession;
import com.festival.game_state.PendingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Выбор следующего события: сначала очередь отложенных, затем взвешенный выбор из каталога
 */
public class EventScheduler {
    private static final Logger log = LoggerFactory.getLogger(EventScheduler.class);

    private final ConditionEvaluator evaluator;

    public EventScheduler(ConditionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Событие для текущего дня и периода сессии. Никогда не возвращает null
     */
    public EventDefinition nextEvent(GameSession session) {
        Optional<EventDefinition> pending = takePendingEvent(session);
        if (pending.isPresent()) {
            log.debug("📬 Отложенное событие: {}", pending.get().getId());
            return pending.get();
        }

        List<EventDefinition> candidates = availableEvents(session);
        if (candidates.isEmpty()) {
            log.debug("😌 Подходящих событий нет, {}", DefaultEvent.ID);
            return DefaultEvent.get();
        }

        double[] weights = new double[candidates.size()];
        for (int i = 0; i < candidates.size(); i++) {
            weights[i] = candidates.get(i).getWeight();
        }
        EventDefinition chosen = candidates.get(DiceRoller.rollWeighted(evaluator.getRandomSource(), weights));
        log.debug("🎲 Выбрано событие {} из {} кандидатов", chosen.getId(), candidates.size());
        return chosen;
    }

    /**
     * Снять из очереди созревшую запись с наибольшим приоритетом (при равенстве - самую раннюю).
     * Запись удаляется, даже если событие с таким id не найдено в каталоге
     */
    Optional<EventDefinition> takePendingEvent(GameSession session) {
        int day = session.getProgress().getCurrentDay();
        int period = session.getProgress().getCurrentPeriod();
        List<PendingEvent> queue = session.getPendingEvents();

        int bestIndex = -1;
        for (int i = 0; i < queue.size(); i++) {
            PendingEvent entry = queue.get(i);
            if (entry.isDue(day, period)
                && (bestIndex < 0 || entry.getPriority() > queue.get(bestIndex).getPriority())) {
                bestIndex = i;
            }
        }
        if (bestIndex < 0) {
            return Optional.empty();
        }

        PendingEvent winner = session.removePendingEvent(bestIndex);
        Optional<EventDefinition> event = catalog(session).findEvent(winner.getEventId());
        if (event.isEmpty()) {
            log.warn("⚠️ Отложенное событие {} отсутствует в каталоге", winner.getEventId());
        }
        return event;
    }

    /**
     * События каталога, которые могут произойти сейчас, в порядке каталога
     */
    public List<EventDefinition> availableEvents(GameSession session) {
        List<EventDefinition> result = new ArrayList<>();
        for (EventDefinition event : catalog(session).getEvents()) {
            if (isEventAvailable(event, session)) {
                result.add(event);
            }
        }
        return result;
    }

    public boolean isEventAvailable(EventDefinition event, GameSession session) {
        if (event.isOnceOnly() && session.isEventTriggered(event.getId())) {
            return false;
        }
        if (!evaluator.allOf(event.getTriggerConditions(), session)) {
            return false;
        }
        for (String exclusiveId : event.getMutuallyExclusive()) {
            if (session.isEventTriggered(exclusiveId)) {
                return false;
            }
        }
        for (String prerequisiteId : event.getPrerequisiteEvents()) {
            if (!session.isEventTriggered(prerequisiteId)) {
                return false;
            }
        }
        if (event.isCharacterExclusive()) {
            CharacterProfile character = session.getCharacter();
            return character != null && event.getExclusiveTo().contains(character.getId());
        }
        return true;
    }

    /**
     * Варианты ответа, видимые игроку. Скрытые отбрасываются, недоступные помечаются
     */
    public List<OptionView> availableOptions(EventDefinition event, GameSession session) {
        List<OptionView> views = new ArrayList<>();
        List<OptionDefinition> options = event.getOptions();

        for (int i = 0; i < options.size(); i++) {
            OptionDefinition option = options.get(i);
            if (!evaluator.allOf(option.getVisibilityConditions(), session)) {
                continue;
            }
            boolean available = evaluator.allOf(option.getAvailabilityConditions(), session);
            views.add(new OptionView(option, i, available, available ? null : option.getUnavailableText()));
        }
        return views;
    }

    private GameContent catalog(GameSession session) {
        return session.getContent() != null ? session.getContent() : GameContent.empty();
    }
}
