package com.festival.events;

import com.festival.game_rules.ConditionEvaluator;
import com.festival.game_state.EffectResult;
import com.festival.game_state.GameConfig;
import com.festival.game_state.GameSession;
import com.festival.game_state.PendingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Применение выбранного варианта ответа к сессии
 */
public class ChoiceProcessor {
    private static final Logger log = LoggerFactory.getLogger(ChoiceProcessor.class);

    private final ConditionEvaluator evaluator;
    private final Clock clock;

    public ChoiceProcessor(ConditionEvaluator evaluator) {
        this(evaluator, Clock.systemDefaultZone());
    }

    public ChoiceProcessor(ConditionEvaluator evaluator, Clock clock) {
        this.evaluator = evaluator;
        this.clock = clock;
    }

    /**
     * Применить вариант с индексом choiceIndex.
     * @return пусто, если такого варианта нет; сессия при этом не меняется
     */
    public Optional<ChoiceResult> process(GameSession session, EventDefinition event, int choiceIndex) {
        List<OptionDefinition> options = event.getOptions();
        if (choiceIndex < 0 || choiceIndex >= options.size()) {
            log.debug("❓ Вариант {} отсутствует в событии {}", choiceIndex, event.getId());
            return Optional.empty();
        }
        OptionDefinition option = options.get(choiceIndex);

        List<EffectResult> effectResults = session.getAttributes().applyEffects(option.getEffects(), evaluator);
        session.recordEvent(event.getId(), choiceIndex, option.getId(), LocalDateTime.now(clock));

        if (event.isOnceOnly()) {
            session.markEventTriggered(event.getId());
        }
        option.getSetFlags().forEach(session::setFlag);

        scheduleFollowUps(session, option);

        return Optional.of(new ChoiceResult(
            option, choiceIndex, effectResults, option.getSpecialOutcome(), option.getFeedback()));
    }

    private void scheduleFollowUps(GameSession session, OptionDefinition option) {
        for (FollowUpSpec followUp : option.getFollowUpEvents()) {
            int day = session.getProgress().getCurrentDay();
            int period = session.getProgress().getCurrentPeriod();

            switch (followUp.getDelay()) {
                case IMMEDIATE -> {
                    // в очередь не ставится
                    continue;
                }
                case NEXT_PERIOD -> {
                    period++;
                    if (period >= GameConfig.PERIODS_PER_DAY) {
                        period = 0;
                        day++;
                    }
                }
                case NEXT_DAY -> {
                    day++;
                    period = 0;
                }
            }

            // null или 0 - без броска, событие ставится всегда
            if (followUp.getProbability() != null && followUp.getProbability() > 0
                && evaluator.getRandomSource().nextDouble() > followUp.getProbability()) {
                log.debug("🎲 Последующее событие {} не выпало", followUp.getEventId());
                continue;
            }

            session.addPendingEvent(new PendingEvent(followUp.getEventId(), day, period, followUp.getPriority()));
            log.debug("📌 {} запланировано на день {}, период {}", followUp.getEventId(), day, period);
        }
    }
}
