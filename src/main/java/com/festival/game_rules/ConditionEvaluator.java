package com.festival.game_rules;

import com.festival.game_rules.Condition.AttributeCondition;
import com.festival.game_rules.Condition.CharacterCondition;
import com.festival.game_rules.Condition.CombinationCondition;
import com.festival.game_rules.Condition.EventHistoryCondition;
import com.festival.game_rules.Condition.EventTriggeredCondition;
import com.festival.game_rules.Condition.FlagCondition;
import com.festival.game_rules.Condition.ProbabilityCondition;
import com.festival.game_rules.Condition.RandomCondition;
import com.festival.game_rules.Condition.TimeCondition;
import com.festival.game_state.Attribute;
import com.festival.game_state.CharacterProfile;
import com.festival.game_state.GameSession;

import java.util.List;
import java.util.Objects;

/**
 * Вычисление условий всех видов против состояния сессии.
 * Случайность расходуют только RANDOM и PROBABILITY, ровно один бросок на проверку
 */
public class ConditionEvaluator {
    private final RandomSource random;

    public ConditionEvaluator(RandomSource random) {
        this.random = random;
    }

    public boolean evaluate(Condition condition, GameSession session) {
        if (condition == null) {
            return true;
        }
        return switch (condition.getType()) {
            case ATTRIBUTE -> evaluateAttribute((AttributeCondition) condition, session);
            case FLAG -> evaluateFlag((FlagCondition) condition, session);
            case RANDOM -> DiceRoller.chance(random, ((RandomCondition) condition).getProbability());
            case TIME -> evaluateTime((TimeCondition) condition, session);
            case PROBABILITY -> evaluateProbability((ProbabilityCondition) condition, session);
            case EVENT_HISTORY -> evaluateEventHistory((EventHistoryCondition) condition, session);
            case CHARACTER -> evaluateCharacter((CharacterCondition) condition, session);
            case EVENT_TRIGGERED -> evaluateEventTriggered((EventTriggeredCondition) condition, session);
            case COMBINATION -> allOf(((CombinationCondition) condition).getConditions(), session);
        };
    }

    /**
     * Все условия списка (И); пустой список истинен
     */
    public boolean allOf(List<Condition> conditions, GameSession session) {
        if (conditions == null) {
            return true;
        }
        for (Condition condition : conditions) {
            if (!evaluate(condition, session)) {
                return false;
            }
        }
        return true;
    }

    public boolean evaluate(ConditionGroup group, GameSession session) {
        return group == null || allOf(group.getConditions(), session);
    }

    /**
     * Хотя бы одна группа (ИЛИ); пустой список групп истинен
     */
    public boolean anyGroup(List<ConditionGroup> groups, GameSession session) {
        if (groups == null || groups.isEmpty()) {
            return true;
        }
        for (ConditionGroup group : groups) {
            if (evaluate(group, session)) {
                return true;
            }
        }
        return false;
    }

    public RandomSource getRandomSource() {
        return random;
    }

    private boolean evaluateAttribute(AttributeCondition condition, GameSession session) {
        double value = session.getAttributes().get(condition.getAttribute());
        return condition.getOperator().test(value, condition.getValue());
    }

    private boolean evaluateFlag(FlagCondition condition, GameSession session) {
        return flagValuesEqual(session.getFlag(condition.getFlagName()), condition.getFlagValue());
    }

    private boolean evaluateTime(TimeCondition condition, GameSession session) {
        int day = session.getProgress().getCurrentDay();
        int period = session.getProgress().getCurrentPeriod();

        if (condition.getDays() != null && !condition.getDays().contains(day)) {
            return false;
        }
        if (condition.getPeriods() != null && !condition.getPeriods().contains(period)) {
            return false;
        }
        if (condition.getDayMin() != null && day < condition.getDayMin()) {
            return false;
        }
        return condition.getDayMax() == null || day <= condition.getDayMax();
    }

    private boolean evaluateProbability(ProbabilityCondition condition, GameSession session) {
        double probability = condition.getBaseRate();
        if (condition.isLuckModifier()) {
            double luck = session.getAttributes().get(Attribute.LUCK.getKey());
            probability += (luck - 50) / 500;
        }
        return DiceRoller.chance(random, probability);
    }

    private boolean evaluateEventHistory(EventHistoryCondition condition, GameSession session) {
        return session.isEventTriggered(condition.getEventId()) == condition.isTriggered();
    }

    private boolean evaluateCharacter(CharacterCondition condition, GameSession session) {
        CharacterProfile character = session.getCharacter();
        return character != null && condition.getCharacterIds().contains(character.getId());
    }

    private boolean evaluateEventTriggered(EventTriggeredCondition condition, GameSession session) {
        if (condition.getChoiceIndex() == null) {
            return session.isEventTriggered(condition.getEventId());
        }
        return session.getEventHistory().stream()
            .anyMatch(record -> Objects.equals(record.getEventId(), condition.getEventId())
                && record.getChoiceIndex() == condition.getChoiceIndex());
    }

    /**
     * Числа сравниваются по значению: после JSON целое 1 и 1.0 - один и тот же флаг
     */
    static boolean flagValuesEqual(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            return Double.compare(((Number) actual).doubleValue(), ((Number) expected).doubleValue()) == 0;
        }
        return Objects.equals(actual, expected);
    }
}
