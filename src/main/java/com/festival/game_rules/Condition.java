package com.festival.game_rules;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Условие игрового правила. Каждый вид - отдельный подкласс с типизированными параметрами,
 * вид определяется тегом {@link ConditionType}
 */
public abstract class Condition {
    private final ConditionType type;

    protected Condition(ConditionType type) {
        this.type = type;
    }

    public ConditionType getType() {
        return type;
    }

    // Фабрики

    public static AttributeCondition attribute(String attribute, String operator, double value) {
        return new AttributeCondition(attribute, ComparisonOperator.fromSymbol(operator), value);
    }

    public static FlagCondition flag(String flagName, Object flagValue) {
        return new FlagCondition(flagName, flagValue);
    }

    public static RandomCondition random(double probability) {
        return new RandomCondition(probability);
    }

    public static TimeCondition time(Set<Integer> days, Set<Integer> periods, Integer dayMin, Integer dayMax) {
        return new TimeCondition(days, periods, dayMin, dayMax);
    }

    public static ProbabilityCondition probability(double baseRate, boolean luckModifier) {
        return new ProbabilityCondition(baseRate, luckModifier);
    }

    public static EventHistoryCondition eventHistory(String eventId, boolean triggered) {
        return new EventHistoryCondition(eventId, triggered);
    }

    public static CharacterCondition character(Set<String> characterIds) {
        return new CharacterCondition(characterIds);
    }

    public static EventTriggeredCondition eventTriggered(String eventId, Integer choiceIndex) {
        return new EventTriggeredCondition(eventId, choiceIndex);
    }

    public static CombinationCondition combination(List<Condition> conditions) {
        return new CombinationCondition(conditions);
    }

    /**
     * Сравнение значения атрибута с порогом
     */
    public static final class AttributeCondition extends Condition {
        private final String attribute;
        private final ComparisonOperator operator;
        private final double value;

        public AttributeCondition(String attribute, ComparisonOperator operator, double value) {
            super(ConditionType.ATTRIBUTE);
            this.attribute = attribute;
            this.operator = operator != null ? operator : ComparisonOperator.GREATER_OR_EQUAL;
            this.value = value;
        }

        public String getAttribute() { return attribute; }
        public ComparisonOperator getOperator() { return operator; }
        public double getValue() { return value; }
    }

    public static final class FlagCondition extends Condition {
        private final String flagName;
        private final Object flagValue;

        public FlagCondition(String flagName, Object flagValue) {
            super(ConditionType.FLAG);
            this.flagName = flagName;
            this.flagValue = flagValue;
        }

        public String getFlagName() { return flagName; }
        public Object getFlagValue() { return flagValue; }
    }

    public static final class RandomCondition extends Condition {
        private final double probability;

        public RandomCondition(double probability) {
            super(ConditionType.RANDOM);
            this.probability = probability;
        }

        public double getProbability() { return probability; }
    }

    /**
     * Попадание в дни / периоды / диапазон дней. Отсутствующая часть не ограничивает
     */
    public static final class TimeCondition extends Condition {
        private final Set<Integer> days;
        private final Set<Integer> periods;
        private final Integer dayMin;
        private final Integer dayMax;

        public TimeCondition(Set<Integer> days, Set<Integer> periods, Integer dayMin, Integer dayMax) {
            super(ConditionType.TIME);
            this.days = days != null ? Collections.unmodifiableSet(new LinkedHashSet<>(days)) : null;
            this.periods = periods != null ? Collections.unmodifiableSet(new LinkedHashSet<>(periods)) : null;
            this.dayMin = dayMin;
            this.dayMax = dayMax;
        }

        public Set<Integer> getDays() { return days; }
        public Set<Integer> getPeriods() { return periods; }
        public Integer getDayMin() { return dayMin; }
        public Integer getDayMax() { return dayMax; }
    }

    /**
     * Базовая вероятность, которую удача может сдвинуть на (luck - 50) / 500
     */
    public static final class ProbabilityCondition extends Condition {
        private final double baseRate;
        private final boolean luckModifier;

        public ProbabilityCondition(double baseRate, boolean luckModifier) {
            super(ConditionType.PROBABILITY);
            this.baseRate = baseRate;
            this.luckModifier = luckModifier;
        }

        public double getBaseRate() { return baseRate; }
        public boolean isLuckModifier() { return luckModifier; }
    }

    public static final class EventHistoryCondition extends Condition {
        private final String eventId;
        private final boolean triggered;

        public EventHistoryCondition(String eventId, boolean triggered) {
            super(ConditionType.EVENT_HISTORY);
            this.eventId = eventId;
            this.triggered = triggered;
        }

        public String getEventId() { return eventId; }
        public boolean isTriggered() { return triggered; }
    }

    public static final class CharacterCondition extends Condition {
        private final Set<String> characterIds;

        public CharacterCondition(Set<String> characterIds) {
            super(ConditionType.CHARACTER);
            this.characterIds = characterIds != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(characterIds))
                : Collections.emptySet();
        }

        public Set<String> getCharacterIds() { return characterIds; }
    }

    /**
     * Событие было отмечено как сработавшее; с choiceIndex - еще и выбран конкретный вариант
     */
    public static final class EventTriggeredCondition extends Condition {
        private final String eventId;
        private final Integer choiceIndex;

        public EventTriggeredCondition(String eventId, Integer choiceIndex) {
            super(ConditionType.EVENT_TRIGGERED);
            this.eventId = eventId;
            this.choiceIndex = choiceIndex;
        }

        public String getEventId() { return eventId; }
        public Integer getChoiceIndex() { return choiceIndex; }
    }

    public static final class CombinationCondition extends Condition {
        private final List<Condition> conditions;

        public CombinationCondition(List<Condition> conditions) {
            super(ConditionType.COMBINATION);
            this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
        }

        public List<Condition> getConditions() { return conditions; }
    }
}
