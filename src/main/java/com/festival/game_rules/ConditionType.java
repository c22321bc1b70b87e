package com.festival.game_rules;

import java.util.EnumSet;
import java.util.Set;

/**
 * Виды условий. Набор закрыт: ConditionEvaluator разбирает каждый вид явно
 */
public enum ConditionType {
    ATTRIBUTE("attribute"),
    FLAG("flag"),
    RANDOM("random"),
    TIME("time"),
    PROBABILITY("probability"),
    EVENT_HISTORY("event_history"),
    CHARACTER("character"),
    EVENT_TRIGGERED("event_triggered"),
    COMBINATION("combination");

    /** Условия эффектов и вариантов ответа */
    public static final Set<ConditionType> OPTION_VOCABULARY = EnumSet.of(ATTRIBUTE, FLAG, RANDOM);

    /** Условия появления событий */
    public static final Set<ConditionType> TRIGGER_VOCABULARY =
        EnumSet.of(TIME, ATTRIBUTE, PROBABILITY, EVENT_HISTORY, CHARACTER, FLAG);

    /** Условия концовок и модификаторов очков */
    public static final Set<ConditionType> ENDING_VOCABULARY =
        EnumSet.of(ATTRIBUTE, EVENT_TRIGGERED, FLAG, COMBINATION);

    private final String value;

    ConditionType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Вид условия по строковому тегу; "flag_set" - синоним "flag"
     * @return null для неизвестного тега
     */
    public static ConditionType fromString(String value) {
        if (value == null) {
            return null;
        }
        if ("flag_set".equalsIgnoreCase(value)) {
            return FLAG;
        }
        for (ConditionType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
