package com.festival.events;

/**
 * Задержка последующего события
 */
public enum FollowUpDelay {
    /** Не ставится в очередь вовсе */
    IMMEDIATE("immediate"),
    NEXT_PERIOD("next_period"),
    NEXT_DAY("next_day");

    private final String value;

    FollowUpDelay(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Задержка по строке; по умолчанию NEXT_PERIOD
     */
    public static FollowUpDelay fromString(String value) {
        if (value != null) {
            for (FollowUpDelay delay : values()) {
                if (delay.value.equalsIgnoreCase(value)) {
                    return delay;
                }
            }
        }
        return NEXT_PERIOD;
    }
}
