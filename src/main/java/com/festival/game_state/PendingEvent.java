package com.festival.game_state;

import java.util.Objects;

/**
 * Отложенное событие в очереди. triggerDay/triggerPeriod == null означает "в любой момент"
 */
public final class PendingEvent {
    private final String eventId;
    private final Integer triggerDay;
    private final Integer triggerPeriod;
    private final int priority;

    public PendingEvent(String eventId, Integer triggerDay, Integer triggerPeriod, int priority) {
        this.eventId = eventId;
        this.triggerDay = triggerDay;
        this.triggerPeriod = triggerPeriod;
        this.priority = priority;
    }

    /**
     * Наступил ли срок для указанного дня и периода
     */
    public boolean isDue(int day, int period) {
        if (triggerDay != null && triggerDay != day) {
            return false;
        }
        return triggerPeriod == null || triggerPeriod == period;
    }

    public String getEventId() { return eventId; }
    public Integer getTriggerDay() { return triggerDay; }
    public Integer getTriggerPeriod() { return triggerPeriod; }
    public int getPriority() { return priority; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PendingEvent)) return false;
        PendingEvent that = (PendingEvent) o;
        return priority == that.priority
            && Objects.equals(eventId, that.eventId)
            && Objects.equals(triggerDay, that.triggerDay)
            && Objects.equals(triggerPeriod, that.triggerPeriod);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, triggerDay, triggerPeriod, priority);
    }
}
