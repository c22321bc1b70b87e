package com.festival.game_state;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Запись журнала: какое событие произошло, когда и что выбрал игрок
 */
public final class EventHistoryRecord {
    private final String eventId;
    private final int day;
    private final int period;
    private final int choiceIndex;
    private final String choiceId;
    private final LocalDateTime timestamp;

    public EventHistoryRecord(String eventId, int day, int period, int choiceIndex,
                              String choiceId, LocalDateTime timestamp) {
        this.eventId = eventId;
        this.day = day;
        this.period = period;
        this.choiceIndex = choiceIndex;
        this.choiceId = choiceId;
        this.timestamp = timestamp;
    }

    public String getEventId() { return eventId; }
    public int getDay() { return day; }
    public int getPeriod() { return period; }
    public int getChoiceIndex() { return choiceIndex; }
    public String getChoiceId() { return choiceId; }
    public LocalDateTime getTimestamp() { return timestamp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventHistoryRecord)) return false;
        EventHistoryRecord that = (EventHistoryRecord) o;
        return day == that.day
            && period == that.period
            && choiceIndex == that.choiceIndex
            && Objects.equals(eventId, that.eventId)
            && Objects.equals(choiceId, that.choiceId)
            && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, day, period, choiceIndex, choiceId, timestamp);
    }
}
