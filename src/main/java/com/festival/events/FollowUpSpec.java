package com.festival.events;

/**
 * Описание последующего события, которое вариант ответа ставит в очередь
 */
public class FollowUpSpec {
    private final String eventId;
    private final FollowUpDelay delay;
    private final Double probability;
    private final int priority;

    public FollowUpSpec(String eventId, FollowUpDelay delay, Double probability, int priority) {
        this.eventId = eventId;
        this.delay = delay != null ? delay : FollowUpDelay.NEXT_PERIOD;
        this.probability = probability;
        this.priority = priority;
    }

    public String getEventId() { return eventId; }
    public FollowUpDelay getDelay() { return delay; }

    /**
     * Вероятность постановки в очередь, null - всегда
     */
    public Double getProbability() { return probability; }
    public int getPriority() { return priority; }
}
