package com.festival.game_state;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Плоский снимок сессии для передачи в хранилище сохранений.
 * Любая секция может отсутствовать (null) - при восстановлении подставляются значения по умолчанию
 */
public class GameSnapshot {
    private SessionMeta meta;
    private ProgressClock progress;
    private CharacterProfile character;
    private Map<String, Double> attributes;
    private Map<String, Double> initialAttributes;
    private Map<String, Integer> inventory;
    private List<EventHistoryRecord> eventHistory;
    private Map<String, Object> flags;
    private List<PendingEvent> pendingEvents;
    private List<String> triggeredOnceEvents;
    private GameStatistics statistics;

    public GameSnapshot() {
    }

    // Getters and Setters
    public SessionMeta getMeta() { return meta; }
    public void setMeta(SessionMeta meta) { this.meta = meta; }

    public ProgressClock getProgress() { return progress; }
    public void setProgress(ProgressClock progress) { this.progress = progress; }

    public CharacterProfile getCharacter() { return character; }
    public void setCharacter(CharacterProfile character) { this.character = character; }

    public Map<String, Double> getAttributes() { return attributes; }
    public void setAttributes(Map<String, Double> attributes) { this.attributes = attributes; }

    public Map<String, Double> getInitialAttributes() { return initialAttributes; }
    public void setInitialAttributes(Map<String, Double> initialAttributes) { this.initialAttributes = initialAttributes; }

    public Map<String, Integer> getInventory() { return inventory; }
    public void setInventory(Map<String, Integer> inventory) { this.inventory = inventory; }

    public List<EventHistoryRecord> getEventHistory() { return eventHistory; }
    public void setEventHistory(List<EventHistoryRecord> eventHistory) { this.eventHistory = eventHistory; }

    public Map<String, Object> getFlags() { return flags; }
    public void setFlags(Map<String, Object> flags) { this.flags = flags; }

    public List<PendingEvent> getPendingEvents() { return pendingEvents; }
    public void setPendingEvents(List<PendingEvent> pendingEvents) { this.pendingEvents = pendingEvents; }

    public List<String> getTriggeredOnceEvents() { return triggeredOnceEvents; }
    public void setTriggeredOnceEvents(List<String> triggeredOnceEvents) { this.triggeredOnceEvents = triggeredOnceEvents; }

    public GameStatistics getStatistics() { return statistics; }
    public void setStatistics(GameStatistics statistics) { this.statistics = statistics; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameSnapshot)) return false;
        GameSnapshot that = (GameSnapshot) o;
        return Objects.equals(meta, that.meta)
            && Objects.equals(progress, that.progress)
            && Objects.equals(character, that.character)
            && Objects.equals(attributes, that.attributes)
            && Objects.equals(initialAttributes, that.initialAttributes)
            && Objects.equals(inventory, that.inventory)
            && Objects.equals(eventHistory, that.eventHistory)
            && Objects.equals(flags, that.flags)
            && Objects.equals(pendingEvents, that.pendingEvents)
            && Objects.equals(triggeredOnceEvents, that.triggeredOnceEvents)
            && Objects.equals(statistics, that.statistics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(meta, progress, character, attributes, initialAttributes, inventory, eventHistory,
            flags, pendingEvents, triggeredOnceEvents, statistics);
    }
}
