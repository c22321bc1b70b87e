package com.festival.game_state;

import com.festival.content.GameContent;
import com.festival.events.EventDefinition;
import com.festival.events.OptionView;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Состояние одного прохождения. Каталог контента только читается и в снимок не попадает
 */
public class GameSession {
    /**
     * Стартовые атрибуты, если персонаж их не задает
     */
    public static final Map<String, Double> NEW_GAME_DEFAULTS = Map.of(
        "deposit", 5000.0,
        "weight", 65.0,
        "face", 50.0,
        "mood", 70.0,
        "health", 80.0,
        "luck", 50.0
    );

    private final GameContent content;
    private final AttributeStore attributes;

    private SessionMeta meta;
    private ProgressClock progress;
    private CharacterProfile character;
    // Атрибуты сразу после старта, с подставленными значениями по умолчанию
    private Map<String, Double> initialAttributes;
    private Map<String, Integer> inventory;
    private List<EventHistoryRecord> eventHistory;
    private Map<String, Object> flags;
    private List<PendingEvent> pendingEvents;
    private Set<String> triggeredOnceEvents;
    private GameStatistics statistics;

    // Не сохраняется: событие, показанное игроку в текущем ходе
    private EventDefinition currentEvent;
    private List<OptionView> currentOptions;

    public GameSession(GameContent content) {
        this.content = content;
        this.attributes = new AttributeStore(this);
        reset();
    }

    public void reset() {
        meta = new SessionMeta();
        progress = new ProgressClock();
        character = null;
        attributes.replaceAll(null);
        initialAttributes = new LinkedHashMap<>();
        inventory = new LinkedHashMap<>();
        eventHistory = new ArrayList<>();
        flags = new LinkedHashMap<>();
        pendingEvents = new ArrayList<>();
        triggeredOnceEvents = new LinkedHashSet<>();
        statistics = new GameStatistics();
        currentEvent = null;
        currentOptions = List.of();
    }

    /**
     * Начать новое прохождение за персонажа (может быть null)
     */
    public void initNewGame(CharacterProfile character, LocalDateTime startTime) {
        int playCount = meta.getPlayCount();
        reset();
        meta.setStartTime(startTime);
        meta.setPlayCount(playCount + 1);
        this.character = character;

        initialAttributes = resolveInitialAttributes(character);
        attributes.replaceAll(initialAttributes);
    }

    /**
     * Стартовые атрибуты персонажа: недостающие ключи берутся из NEW_GAME_DEFAULTS, значения в границах
     */
    static Map<String, Double> resolveInitialAttributes(CharacterProfile character) {
        Map<String, Double> initial = new LinkedHashMap<>();
        if (character != null && character.getInitialAttributes() != null) {
            character.getInitialAttributes().forEach((key, value) -> {
                if (key != null && value != null) {
                    initial.put(key, value);
                }
            });
        }
        for (Attribute attribute : Attribute.values()) {
            initial.putIfAbsent(attribute.getKey(), NEW_GAME_DEFAULTS.get(attribute.getKey()));
        }
        initial.replaceAll((key, value) -> {
            Attribute known = Attribute.fromKey(key);
            return known != null ? known.clamp(value) : value;
        });
        return initial;
    }

    /**
     * Значение атрибута на старте прохождения
     */
    public double getInitialAttribute(String attribute) {
        Double value = initialAttributes.get(attribute);
        if (value != null) {
            return value;
        }
        return NEW_GAME_DEFAULTS.getOrDefault(attribute, 0.0);
    }

    /**
     * Сдвинуть время на один период
     * @return true, если начался новый день
     */
    public boolean advanceTime() {
        return progress.advance();
    }

    public boolean isGameOver() {
        return progress.isFinished();
    }

    public String getCurrentTimeDescription() {
        return progress.describe();
    }

    /**
     * Записать выбор в журнал на текущий день и период
     */
    public EventHistoryRecord recordEvent(String eventId, int choiceIndex, String choiceId, LocalDateTime timestamp) {
        EventHistoryRecord record = new EventHistoryRecord(
            eventId, progress.getCurrentDay(), progress.getCurrentPeriod(), choiceIndex, choiceId, timestamp);
        eventHistory.add(record);
        statistics.recordChoice();
        return record;
    }

    // Флаги

    public void setFlag(String name, Object value) {
        flags.put(name, value);
    }

    public Object getFlag(String name) {
        return flags.get(name);
    }

    public Object getFlag(String name, Object defaultValue) {
        Object value = flags.get(name);
        return value != null ? value : defaultValue;
    }

    public boolean hasFlag(String name) {
        return flags.containsKey(name);
    }

    // Очередь отложенных событий

    public void addPendingEvent(PendingEvent pendingEvent) {
        pendingEvents.add(pendingEvent);
    }

    public PendingEvent removePendingEvent(int index) {
        return pendingEvents.remove(index);
    }

    public List<PendingEvent> getPendingEvents() {
        return Collections.unmodifiableList(pendingEvents);
    }

    // Одноразовые события

    public void markEventTriggered(String eventId) {
        triggeredOnceEvents.add(eventId);
    }

    public boolean isEventTriggered(String eventId) {
        return triggeredOnceEvents.contains(eventId);
    }

    /**
     * Глубокая копия состояния
     */
    public GameSnapshot serialize() {
        GameSnapshot snapshot = new GameSnapshot();
        snapshot.setMeta(meta.copy());
        snapshot.setProgress(progress.copy());
        snapshot.setCharacter(character);
        snapshot.setAttributes(new LinkedHashMap<>(attributes.getAll()));
        snapshot.setInitialAttributes(new LinkedHashMap<>(initialAttributes));
        snapshot.setInventory(new LinkedHashMap<>(inventory));
        snapshot.setEventHistory(new ArrayList<>(eventHistory));
        snapshot.setFlags(new LinkedHashMap<>(flags));
        snapshot.setPendingEvents(new ArrayList<>(pendingEvents));
        snapshot.setTriggeredOnceEvents(new ArrayList<>(triggeredOnceEvents));
        snapshot.setStatistics(statistics.copy());
        return snapshot;
    }

    /**
     * Восстановить состояние из снимка. Отсутствующие секции заменяются значениями по умолчанию
     */
    public void deserialize(GameSnapshot snapshot) {
        reset();
        if (snapshot == null) {
            return;
        }
        if (snapshot.getMeta() != null) {
            meta = snapshot.getMeta().copy();
        }
        if (snapshot.getProgress() != null) {
            progress = snapshot.getProgress().copy();
        }
        character = snapshot.getCharacter();
        if (snapshot.getAttributes() != null) {
            attributes.replaceAll(snapshot.getAttributes());
            attributes.clampAll();
        } else {
            attributes.resetToDefaults();
        }
        // Старые сохранения без стартовых атрибутов: восстанавливаем их по профилю
        initialAttributes = snapshot.getInitialAttributes() != null
            ? new LinkedHashMap<>(snapshot.getInitialAttributes())
            : resolveInitialAttributes(character);
        if (snapshot.getInventory() != null) {
            inventory = new LinkedHashMap<>(snapshot.getInventory());
        }
        if (snapshot.getEventHistory() != null) {
            eventHistory = new ArrayList<>(snapshot.getEventHistory());
        }
        if (snapshot.getFlags() != null) {
            flags = new LinkedHashMap<>(snapshot.getFlags());
        }
        if (snapshot.getPendingEvents() != null) {
            pendingEvents = new ArrayList<>(snapshot.getPendingEvents());
        }
        if (snapshot.getTriggeredOnceEvents() != null) {
            triggeredOnceEvents = new LinkedHashSet<>(snapshot.getTriggeredOnceEvents());
        }
        if (snapshot.getStatistics() != null) {
            statistics = snapshot.getStatistics().copy();
        }
    }

    // Getters and Setters
    public GameContent getContent() { return content; }
    public AttributeStore getAttributes() { return attributes; }
    public SessionMeta getMeta() { return meta; }
    public ProgressClock getProgress() { return progress; }
    public CharacterProfile getCharacter() { return character; }
    public Map<String, Double> getInitialAttributes() { return Collections.unmodifiableMap(initialAttributes); }
    public Map<String, Integer> getInventory() { return inventory; }
    public List<EventHistoryRecord> getEventHistory() { return Collections.unmodifiableList(eventHistory); }
    public Map<String, Object> getFlags() { return Collections.unmodifiableMap(flags); }
    public Set<String> getTriggeredOnceEvents() { return Collections.unmodifiableSet(triggeredOnceEvents); }
    public GameStatistics getStatistics() { return statistics; }

    public EventDefinition getCurrentEvent() { return currentEvent; }
    public List<OptionView> getCurrentOptions() { return currentOptions; }

    public void setCurrentEvent(EventDefinition event, List<OptionView> options) {
        this.currentEvent = event;
        this.currentOptions = options != null ? List.copyOf(options) : List.of();
    }

    public void clearCurrentEvent() {
        setCurrentEvent(null, null);
    }
}
