package com.festival.events;

import com.festival.game_rules.Condition;

import java.util.List;

/**
 * Событие из каталога. Связи с другими событиями и персонажами хранятся только как id
 */
public class EventDefinition {
    public static final double DEFAULT_WEIGHT = 100;

    private final String id;
    private final String title;
    private final String description;
    private final String category;
    private final String scene;
    private final String location;
    private final String npc;
    private final String npcName;
    private final List<OptionDefinition> options;
    private final List<Condition> triggerConditions;
    private final double weight;
    private final boolean onceOnly;
    private final List<String> mutuallyExclusive;
    private final List<String> prerequisiteEvents;
    private final List<String> exclusiveTo;

    private EventDefinition(Builder builder) {
        this.id = builder.id;
        this.title = builder.title;
        this.description = builder.description;
        this.category = builder.category;
        this.scene = builder.scene;
        this.location = builder.location;
        this.npc = builder.npc;
        this.npcName = builder.npcName;
        this.options = List.copyOf(builder.options);
        this.triggerConditions = List.copyOf(builder.triggerConditions);
        this.weight = builder.weight;
        this.onceOnly = builder.onceOnly;
        this.mutuallyExclusive = List.copyOf(builder.mutuallyExclusive);
        this.prerequisiteEvents = List.copyOf(builder.prerequisiteEvents);
        this.exclusiveTo = List.copyOf(builder.exclusiveTo);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Событие доступно только перечисленным персонажам
     */
    public boolean isCharacterExclusive() {
        return !exclusiveTo.isEmpty();
    }

    // Getters
    public String getId() { return id; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getCategory() { return category; }
    public String getScene() { return scene; }
    public String getLocation() { return location; }
    public String getNpc() { return npc; }
    public String getNpcName() { return npcName; }
    public List<OptionDefinition> getOptions() { return options; }
    public List<Condition> getTriggerConditions() { return triggerConditions; }
    public double getWeight() { return weight; }
    public boolean isOnceOnly() { return onceOnly; }
    public List<String> getMutuallyExclusive() { return mutuallyExclusive; }
    public List<String> getPrerequisiteEvents() { return prerequisiteEvents; }
    public List<String> getExclusiveTo() { return exclusiveTo; }

    public static class Builder {
        private final String id;
        private String title = "事件";
        private String description = "";
        private String category = "common";
        private String scene = "🏠";
        private String location = "未知地点";
        private String npc = "👤";
        private String npcName = "未知";
        private List<OptionDefinition> options = List.of();
        private List<Condition> triggerConditions = List.of();
        private double weight = DEFAULT_WEIGHT;
        private boolean onceOnly = false;
        private List<String> mutuallyExclusive = List.of();
        private List<String> prerequisiteEvents = List.of();
        private List<String> exclusiveTo = List.of();

        private Builder(String id) {
            this.id = id;
        }

        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder category(String category) { this.category = category; return this; }
        public Builder scene(String scene) { this.scene = scene; return this; }
        public Builder location(String location) { this.location = location; return this; }
        public Builder npc(String npc) { this.npc = npc; return this; }
        public Builder npcName(String npcName) { this.npcName = npcName; return this; }
        public Builder options(List<OptionDefinition> options) { this.options = options; return this; }
        public Builder options(OptionDefinition... options) { this.options = List.of(options); return this; }
        public Builder triggerConditions(List<Condition> conditions) { this.triggerConditions = conditions; return this; }
        public Builder weight(double weight) { this.weight = weight; return this; }
        public Builder onceOnly(boolean onceOnly) { this.onceOnly = onceOnly; return this; }
        public Builder mutuallyExclusive(List<String> ids) { this.mutuallyExclusive = ids; return this; }
        public Builder prerequisiteEvents(List<String> ids) { this.prerequisiteEvents = ids; return this; }
        public Builder exclusiveTo(List<String> characterIds) { this.exclusiveTo = characterIds; return this; }

        public EventDefinition build() {
            return new EventDefinition(this);
        }
    }
}
