package com.festival.endings;

import com.festival.game_rules.ConditionGroup;

import java.util.List;

/**
 * Концовка из каталога.
 * Условия открытия: группы через ИЛИ, условия внутри группы через И; пустой список - открыта всегда
 */
public class EndingDefinition {
    private final String id;
    private final String title;
    private final String description;
    private final EndingCategory category;
    private final String icon;
    private final int priority;
    private final String characterId;
    private final List<ConditionGroup> unlockConditions;
    private final double baseScore;
    private final List<ScoreModifier> scoreModifiers;
    private final boolean hidden;

    private EndingDefinition(Builder builder) {
        this.id = builder.id;
        this.title = builder.title;
        this.description = builder.description;
        this.category = builder.category;
        this.icon = builder.icon;
        this.priority = builder.priority;
        this.characterId = builder.characterId;
        this.unlockConditions = List.copyOf(builder.unlockConditions);
        this.baseScore = builder.baseScore;
        this.scoreModifiers = List.copyOf(builder.scoreModifiers);
        this.hidden = builder.hidden;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Значок концовки, а если он не задан - значок категории
     */
    public String getDisplayIcon() {
        return icon != null && !icon.isEmpty() ? icon : category.getIcon();
    }

    public boolean isAvailableFor(String activeCharacterId) {
        return characterId == null || characterId.equals(activeCharacterId);
    }

    public String getId() { return id; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public EndingCategory getCategory() { return category; }
    public String getIcon() { return icon; }
    public int getPriority() { return priority; }
    public String getCharacterId() { return characterId; }
    public List<ConditionGroup> getUnlockConditions() { return unlockConditions; }
    public double getBaseScore() { return baseScore; }
    public List<ScoreModifier> getScoreModifiers() { return scoreModifiers; }
    public boolean isHidden() { return hidden; }

    public static class Builder {
        private final String id;
        private String title = "";
        private String description = "";
        private EndingCategory category = EndingCategory.NORMAL;
        private String icon;
        private int priority = 0;
        private String characterId;
        private List<ConditionGroup> unlockConditions = List.of();
        private double baseScore = 0;
        private List<ScoreModifier> scoreModifiers = List.of();
        private boolean hidden = false;

        private Builder(String id) {
            this.id = id;
        }

        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder category(EndingCategory category) { this.category = category != null ? category : EndingCategory.NORMAL; return this; }
        public Builder icon(String icon) { this.icon = icon; return this; }
        public Builder priority(int priority) { this.priority = priority; return this; }
        public Builder characterId(String characterId) { this.characterId = characterId; return this; }
        public Builder unlockConditions(List<ConditionGroup> groups) { this.unlockConditions = groups; return this; }
        public Builder unlockConditions(ConditionGroup... groups) { this.unlockConditions = List.of(groups); return this; }
        public Builder baseScore(double baseScore) { this.baseScore = baseScore; return this; }
        public Builder scoreModifiers(List<ScoreModifier> modifiers) { this.scoreModifiers = modifiers; return this; }
        public Builder hidden(boolean hidden) { this.hidden = hidden; return this; }

        public EndingDefinition build() {
            return new EndingDefinition(this);
        }
    }
}
