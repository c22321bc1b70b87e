package com.festival.events;

import com.festival.game_rules.Condition;
import com.festival.game_rules.Effect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Вариант ответа на событие
 */
public class OptionDefinition {
    public static final String DEFAULT_UNAVAILABLE_TEXT = "条件不满足";

    private final String id;
    private final String text;
    private final List<Effect> effects;
    private final List<Condition> availabilityConditions;
    private final String unavailableText;
    private final List<Condition> visibilityConditions;
    private final List<FollowUpSpec> followUpEvents;
    private final Map<String, Object> setFlags;
    private final SpecialOutcome specialOutcome;
    private final String feedback;

    private OptionDefinition(Builder builder) {
        this.id = builder.id;
        this.text = builder.text;
        this.effects = List.copyOf(builder.effects);
        this.availabilityConditions = List.copyOf(builder.availabilityConditions);
        this.unavailableText = builder.unavailableText;
        this.visibilityConditions = List.copyOf(builder.visibilityConditions);
        this.followUpEvents = List.copyOf(builder.followUpEvents);
        this.setFlags = Collections.unmodifiableMap(new LinkedHashMap<>(builder.setFlags));
        this.specialOutcome = builder.specialOutcome;
        this.feedback = builder.feedback;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() { return id; }
    public String getText() { return text; }
    public List<Effect> getEffects() { return effects; }

    /**
     * Условия доступности: вариант виден, но выбрать его нельзя
     */
    public List<Condition> getAvailabilityConditions() { return availabilityConditions; }

    public String getUnavailableText() {
        return unavailableText != null && !unavailableText.isEmpty() ? unavailableText : DEFAULT_UNAVAILABLE_TEXT;
    }

    /**
     * Условия видимости: при провале вариант скрывается совсем
     */
    public List<Condition> getVisibilityConditions() { return visibilityConditions; }

    public List<FollowUpSpec> getFollowUpEvents() { return followUpEvents; }
    public Map<String, Object> getSetFlags() { return setFlags; }
    public SpecialOutcome getSpecialOutcome() { return specialOutcome; }
    public String getFeedback() { return feedback; }

    public static class Builder {
        private final String id;
        private String text = "";
        private List<Effect> effects = List.of();
        private List<Condition> availabilityConditions = List.of();
        private String unavailableText;
        private List<Condition> visibilityConditions = List.of();
        private List<FollowUpSpec> followUpEvents = List.of();
        private Map<String, Object> setFlags = Map.of();
        private SpecialOutcome specialOutcome;
        private String feedback;

        private Builder(String id) {
            this.id = id;
        }

        public Builder text(String text) { this.text = text; return this; }
        public Builder effects(List<Effect> effects) { this.effects = effects; return this; }
        public Builder effects(Effect... effects) { this.effects = List.of(effects); return this; }
        public Builder availabilityConditions(List<Condition> conditions) { this.availabilityConditions = conditions; return this; }
        public Builder unavailableText(String unavailableText) { this.unavailableText = unavailableText; return this; }
        public Builder visibilityConditions(List<Condition> conditions) { this.visibilityConditions = conditions; return this; }
        public Builder followUpEvents(List<FollowUpSpec> followUpEvents) { this.followUpEvents = followUpEvents; return this; }
        public Builder setFlags(Map<String, Object> setFlags) { this.setFlags = setFlags; return this; }
        public Builder specialOutcome(SpecialOutcome specialOutcome) { this.specialOutcome = specialOutcome; return this; }
        public Builder feedback(String feedback) { this.feedback = feedback; return this; }

        public OptionDefinition build() {
            return new OptionDefinition(this);
        }
    }
}
