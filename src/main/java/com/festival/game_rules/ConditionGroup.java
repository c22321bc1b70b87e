package com.festival.game_rules;

import java.util.List;

/**
 * Группа условий, объединенных через И
 */
public class ConditionGroup {
    private final List<Condition> conditions;

    public ConditionGroup(List<Condition> conditions) {
        this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    public static ConditionGroup of(Condition... conditions) {
        return new ConditionGroup(List.of(conditions));
    }

    public List<Condition> getConditions() {
        return conditions;
    }
}
