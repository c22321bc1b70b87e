package com.festival.game_state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Игровой персонаж из каталога: кто он и с какими атрибутами начинает праздник
 */
public class CharacterProfile {
    private final String id;
    private final String name;
    private final String title;
    private final String monologue;
    private final String avatar;
    private final Map<String, Double> initialAttributes;

    public CharacterProfile(String id, String name, String title, String monologue,
                            String avatar, Map<String, Double> initialAttributes) {
        this.id = id;
        this.name = name;
        this.title = title;
        this.monologue = monologue;
        this.avatar = avatar;
        this.initialAttributes = initialAttributes != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(initialAttributes))
            : Collections.emptyMap();
    }

    /**
     * Начальное значение атрибута или указанное значение по умолчанию
     */
    public double getInitial(String attribute, double defaultValue) {
        Map<String, Double> attributes = getInitialAttributes();
        Double value = attributes.get(attribute);
        return value != null ? value : defaultValue;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getTitle() { return title; }
    public String getMonologue() { return monologue; }
    public String getAvatar() { return avatar; }

    public Map<String, Double> getInitialAttributes() {
        // Gson при десериализации может оставить поле пустым
        return initialAttributes != null ? initialAttributes : Collections.emptyMap();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CharacterProfile)) return false;
        CharacterProfile that = (CharacterProfile) o;
        return Objects.equals(id, that.id)
            && Objects.equals(name, that.name)
            && Objects.equals(title, that.title)
            && Objects.equals(monologue, that.monologue)
            && Objects.equals(avatar, that.avatar)
            && Objects.equals(getInitialAttributes(), that.getInitialAttributes());
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, title, monologue, avatar, getInitialAttributes());
    }
}
