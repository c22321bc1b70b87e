package com.festival.game_state;

/**
 * Атрибуты игрока с границами и значениями по умолчанию
 */
public enum Attribute {
    DEPOSIT("deposit", "存款", "💰", -50000, 10000000, 0),
    WEIGHT("weight", "体重", "⚖️", 30, 200, 65),
    FACE("face", "面子", "👑", -100, 100, 50),
    MOOD("mood", "心情", "😊", 0, 100, 50),
    HEALTH("health", "健康", "❤️", 0, 100, 50),
    LUCK("luck", "运气", "🍀", 0, 100, 50);

    /**
     * Денежный атрибут: логарифмическая шкала и учет трат/доходов
     */
    public static final Attribute MONETARY = DEPOSIT;

    private final String key;
    private final String displayName;
    private final String icon;
    private final double min;
    private final double max;
    private final double defaultValue;

    Attribute(String key, String displayName, String icon, double min, double max, double defaultValue) {
        this.key = key;
        this.displayName = displayName;
        this.icon = icon;
        this.min = min;
        this.max = max;
        this.defaultValue = defaultValue;
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getIcon() {
        return icon;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getDefaultValue() {
        return defaultValue;
    }

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Найти атрибут по ключу; null для неизвестных имен
     */
    public static Attribute fromKey(String key) {
        if (key == null) {
            return null;
        }
        for (Attribute attribute : values()) {
            if (attribute.key.equals(key)) {
                return attribute;
            }
        }
        return null;
    }
}
