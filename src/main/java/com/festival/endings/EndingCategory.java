package com.festival.endings;

/**
 * Категории концовок и их значки по умолчанию
 */
public enum EndingCategory {
    PERFECT("perfect", "👑"),
    GOOD("good", "🌟"),
    NORMAL("normal", "🎊"),
    BAD("bad", "😰"),
    SECRET("secret", "🔮");

    private final String value;
    private final String icon;

    EndingCategory(String value, String icon) {
        this.value = value;
        this.icon = icon;
    }

    public String getValue() {
        return value;
    }

    public String getIcon() {
        return icon;
    }

    /**
     * Категория по строке; неизвестная категория считается обычной
     */
    public static EndingCategory fromString(String value) {
        if (value != null) {
            for (EndingCategory category : values()) {
                if (category.value.equalsIgnoreCase(value)) {
                    return category;
                }
            }
        }
        return NORMAL;
    }
}
