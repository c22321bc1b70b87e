package com.festival.events;

/**
 * Особый исход варианта ответа. Типы "ending_trigger" и "game_over" завершают игру сразу
 */
public class SpecialOutcome {
    public static final String ENDING_TRIGGER = "ending_trigger";
    public static final String GAME_OVER = "game_over";

    private final String type;
    private final String message;

    public SpecialOutcome(String type, String message) {
        this.type = type;
        this.message = message;
    }

    public boolean isTerminal() {
        return ENDING_TRIGGER.equals(type) || GAME_OVER.equals(type);
    }

    public String getType() { return type; }
    public String getMessage() { return message; }
}
