package com.festival.game_engine;

import com.festival.endings.EndingResult;
import com.festival.events.ChoiceResult;

/**
 * Итог хода
 */
public class TurnResult {
    private final TurnStatus status;
    private final ChoiceResult choice;
    private final boolean newDay;
    private final EndingResult ending;
    private final String message;

    private TurnResult(TurnStatus status, ChoiceResult choice, boolean newDay, EndingResult ending, String message) {
        this.status = status;
        this.choice = choice;
        this.newDay = newDay;
        this.ending = ending;
        this.message = message;
    }

    public static TurnResult applied(ChoiceResult choice, boolean newDay) {
        return new TurnResult(TurnStatus.APPLIED, choice, newDay, null, null);
    }

    public static TurnResult ended(ChoiceResult choice, boolean newDay, EndingResult ending) {
        return new TurnResult(TurnStatus.ENDED, choice, newDay, ending, null);
    }

    public static TurnResult notFound(String message) {
        return new TurnResult(TurnStatus.NOT_FOUND, null, false, null, message);
    }

    public static TurnResult unavailable(String reason) {
        return new TurnResult(TurnStatus.UNAVAILABLE, null, false, null, reason);
    }

    public TurnStatus getStatus() { return status; }
    public ChoiceResult getChoice() { return choice; }
    public boolean isNewDay() { return newDay; }
    public EndingResult getEnding() { return ending; }

    /**
     * Пояснение для NOT_FOUND и UNAVAILABLE
     */
    public String getMessage() { return message; }
}
