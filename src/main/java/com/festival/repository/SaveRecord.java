package com.festival.repository;

import java.time.LocalDateTime;

/**
 * Строка хранилища: слот, имя, время сохранения и снимок в JSON
 */
public class SaveRecord {
    private final int slotIndex;
    private final String name;
    private final LocalDateTime savedAt;
    private final String gameData;

    public SaveRecord(int slotIndex, String name, LocalDateTime savedAt, String gameData) {
        this.slotIndex = slotIndex;
        this.name = name;
        this.savedAt = savedAt;
        this.gameData = gameData;
    }

    public int getSlotIndex() { return slotIndex; }
    public String getName() { return name; }
    public LocalDateTime getSavedAt() { return savedAt; }
    public String getGameData() { return gameData; }
}
