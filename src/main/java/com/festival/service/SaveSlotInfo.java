package com.festival.service;

import java.time.LocalDateTime;

/**
 * Описание слота сохранения для списка слотов
 */
public class SaveSlotInfo {
    private final int index;
    private final boolean empty;
    private final String name;
    private final LocalDateTime savedAt;
    private final String characterName;
    private final String timeDescription;

    public SaveSlotInfo(int index, boolean empty, String name, LocalDateTime savedAt,
                        String characterName, String timeDescription) {
        this.index = index;
        this.empty = empty;
        this.name = name;
        this.savedAt = savedAt;
        this.characterName = characterName;
        this.timeDescription = timeDescription;
    }

    public static SaveSlotInfo empty(int index) {
        return new SaveSlotInfo(index, true, null, null, null, null);
    }

    public int getIndex() { return index; }
    public boolean isEmpty() { return empty; }
    public String getName() { return name; }
    public LocalDateTime getSavedAt() { return savedAt; }
    public String getCharacterName() { return characterName; }
    public String getTimeDescription() { return timeDescription; }
}
