package com.festival.repository;

import com.festival.game_state.GameSnapshot;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * Снимок сессии в JSON и обратно
 */
public class SnapshotCodec {
    private static final Gson gson = new GsonBuilder()
        .registerTypeAdapter(LocalDateTime.class, new LocalDateTimeAdapter())
        .create();

    public String encode(GameSnapshot snapshot) {
        return gson.toJson(snapshot);
    }

    /**
     * @throws PersistenceException если строка не является снимком
     */
    public GameSnapshot decode(String json) {
        try {
            GameSnapshot snapshot = gson.fromJson(json, GameSnapshot.class);
            if (snapshot == null) {
                throw new PersistenceException("Пустые данные сохранения");
            }
            return snapshot;
        } catch (JsonParseException | DateTimeParseException | IllegalStateException e) {
            throw new PersistenceException("Поврежденные данные сохранения: " + e.getMessage(), e);
        }
    }
}
