package com.festival.service;

import com.festival.game_state.GameSnapshot;
import com.festival.game_state.GameSession;
import com.festival.repository.PersistenceException;
import com.festival.repository.SaveRecord;
import com.festival.repository.SaveRepository;
import com.festival.repository.SnapshotCodec;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Слоты сохранения поверх хранилища.
 * Ошибки хранилища не выходят наружу: операция пишет в лог и возвращает false, сессия в памяти не страдает
 */
public class SaveService {
    private static final Logger log = LoggerFactory.getLogger(SaveService.class);
    private static final Gson gson = new Gson();
    private static final Type SETTINGS_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    public static final int DEFAULT_SLOTS = 5;
    public static final String AUTO_SAVE_NAME = "自动存档";

    private final SaveRepository repository;
    private final SnapshotCodec codec;
    private final int maxSlots;
    private final Clock clock;

    public SaveService(SaveRepository repository, SnapshotCodec codec, int maxSlots) {
        this(repository, codec, maxSlots, Clock.systemDefaultZone());
    }

    public SaveService(SaveRepository repository, SnapshotCodec codec, int maxSlots, Clock clock) {
        this.repository = repository;
        this.codec = codec;
        this.maxSlots = maxSlots > 0 ? maxSlots : DEFAULT_SLOTS;
        this.clock = clock;
    }

    public boolean createSave(GameSession session, int slotIndex, String name) {
        if (!isValidSlot(slotIndex)) {
            return false;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        String saveName = name != null && !name.isBlank() ? name : "存档 " + (slotIndex + 1);

        try {
            // Время сохранения попадает в сессию только после успешной записи
            GameSnapshot snapshot = session.serialize();
            snapshot.getMeta().setLastSaveTime(now);
            repository.save(new SaveRecord(slotIndex, saveName, now, codec.encode(snapshot)));
            session.getMeta().setLastSaveTime(now);
            log.info("💾 Сохранено в слот {}: {}", slotIndex, saveName);
            return true;
        } catch (PersistenceException e) {
            log.error("❌ Ошибка сохранения в слот {}: {}", slotIndex, e.getMessage());
            return false;
        }
    }

    public boolean loadSave(GameSession session, int slotIndex) {
        if (!isValidSlot(slotIndex)) {
            return false;
        }
        try {
            Optional<SaveRecord> record = repository.find(slotIndex);
            if (record.isEmpty() || record.get().getGameData() == null) {
                return false;
            }
            session.deserialize(codec.decode(record.get().getGameData()));
            log.info("📂 Загружен слот {}", slotIndex);
            return true;
        } catch (PersistenceException e) {
            log.error("❌ Ошибка загрузки слота {}: {}", slotIndex, e.getMessage());
            return false;
        }
    }

    public boolean deleteSave(int slotIndex) {
        if (!isValidSlot(slotIndex)) {
            return false;
        }
        try {
            repository.delete(slotIndex);
            return true;
        } catch (PersistenceException e) {
            log.error("❌ Ошибка удаления слота {}: {}", slotIndex, e.getMessage());
            return false;
        }
    }

    public Optional<SaveSlotInfo> getSaveInfo(int slotIndex) {
        if (!isValidSlot(slotIndex)) {
            return Optional.empty();
        }
        try {
            return repository.find(slotIndex).map(this::describe);
        } catch (PersistenceException e) {
            log.error("❌ Ошибка чтения слота {}: {}", slotIndex, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Все слоты по порядку, пустые тоже
     */
    public List<SaveSlotInfo> getAllSaves() {
        List<SaveSlotInfo> slots = new ArrayList<>();
        for (int i = 0; i < maxSlots; i++) {
            slots.add(SaveSlotInfo.empty(i));
        }
        try {
            for (SaveRecord record : repository.findAll()) {
                if (isValidSlot(record.getSlotIndex())) {
                    slots.set(record.getSlotIndex(), describe(record));
                }
            }
        } catch (PersistenceException e) {
            log.error("❌ Ошибка чтения сохранений: {}", e.getMessage());
        }
        return slots;
    }

    /**
     * Первый пустой слот или -1
     */
    public int findEmptySlot() {
        for (SaveSlotInfo slot : getAllSaves()) {
            if (slot.isEmpty()) {
                return slot.getIndex();
            }
        }
        return -1;
    }

    /**
     * Автосохранение в пустой слот, а если пустых нет - поверх самого старого
     */
    public boolean autoSave(GameSession session) {
        List<SaveSlotInfo> slots = getAllSaves();
        int slotIndex = -1;
        LocalDateTime oldest = null;
        int oldestIndex = 0;

        for (SaveSlotInfo slot : slots) {
            if (slot.isEmpty()) {
                slotIndex = slot.getIndex();
                break;
            }
            if (slot.getSavedAt() != null && (oldest == null || slot.getSavedAt().isBefore(oldest))) {
                oldest = slot.getSavedAt();
                oldestIndex = slot.getIndex();
            }
        }
        if (slotIndex < 0) {
            slotIndex = oldestIndex;
        }
        return createSave(session, slotIndex, AUTO_SAVE_NAME);
    }

    public String exportSave(GameSession session) {
        return codec.encode(session.serialize());
    }

    public boolean importSave(GameSession session, String data) {
        try {
            session.deserialize(codec.decode(data));
            return true;
        } catch (PersistenceException e) {
            log.error("❌ Ошибка импорта сохранения: {}", e.getMessage());
            return false;
        }
    }

    public boolean saveSettings(Map<String, Object> settings) {
        try {
            repository.saveSettings(gson.toJson(settings != null ? settings : Map.of()));
            return true;
        } catch (PersistenceException e) {
            log.error("❌ Ошибка сохранения настроек: {}", e.getMessage());
            return false;
        }
    }

    public Map<String, Object> loadSettings() {
        try {
            Optional<String> json = repository.loadSettings();
            if (json.isPresent()) {
                Map<String, Object> settings = gson.fromJson(json.get(), SETTINGS_TYPE);
                if (settings != null) {
                    return settings;
                }
            }
        } catch (PersistenceException | JsonParseException e) {
            log.error("❌ Ошибка загрузки настроек: {}", e.getMessage());
        }
        return new HashMap<>();
    }

    public boolean clearAllSaves() {
        try {
            repository.deleteAll();
            return true;
        } catch (PersistenceException e) {
            log.error("❌ Ошибка очистки сохранений: {}", e.getMessage());
            return false;
        }
    }

    public int getMaxSlots() {
        return maxSlots;
    }

    private boolean isValidSlot(int slotIndex) {
        return slotIndex >= 0 && slotIndex < maxSlots;
    }

    private SaveSlotInfo describe(SaveRecord record) {
        String characterName = null;
        String timeDescription = null;
        try {
            GameSnapshot snapshot = codec.decode(record.getGameData());
            if (snapshot.getCharacter() != null) {
                characterName = snapshot.getCharacter().getName();
            }
            if (snapshot.getProgress() != null) {
                timeDescription = snapshot.getProgress().describe();
            }
        } catch (PersistenceException e) {
            log.warn("⚠️ Слот {} содержит поврежденные данные: {}", record.getSlotIndex(), e.getMessage());
        }
        return new SaveSlotInfo(record.getSlotIndex(), false, record.getName(), record.getSavedAt(),
            characterName, timeDescription);
    }
}
