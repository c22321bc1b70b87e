package com.festival.repository;

import java.util.List;
import java.util.Optional;

/**
 * Хранилище слотов сохранения и настроек. Ошибки ввода-вывода - PersistenceException
 */
public interface SaveRepository {

    void save(SaveRecord record);

    Optional<SaveRecord> find(int slotIndex);

    /**
     * Все занятые слоты по возрастанию индекса
     */
    List<SaveRecord> findAll();

    boolean delete(int slotIndex);

    void deleteAll();

    void saveSettings(String settingsJson);

    Optional<String> loadSettings();
}
