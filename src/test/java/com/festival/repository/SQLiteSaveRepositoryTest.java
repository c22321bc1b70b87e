package com.festival.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteSaveRepositoryTest {

    @TempDir
    Path tempDir;

    private SQLiteSaveRepository repository;

    @BeforeEach
    void setUp() {
        repository = new SQLiteSaveRepository(tempDir.resolve("saves.db").toString());
    }

    @Test
    void shouldSaveAndFindRecord() {
        LocalDateTime savedAt = LocalDateTime.of(2026, 2, 17, 20, 15, 30);
        repository.save(new SaveRecord(2, "除夕夜", savedAt, "{\"flags\":{}}"));

        Optional<SaveRecord> found = repository.find(2);

        assertTrue(found.isPresent());
        assertEquals("除夕夜", found.get().getName());
        assertEquals(savedAt, found.get().getSavedAt());
        assertEquals("{\"flags\":{}}", found.get().getGameData());
        assertTrue(repository.find(3).isEmpty());
    }

    @Test
    void shouldOverwriteSlot() {
        repository.save(new SaveRecord(0, "first", LocalDateTime.now(), "{}"));
        repository.save(new SaveRecord(0, "second", LocalDateTime.now(), "{}"));

        assertEquals("second", repository.find(0).orElseThrow().getName());
        assertEquals(1, repository.findAll().size());
    }

    @Test
    void shouldListSlotsInOrderAndDelete() {
        repository.save(new SaveRecord(3, "c", LocalDateTime.now(), "{}"));
        repository.save(new SaveRecord(1, "a", LocalDateTime.now(), "{}"));

        List<SaveRecord> all = repository.findAll();
        assertEquals(1, all.get(0).getSlotIndex());
        assertEquals(3, all.get(1).getSlotIndex());

        assertTrue(repository.delete(1));
        assertFalse(repository.delete(1));

        repository.deleteAll();
        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    void shouldStoreSettings() {
        assertTrue(repository.loadSettings().isEmpty());

        repository.saveSettings("{\"sound\":false}");
        repository.saveSettings("{\"sound\":true}");

        assertEquals("{\"sound\":true}", repository.loadSettings().orElseThrow());
    }

    @Test
    void shouldKeepDataAcrossInstances() {
        repository.save(new SaveRecord(4, "persist", LocalDateTime.now(), "{}"));

        SQLiteSaveRepository reopened = new SQLiteSaveRepository(repository.getDbPath());

        assertEquals("persist", reopened.find(4).orElseThrow().getName());
    }

    @Test
    void shouldFailWithPersistenceExceptionOnUnusablePath() {
        Path missingDir = tempDir.resolve("no/such/dir/saves.db");

        assertThrows(PersistenceException.class, () -> new SQLiteSaveRepository(missingDir.toString()));
    }
}
