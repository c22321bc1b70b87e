package com.festival.service;

import com.festival.content.GameContent;
import com.festival.game_state.CharacterProfile;
import com.festival.game_state.GameSession;
import com.festival.repository.PersistenceException;
import com.festival.repository.SaveRecord;
import com.festival.repository.SaveRepository;
import com.festival.repository.SnapshotCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class SaveServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-17T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    private SaveRepository repository;
    private SnapshotCodec codec;
    private SaveService saveService;
    private GameSession session;

    @BeforeEach
    void setUp() {
        repository = mock(SaveRepository.class);
        codec = new SnapshotCodec();
        saveService = new SaveService(repository, codec, 3, CLOCK);
        session = new GameSession(GameContent.empty());
        session.initNewGame(new CharacterProfile("student", "大学生", "", "", "🎓", Map.of()), NOW.minusHours(2));
    }

    @Test
    void shouldWriteSnapshotAndStampSaveTime() {
        assertTrue(saveService.createSave(session, 1, null));

        ArgumentCaptor<SaveRecord> captor = ArgumentCaptor.forClass(SaveRecord.class);
        verify(repository).save(captor.capture());
        SaveRecord record = captor.getValue();
        assertEquals(1, record.getSlotIndex());
        assertEquals("存档 2", record.getName());
        assertEquals(NOW, record.getSavedAt());
        assertEquals(NOW, session.getMeta().getLastSaveTime());
        assertEquals(NOW, codec.decode(record.getGameData()).getMeta().getLastSaveTime());
    }

    @Test
    void shouldRejectSlotsOutOfRange() {
        assertFalse(saveService.createSave(session, 3, "x"));
        assertFalse(saveService.createSave(session, -1, "x"));
        assertFalse(saveService.loadSave(session, 7));
        verifyNoInteractions(repository);
    }

    @Test
    void shouldReturnFalseWhenRepositoryFails() {
        doThrow(new PersistenceException("disk full")).when(repository).save(any());
        when(repository.find(anyInt())).thenThrow(new PersistenceException("locked"));

        assertFalse(saveService.createSave(session, 0, "x"));
        assertFalse(saveService.loadSave(session, 0));
        assertEquals("student", session.getCharacter().getId());
    }

    @Test
    void shouldKeepLastSaveTimeWhenWriteFails() {
        doThrow(new PersistenceException("disk full")).when(repository).save(any());

        assertFalse(saveService.createSave(session, 0, "x"));

        assertNull(session.getMeta().getLastSaveTime());
    }

    @Test
    void shouldLoadSavedSession() {
        session.getAttributes().set("mood", 33);
        String data = codec.encode(session.serialize());
        when(repository.find(0)).thenReturn(Optional.of(new SaveRecord(0, "a", NOW, data)));

        GameSession restored = new GameSession(GameContent.empty());
        assertTrue(saveService.loadSave(restored, 0));

        assertEquals(33, restored.getAttributes().get("mood"));
        assertEquals("student", restored.getCharacter().getId());
    }

    @Test
    void shouldNotTouchSessionOnCorruptedSlot() {
        when(repository.find(0)).thenReturn(Optional.of(new SaveRecord(0, "bad", NOW, "{broken")));
        session.setFlag("keep", true);

        assertFalse(saveService.loadSave(session, 0));
        assertTrue(session.hasFlag("keep"));
    }

    @Test
    void shouldListAllSlotsIncludingEmpty() {
        when(repository.findAll()).thenReturn(List.of(
            new SaveRecord(1, "除夕", NOW, codec.encode(session.serialize())),
            new SaveRecord(9, "stray", NOW, "{}")));

        List<SaveSlotInfo> slots = saveService.getAllSaves();

        assertEquals(3, slots.size());
        assertTrue(slots.get(0).isEmpty());
        assertFalse(slots.get(1).isEmpty());
        assertEquals("大学生", slots.get(1).getCharacterName());
        assertEquals("腊月二十九 早晨", slots.get(1).getTimeDescription());
        assertEquals(0, saveService.findEmptySlot());
    }

    @Test
    void autoSaveShouldOverwriteOldestSlotWhenFull() {
        when(repository.findAll()).thenReturn(List.of(
            new SaveRecord(0, "a", NOW.minusDays(1), "{}"),
            new SaveRecord(1, "b", NOW.minusDays(3), "{}"),
            new SaveRecord(2, "c", NOW.minusDays(2), "{}")));

        assertTrue(saveService.autoSave(session));

        ArgumentCaptor<SaveRecord> captor = ArgumentCaptor.forClass(SaveRecord.class);
        verify(repository).save(captor.capture());
        assertEquals(1, captor.getValue().getSlotIndex());
        assertEquals(SaveService.AUTO_SAVE_NAME, captor.getValue().getName());
    }

    @Test
    void shouldExportAndImport() {
        session.setFlag("exported", true);
        String data = saveService.exportSave(session);

        GameSession imported = new GameSession(GameContent.empty());
        assertTrue(saveService.importSave(imported, data));
        assertEquals(true, imported.getFlag("exported"));

        assertFalse(saveService.importSave(imported, "garbage"));
        assertEquals(true, imported.getFlag("exported"));
    }

    @Test
    void shouldRoundTripSettings() {
        when(repository.loadSettings()).thenReturn(Optional.of("{\"sound\":true,\"speed\":2}"));

        Map<String, Object> settings = saveService.loadSettings();

        assertEquals(true, settings.get("sound"));
        assertEquals(2.0, settings.get("speed"));
        assertTrue(saveService.saveSettings(Map.of("sound", false)));
        verify(repository).saveSettings("{\"sound\":false}");
    }

    @Test
    void shouldReturnEmptySettingsWhenStoredJsonIsBroken() {
        when(repository.loadSettings()).thenReturn(Optional.of("[oops"));

        assertTrue(saveService.loadSettings().isEmpty());
    }
}
