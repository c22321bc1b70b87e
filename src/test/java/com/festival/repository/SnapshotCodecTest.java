package com.festival.repository;

import com.festival.content.GameContent;
import com.festival.game_state.CharacterProfile;
import com.festival.game_state.GameSession;
import com.festival.game_state.GameSnapshot;
import com.festival.game_state.PendingEvent;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotCodecTest {

    private final SnapshotCodec codec = new SnapshotCodec();

    @Test
    void shouldRestoreSessionFromEncodedSnapshot() {
        LocalDateTime start = LocalDateTime.of(2026, 2, 16, 9, 0);
        GameSession session = new GameSession(GameContent.empty());
        session.initNewGame(new CharacterProfile("student", "大学生", "学生", "回家了", "🎓",
            Map.of("deposit", 800.0)), start);
        session.getAttributes().modify("deposit", -120.5);
        session.setFlag("has_partner", true);
        session.setFlag("nickname", "小明");
        session.setFlag("envelopes", 2.0);
        session.markEventTriggered("aunt_visit");
        session.recordEvent("aunt_visit", 1, "aunt_visit_1", start.plusHours(1));
        session.addPendingEvent(new PendingEvent("aunt_returns", 2, 0, 3));
        session.advanceTime();

        GameSnapshot decoded = codec.decode(codec.encode(session.serialize()));

        assertEquals(session.serialize(), decoded);
        assertEquals(start, decoded.getMeta().getStartTime());
        assertEquals("小明", decoded.getFlags().get("nickname"));
    }

    @Test
    void shouldAcceptSnapshotWithMissingSections() {
        GameSnapshot snapshot = codec.decode("{\"progress\":{\"currentDay\":4,\"currentPeriod\":1,\"totalPeriods\":10}}");

        GameSession session = new GameSession(GameContent.empty());
        session.deserialize(snapshot);

        assertEquals(4, session.getProgress().getCurrentDay());
        assertEquals(50, session.getAttributes().get("mood"));
        assertTrue(session.getPendingEvents().isEmpty());
        assertNull(session.getCharacter());
    }

    @Test
    void shouldRejectCorruptedData() {
        assertThrows(PersistenceException.class, () -> codec.decode("not a snapshot"));
        assertThrows(PersistenceException.class, () -> codec.decode(""));
        assertThrows(PersistenceException.class, () -> codec.decode("{\"meta\":{\"startTime\":\"yesterday\"}}"));
        assertThrows(PersistenceException.class, () -> codec.decode("{\"progress\":[1,2]}"));
    }
}
