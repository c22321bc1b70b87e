package com.festival.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Сохранения в SQLite: таблица слотов и таблица настроек
 */
public class SQLiteSaveRepository implements SaveRepository {
    private static final Logger log = LoggerFactory.getLogger(SQLiteSaveRepository.class);
    private static final String SETTINGS_KEY = "settings";

    private final String dbPath;

    public SQLiteSaveRepository() {
        this(getDbPathFromEnv());
    }

    public SQLiteSaveRepository(String dbPath) {
        this.dbPath = dbPath;
        initDatabase();
    }

    /**
     * GAME_DB_PATH, затем game.db.path, затем game_saves.db в каталоге данных
     */
    public static String getDbPathFromEnv() {
        String dbPath = System.getenv("GAME_DB_PATH");
        if (dbPath == null || dbPath.isEmpty()) {
            dbPath = System.getProperty("game.db.path");
        }
        if (dbPath == null || dbPath.isEmpty()) {
            String dataDir = System.getenv("GAME_DATA_DIR");
            if (dataDir == null || dataDir.isEmpty()) {
                dataDir = System.getProperty("game.data.dir", ".");
            }
            dbPath = dataDir + "/game_saves.db";
        }
        return dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    private void initDatabase() {
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS save_slots (
                    slot_index INTEGER PRIMARY KEY,
                    name TEXT,
                    saved_at TEXT,
                    game_data TEXT
                )
            """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS settings (
                    key TEXT PRIMARY KEY,
                    value TEXT
                )
            """);
            log.info("💾 Хранилище сохранений: {}", dbPath);
        } catch (SQLException e) {
            throw new PersistenceException("Ошибка инициализации БД: " + e.getMessage(), e);
        }
    }

    @Override
    public void save(SaveRecord record) {
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(
                 "INSERT OR REPLACE INTO save_slots (slot_index, name, saved_at, game_data) VALUES (?, ?, ?, ?)")) {
            stmt.setInt(1, record.getSlotIndex());
            stmt.setString(2, record.getName());
            stmt.setString(3, record.getSavedAt() != null ? record.getSavedAt().toString() : null);
            stmt.setString(4, record.getGameData());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Ошибка сохранения в слот " + record.getSlotIndex() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<SaveRecord> find(int slotIndex) {
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(
                 "SELECT slot_index, name, saved_at, game_data FROM save_slots WHERE slot_index = ?")) {
            stmt.setInt(1, slotIndex);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new PersistenceException("Ошибка загрузки слота " + slotIndex + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<SaveRecord> findAll() {
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(
                 "SELECT slot_index, name, saved_at, game_data FROM save_slots ORDER BY slot_index")) {
            List<SaveRecord> records = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(mapRow(rs));
                }
            }
            return records;
        } catch (SQLException e) {
            throw new PersistenceException("Ошибка чтения сохранений: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean delete(int slotIndex) {
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement("DELETE FROM save_slots WHERE slot_index = ?")) {
            stmt.setInt(1, slotIndex);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new PersistenceException("Ошибка удаления слота " + slotIndex + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void deleteAll() {
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("DELETE FROM save_slots");
        } catch (SQLException e) {
            throw new PersistenceException("Ошибка очистки сохранений: " + e.getMessage(), e);
        }
    }

    @Override
    public void saveSettings(String settingsJson) {
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(
                 "INSERT OR REPLACE INTO settings (key, value) VALUES (?, ?)")) {
            stmt.setString(1, SETTINGS_KEY);
            stmt.setString(2, settingsJson);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Ошибка сохранения настроек: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> loadSettings() {
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement("SELECT value FROM settings WHERE key = ?")) {
            stmt.setString(1, SETTINGS_KEY);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString("value"));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new PersistenceException("Ошибка загрузки настроек: " + e.getMessage(), e);
        }
    }

    private static SaveRecord mapRow(ResultSet rs) throws SQLException {
        String savedAt = rs.getString("saved_at");
        return new SaveRecord(
            rs.getInt("slot_index"),
            rs.getString("name"),
            savedAt != null ? LocalDateTime.parse(savedAt) : null,
            rs.getString("game_data"));
    }

    public String getDbPath() {
        return dbPath;
    }
}
