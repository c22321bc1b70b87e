package com.festival.game_state;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Служебная информация о прохождении
 */
public class SessionMeta {
    private String version = GameConfig.VERSION;
    private LocalDateTime startTime;
    private LocalDateTime lastSaveTime;
    private int playCount = 0;

    public SessionMeta copy() {
        SessionMeta copy = new SessionMeta();
        copy.version = version;
        copy.startTime = startTime;
        copy.lastSaveTime = lastSaveTime;
        copy.playCount = playCount;
        return copy;
    }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public LocalDateTime getStartTime() { return startTime; }
    public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }

    public LocalDateTime getLastSaveTime() { return lastSaveTime; }
    public void setLastSaveTime(LocalDateTime lastSaveTime) { this.lastSaveTime = lastSaveTime; }

    public int getPlayCount() { return playCount; }
    public void setPlayCount(int playCount) { this.playCount = playCount; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SessionMeta)) return false;
        SessionMeta that = (SessionMeta) o;
        return playCount == that.playCount
            && Objects.equals(version, that.version)
            && Objects.equals(startTime, that.startTime)
            && Objects.equals(lastSaveTime, that.lastSaveTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, startTime, lastSaveTime, playCount);
    }
}
