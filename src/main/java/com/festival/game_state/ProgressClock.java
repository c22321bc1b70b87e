package com.festival.game_state;

import java.util.Objects;

/**
 * Игровые часы: день (1..TOTAL_DAYS) и период внутри дня (0..PERIODS_PER_DAY-1)
 */
public class ProgressClock {
    private int currentDay = 1;
    private int currentPeriod = 0;
    private int totalPeriods = 0;

    public ProgressClock() {
    }

    public ProgressClock(int currentDay, int currentPeriod, int totalPeriods) {
        this.currentDay = currentDay;
        this.currentPeriod = currentPeriod;
        this.totalPeriods = totalPeriods;
    }

    /**
     * Сдвинуть время на один период
     * @return true, если начался новый день
     */
    public boolean advance() {
        currentPeriod++;
        totalPeriods++;

        if (currentPeriod >= GameConfig.PERIODS_PER_DAY) {
            currentPeriod = 0;
            currentDay++;
            return true;
        }
        return false;
    }

    /**
     * Закончился ли календарь (пройден последний период последнего дня)
     */
    public boolean isFinished() {
        return currentDay > GameConfig.TOTAL_DAYS
            || (currentDay == GameConfig.TOTAL_DAYS && currentPeriod >= GameConfig.PERIODS_PER_DAY);
    }

    public String describe() {
        return GameConfig.dayName(currentDay) + " " + GameConfig.periodName(currentPeriod);
    }

    /**
     * Номер текущего периода от начала игры (1-based) в процентах от всего календаря
     */
    public double progressPercent() {
        int total = GameConfig.TOTAL_DAYS * GameConfig.PERIODS_PER_DAY;
        int current = (currentDay - 1) * GameConfig.PERIODS_PER_DAY + currentPeriod + 1;
        return (double) current / total * 100;
    }

    public ProgressClock copy() {
        return new ProgressClock(currentDay, currentPeriod, totalPeriods);
    }

    public int getCurrentDay() { return currentDay; }
    public void setCurrentDay(int currentDay) { this.currentDay = currentDay; }

    public int getCurrentPeriod() { return currentPeriod; }
    public void setCurrentPeriod(int currentPeriod) { this.currentPeriod = currentPeriod; }

    public int getTotalPeriods() { return totalPeriods; }
    public void setTotalPeriods(int totalPeriods) { this.totalPeriods = totalPeriods; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProgressClock)) return false;
        ProgressClock that = (ProgressClock) o;
        return currentDay == that.currentDay
            && currentPeriod == that.currentPeriod
            && totalPeriods == that.totalPeriods;
    }

    @Override
    public int hashCode() {
        return Objects.hash(currentDay, currentPeriod, totalPeriods);
    }
}
