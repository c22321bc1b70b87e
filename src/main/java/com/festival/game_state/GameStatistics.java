package com.festival.game_state;

import java.util.Objects;

/**
 * Накопительная статистика прохождения
 */
public class GameStatistics {
    private int totalEvents = 0;
    private int totalChoices = 0;
    private double moneySpent = 0;
    private double moneyEarned = 0;
    private int redEnvelopesGiven = 0;
    private int redEnvelopesReceived = 0;
    private int mealsEaten = 0;
    private int relativesMet = 0;

    public void recordChoice() {
        totalEvents++;
        totalChoices++;
    }

    /**
     * Учет изменения денежного атрибута по величине дельты
     */
    public void recordMoneyDelta(double delta) {
        if (delta < 0) {
            moneySpent += Math.abs(delta);
        } else if (delta > 0) {
            moneyEarned += delta;
        }
    }

    public GameStatistics copy() {
        GameStatistics copy = new GameStatistics();
        copy.totalEvents = totalEvents;
        copy.totalChoices = totalChoices;
        copy.moneySpent = moneySpent;
        copy.moneyEarned = moneyEarned;
        copy.redEnvelopesGiven = redEnvelopesGiven;
        copy.redEnvelopesReceived = redEnvelopesReceived;
        copy.mealsEaten = mealsEaten;
        copy.relativesMet = relativesMet;
        return copy;
    }

    // Getters and Setters
    public int getTotalEvents() { return totalEvents; }
    public void setTotalEvents(int totalEvents) { this.totalEvents = totalEvents; }

    public int getTotalChoices() { return totalChoices; }
    public void setTotalChoices(int totalChoices) { this.totalChoices = totalChoices; }

    public double getMoneySpent() { return moneySpent; }
    public void setMoneySpent(double moneySpent) { this.moneySpent = moneySpent; }

    public double getMoneyEarned() { return moneyEarned; }
    public void setMoneyEarned(double moneyEarned) { this.moneyEarned = moneyEarned; }

    public int getRedEnvelopesGiven() { return redEnvelopesGiven; }
    public void setRedEnvelopesGiven(int redEnvelopesGiven) { this.redEnvelopesGiven = redEnvelopesGiven; }

    public int getRedEnvelopesReceived() { return redEnvelopesReceived; }
    public void setRedEnvelopesReceived(int redEnvelopesReceived) { this.redEnvelopesReceived = redEnvelopesReceived; }

    public int getMealsEaten() { return mealsEaten; }
    public void setMealsEaten(int mealsEaten) { this.mealsEaten = mealsEaten; }

    public int getRelativesMet() { return relativesMet; }
    public void setRelativesMet(int relativesMet) { this.relativesMet = relativesMet; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameStatistics)) return false;
        GameStatistics that = (GameStatistics) o;
        return totalEvents == that.totalEvents
            && totalChoices == that.totalChoices
            && Double.compare(moneySpent, that.moneySpent) == 0
            && Double.compare(moneyEarned, that.moneyEarned) == 0
            && redEnvelopesGiven == that.redEnvelopesGiven
            && redEnvelopesReceived == that.redEnvelopesReceived
            && mealsEaten == that.mealsEaten
            && relativesMet == that.relativesMet;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalEvents, totalChoices, moneySpent, moneyEarned,
            redEnvelopesGiven, redEnvelopesReceived, mealsEaten, relativesMet);
    }
}
