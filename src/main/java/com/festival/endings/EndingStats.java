package com.festival.endings;

/**
 * Изменения атрибутов за прохождение и счетчики выборов
 */
public class EndingStats {
    private final double depositChange;
    private final double weightChange;
    private final double faceChange;
    private final double moodChange;
    private final double healthChange;
    private final int totalEvents;
    private final int totalChoices;

    public EndingStats(double depositChange, double weightChange, double faceChange, double moodChange,
                       double healthChange, int totalEvents, int totalChoices) {
        this.depositChange = depositChange;
        this.weightChange = weightChange;
        this.faceChange = faceChange;
        this.moodChange = moodChange;
        this.healthChange = healthChange;
        this.totalEvents = totalEvents;
        this.totalChoices = totalChoices;
    }

    public double getDepositChange() { return depositChange; }
    public double getWeightChange() { return weightChange; }
    public double getFaceChange() { return faceChange; }
    public double getMoodChange() { return moodChange; }
    public double getHealthChange() { return healthChange; }
    public int getTotalEvents() { return totalEvents; }
    public int getTotalChoices() { return totalChoices; }
}
