package com.festival.game_state;

import java.util.List;

/**
 * Неизменяемые константы игры: календарь праздника и версия формата сохранений
 */
public final class GameConfig {
    public static final String VERSION = "1.0.0";
    public static final int TOTAL_DAYS = 9;
    public static final int PERIODS_PER_DAY = 3;

    public static final List<String> PERIOD_NAMES = List.of("早晨", "中午", "晚上");
    public static final List<String> DAY_NAMES = List.of(
        "腊月二十九", "除夕", "大年初一", "大年初二", "大年初三",
        "大年初四", "大年初五", "大年初六", "大年初七"
    );

    private GameConfig() {
    }

    /**
     * Название дня (1-based), для дней за пределами календаря - "第N天"
     */
    public static String dayName(int day) {
        if (day >= 1 && day <= DAY_NAMES.size()) {
            return DAY_NAMES.get(day - 1);
        }
        return "第" + day + "天";
    }

    public static String periodName(int period) {
        if (period >= 0 && period < PERIOD_NAMES.size()) {
            return PERIOD_NAMES.get(period);
        }
        return "";
    }
}
