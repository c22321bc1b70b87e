package com.festival.game_engine;

/**
 * Исход хода
 */
public enum TurnStatus {
    /** Выбор применен, время сдвинулось */
    APPLIED,
    /** Варианта с таким индексом нет, сессия не изменилась */
    NOT_FOUND,
    /** Вариант скрыт или заблокирован условиями, сессия не изменилась */
    UNAVAILABLE,
    /** Выбор применен и игра закончилась */
    ENDED
}
