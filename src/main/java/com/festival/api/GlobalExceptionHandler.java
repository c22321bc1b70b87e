package com.festival.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Глобальный обработчик исключений для API
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // Неизвестный run_id или персонаж
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(IllegalArgumentException e) {
        log.warn("⚠️ {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e);
    }

    // Операция не подходит к состоянию прохождения, например концовка до конца игры
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(IllegalStateException e) {
        log.warn("⚠️ {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("❌ Глобальная ошибка: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, Exception e) {
        Map<String, Object> error = new HashMap<>();
        error.put("success", false);
        String errorMessage = e.getMessage();
        if (errorMessage == null) {
            errorMessage = "Неизвестная ошибка: " + e.getClass().getSimpleName();
        }
        error.put("error", errorMessage);
        error.put("type", e.getClass().getSimpleName());
        return ResponseEntity.status(status)
            .header("Content-Type", "application/json;charset=UTF-8")
            .body(error);
    }
}
