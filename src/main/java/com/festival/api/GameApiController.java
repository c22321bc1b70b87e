package com.festival.api;

import com.festival.service.GameService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * REST контроллер симулятора. Все игровые операции привязаны к run_id
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
@Tag(name = "Game API", description = "Прохождения, ходы, концовки и сохранения")
public class GameApiController {

    private final GameService gameService;

    @Autowired
    public GameApiController(GameService gameService) {
        this.gameService = gameService;
    }

    /**
     * GET /api/health - Проверка здоровья сервера
     */
    @Operation(summary = "Проверка здоровья сервера", description = "Возвращает статус работы сервера")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "ok");
        health.put("service", "Spring Festival Simulator");
        health.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(health);
    }

    @Operation(summary = "Список персонажей")
    @GetMapping("/characters")
    public ResponseEntity<Map<String, Object>> listCharacters() {
        return ok("characters", gameService.listCharacters());
    }

    /**
     * POST /api/runs - Начать прохождение за выбранного персонажа
     */
    @Operation(summary = "Начать прохождение", description = "Создает сессию для персонажа character_id и возвращает run_id")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Прохождение создано"),
        @ApiResponse(responseCode = "400", description = "Не указан character_id"),
        @ApiResponse(responseCode = "404", description = "Персонаж не найден")
    })
    @PostMapping("/runs")
    public ResponseEntity<Map<String, Object>> createRun(@RequestBody(required = false) Map<String, Object> body) {
        if (body == null || !(body.get("character_id") instanceof String)) {
            return error(HttpStatus.BAD_REQUEST, "Поле 'character_id' обязательно");
        }
        return ok("run", gameService.createRun((String) body.get("character_id")));
    }

    @Operation(summary = "Состояние прохождения")
    @GetMapping("/runs/{runId}")
    public ResponseEntity<Map<String, Object>> getRun(@PathVariable String runId) {
        return ok("run", gameService.getRun(runId));
    }

    /**
     * GET /api/runs/{runId}/event - Текущее событие. Повторный запрос возвращает то же событие, пока не сделан выбор
     */
    @Operation(summary = "Текущее событие", description = "Выбирает следующее событие, если текущего нет")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Событие и варианты ответа"),
        @ApiResponse(responseCode = "404", description = "Прохождение не найдено"),
        @ApiResponse(responseCode = "409", description = "Игра окончена")
    })
    @GetMapping("/runs/{runId}/event")
    public ResponseEntity<Map<String, Object>> getCurrentEvent(@PathVariable String runId) {
        return ok("event", gameService.getCurrentEvent(runId));
    }

    /**
     * POST /api/runs/{runId}/choices - Выбрать вариант текущего события
     */
    @Operation(summary = "Сделать выбор", description = "Применяет вариант choice_index к текущему событию и продвигает время")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Ход обработан, статус в поле status"),
        @ApiResponse(responseCode = "400", description = "Не указан choice_index")
    })
    @PostMapping("/runs/{runId}/choices")
    public ResponseEntity<Map<String, Object>> choose(
            @PathVariable String runId,
            @RequestBody(required = false) Map<String, Object> body) {
        if (body == null || !(body.get("choice_index") instanceof Number)) {
            return error(HttpStatus.BAD_REQUEST, "Поле 'choice_index' обязательно");
        }
        int choiceIndex = ((Number) body.get("choice_index")).intValue();
        return ok("turn", gameService.choose(runId, choiceIndex));
    }

    @Operation(summary = "Концовка", description = "Доступна только после окончания игры")
    @GetMapping("/runs/{runId}/ending")
    public ResponseEntity<Map<String, Object>> getEnding(@PathVariable String runId) {
        return ok("ending", gameService.getEnding(runId));
    }

    @Operation(summary = "Слоты сохранений")
    @GetMapping("/saves")
    public ResponseEntity<Map<String, Object>> listSaves() {
        return ok("saves", gameService.listSaves());
    }

    @Operation(summary = "Сохранить прохождение в слот")
    @PostMapping("/runs/{runId}/saves/{slot}")
    public ResponseEntity<Map<String, Object>> saveRun(
            @PathVariable String runId,
            @PathVariable int slot,
            @RequestBody(required = false) Map<String, Object> body) {
        String name = body != null && body.get("name") instanceof String ? (String) body.get("name") : null;
        if (!gameService.saveRun(runId, slot, name)) {
            return error(HttpStatus.BAD_REQUEST, "Не удалось сохранить в слот " + slot);
        }
        return ok("slot", slot);
    }

    /**
     * POST /api/saves/{slot}/load - Загрузить слот в новое прохождение
     */
    @Operation(summary = "Загрузить сохранение", description = "Открывает новое прохождение из слота и возвращает его run_id")
    @PostMapping("/saves/{slot}/load")
    public ResponseEntity<Map<String, Object>> loadSave(@PathVariable int slot) {
        Optional<String> runId = gameService.loadSave(slot);
        if (runId.isEmpty()) {
            return error(HttpStatus.NOT_FOUND, "Сохранение не найдено или повреждено: " + slot);
        }
        return ok("run", gameService.getRun(runId.get()));
    }

    @Operation(summary = "Закрыть прохождение", description = "Сессия удаляется из памяти; сохранения не затрагиваются")
    @DeleteMapping("/runs/{runId}")
    public ResponseEntity<Map<String, Object>> closeRun(@PathVariable String runId) {
        gameService.closeRun(runId);
        return ok("run_id", runId);
    }

    @Operation(summary = "Удалить сохранение")
    @DeleteMapping("/saves/{slot}")
    public ResponseEntity<Map<String, Object>> deleteSave(@PathVariable int slot) {
        if (!gameService.deleteSave(slot)) {
            return error(HttpStatus.NOT_FOUND, "Сохранение не найдено: " + slot);
        }
        return ok("slot", slot);
    }

    @Operation(summary = "Экспорт прохождения", description = "Снимок прохождения одной JSON-строкой")
    @GetMapping("/runs/{runId}/export")
    public ResponseEntity<Map<String, Object>> exportRun(@PathVariable String runId) {
        return ok("data", gameService.exportRun(runId));
    }

    @Operation(summary = "Импорт прохождения", description = "Открывает новое прохождение из экспортированной строки")
    @PostMapping("/runs/import")
    public ResponseEntity<Map<String, Object>> importRun(@RequestBody(required = false) Map<String, Object> body) {
        if (body == null || !(body.get("data") instanceof String)) {
            return error(HttpStatus.BAD_REQUEST, "Поле 'data' обязательно");
        }
        Optional<String> runId = gameService.importRun((String) body.get("data"));
        if (runId.isEmpty()) {
            return error(HttpStatus.BAD_REQUEST, "Некорректные данные сохранения");
        }
        return ok("run", gameService.getRun(runId.get()));
    }

    private ResponseEntity<Map<String, Object>> ok(String key, Object value) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put(key, value);
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("success", false);
        error.put("error", message);
        return ResponseEntity.status(status).body(error);
    }
}
