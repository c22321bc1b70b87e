package com.festival.api;

import com.festival.service.GameService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GameApiControllerTest {

    private GameService gameService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        gameService = mock(GameService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new GameApiController(gameService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void healthShouldReturnOk() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void shouldCreateRun() throws Exception {
        when(gameService.createRun("student")).thenReturn(Map.of("run_id", "run_1"));

        mockMvc.perform(post("/api/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"character_id\": \"student\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.run.run_id").value("run_1"));
    }

    @Test
    void shouldRequireCharacterId() throws Exception {
        mockMvc.perform(post("/api/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false));
        verifyNoInteractions(gameService);
    }

    @Test
    void shouldPassChoiceIndex() throws Exception {
        when(gameService.choose("run_1", 2)).thenReturn(Map.of("status", "APPLIED"));

        mockMvc.perform(post("/api/runs/run_1/choices")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"choice_index\": 2}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.turn.status").value("APPLIED"));
    }

    @Test
    void unknownRunShouldMapToNotFound() throws Exception {
        when(gameService.getRun("run_x")).thenThrow(new IllegalArgumentException("Прохождение не найдено: run_x"));

        mockMvc.perform(get("/api/runs/run_x"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.type").value("IllegalArgumentException"));
    }

    @Test
    void shouldCloseRun() throws Exception {
        mockMvc.perform(delete("/api/runs/run_1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.run_id").value("run_1"));
        verify(gameService).closeRun("run_1");
    }

    @Test
    void closingUnknownRunShouldMapToNotFound() throws Exception {
        doThrow(new IllegalArgumentException("Прохождение не найдено: run_x")).when(gameService).closeRun("run_x");

        mockMvc.perform(delete("/api/runs/run_x"))
            .andExpect(status().isNotFound());
    }

    @Test
    void endingBeforeGameOverShouldMapToConflict() throws Exception {
        when(gameService.getEnding("run_1")).thenThrow(new IllegalStateException("Игра еще не окончена"));

        mockMvc.perform(get("/api/runs/run_1/ending"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void unexpectedErrorShouldMapToServerError() throws Exception {
        when(gameService.listSaves()).thenThrow(new RuntimeException("boom"));

        mockMvc.perform(get("/api/saves"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("boom"));
    }

    @Test
    void shouldLoadSaveIntoNewRun() throws Exception {
        when(gameService.loadSave(0)).thenReturn(Optional.of("run_7"));
        when(gameService.getRun("run_7")).thenReturn(Map.of("run_id", "run_7"));
        when(gameService.loadSave(1)).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/saves/0/load"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.run.run_id").value("run_7"));
        mockMvc.perform(post("/api/saves/1/load"))
            .andExpect(status().isNotFound());
    }

    @Test
    void shouldDeleteSaveAndListSlots() throws Exception {
        when(gameService.deleteSave(2)).thenReturn(true);
        when(gameService.listSaves()).thenReturn(List.of(Map.of("index", 0, "empty", true)));

        mockMvc.perform(delete("/api/saves/2"))
            .andExpect(status().isOk());
        mockMvc.perform(get("/api/saves"))
            .andExpect(jsonPath("$.saves[0].empty").value(true));
    }

    @Test
    void shouldRejectInvalidImport() throws Exception {
        when(gameService.importRun("junk")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/runs/import")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"data\": \"junk\"}"))
            .andExpect(status().isBadRequest());
    }
}
