package com.festival.service;

import com.festival.endings.EndingResult;
import com.festival.events.ChoiceResult;
import com.festival.events.EventDefinition;
import com.festival.events.OptionView;
import com.festival.game_engine.EventPresentation;
import com.festival.game_engine.GameEngine;
import com.festival.game_engine.TurnResult;
import com.festival.game_engine.TurnStatus;
import com.festival.game_state.Attribute;
import com.festival.game_state.CharacterProfile;
import com.festival.game_state.EffectResult;
import com.festival.game_state.GameSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Прохождения, открытые через API, по их id. Ход в одной сессии выполняется под ее монитором
 */
@Service
public class GameService {
    private static final Logger log = LoggerFactory.getLogger(GameService.class);

    private final GameEngine engine;
    private final SaveService saveService;
    static final int DEFAULT_MAX_RUNS = 100;

    private final boolean autoSaveEnabled;
    private final int maxRuns;
    // Порядок доступа: при переполнении закрывается прохождение, к которому дольше всего не обращались
    private final Map<String, GameSession> runs;

    public GameService(GameEngine engine, SaveService saveService, boolean autoSaveEnabled) {
        this(engine, saveService, autoSaveEnabled, DEFAULT_MAX_RUNS);
    }

    @Autowired
    public GameService(GameEngine engine, SaveService saveService,
                       @Value("${game.autosave.enabled:true}") boolean autoSaveEnabled,
                       @Value("${game.runs.max:100}") int maxRuns) {
        this.engine = engine;
        this.saveService = saveService;
        this.autoSaveEnabled = autoSaveEnabled;
        this.maxRuns = Math.max(1, maxRuns);
        this.runs = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, GameSession> eldest) {
                if (size() > GameService.this.maxRuns) {
                    log.info("🧹 Прохождение {} закрыто: превышен лимит {}", eldest.getKey(), GameService.this.maxRuns);
                    return true;
                }
                return false;
            }
        });
    }

    public List<Map<String, Object>> listCharacters() {
        List<Map<String, Object>> result = new ArrayList<>();
        for (CharacterProfile character : engine.getContent().getCharacters()) {
            result.add(characterToMap(character));
        }
        return result;
    }

    /**
     * Начать прохождение
     * @throws IllegalArgumentException если персонаж не найден
     */
    public Map<String, Object> createRun(String characterId) {
        GameSession session = engine.startNewRun(characterId);
        String runId = register(session);
        return runToMap(runId, session);
    }

    public Map<String, Object> getRun(String runId) {
        GameSession session = requireRun(runId);
        synchronized (session) {
            return runToMap(runId, session);
        }
    }

    public Map<String, Object> getCurrentEvent(String runId) {
        GameSession session = requireRun(runId);
        synchronized (session) {
            return presentationToMap(engine.presentNextEvent(session));
        }
    }

    public Map<String, Object> choose(String runId, int choiceIndex) {
        GameSession session = requireRun(runId);
        synchronized (session) {
            if (session.getCurrentEvent() == null && !engine.isFinished(session)) {
                engine.presentNextEvent(session);
            }
            TurnResult turn = engine.makeChoice(session, choiceIndex);
            // автосохранение на рассвете нового дня и в конце игры
            if (autoSaveEnabled && (turn.getStatus() == TurnStatus.ENDED
                || (turn.getStatus() == TurnStatus.APPLIED && turn.isNewDay()))) {
                saveService.autoSave(session);
            }
            return turnToMap(runId, session, turn);
        }
    }

    /**
     * @throws IllegalStateException если игра еще не закончена
     */
    public Map<String, Object> getEnding(String runId) {
        GameSession session = requireRun(runId);
        synchronized (session) {
            if (!engine.isFinished(session)) {
                throw new IllegalStateException("Игра еще не окончена");
            }
            return endingToMap(engine.determineEnding(session));
        }
    }

    public List<Map<String, Object>> listSaves() {
        List<Map<String, Object>> result = new ArrayList<>();
        for (SaveSlotInfo slot : saveService.getAllSaves()) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("index", slot.getIndex());
            map.put("empty", slot.isEmpty());
            map.put("name", slot.getName());
            map.put("saved_at", slot.getSavedAt() != null ? slot.getSavedAt().toString() : null);
            map.put("character_name", slot.getCharacterName());
            map.put("time", slot.getTimeDescription());
            result.add(map);
        }
        return result;
    }

    public boolean saveRun(String runId, int slotIndex, String name) {
        GameSession session = requireRun(runId);
        synchronized (session) {
            return saveService.createSave(session, slotIndex, name);
        }
    }

    /**
     * Загрузить слот в новое прохождение
     * @return id прохождения или пусто, если слот пуст или поврежден
     */
    public Optional<String> loadSave(int slotIndex) {
        GameSession session = engine.newSession();
        if (!saveService.loadSave(session, slotIndex)) {
            return Optional.empty();
        }
        return Optional.of(register(session));
    }

    public boolean deleteSave(int slotIndex) {
        return saveService.deleteSave(slotIndex);
    }

    public String exportRun(String runId) {
        GameSession session = requireRun(runId);
        synchronized (session) {
            return saveService.exportSave(session);
        }
    }

    public Optional<String> importRun(String data) {
        GameSession session = engine.newSession();
        if (!saveService.importSave(session, data)) {
            return Optional.empty();
        }
        return Optional.of(register(session));
    }

    /**
     * Закрыть прохождение и освободить его сессию
     * @throws IllegalArgumentException если прохождение не найдено
     */
    public void closeRun(String runId) {
        if (runs.remove(runId) == null) {
            throw new IllegalArgumentException("Прохождение не найдено: " + runId);
        }
        log.info("🚪 Прохождение {} закрыто", runId);
    }

    public int getOpenRunCount() {
        return runs.size();
    }

    GameSession requireRun(String runId) {
        GameSession session = runs.get(runId);
        if (session == null) {
            throw new IllegalArgumentException("Прохождение не найдено: " + runId);
        }
        return session;
    }

    private String register(GameSession session) {
        String runId = "run_" + UUID.randomUUID().toString().substring(0, 8);
        runs.put(runId, session);
        log.info("🎮 Открыто прохождение {}", runId);
        return runId;
    }

    // Представления для JSON

    private Map<String, Object> characterToMap(CharacterProfile character) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", character.getId());
        map.put("name", character.getName());
        map.put("title", character.getTitle());
        map.put("monologue", character.getMonologue());
        map.put("avatar", character.getAvatar());
        map.put("initial_attributes", character.getInitialAttributes());
        return map;
    }

    private Map<String, Object> runToMap(String runId, GameSession session) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("run_id", runId);
        map.put("character", session.getCharacter() != null ? characterToMap(session.getCharacter()) : null);
        map.put("day", session.getProgress().getCurrentDay());
        map.put("period", session.getProgress().getCurrentPeriod());
        map.put("time", session.getCurrentTimeDescription());
        map.put("progress_percent", session.getProgress().progressPercent());
        map.put("finished", engine.isFinished(session));

        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Attribute attribute : Attribute.values()) {
            Map<String, Object> attr = new LinkedHashMap<>();
            attr.put("value", session.getAttributes().get(attribute.getKey()));
            attr.put("percentage", session.getAttributes().percentage(attribute.getKey()));
            attr.put("name", attribute.getDisplayName());
            attr.put("icon", attribute.getIcon());
            attributes.put(attribute.getKey(), attr);
        }
        map.put("attributes", attributes);
        map.put("flags", session.getFlags());
        map.put("statistics", session.getStatistics());
        return map;
    }

    private Map<String, Object> presentationToMap(EventPresentation presentation) {
        EventDefinition event = presentation.getEvent();
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", event.getId());
        map.put("title", event.getTitle());
        map.put("description", event.getDescription());
        map.put("category", event.getCategory());
        map.put("scene", event.getScene());
        map.put("location", event.getLocation());
        map.put("npc", event.getNpc());
        map.put("npc_name", event.getNpcName());
        map.put("day", presentation.getDay());
        map.put("period", presentation.getPeriod());
        map.put("time", presentation.getTimeDescription());

        List<Map<String, Object>> options = new ArrayList<>();
        for (OptionView view : presentation.getOptions()) {
            Map<String, Object> option = new LinkedHashMap<>();
            option.put("index", view.getIndex());
            option.put("id", view.getOption().getId());
            option.put("text", view.getOption().getText());
            option.put("available", view.isAvailable());
            option.put("unavailable_reason", view.getUnavailableReason());
            options.add(option);
        }
        map.put("options", options);
        return map;
    }

    private Map<String, Object> turnToMap(String runId, GameSession session, TurnResult turn) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", turn.getStatus().name());
        map.put("message", turn.getMessage());
        map.put("new_day", turn.isNewDay());

        ChoiceResult choice = turn.getChoice();
        if (choice != null) {
            map.put("option_id", choice.getOption().getId());
            map.put("feedback", choice.getFeedback());
            List<Map<String, Object>> effects = new ArrayList<>();
            for (EffectResult effect : choice.getEffectResults()) {
                Map<String, Object> e = new LinkedHashMap<>();
                e.put("attribute", effect.getAttribute());
                e.put("old_value", effect.getOldValue());
                e.put("new_value", effect.getNewValue());
                e.put("change", effect.getChange());
                effects.add(e);
            }
            map.put("effects", effects);
            if (choice.getSpecialOutcome() != null) {
                map.put("special_outcome", Map.of(
                    "type", choice.getSpecialOutcome().getType(),
                    "message", String.valueOf(choice.getSpecialOutcome().getMessage())));
            }
        }
        if (turn.getEnding() != null) {
            map.put("ending", endingToMap(turn.getEnding()));
        }
        map.put("run", runToMap(runId, session));
        return map;
    }

    private Map<String, Object> endingToMap(EndingResult ending) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", ending.getId());
        map.put("title", ending.getTitle());
        map.put("description", ending.getDescription());
        map.put("category", ending.getCategory().getValue());
        map.put("icon", ending.getIcon());
        map.put("score", ending.getScore());
        map.put("story", ending.getStory());
        map.put("final_attributes", ending.getFinalAttributes());
        map.put("stats", ending.getStats());
        return map;
    }
}
