package com.festival.game_engine;

import com.festival.content.GameContent;
import com.festival.endings.EndingResolver;
import com.festival.endings.EndingResult;
import com.festival.events.ChoiceProcessor;
import com.festival.events.ChoiceResult;
import com.festival.events.EventDefinition;
import com.festival.events.EventScheduler;
import com.festival.events.OptionView;
import com.festival.game_rules.ConditionEvaluator;
import com.festival.game_rules.RandomSource;
import com.festival.game_state.CharacterProfile;
import com.festival.game_state.GameSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Игровой цикл: событие - выбор - сдвиг времени, а в конце концовка.
 * Один движок обслуживает любое число сессий над общим каталогом
 */
public class GameEngine {
    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    /**
     * Флаг сессии с типом особого исхода, завершившего игру досрочно
     */
    public static final String TERMINAL_FLAG = "special_outcome";

    private final GameContent content;
    private final Clock clock;
    private final ConditionEvaluator evaluator;
    private final EventScheduler scheduler;
    private final ChoiceProcessor choiceProcessor;
    private final EndingResolver endingResolver;

    public GameEngine(GameContent content, RandomSource random) {
        this(content, random, Clock.systemDefaultZone());
    }

    public GameEngine(GameContent content, RandomSource random, Clock clock) {
        this.content = content;
        this.clock = clock;
        this.evaluator = new ConditionEvaluator(random);
        this.scheduler = new EventScheduler(evaluator);
        this.choiceProcessor = new ChoiceProcessor(evaluator, clock);
        this.endingResolver = new EndingResolver(evaluator);
    }

    /**
     * Новое прохождение за персонажа из каталога; null - без персонажа
     * @throws IllegalArgumentException если персонажа нет в каталоге
     */
    public GameSession startNewRun(String characterId) {
        CharacterProfile character = null;
        if (characterId != null) {
            character = content.findCharacter(characterId)
                .orElseThrow(() -> new IllegalArgumentException("Персонаж не найден: " + characterId));
        }
        return startNewRun(character);
    }

    public GameSession startNewRun(CharacterProfile character) {
        GameSession session = new GameSession(content);
        session.initNewGame(character, LocalDateTime.now(clock));
        log.info("🧧 Новое прохождение: {}", character != null ? character.getName() : "без персонажа");
        return session;
    }

    /**
     * Восстановить сессию над каталогом движка (для загрузки сохранений)
     */
    public GameSession newSession() {
        return new GameSession(content);
    }

    /**
     * Событие текущего хода. Повторный вызов до выбора возвращает то же событие
     * @throws IllegalStateException если игра уже закончилась
     */
    public EventPresentation presentNextEvent(GameSession session) {
        if (isFinished(session)) {
            throw new IllegalStateException("Игра окончена");
        }
        if (session.getCurrentEvent() == null) {
            EventDefinition event = scheduler.nextEvent(session);
            session.setCurrentEvent(event, scheduler.availableOptions(event, session));
        }
        return new EventPresentation(
            session.getCurrentEvent(),
            session.getCurrentOptions(),
            session.getProgress().getCurrentDay(),
            session.getProgress().getCurrentPeriod(),
            session.getCurrentTimeDescription());
    }

    /**
     * Применить выбор игрока к показанному событию
     * @throws IllegalStateException если игра закончилась или событие еще не показано
     */
    public TurnResult makeChoice(GameSession session, int choiceIndex) {
        if (isFinished(session)) {
            throw new IllegalStateException("Игра окончена");
        }
        EventDefinition event = session.getCurrentEvent();
        if (event == null) {
            throw new IllegalStateException("Нет текущего события");
        }
        if (choiceIndex < 0 || choiceIndex >= event.getOptions().size()) {
            return TurnResult.notFound("Вариант не найден: " + choiceIndex);
        }

        Optional<OptionView> view = findView(session.getCurrentOptions(), choiceIndex);
        if (view.isEmpty()) {
            return TurnResult.unavailable("Вариант скрыт: " + choiceIndex);
        }
        if (!view.get().isAvailable()) {
            return TurnResult.unavailable(view.get().getUnavailableReason());
        }

        Optional<ChoiceResult> processed = choiceProcessor.process(session, event, choiceIndex);
        if (processed.isEmpty()) {
            return TurnResult.notFound("Вариант не найден: " + choiceIndex);
        }
        ChoiceResult choice = processed.get();
        session.clearCurrentEvent();

        if (choice.isTerminal()) {
            session.setFlag(TERMINAL_FLAG, choice.getSpecialOutcome().getType());
            log.info("⚡ Особый исход {} в событии {}", choice.getSpecialOutcome().getType(), event.getId());
            return TurnResult.ended(choice, false, determineEnding(session));
        }

        boolean newDay = session.advanceTime();
        if (session.isGameOver()) {
            return TurnResult.ended(choice, newDay, determineEnding(session));
        }
        return TurnResult.applied(choice, newDay);
    }

    public EndingResult determineEnding(GameSession session) {
        EndingResult ending = endingResolver.determineEnding(session);
        log.info("🏁 Концовка {} ({} очков)", ending.getId(), ending.getScore());
        return ending;
    }

    /**
     * Календарь пройден или сработал завершающий особый исход
     */
    public boolean isFinished(GameSession session) {
        return session.isGameOver() || session.hasFlag(TERMINAL_FLAG);
    }

    public GameContent getContent() {
        return content;
    }

    public EventScheduler getScheduler() {
        return scheduler;
    }

    private static Optional<OptionView> findView(List<OptionView> views, int choiceIndex) {
        return views.stream().filter(view -> view.getIndex() == choiceIndex).findFirst();
    }
}
