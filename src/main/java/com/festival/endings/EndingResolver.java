package com.festival.endings;

import com.festival.content.GameContent;
import com.festival.game_rules.ConditionEvaluator;
import com.festival.game_state.Attribute;
import com.festival.game_state.AttributeStore;
import com.festival.game_state.GameSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Выбор концовки: кандидаты по приоритету, побеждает первая открытая.
 * Если ни одна не открыта - встроенная "平凡春节", так что результат есть всегда
 */
public class EndingResolver {
    private static final Logger log = LoggerFactory.getLogger(EndingResolver.class);

    public static final EndingDefinition DEFAULT_ENDING = EndingDefinition.builder("ordinary_spring")
        .title("平凡春节")
        .description("一个普通的春节，有喜有忧，这就是生活的常态。")
        .category(EndingCategory.NORMAL)
        .icon("🎊")
        .baseScore(500)
        .priority(0)
        .build();

    private final ConditionEvaluator evaluator;
    private final StoryNarrator narrator;

    public EndingResolver(ConditionEvaluator evaluator) {
        this(evaluator, new StoryNarrator());
    }

    public EndingResolver(ConditionEvaluator evaluator, StoryNarrator narrator) {
        this.evaluator = evaluator;
        this.narrator = narrator;
    }

    public EndingResult determineEnding(GameSession session) {
        EndingDefinition ending = selectEnding(session);
        log.debug("🏁 Концовка: {}", ending.getId());
        return new EndingResult(
            ending,
            calculateScore(ending, session),
            narrator.narrate(session),
            session.getAttributes().getAll(),
            stats(session));
    }

    /**
     * Первая по приоритету концовка, условия которой выполнены
     */
    public EndingDefinition selectEnding(GameSession session) {
        for (EndingDefinition ending : candidates(session)) {
            if (isUnlocked(ending, session)) {
                return ending;
            }
        }
        return DEFAULT_ENDING;
    }

    /**
     * Концовки без привязки к персонажу и концовки текущего персонажа, по убыванию приоритета.
     * Сортировка устойчивая: при равном приоритете сохраняется порядок каталога
     */
    List<EndingDefinition> candidates(GameSession session) {
        GameContent content = session.getContent();
        if (content == null) {
            return List.of();
        }
        String characterId = session.getCharacter() != null ? session.getCharacter().getId() : null;
        return content.getEndings().stream()
            .filter(ending -> ending.isAvailableFor(characterId))
            .sorted(Comparator.comparingInt(EndingDefinition::getPriority).reversed())
            .collect(Collectors.toList());
    }

    public boolean isUnlocked(EndingDefinition ending, GameSession session) {
        return evaluator.anyGroup(ending.getUnlockConditions(), session);
    }

    /**
     * База + выполненные модификаторы + вклад атрибутов, с округлением вниз
     */
    public long calculateScore(EndingDefinition ending, GameSession session) {
        double score = ending.getBaseScore();
        for (ScoreModifier modifier : ending.getScoreModifiers()) {
            if (evaluator.evaluate(modifier.getCondition(), session)) {
                score += modifier.getValue();
            }
        }

        AttributeStore attributes = session.getAttributes();
        score += attributes.get(Attribute.DEPOSIT.getKey()) / 1000;
        score += attributes.get(Attribute.FACE.getKey()) / 2;
        score += attributes.get(Attribute.MOOD.getKey()) / 2;
        score += attributes.get(Attribute.HEALTH.getKey()) / 2;
        return (long) Math.floor(score);
    }

    /**
     * Изменения относительно атрибутов на старте прохождения
     */
    public EndingStats stats(GameSession session) {
        return new EndingStats(
            change(session, Attribute.DEPOSIT),
            change(session, Attribute.WEIGHT),
            change(session, Attribute.FACE),
            change(session, Attribute.MOOD),
            change(session, Attribute.HEALTH),
            session.getStatistics().getTotalEvents(),
            session.getStatistics().getTotalChoices());
    }

    private static double change(GameSession session, Attribute attribute) {
        return session.getAttributes().get(attribute.getKey()) - session.getInitialAttribute(attribute.getKey());
    }
}
