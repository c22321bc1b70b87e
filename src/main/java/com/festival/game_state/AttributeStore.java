package com.festival.game_state;

import com.festival.game_rules.ConditionEvaluator;
import com.festival.game_rules.Effect;
import com.festival.game_rules.EffectOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Хранилище атрибутов сессии. Значение известного атрибута всегда лежит в его границах,
 * неизвестные имена хранятся как есть
 */
public class AttributeStore {
    private static final Logger log = LoggerFactory.getLogger(AttributeStore.class);

    public static final List<String> WELLBEING = List.of(
        Attribute.FACE.getKey(), Attribute.MOOD.getKey(), Attribute.HEALTH.getKey());

    private final GameSession session;
    private final Map<String, Double> values = new LinkedHashMap<>();

    AttributeStore(GameSession session) {
        this.session = session;
    }

    /**
     * Текущее значение; 0 для отсутствующего атрибута
     */
    public double get(String attribute) {
        Double value = values.get(attribute);
        return value != null ? value : 0;
    }

    public void set(String attribute, double value) {
        Attribute known = Attribute.fromKey(attribute);
        values.put(attribute, known != null ? known.clamp(value) : value);
    }

    /**
     * Изменить атрибут операцией и вернуть новое значение.
     * Для денежного атрибута дельта учитывается в тратах или доходах независимо от операции
     */
    public double modify(String attribute, double delta, EffectOperation operation) {
        EffectOperation op = operation != null ? operation : EffectOperation.ADD;
        set(attribute, op.apply(get(attribute), delta));

        if (Attribute.MONETARY.getKey().equals(attribute)) {
            session.getStatistics().recordMoneyDelta(delta);
        }
        return get(attribute);
    }

    public double modify(String attribute, double delta) {
        return modify(attribute, delta, EffectOperation.ADD);
    }

    /**
     * Применить эффекты по порядку. Случайное значение разыгрывается до проверки условия,
     * поэтому пропущенный эффект с диапазоном тоже тратит бросок
     */
    public List<EffectResult> applyEffects(List<Effect> effects, ConditionEvaluator evaluator) {
        List<EffectResult> results = new ArrayList<>();
        if (effects == null) {
            return results;
        }

        for (Effect effect : effects) {
            double amount = effect.getValue().resolve(evaluator.getRandomSource());

            if (effect.getCondition() != null && !evaluator.evaluate(effect.getCondition(), session)) {
                log.debug("⏭️ Эффект на {} пропущен: условие не выполнено", effect.getAttribute());
                continue;
            }

            String attribute = effect.getAttribute();
            double oldValue = get(attribute);
            modify(attribute, amount, effect.getOperation());
            results.add(new EffectResult(attribute, oldValue, get(attribute)));
        }
        return results;
    }

    /**
     * Положение значения между границами в процентах (0..100).
     * Деньги идут по логарифмической шкале, для неизвестного атрибута - 50
     */
    public double percentage(String attribute) {
        Attribute known = Attribute.fromKey(attribute);
        if (known == null) {
            return 50;
        }
        double value = get(attribute);

        double percentage;
        if (known == Attribute.MONETARY) {
            double minLog = Math.log10(Math.max(1, Math.abs(known.getMin())));
            double maxLog = Math.log10(Math.max(1, known.getMax()));
            double valueLog = Math.log10(Math.max(1, Math.abs(value)));
            percentage = (valueLog - minLog) / (maxLog - minLog) * 100;
        } else {
            percentage = (value - known.getMin()) / (known.getMax() - known.getMin()) * 100;
        }
        return Math.max(0, Math.min(100, percentage));
    }

    public Map<String, Double> getAll() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public double average(List<String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (String attribute : attributes) {
            sum += get(attribute);
        }
        return sum / attributes.size();
    }

    /**
     * Среднее по лицу, настроению и здоровью
     */
    public double average() {
        return average(WELLBEING);
    }

    public void clampAll() {
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            Attribute known = Attribute.fromKey(entry.getKey());
            if (known != null) {
                entry.setValue(known.clamp(entry.getValue()));
            }
        }
    }

    void replaceAll(Map<String, Double> newValues) {
        values.clear();
        if (newValues != null) {
            newValues.forEach((key, value) -> {
                if (key != null && value != null) {
                    values.put(key, value);
                }
            });
        }
    }

    void resetToDefaults() {
        values.clear();
        for (Attribute attribute : Attribute.values()) {
            values.put(attribute.getKey(), attribute.getDefaultValue());
        }
    }
}
