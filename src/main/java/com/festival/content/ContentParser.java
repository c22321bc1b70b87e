package com.festival.content;

import com.festival.endings.EndingCategory;
import com.festival.endings.EndingDefinition;
import com.festival.endings.ScoreModifier;
import com.festival.events.EventDefinition;
import com.festival.events.FollowUpDelay;
import com.festival.events.FollowUpSpec;
import com.festival.events.OptionDefinition;
import com.festival.events.SpecialOutcome;
import com.festival.game_rules.ComparisonOperator;
import com.festival.game_rules.Condition;
import com.festival.game_rules.ConditionGroup;
import com.festival.game_rules.ConditionType;
import com.festival.game_rules.Effect;
import com.festival.game_rules.EffectOperation;
import com.festival.game_rules.EffectValue;
import com.festival.game_state.CharacterProfile;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Разбор контента в нормализованном формате (characters / events / endings) в типизированные каталоги.
 * Все проверки выполняются здесь: ядро получает только корректный контент
 */
public class ContentParser {
    private static final Gson gson = new GsonBuilder().setLenient().create();

    public List<CharacterProfile> parseCharacters(String json) {
        JsonArray array = rootArray(json, "characters");
        List<CharacterProfile> characters = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (JsonElement element : array) {
            JsonObject obj = asObject(element, "персонаж");
            String id = requireString(obj, "id", "персонаж");
            if (!ids.add(id)) {
                throw new ContentInvalidException("Повторяющийся id персонажа: " + id);
            }
            characters.add(new CharacterProfile(
                id,
                getString(obj, "name", id),
                getString(obj, "title", ""),
                getString(obj, "monologue", ""),
                getString(obj, "avatar", "👤"),
                parseNumberMap(firstObject(obj, "initial_attributes", "initialAttributes"))));
        }
        return characters;
    }

    public List<EventDefinition> parseEvents(String json) {
        JsonArray array = rootArray(json, "events");
        List<EventDefinition> events = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (JsonElement element : array) {
            EventDefinition event = guarded("событие", () -> parseEvent(asObject(element, "событие")));
            if (!ids.add(event.getId())) {
                throw new ContentInvalidException("Повторяющийся id события: " + event.getId());
            }
            events.add(event);
        }
        return events;
    }

    public List<EndingDefinition> parseEndings(String json) {
        JsonArray array = rootArray(json, "endings");
        List<EndingDefinition> endings = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (JsonElement element : array) {
            EndingDefinition ending = guarded("концовка", () -> parseEnding(asObject(element, "концовка")));
            if (!ids.add(ending.getId())) {
                throw new ContentInvalidException("Повторяющийся id концовки: " + ending.getId());
            }
            endings.add(ending);
        }
        return endings;
    }

    /**
     * Ошибки типов Gson (строка вместо числа и т.п.) превращаются в ContentInvalidException
     */
    private static <T> T guarded(String context, Supplier<T> parse) {
        try {
            return parse.get();
        } catch (IllegalStateException | NumberFormatException | UnsupportedOperationException | ClassCastException e) {
            throw new ContentInvalidException("Неверный формат данных (" + context + "): " + e.getMessage(), e);
        }
    }

    EventDefinition parseEvent(JsonObject obj) {
        String id = requireString(obj, "id", "событие");
        String context = "событие " + id;

        JsonArray optionsArray = getArray(obj, "options");
        if (optionsArray.size() == 0) {
            throw new ContentInvalidException("У события нет вариантов ответа: " + id);
        }
        List<OptionDefinition> options = new ArrayList<>();
        for (int i = 0; i < optionsArray.size(); i++) {
            options.add(parseOption(asObject(optionsArray.get(i), context), i, context));
        }

        double weight = getDouble(obj, "weight", EventDefinition.DEFAULT_WEIGHT);
        if (weight < 0) {
            throw new ContentInvalidException("Отрицательный вес у " + context);
        }

        return EventDefinition.builder(id)
            .title(getString(obj, "title", "事件"))
            .description(getString(obj, "description", ""))
            .category(getString(obj, "category", "common"))
            .scene(getString(obj, "scene", "🏠"))
            .location(getString(obj, "location", "未知地点"))
            .npc(getString(obj, "npc", "👤"))
            .npcName(getString(obj, "npcName", "未知"))
            .options(options)
            .triggerConditions(parseConditions(getArray(obj, "triggerConditions"),
                ConditionType.TRIGGER_VOCABULARY, context))
            .weight(weight)
            .onceOnly(getBoolean(obj, "onceOnly", false))
            .mutuallyExclusive(getStringList(obj, "mutuallyExclusive"))
            .prerequisiteEvents(getStringList(obj, "prerequisiteEvents"))
            .exclusiveTo(getStringList(obj, "exclusiveTo"))
            .build();
    }

    OptionDefinition parseOption(JsonObject obj, int index, String eventContext) {
        String id = getString(obj, "id", "opt_" + index);
        String context = eventContext + " / вариант " + id;

        List<Effect> effects = new ArrayList<>();
        for (JsonElement element : getArray(obj, "effects")) {
            effects.add(parseEffect(asObject(element, context), context));
        }

        List<FollowUpSpec> followUps = new ArrayList<>();
        for (JsonElement element : getArray(obj, "followUpEvents")) {
            JsonObject followUp = asObject(element, context);
            followUps.add(new FollowUpSpec(
                requireString(followUp, "eventId", context),
                FollowUpDelay.fromString(getString(followUp, "delay", null)),
                hasValue(followUp, "probability") ? followUp.get("probability").getAsDouble() : null,
                (int) getDouble(followUp, "priority", 0)));
        }

        SpecialOutcome specialOutcome = null;
        if (hasValue(obj, "specialOutcome")) {
            JsonObject outcome = asObject(obj.get("specialOutcome"), context);
            specialOutcome = new SpecialOutcome(requireString(outcome, "type", context), getString(outcome, "message", null));
        }

        Map<String, Object> flags = new LinkedHashMap<>();
        if (hasValue(obj, "setFlags")) {
            for (Map.Entry<String, JsonElement> entry : asObject(obj.get("setFlags"), context).entrySet()) {
                flags.put(entry.getKey(), toFlagValue(entry.getValue()));
            }
        }

        return OptionDefinition.builder(id)
            .text(getString(obj, "text", "选择"))
            .effects(effects)
            .availabilityConditions(parseConditions(getArray(obj, "availabilityConditions"),
                ConditionType.OPTION_VOCABULARY, context))
            .unavailableText(getString(obj, "unavailableText", null))
            .visibilityConditions(parseConditions(getArray(obj, "visibilityConditions"),
                ConditionType.OPTION_VOCABULARY, context))
            .followUpEvents(followUps)
            .setFlags(flags)
            .specialOutcome(specialOutcome)
            .feedback(getString(obj, "feedback", null))
            .build();
    }

    Effect parseEffect(JsonObject obj, String context) {
        String attribute = requireString(obj, "attribute", context);
        if (!obj.has("value") || obj.get("value").isJsonNull()) {
            throw new ContentInvalidException("Эффект без значения: " + context);
        }

        JsonElement rawValue = obj.get("value");
        EffectValue value;
        try {
            if (rawValue.isJsonObject()) {
                JsonObject range = rawValue.getAsJsonObject();
                value = EffectValue.range(range.get("min").getAsInt(), range.get("max").getAsInt());
            } else {
                value = EffectValue.of(rawValue.getAsDouble());
            }
        } catch (IllegalArgumentException | IllegalStateException | NullPointerException e) {
            throw new ContentInvalidException("Неверное значение эффекта (" + context + "): " + rawValue, e);
        }

        Condition condition = null;
        if (hasValue(obj, "condition")) {
            condition = parseCondition(asObject(obj.get("condition"), context), ConditionType.OPTION_VOCABULARY, context);
        }
        return new Effect(attribute, EffectOperation.fromString(getString(obj, "operation", null)), value, condition);
    }

    EndingDefinition parseEnding(JsonObject obj) {
        String id = requireString(obj, "id", "концовка");
        String context = "концовка " + id;

        List<ConditionGroup> groups = new ArrayList<>();
        for (JsonElement element : getArray(obj, "unlockConditions")) {
            JsonObject group = asObject(element, context);
            groups.add(new ConditionGroup(parseConditions(getArray(group, "conditions"),
                ConditionType.ENDING_VOCABULARY, context)));
        }

        double baseScore = 0;
        List<ScoreModifier> modifiers = new ArrayList<>();
        if (hasValue(obj, "score")) {
            JsonElement score = obj.get("score");
            if (score.isJsonPrimitive()) {
                baseScore = score.getAsDouble();
            } else {
                JsonObject scoreObj = asObject(score, context);
                baseScore = getDouble(scoreObj, "base", 0);
                for (JsonElement element : getArray(scoreObj, "modifiers")) {
                    JsonObject modifier = asObject(element, context);
                    modifiers.add(new ScoreModifier(
                        parseCondition(asObject(modifier.get("condition"), context), ConditionType.ENDING_VOCABULARY, context),
                        getDouble(modifier, "value", 0)));
                }
            }
        }

        return EndingDefinition.builder(id)
            .title(getString(obj, "title", "结局"))
            .description(getString(obj, "description", ""))
            .category(EndingCategory.fromString(getString(obj, "category", null)))
            .icon(getString(obj, "icon", null))
            .priority((int) getDouble(obj, "priority", 0))
            .characterId(getString(obj, "characterId", null))
            .unlockConditions(groups)
            .baseScore(baseScore)
            .scoreModifiers(modifiers)
            .hidden(getBoolean(obj, "hidden", false))
            .build();
    }

    List<Condition> parseConditions(JsonArray array, Set<ConditionType> vocabulary, String context) {
        List<Condition> conditions = new ArrayList<>();
        for (JsonElement element : array) {
            conditions.add(parseCondition(asObject(element, context), vocabulary, context));
        }
        return conditions;
    }

    /**
     * Условие в виде {type, params: {...}} или плоском виде {type, ...}
     */
    Condition parseCondition(JsonObject obj, Set<ConditionType> vocabulary, String context) {
        String typeName = requireString(obj, "type", context);
        ConditionType type = ConditionType.fromString(typeName);
        if (type == null) {
            throw new ContentInvalidException("Неизвестный вид условия '" + typeName + "' (" + context + ")");
        }
        if (!vocabulary.contains(type)) {
            throw new ContentInvalidException("Условие '" + typeName + "' здесь недопустимо (" + context + ")");
        }

        JsonObject params = obj.has("params") && obj.get("params").isJsonObject() ? obj.getAsJsonObject("params") : obj;
        try {
            return switch (type) {
                case ATTRIBUTE -> new Condition.AttributeCondition(
                    requireString(params, "attribute", context),
                    ComparisonOperator.fromSymbol(getString(params, "operator", null)),
                    requireDouble(params, "value", context));
                case FLAG -> Condition.flag(requireString(params, "flagName", context),
                    hasValue(params, "flagValue") ? toFlagValue(params.get("flagValue")) : null);
                case RANDOM -> Condition.random(requireDouble(params, "probability", context));
                case TIME -> parseTime(params);
                case PROBABILITY -> Condition.probability(requireDouble(params, "baseRate", context),
                    getBoolean(params, "luckModifier", false));
                case EVENT_HISTORY -> Condition.eventHistory(requireString(params, "eventId", context),
                    getBoolean(params, "triggered", true));
                case CHARACTER -> Condition.character(new LinkedHashSet<>(getStringList(params, "characterIds")));
                case EVENT_TRIGGERED -> Condition.eventTriggered(requireString(params, "eventId", context),
                    hasValue(params, "choiceIndex") ? params.get("choiceIndex").getAsInt() : null);
                case COMBINATION -> Condition.combination(
                    parseConditions(getArray(params, "conditions"), vocabulary, context));
            };
        } catch (IllegalStateException | NumberFormatException | UnsupportedOperationException e) {
            throw new ContentInvalidException("Неверные параметры условия '" + typeName + "' (" + context + ")", e);
        }
    }

    private Condition parseTime(JsonObject params) {
        Set<Integer> days = hasValue(params, "days") ? intSet(params.getAsJsonArray("days")) : null;
        Set<Integer> periods = hasValue(params, "periods") ? intSet(params.getAsJsonArray("periods")) : null;
        Integer dayMin = null;
        Integer dayMax = null;
        if (hasValue(params, "dayRange")) {
            JsonObject range = params.getAsJsonObject("dayRange");
            dayMin = hasValue(range, "min") ? range.get("min").getAsInt() : null;
            dayMax = hasValue(range, "max") ? range.get("max").getAsInt() : null;
        }
        return Condition.time(days, periods, dayMin, dayMax);
    }

    // JSON helpers

    private static JsonArray rootArray(String json, String key) {
        JsonElement root;
        try {
            root = gson.fromJson(json, JsonElement.class);
        } catch (JsonParseException e) {
            throw new ContentInvalidException("Некорректный JSON (" + key + "): " + e.getMessage(), e);
        }
        if (root == null || root.isJsonNull()) {
            throw new ContentInvalidException("Пустой документ: " + key);
        }
        if (root.isJsonArray()) {
            return root.getAsJsonArray();
        }
        if (root.isJsonObject() && root.getAsJsonObject().has(key) && root.getAsJsonObject().get(key).isJsonArray()) {
            return root.getAsJsonObject().getAsJsonArray(key);
        }
        throw new ContentInvalidException("Ожидался массив '" + key + "'");
    }

    static JsonObject asObject(JsonElement element, String context) {
        if (element == null || !element.isJsonObject()) {
            throw new ContentInvalidException("Ожидался объект (" + context + ")");
        }
        return element.getAsJsonObject();
    }

    static boolean hasValue(JsonObject obj, String key) {
        return obj.has(key) && !obj.get(key).isJsonNull();
    }

    static String requireString(JsonObject obj, String key, String context) {
        String value = getString(obj, key, null);
        if (value == null || value.isBlank()) {
            throw new ContentInvalidException("Отсутствует поле '" + key + "' (" + context + ")");
        }
        return value;
    }

    static String getString(JsonObject obj, String key, String defaultValue) {
        return hasValue(obj, key) && obj.get(key).isJsonPrimitive() ? obj.get(key).getAsString() : defaultValue;
    }

    static double requireDouble(JsonObject obj, String key, String context) {
        if (!hasValue(obj, key)) {
            throw new ContentInvalidException("Отсутствует поле '" + key + "' (" + context + ")");
        }
        return obj.get(key).getAsDouble();
    }

    static double getDouble(JsonObject obj, String key, double defaultValue) {
        return hasValue(obj, key) ? obj.get(key).getAsDouble() : defaultValue;
    }

    static boolean getBoolean(JsonObject obj, String key, boolean defaultValue) {
        return hasValue(obj, key) ? obj.get(key).getAsBoolean() : defaultValue;
    }

    static JsonArray getArray(JsonObject obj, String key) {
        return hasValue(obj, key) && obj.get(key).isJsonArray() ? obj.getAsJsonArray(key) : new JsonArray();
    }

    static List<String> getStringList(JsonObject obj, String key) {
        List<String> values = new ArrayList<>();
        for (JsonElement element : getArray(obj, key)) {
            if (!element.isJsonNull()) {
                values.add(element.getAsString());
            }
        }
        return values;
    }

    private static JsonObject firstObject(JsonObject obj, String... keys) {
        for (String key : keys) {
            if (hasValue(obj, key) && obj.get(key).isJsonObject()) {
                return obj.getAsJsonObject(key);
            }
        }
        return new JsonObject();
    }

    private static Map<String, Double> parseNumberMap(JsonObject obj) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : obj.entrySet()) {
            if (entry.getValue().isJsonPrimitive() && entry.getValue().getAsJsonPrimitive().isNumber()) {
                values.put(entry.getKey(), entry.getValue().getAsDouble());
            }
        }
        return values;
    }

    private static Set<Integer> intSet(JsonArray array) {
        Set<Integer> values = new LinkedHashSet<>();
        for (JsonElement element : array) {
            values.add(element.getAsInt());
        }
        return values;
    }

    /**
     * Значение флага: строка, число (double) или boolean
     */
    static Object toFlagValue(JsonElement element) {
        if (element == null || element.isJsonNull() || !element.isJsonPrimitive()) {
            return null;
        }
        var primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) return primitive.getAsBoolean();
        if (primitive.isNumber()) return primitive.getAsDouble();
        return primitive.getAsString();
    }
}
