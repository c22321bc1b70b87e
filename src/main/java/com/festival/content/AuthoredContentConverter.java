package com.festival.content;

import com.festival.endings.EndingCategory;
import com.festival.endings.EndingDefinition;
import com.festival.events.EventDefinition;
import com.festival.events.OptionDefinition;
import com.festival.game_rules.ComparisonOperator;
import com.festival.game_rules.Condition;
import com.festival.game_rules.ConditionGroup;
import com.festival.game_rules.Effect;
import com.festival.game_state.Attribute;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.festival.content.ContentParser.getArray;
import static com.festival.content.ContentParser.getDouble;
import static com.festival.content.ContentParser.getString;
import static com.festival.content.ContentParser.hasValue;

/**
 * Перевод авторского формата файлов (common_events / character_events / endings)
 * в типизированные каталоги. Пропущенные id генерируются, остальное заполняется значениями по умолчанию
 */
public class AuthoredContentConverter {
    private static final Gson gson = new GsonBuilder().setLenient().create();

    static final double DEFAULT_PROBABILITY = 0.25;
    static final double DEFAULT_ENDING_SCORE = 500;

    private static final Map<String, String> SCENE_EMOJI = new LinkedHashMap<>();
    static {
        SCENE_EMOJI.put("红包", "🧧");
        SCENE_EMOJI.put("拜年", "🏮");
        SCENE_EMOJI.put("饭", "🍜");
        SCENE_EMOJI.put("吃", "🍜");
        SCENE_EMOJI.put("麻将", "🎰");
        SCENE_EMOJI.put("赌", "🎲");
        SCENE_EMOJI.put("购物", "🛍️");
        SCENE_EMOJI.put("买", "🛍️");
        SCENE_EMOJI.put("烟花", "🎆");
        SCENE_EMOJI.put("健身", "🏋️");
        SCENE_EMOJI.put("医生", "🏥");
        SCENE_EMOJI.put("病", "🏥");
        SCENE_EMOJI.put("回家", "🚗");
        SCENE_EMOJI.put("高铁", "🚄");
        SCENE_EMOJI.put("堵车", "🚗");
        SCENE_EMOJI.put("大扫除", "🧹");
        SCENE_EMOJI.put("贴春联", "🧧");
        SCENE_EMOJI.put("初一", "🧧");
        SCENE_EMOJI.put("除夕", "🎊");
        SCENE_EMOJI.put("亲戚", "👨‍👩‍👧‍👦");
        SCENE_EMOJI.put("相亲", "💕");
        SCENE_EMOJI.put("熊孩子", "👶");
        SCENE_EMOJI.put("迎财神", "💰");
        SCENE_EMOJI.put("催婚", "💔");
        SCENE_EMOJI.put("灵魂拷问", "❓");
    }

    private static final Map<String, EndingCategory> ENDING_TYPES = Map.of(
        "success", EndingCategory.GOOD,
        "failure", EndingCategory.BAD,
        "special", EndingCategory.SECRET,
        "hidden", EndingCategory.SECRET,
        "normal", EndingCategory.NORMAL
    );

    /**
     * Общие события: повторяемые, вес = вероятность * 100
     */
    public List<EventDefinition> convertCommonEvents(String json) {
        JsonArray array = rootArray(json, "events");
        List<EventDefinition> events = new ArrayList<>();

        for (int i = 0; i < array.size(); i++) {
            JsonObject obj = ContentParser.asObject(array.get(i), "общее событие #" + i);
            JsonObject trigger = hasValue(obj, "trigger_condition") && obj.get("trigger_condition").isJsonObject()
                ? obj.getAsJsonObject("trigger_condition") : new JsonObject();
            String title = getString(obj, "event_name", "事件");

            events.add(EventDefinition.builder(getString(obj, "event_id", "common_" + i))
                .title(title)
                .description(getString(obj, "description", ""))
                .category(getString(obj, "type", "common"))
                .scene(sceneEmoji(title))
                .location(getString(trigger, "scene", "未知地点"))
                .npc("👤")
                .npcName("路人")
                .weight(Math.floor(getDouble(trigger, "probability", DEFAULT_PROBABILITY) * 100))
                .onceOnly(false)
                .options(convertOptions(getArray(obj, "options")))
                .build());
        }
        return events;
    }

    /**
     * События персонажей: одноразовые, только для своего персонажа, в свой день и время суток
     */
    public List<EventDefinition> convertCharacterEvents(String json) {
        JsonArray array = rootArray(json, "events");
        List<EventDefinition> events = new ArrayList<>();

        for (int i = 0; i < array.size(); i++) {
            JsonObject obj = ContentParser.asObject(array.get(i), "событие персонажа #" + i);
            String title = getString(obj, "event_name", "事件");
            String characterId = getString(obj, "character_id", null);

            List<Condition> triggers = new ArrayList<>();
            if (hasValue(obj, "day") && obj.get("day").getAsInt() != 0) {
                triggers.add(Condition.time(
                    Set.of(obj.get("day").getAsInt()),
                    periodIndexes(getString(obj, "time_slot", null)),
                    null, null));
            }

            events.add(EventDefinition.builder(getString(obj, "event_id", "char_" + i))
                .title(title)
                .description(getString(obj, "description", ""))
                .category("character")
                .scene(sceneEmoji(title))
                .location("家中")
                .npc("👤")
                .npcName("家人")
                .weight(EventDefinition.DEFAULT_WEIGHT)
                .onceOnly(true)
                .exclusiveTo(characterId != null && !characterId.isEmpty() ? List.of(characterId) : List.of())
                .triggerConditions(triggers)
                .options(convertOptions(getArray(obj, "options")))
                .build());
        }
        return events;
    }

    public List<EndingDefinition> convertEndings(String json) {
        JsonArray array = rootArray(json, "endings");
        List<EndingDefinition> endings = new ArrayList<>();

        for (int i = 0; i < array.size(); i++) {
            JsonObject obj = ContentParser.asObject(array.get(i), "концовка #" + i);
            String type = getString(obj, "ending_type", getString(obj, "type", "normal"));
            String characterId = getString(obj, "character_id", getString(obj, "characterId", null));
            JsonElement unlock = hasValue(obj, "unlock_conditions") ? obj.get("unlock_conditions") : obj.get("unlockConditions");
            double score = getDouble(obj, "score", 0);

            endings.add(EndingDefinition.builder(getString(obj, "ending_id", "ending_" + i))
                .title(getString(obj, "ending_name", "结局"))
                .description(getString(obj, "description", ""))
                .category(ENDING_TYPES.getOrDefault(type, EndingCategory.fromString(type)))
                .icon(getString(obj, "icon", "🎊"))
                .priority((int) getDouble(obj, "priority", 0))
                .characterId(characterId)
                .unlockConditions(convertUnlockConditions(unlock))
                .baseScore(score != 0 ? score : DEFAULT_ENDING_SCORE)
                .build());
        }
        return endings;
    }

    List<OptionDefinition> convertOptions(JsonArray array) {
        List<OptionDefinition> options = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            JsonObject obj = ContentParser.asObject(array.get(i), "вариант #" + i);
            String feedback = getString(obj, "result_desc", "");
            options.add(OptionDefinition.builder(getString(obj, "option_id", "opt_" + i))
                .text(getString(obj, "text", "选择"))
                .effects(convertEffects(hasValue(obj, "effects") && obj.get("effects").isJsonObject()
                    ? obj.getAsJsonObject("effects") : new JsonObject()))
                .feedback(feedback)
                .build());
        }
        return options;
    }

    /**
     * Эффекты вида {"deposit": -200, "mood": 5}; нулевые и неизвестные ключи пропускаются
     */
    List<Effect> convertEffects(JsonObject effects) {
        List<Effect> result = new ArrayList<>();
        for (Map.Entry<String, JsonElement> entry : effects.entrySet()) {
            if (Attribute.fromKey(entry.getKey()) == null || !entry.getValue().isJsonPrimitive()) {
                continue;
            }
            double value = entry.getValue().getAsDouble();
            if (value != 0) {
                result.add(Effect.add(entry.getKey(), value));
            }
        }
        return result;
    }

    /**
     * Условия открытия концовки: список групп [{conditions: [...]}] или объект с ключами min_* / max_*
     */
    List<ConditionGroup> convertUnlockConditions(JsonElement conditions) {
        List<ConditionGroup> groups = new ArrayList<>();
        if (conditions == null || conditions.isJsonNull()) {
            return groups;
        }

        if (conditions.isJsonArray()) {
            for (JsonElement element : conditions.getAsJsonArray()) {
                JsonObject group = ContentParser.asObject(element, "условия концовки");
                List<Condition> list = new ArrayList<>();
                for (JsonElement c : getArray(group, "conditions")) {
                    JsonObject cond = ContentParser.asObject(c, "условие концовки");
                    list.add(new Condition.AttributeCondition(
                        ContentParser.requireString(cond, "attribute", "условие концовки"),
                        ComparisonOperator.fromSymbol(getString(cond, "operator", ">=")),
                        ContentParser.requireDouble(cond, "value", "условие концовки")));
                }
                groups.add(new ConditionGroup(list));
            }
            return groups;
        }

        if (conditions.isJsonObject()) {
            JsonObject obj = conditions.getAsJsonObject();
            List<Condition> list = new ArrayList<>();
            for (Attribute attribute : Attribute.values()) {
                String minKey = "min_" + attribute.getKey();
                String maxKey = "max_" + attribute.getKey();
                if (hasValue(obj, minKey)) {
                    list.add(new Condition.AttributeCondition(attribute.getKey(),
                        ComparisonOperator.GREATER_OR_EQUAL, obj.get(minKey).getAsDouble()));
                }
                if (hasValue(obj, maxKey)) {
                    list.add(new Condition.AttributeCondition(attribute.getKey(),
                        ComparisonOperator.LESS_OR_EQUAL, obj.get(maxKey).getAsDouble()));
                }
            }
            if (!list.isEmpty()) {
                groups.add(new ConditionGroup(list));
            }
        }
        return groups;
    }

    /**
     * Время суток в индексы периодов; неизвестное значение - весь день
     */
    static Set<Integer> periodIndexes(String timeSlot) {
        if (timeSlot == null) {
            return new LinkedHashSet<>(List.of(0, 1, 2));
        }
        return switch (timeSlot) {
            case "morning" -> Set.of(0);
            case "noon", "afternoon" -> Set.of(1);
            case "evening", "night" -> Set.of(2);
            default -> new LinkedHashSet<>(List.of(0, 1, 2));
        };
    }

    static String sceneEmoji(String eventName) {
        if (eventName != null) {
            for (Map.Entry<String, String> entry : SCENE_EMOJI.entrySet()) {
                if (eventName.contains(entry.getKey())) {
                    return entry.getValue();
                }
            }
        }
        return "🏠";
    }

    private static JsonArray rootArray(String json, String key) {
        try {
            JsonElement root = gson.fromJson(json, JsonElement.class);
            if (root != null && root.isJsonObject()) {
                return getArray(root.getAsJsonObject(), key);
            }
            if (root != null && root.isJsonArray()) {
                return root.getAsJsonArray();
            }
            return new JsonArray();
        } catch (JsonParseException e) {
            throw new ContentInvalidException("Некорректный JSON (" + key + "): " + e.getMessage(), e);
        }
    }
}
