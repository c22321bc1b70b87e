package com.festival.events;

import com.festival.game_rules.Effect;

/**
 * Встроенное повторяемое событие на случай, когда каталог не предложил ни одного кандидата
 */
public final class DefaultEvent {
    public static final String ID = "default_event";

    private static final EventDefinition INSTANCE = EventDefinition.builder(ID)
        .title("平静的时光")
        .description("没有什么特别的事情发生，你享受了一段平静的时光。")
        .category("random")
        .scene("🏠")
        .location("家中")
        .npc("👤")
        .npcName("自己")
        .options(
            OptionDefinition.builder("relax")
                .text("好好休息")
                .effects(Effect.add("mood", 5))
                .build(),
            OptionDefinition.builder("exercise")
                .text("做些运动")
                .effects(Effect.add("health", 3), Effect.add("weight", -0.5))
                .build(),
            OptionDefinition.builder("snack")
                .text("吃点零食")
                .effects(Effect.add("mood", 3), Effect.add("weight", 0.5))
                .build())
        .build();

    private DefaultEvent() {
    }

    public static EventDefinition get() {
        return INSTANCE;
    }
}
