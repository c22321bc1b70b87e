package com.festival.endings;

import com.festival.game_state.Attribute;
import com.festival.game_state.CharacterProfile;
import com.festival.game_state.GameConfig;
import com.festival.game_state.GameSession;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Рассказ об итогах праздника по конечным и начальным атрибутам
 */
public class StoryNarrator {
    private static final String UNKNOWN_CHARACTER = "未知角色";

    public List<String> narrate(GameSession session) {
        var attributes = session.getAttributes();
        CharacterProfile character = session.getCharacter();
        List<String> story = new ArrayList<>();

        String name = character != null && character.getName() != null ? character.getName() : UNKNOWN_CHARACTER;
        story.add("作为" + name + "，你度过了" + GameConfig.TOTAL_DAYS + "天的春节假期。");

        double depositChange = attributes.get(Attribute.DEPOSIT.getKey()) - session.getInitialAttribute(Attribute.DEPOSIT.getKey());
        if (depositChange > 10000) {
            story.add("你的钱包比假期前更鼓了，财运亨通！");
        } else if (depositChange > 0) {
            story.add("这个春节你还小赚了一笔，不错！");
        } else if (depositChange < -10000) {
            story.add("这个春节花了不少钱，需要好好规划一下财务了。");
        } else if (depositChange < 0) {
            story.add("这个春节略有开销，还在可控范围内。");
        } else {
            story.add("你的财务状况保持平衡。");
        }

        double weightChange = attributes.get(Attribute.WEIGHT.getKey()) - session.getInitialAttribute(Attribute.WEIGHT.getKey());
        if (weightChange > 3) {
            story.add("春节期间美食太多，你的体重增加了" + oneDecimal(weightChange) + "公斤。");
        } else if (weightChange < -2) {
            story.add("你成功控制了体重，甚至还瘦了" + oneDecimal(Math.abs(weightChange)) + "公斤！");
        }

        double mood = attributes.get(Attribute.MOOD.getKey());
        if (mood >= 80) {
            story.add("这个春节你过得非常开心，留下了美好的回忆。");
        } else if (mood >= 60) {
            story.add("这个春节你过得还算愉快。");
        } else if (mood < 40) {
            story.add("这个春节让你感到有些疲惫和郁闷。");
        }

        double health = attributes.get(Attribute.HEALTH.getKey());
        if (health >= 80) {
            story.add("你保持了良好的健康状态，作息规律。");
        } else if (health < 50) {
            story.add("春节期间的应酬让你的身体有些吃不消。");
        }

        double face = attributes.get(Attribute.FACE.getKey());
        if (face >= 80) {
            story.add("你在亲戚朋友面前很有面子，备受尊重。");
        } else if (face < 30) {
            story.add("这个春节让你在某些场合感到有些尴尬。");
        }
        return story;
    }

    private static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
