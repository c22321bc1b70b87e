package com.festival.endings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Итог прохождения: выбранная концовка, очки и рассказ
 */
public class EndingResult {
    private final EndingDefinition ending;
    private final String icon;
    private final long score;
    private final List<String> story;
    private final Map<String, Double> finalAttributes;
    private final EndingStats stats;

    public EndingResult(EndingDefinition ending, long score, List<String> story,
                        Map<String, Double> finalAttributes, EndingStats stats) {
        this.ending = ending;
        this.icon = ending.getDisplayIcon();
        this.score = score;
        this.story = List.copyOf(story);
        this.finalAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(finalAttributes));
        this.stats = stats;
    }

    public String getId() { return ending.getId(); }
    public String getTitle() { return ending.getTitle(); }
    public String getDescription() { return ending.getDescription(); }
    public EndingCategory getCategory() { return ending.getCategory(); }
    public EndingDefinition getEnding() { return ending; }
    public String getIcon() { return icon; }
    public long getScore() { return score; }
    public List<String> getStory() { return story; }
    public Map<String, Double> getFinalAttributes() { return finalAttributes; }
    public EndingStats getStats() { return stats; }
}
