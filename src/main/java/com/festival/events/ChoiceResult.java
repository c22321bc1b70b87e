package com.festival.events;

import com.festival.game_state.EffectResult;

import java.util.List;

/**
 * Итог обработки выбора
 */
public class ChoiceResult {
    private final OptionDefinition option;
    private final int choiceIndex;
    private final List<EffectResult> effectResults;
    private final SpecialOutcome specialOutcome;
    private final String feedback;

    public ChoiceResult(OptionDefinition option, int choiceIndex, List<EffectResult> effectResults,
                        SpecialOutcome specialOutcome, String feedback) {
        this.option = option;
        this.choiceIndex = choiceIndex;
        this.effectResults = effectResults != null ? List.copyOf(effectResults) : List.of();
        this.specialOutcome = specialOutcome;
        this.feedback = feedback;
    }

    /**
     * Особый исход завершает игру без продвижения времени
     */
    public boolean isTerminal() {
        return specialOutcome != null && specialOutcome.isTerminal();
    }

    public OptionDefinition getOption() { return option; }
    public int getChoiceIndex() { return choiceIndex; }
    public List<EffectResult> getEffectResults() { return effectResults; }
    public SpecialOutcome getSpecialOutcome() { return specialOutcome; }
    public String getFeedback() { return feedback; }
}
