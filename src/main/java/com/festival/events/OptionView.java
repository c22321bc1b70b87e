package com.festival.events;

/**
 * Вариант ответа в том виде, в каком его видит игрок: с исходным индексом и признаком доступности
 */
public class OptionView {
    private final OptionDefinition option;
    private final int index;
    private final boolean available;
    private final String unavailableReason;

    public OptionView(OptionDefinition option, int index, boolean available, String unavailableReason) {
        this.option = option;
        this.index = index;
        this.available = available;
        this.unavailableReason = unavailableReason;
    }

    public OptionDefinition getOption() { return option; }

    /**
     * Индекс варианта в списке события, а не в отфильтрованном списке
     */
    public int getIndex() { return index; }
    public boolean isAvailable() { return available; }
    public String getUnavailableReason() { return unavailableReason; }
}
