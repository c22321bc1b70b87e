package com.festival.game_engine;

import com.festival.events.EventDefinition;
import com.festival.events.OptionView;

import java.util.List;

/**
 * Событие хода вместе с вариантами, которые видит игрок
 */
public class EventPresentation {
    private final EventDefinition event;
    private final List<OptionView> options;
    private final int day;
    private final int period;
    private final String timeDescription;

    public EventPresentation(EventDefinition event, List<OptionView> options, int day, int period,
                             String timeDescription) {
        this.event = event;
        this.options = List.copyOf(options);
        this.day = day;
        this.period = period;
        this.timeDescription = timeDescription;
    }

    public EventDefinition getEvent() { return event; }
    public List<OptionView> getOptions() { return options; }
    public int getDay() { return day; }
    public int getPeriod() { return period; }
    public String getTimeDescription() { return timeDescription; }
}
