package com.festival.content;

import com.festival.endings.EndingDefinition;
import com.festival.events.EventDefinition;
import com.festival.game_state.CharacterProfile;

import java.util.List;
import java.util.Optional;

/**
 * Неизменяемый каталог контента: события, концовки и персонажи.
 * Загружается один раз и разделяется всеми сессиями
 */
public class GameContent {
    private final List<EventDefinition> events;
    private final List<EndingDefinition> endings;
    private final List<CharacterProfile> characters;

    public GameContent(List<EventDefinition> events, List<EndingDefinition> endings,
                       List<CharacterProfile> characters) {
        this.events = events != null ? List.copyOf(events) : List.of();
        this.endings = endings != null ? List.copyOf(endings) : List.of();
        this.characters = characters != null ? List.copyOf(characters) : List.of();
    }

    public static GameContent empty() {
        return new GameContent(List.of(), List.of(), List.of());
    }

    public Optional<EventDefinition> findEvent(String eventId) {
        return events.stream().filter(event -> event.getId().equals(eventId)).findFirst();
    }

    public Optional<EndingDefinition> findEnding(String endingId) {
        return endings.stream().filter(ending -> ending.getId().equals(endingId)).findFirst();
    }

    public Optional<CharacterProfile> findCharacter(String characterId) {
        return characters.stream().filter(character -> character.getId().equals(characterId)).findFirst();
    }

    public List<EventDefinition> getEvents() { return events; }
    public List<EndingDefinition> getEndings() { return endings; }
    public List<CharacterProfile> getCharacters() { return characters; }
}
