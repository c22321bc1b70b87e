package com.festival.content;

import com.festival.endings.EndingDefinition;
import com.festival.events.EventDefinition;
import com.festival.game_state.CharacterProfile;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Загрузка каталогов контента.
 * Источник - каталог на диске или http(s) адрес с файлами авторского формата;
 * при любой ошибке используется контент, встроенный в приложение
 */
public class ContentLoader {
    private static final Logger log = LoggerFactory.getLogger(ContentLoader.class);

    static final String BUNDLED_PREFIX = "content/";
    static final String CHARACTERS_FILE = "characters.json";
    static final String COMMON_EVENTS_FILE = "common_events.json";
    static final String CHARACTER_EVENTS_FILE = "character_events.json";
    static final String ENDINGS_FILE = "endings.json";
    static final String BUNDLED_EVENTS_FILE = "events.json";

    private final String location;
    private final OkHttpClient httpClient;
    private final ContentParser parser = new ContentParser();
    private final AuthoredContentConverter converter = new AuthoredContentConverter();

    public ContentLoader() {
        this(getLocationFromEnv());
    }

    public ContentLoader(String location) {
        this(location, new OkHttpClient());
    }

    public ContentLoader(String location, OkHttpClient httpClient) {
        this.location = location;
        this.httpClient = httpClient;
    }

    private static String getLocationFromEnv() {
        String location = System.getenv("GAME_CONTENT_LOCATION");
        if (location == null || location.isEmpty()) {
            location = System.getProperty("game.content.location");
        }
        return location;
    }

    /**
     * Каталоги из настроенного источника, а при ошибке - встроенные
     */
    public GameContent load() {
        if (location == null || location.isBlank()) {
            return loadBundled();
        }
        try {
            GameContent content = loadAuthored();
            log.info("📚 Контент загружен из {}: {} событий, {} концовок, {} персонажей",
                location, content.getEvents().size(), content.getEndings().size(), content.getCharacters().size());
            return content;
        } catch (IOException | ContentInvalidException | InvalidPathException
                 | IllegalStateException | NumberFormatException | UnsupportedOperationException e) {
            log.warn("⚠️ Не удалось загрузить контент из {}, используются встроенные данные: {}", location, e.getMessage());
            return loadBundled();
        }
    }

    /**
     * Встроенный контент из classpath. Ошибка в нем - ошибка сборки, поэтому исключение не перехватывается
     */
    public GameContent loadBundled() {
        GameContent content = validate(new GameContent(
            parser.parseEvents(readResource(BUNDLED_PREFIX + BUNDLED_EVENTS_FILE)),
            parser.parseEndings(readResource(BUNDLED_PREFIX + ENDINGS_FILE)),
            parser.parseCharacters(readResource(BUNDLED_PREFIX + CHARACTERS_FILE))));
        log.info("📦 Встроенный контент: {} событий, {} концовок, {} персонажей",
            content.getEvents().size(), content.getEndings().size(), content.getCharacters().size());
        return content;
    }

    GameContent loadAuthored() throws IOException {
        List<CharacterProfile> characters = parser.parseCharacters(read(CHARACTERS_FILE));

        List<EventDefinition> events = new ArrayList<>();
        events.addAll(converter.convertCommonEvents(read(COMMON_EVENTS_FILE)));
        events.addAll(converter.convertCharacterEvents(read(CHARACTER_EVENTS_FILE)));

        List<EndingDefinition> endings = converter.convertEndings(read(ENDINGS_FILE));
        return validate(new GameContent(events, endings, characters));
    }

    /**
     * Проверки, общие для обоих форматов: уникальные id и хотя бы один вариант ответа у события
     */
    static GameContent validate(GameContent content) {
        Set<String> eventIds = new HashSet<>();
        for (EventDefinition event : content.getEvents()) {
            if (!eventIds.add(event.getId())) {
                throw new ContentInvalidException("Повторяющийся id события: " + event.getId());
            }
            if (event.getOptions().isEmpty()) {
                throw new ContentInvalidException("У события нет вариантов ответа: " + event.getId());
            }
        }
        Set<String> endingIds = new HashSet<>();
        for (EndingDefinition ending : content.getEndings()) {
            if (!endingIds.add(ending.getId())) {
                throw new ContentInvalidException("Повторяющийся id концовки: " + ending.getId());
            }
        }
        return content;
    }

    private String read(String fileName) throws IOException {
        if (isRemote()) {
            return fetch(joinUrl(location, fileName));
        }
        return Files.readString(Path.of(location).resolve(fileName), StandardCharsets.UTF_8);
    }

    private boolean isRemote() {
        return location.startsWith("http://") || location.startsWith("https://");
    }

    private String fetch(String url) throws IOException {
        Request request = new Request.Builder()
            .url(url)
            .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("HTTP " + response.code() + " для " + url);
            }
            return response.body().string();
        }
    }

    private static String joinUrl(String base, String fileName) {
        return base.endsWith("/") ? base + fileName : base + "/" + fileName;
    }

    private static String readResource(String path) {
        try (InputStream in = ContentLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new ContentInvalidException("Не найден встроенный ресурс: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ContentInvalidException("Ошибка чтения встроенного ресурса: " + path, e);
        }
    }

    public String getLocation() {
        return location;
    }
}
