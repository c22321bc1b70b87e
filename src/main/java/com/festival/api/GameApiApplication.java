package com.festival.api;

import com.festival.content.ContentLoader;
import com.festival.content.GameContent;
import com.festival.game_engine.GameEngine;
import com.festival.game_rules.JdkRandomSource;
import com.festival.game_rules.RandomSource;
import com.festival.repository.SQLiteSaveRepository;
import com.festival.repository.SaveRepository;
import com.festival.repository.SnapshotCodec;
import com.festival.service.SaveService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot Application для симулятора праздника Весны
 */
@SpringBootApplication
@Configuration
@ComponentScan(basePackages = "com.festival")
public class GameApiApplication {
    private static final Logger log = LoggerFactory.getLogger(GameApiApplication.class);

    public static void main(String[] args) {
        log.info("=== Spring Festival Simulator API Server ===");
        SpringApplication.run(GameApiApplication.class, args);
    }

    @Bean
    public GameContent gameContent(@Value("${game.content.location:}") String location) {
        return new ContentLoader(location).load();
    }

    @Bean
    public RandomSource randomSource(@Value("${game.random.seed:}") String seed) {
        if (seed == null || seed.isBlank()) {
            return new JdkRandomSource();
        }
        try {
            return new JdkRandomSource(Long.parseLong(seed.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Некорректный game.random.seed: " + seed, e);
        }
    }

    @Bean
    public GameEngine gameEngine(GameContent gameContent, RandomSource randomSource) {
        return new GameEngine(gameContent, randomSource);
    }

    @Bean
    public SaveRepository saveRepository(@Value("${game.db.path:}") String dbPath) {
        return dbPath == null || dbPath.isBlank() ? new SQLiteSaveRepository() : new SQLiteSaveRepository(dbPath);
    }

    @Bean
    public SaveService saveService(SaveRepository saveRepository,
                                   @Value("${game.save.slots:5}") int maxSlots) {
        return new SaveService(saveRepository, new SnapshotCodec(), maxSlots);
    }
}
