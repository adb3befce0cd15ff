package com.labyrinth.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Wiring for collaborators that are not plain services.
 */
@Configuration
@Slf4j
public class GameConfig {

    /**
     * Random source for hazard placement. Setting {@code labyrinth.hazard-seed} makes every
     * round's fire cells reproducible.
     */
    @Bean
    public Random hazardRandom(@Value("${labyrinth.hazard-seed:#{null}}") Long seed) {
        if (seed != null) {
            log.info("Hazard placement seeded with {}", seed);
            return new Random(seed);
        }
        return new SecureRandom();
    }
}
