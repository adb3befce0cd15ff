package com.labyrinth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the Labyrinth console game.
 *
 * Features:
 * - Up to five local heroes taking turns
 * - Fire hazards that move every round
 * - Per-login saved games
 */
@SpringBootApplication
public class LabyrinthGameApplication {

    public static void main(String[] args) {
        SpringApplication.run(LabyrinthGameApplication.class, args);
    }
}
