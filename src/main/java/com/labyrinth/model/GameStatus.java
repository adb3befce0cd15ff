package com.labyrinth.model;

/**
 * Represents the overall status of a game session.
 */
public enum GameStatus {
    IN_PROGRESS,
    VICTORY,
    ALL_HEROES_DEAD,
    QUIT;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
