package com.labyrinth.model;

/**
 * Kinds of action a hero can pick on its turn.
 */
public enum ActionType {
    ATTACK("Attack"),
    PICK_UP_KEY("Pick up the key"),
    HEAL_AT_STATION("Restore health at the heart"),
    MOVE("Move"),
    SELF_HEAL("Self-heal"),
    SAVE_GAME("Save game"),
    QUIT("Quit game");

    private final String label;

    ActionType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
