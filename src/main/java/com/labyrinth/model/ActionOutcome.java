package com.labyrinth.model;

/**
 * What applying a single action did to the active hero's turn.
 */
public enum ActionOutcome {
    TURN_CONSUMED,
    NOT_APPLIED,    // precondition failed, hero chooses again
    SAVED,          // game persisted, hero chooses again
    VICTORY,
    QUIT;

    public boolean endsDecisionLoop() {
        return this == TURN_CONSUMED || this == VICTORY || this == QUIT;
    }
}
