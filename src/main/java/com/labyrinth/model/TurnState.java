package com.labyrinth.model;

/**
 * States of the turn engine. The last three are terminal.
 */
public enum TurnState {
    AWAITING_ACTION,    // active hero is choosing an action
    TURN_COMPLETE,      // turn consumed, next hero is up in the same round
    ROUND_COMPLETE,     // turn index wrapped and a new round has started
    HERO_ELIMINATED,    // active hero died and left the roster
    ALL_HEROES_DEAD,
    VICTORY,
    QUIT;

    public boolean isTerminal() {
        return this == ALL_HEROES_DEAD || this == VICTORY || this == QUIT;
    }
}
