package com.labyrinth.dto;

import com.labyrinth.model.Coordinate;
import lombok.Builder;
import lombok.Data;

/**
 * Result of a move attempt: where the hero ended up and what happened on arrival.
 */
@Data
@Builder
public class MoveResult {
    private Outcome outcome;
    private Coordinate from;
    private Coordinate to;
    private boolean caughtFire;

    public boolean isTurnConsumed() {
        return outcome != Outcome.RETREAT_DECLINED;
    }

    public enum Outcome {
        MOVED,
        COLLIDED_WITH_WALL,
        RETREAT_DECLINED,
        RETREAT_FATAL,
        SLAIN_BY_GOLEM,
        VICTORY
    }
}
