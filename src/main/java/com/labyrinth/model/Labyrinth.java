package com.labyrinth.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The terrain grid plus its item and hazard overlay.
 */
@Getter
@Setter
@Builder
@AllArgsConstructor
public class Labyrinth {

    public static final int DEFAULT_HAZARD_COUNT = 4;

    private final GridMap grid;

    @Builder.Default
    private boolean keyPresent = true;

    private Coordinate keyCoordinate;

    @Builder.Default
    private Set<Coordinate> hearts = new LinkedHashSet<>();

    private Coordinate golemCoordinate;

    @Builder.Default
    private int hazardCount = DEFAULT_HAZARD_COUNT;

    /** Cells on fire for the current round. */
    @Builder.Default
    private Set<Coordinate> hazards = new LinkedHashSet<>();

    public boolean isKeyAt(Coordinate coordinate) {
        return keyPresent && coordinate.equals(keyCoordinate);
    }

    public boolean isHeartAt(Coordinate coordinate) {
        return hearts.contains(coordinate);
    }

    public boolean isGolemAt(Coordinate coordinate) {
        return coordinate.equals(golemCoordinate);
    }

    public boolean isHazardAt(Coordinate coordinate) {
        return hazards.contains(coordinate);
    }

    public void takeKey() {
        keyPresent = false;
    }

    /**
     * Put the key back on the board, typically where its carrier died.
     */
    public void dropKey(Coordinate coordinate) {
        keyCoordinate = coordinate;
        keyPresent = true;
    }

    /**
     * Replace the hazard set entirely; nothing carries over from the previous round.
     */
    public void replaceHazards(Set<Coordinate> newHazards) {
        hazards = new LinkedHashSet<>(newHazards);
    }
}
