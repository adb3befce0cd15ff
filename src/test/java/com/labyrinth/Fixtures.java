package com.labyrinth;

import com.labyrinth.model.Coordinate;
import com.labyrinth.model.GameSession;
import com.labyrinth.model.GridMap;
import com.labyrinth.model.Hero;
import com.labyrinth.model.Labyrinth;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Shared game objects for tests, built on the classic layout.
 */
public final class Fixtures {

    public static final List<List<Integer>> CLASSIC_GRID = List.of(
            List.of(0, 0, 0, 0, 2, 1, 1, 1),
            List.of(0, 0, 2, 0, 0, 1, 0, 0),
            List.of(0, 1, 1, 1, 0, 1, 2, 0),
            List.of(1, 1, 0, 1, 1, 1, 0, 0));

    public static final Coordinate START = Coordinate.of(3, 0);
    public static final Coordinate KEY = Coordinate.of(1, 2);
    public static final Coordinate HEART = Coordinate.of(0, 4);
    public static final Coordinate GOLEM = Coordinate.of(0, 7);

    private Fixtures() {}

    public static GridMap classicGrid() {
        return GridMap.fromRows(CLASSIC_GRID);
    }

    /** Classic labyrinth with the key in place and no fire. */
    public static Labyrinth classicLabyrinth() {
        return Labyrinth.builder()
                .grid(classicGrid())
                .keyPresent(true)
                .keyCoordinate(KEY)
                .hearts(new LinkedHashSet<>(List.of(HEART, Coordinate.of(2, 6))))
                .golemCoordinate(GOLEM)
                .build();
    }

    public static Hero hero(String name) {
        return Hero.startingAt(name, START);
    }

    public static Hero heroAt(String name, Coordinate position) {
        return Hero.startingAt(name, position);
    }

    public static GameSession session(Hero... heroes) {
        return GameSession.builder()
                .playerLogin("tester")
                .labyrinth(classicLabyrinth())
                .heroes(new ArrayList<>(Arrays.asList(heroes)))
                .build();
    }
}
