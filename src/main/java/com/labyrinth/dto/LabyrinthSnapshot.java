package com.labyrinth.dto;

import com.labyrinth.model.Coordinate;
import com.labyrinth.model.GridMap;
import com.labyrinth.model.Labyrinth;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Persisted labyrinth overlay. The golem is stored as a plain {@code [row, column]} pair.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LabyrinthSnapshot {

    private List<List<Integer>> grid;
    private List<List<Integer>> hazards;
    private List<Integer> keyCoordinate;
    private boolean keyPresent;
    private List<Integer> golemCoordinate;
    private List<List<Integer>> hearts;

    public static LabyrinthSnapshot fromLabyrinth(Labyrinth labyrinth) {
        return LabyrinthSnapshot.builder()
                .grid(labyrinth.getGrid().toRows())
                .hazards(toPairs(labyrinth.getHazards()))
                .keyCoordinate(labyrinth.getKeyCoordinate().toPair())
                .keyPresent(labyrinth.isKeyPresent())
                .golemCoordinate(labyrinth.getGolemCoordinate().toPair())
                .hearts(toPairs(labyrinth.getHearts()))
                .build();
    }

    /**
     * Rebuild the labyrinth.
     *
     * @param fallbackHearts hearts to use when the snapshot predates stored hearts
     */
    public Labyrinth toLabyrinth(Set<Coordinate> fallbackHearts) {
        return Labyrinth.builder()
                .grid(GridMap.fromRows(grid))
                .hazards(toCoordinates(hazards))
                .keyCoordinate(Coordinate.fromPair(keyCoordinate))
                .keyPresent(keyPresent)
                .golemCoordinate(Coordinate.fromPair(golemCoordinate))
                .hearts(hearts != null ? toCoordinates(hearts) : new LinkedHashSet<>(fallbackHearts))
                .build();
    }

    static List<List<Integer>> toPairs(Set<Coordinate> coordinates) {
        return coordinates.stream()
                .map(Coordinate::toPair)
                .toList();
    }

    static Set<Coordinate> toCoordinates(List<List<Integer>> pairs) {
        Set<Coordinate> coordinates = new LinkedHashSet<>();
        if (pairs != null) {
            pairs.forEach(pair -> coordinates.add(Coordinate.fromPair(pair)));
        }
        return coordinates;
    }
}
