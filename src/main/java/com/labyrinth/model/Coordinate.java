package com.labyrinth.model;

import java.util.List;

/**
 * A cell address in the labyrinth grid: row first, then column.
 *
 * @param row    zero-based row, 0 is the top row
 * @param column zero-based column, 0 is the leftmost column
 */
public record Coordinate(int row, int column) {

    public static Coordinate of(int row, int column) {
        return new Coordinate(row, column);
    }

    /**
     * Builds a coordinate from a persisted {@code [row, column]} pair.
     *
     * @throws IllegalArgumentException if the pair does not hold exactly two values
     */
    public static Coordinate fromPair(List<Integer> pair) {
        if (pair == null || pair.size() != 2) {
            throw new IllegalArgumentException("Coordinate pair must have exactly two values: " + pair);
        }
        return new Coordinate(pair.get(0), pair.get(1));
    }

    public List<Integer> toPair() {
        return List.of(row, column);
    }

    public Coordinate step(Direction direction) {
        return new Coordinate(row + direction.getRowDelta(), column + direction.getColumnDelta());
    }

    @Override
    public String toString() {
        return "(" + row + ", " + column + ")";
    }
}
