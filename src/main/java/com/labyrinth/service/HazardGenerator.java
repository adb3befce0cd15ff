package com.labyrinth.service;

import com.labyrinth.model.CellType;
import com.labyrinth.model.Coordinate;
import com.labyrinth.model.GridMap;
import com.labyrinth.model.Labyrinth;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Random;
import java.util.Set;

/**
 * Picks the floor cells that catch fire each round.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HazardGenerator {

    private final Random hazardRandom;

    public Set<Coordinate> regenerateHazards(GridMap grid) {
        return regenerateHazards(grid, Labyrinth.DEFAULT_HAZARD_COUNT);
    }

    /**
     * Draw {@code count} distinct plain floor cells uniformly at random, retrying on walls,
     * special floor and repeats.
     *
     * @throws IllegalStateException if the grid has fewer floor cells than requested
     */
    public Set<Coordinate> regenerateHazards(GridMap grid, int count) {
        int available = grid.floorCells().size();
        if (available < count) {
            throw new IllegalStateException("Cannot place " + count + " hazards on a grid with only "
                    + available + " floor cells");
        }

        Set<Coordinate> hazards = new LinkedHashSet<>();
        while (hazards.size() != count) {
            int row = hazardRandom.nextInt(grid.getRows());
            int column = hazardRandom.nextInt(grid.getColumns());
            if (grid.cellCode(row, column) == CellType.FLOOR.getCode()) {
                hazards.add(Coordinate.of(row, column));
            }
        }
        log.debug("Generated hazards: {}", hazards);
        return hazards;
    }
}
