package com.labyrinth.service;

import com.labyrinth.Fixtures;
import com.labyrinth.model.CellType;
import com.labyrinth.model.Coordinate;
import com.labyrinth.model.GridMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for fire cell placement.
 */
class HazardGeneratorTest {

    private final GridMap grid = Fixtures.classicGrid();

    @Test
    @DisplayName("always yields 4 distinct plain floor cells on the classic grid")
    void shouldYieldFourFloorCells() {
        for (long seed = 0; seed < 200; seed++) {
            Set<Coordinate> hazards = new HazardGenerator(new Random(seed)).regenerateHazards(grid);

            assertEquals(4, hazards.size(), "seed " + seed);
            for (Coordinate cell : hazards) {
                assertEquals(CellType.FLOOR, grid.cellType(cell), "seed " + seed + " put fire on " + cell);
            }
        }
    }

    @Test
    @DisplayName("same seed gives the same hazards")
    void shouldBeDeterministicForSeed() {
        Set<Coordinate> first = new HazardGenerator(new Random(42)).regenerateHazards(grid);
        Set<Coordinate> second = new HazardGenerator(new Random(42)).regenerateHazards(grid);

        assertEquals(List.copyOf(first), List.copyOf(second));
    }

    @Test
    @DisplayName("can cover every floor cell when asked for all of them")
    void shouldFillAllFloorCells() {
        Set<Coordinate> hazards = new HazardGenerator(new Random(1)).regenerateHazards(grid, 13);

        assertEquals(Set.copyOf(grid.floorCells()), hazards);
    }

    @Test
    @DisplayName("fails fast when the grid has too few floor cells")
    void shouldFailWithTooFewFloorCells() {
        GridMap tiny = GridMap.fromRows(List.of(List.of(1, 1, 2, 0), List.of(0, 1, 0, 2)));
        HazardGenerator generator = new HazardGenerator(new Random(3));

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> generator.regenerateHazards(tiny));
        assertTrue(ex.getMessage().contains("3 floor cells"));
    }
}
