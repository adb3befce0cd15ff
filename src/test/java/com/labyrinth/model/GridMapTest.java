package com.labyrinth.model;

import com.labyrinth.Fixtures;
import com.labyrinth.exception.GridOutOfBoundsException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for terrain queries on the classic grid.
 */
class GridMapTest {

    private final GridMap grid = Fixtures.classicGrid();

    @Test
    @DisplayName("classic grid is 4 rows by 8 columns")
    void shouldHaveClassicDimensions() {
        assertEquals(4, grid.getRows());
        assertEquals(8, grid.getColumns());
    }

    @Nested
    @DisplayName("isPassable()")
    class IsPassableTests {

        @Test
        @DisplayName("floor and special floor are passable")
        void shouldAcceptFloorAndSpecialFloor() {
            assertTrue(grid.isPassable(3, 0), "floor");
            assertTrue(grid.isPassable(1, 2), "special floor");
        }

        @Test
        @DisplayName("walls are not passable")
        void shouldRejectWalls() {
            assertFalse(grid.isPassable(2, 0));
            assertFalse(grid.isPassable(0, 0));
        }

        @Test
        @DisplayName("cells outside the grid are not passable")
        void shouldRejectOutOfBounds() {
            assertFalse(grid.isPassable(-1, 0));
            assertFalse(grid.isPassable(4, 0));
            assertFalse(grid.isPassable(3, -1));
            assertFalse(grid.isPassable(0, 8));
        }
    }

    @Nested
    @DisplayName("cellCode()")
    class CellCodeTests {

        @Test
        @DisplayName("returns the terrain code")
        void shouldReturnCode() {
            assertEquals(0, grid.cellCode(2, 0));
            assertEquals(1, grid.cellCode(3, 0));
            assertEquals(2, grid.cellCode(0, 4));
        }

        @Test
        @DisplayName("fails outside the grid")
        void shouldThrowOutOfBounds() {
            GridOutOfBoundsException ex = assertThrows(GridOutOfBoundsException.class, () -> grid.cellCode(4, 8));
            assertTrue(ex.getMessage().contains("(4, 8)"));
        }
    }

    @Test
    @DisplayName("floorCells() lists only plain floor in row-major order")
    void shouldListFloorCells() {
        List<Coordinate> floor = grid.floorCells();

        assertEquals(13, floor.size());
        assertEquals(Coordinate.of(0, 5), floor.get(0));
        assertEquals(Coordinate.of(3, 5), floor.get(floor.size() - 1));
        assertFalse(floor.contains(Coordinate.of(1, 2)), "special floor is not plain floor");
    }

    @Test
    @DisplayName("toRows() round-trips the layout and is a copy")
    void shouldCopyRows() {
        List<List<Integer>> rows = grid.toRows();
        assertEquals(Fixtures.CLASSIC_GRID, rows);

        rows.get(0).set(0, 1);
        assertEquals(0, grid.cellCode(0, 0), "grid must not change through the copy");
    }

    @Nested
    @DisplayName("fromRows() validation")
    class FromRowsTests {

        @Test
        @DisplayName("rejects ragged rows")
        void shouldRejectRaggedRows() {
            assertThrows(IllegalArgumentException.class,
                    () -> GridMap.fromRows(List.of(List.of(1, 1), List.of(1))));
        }

        @Test
        @DisplayName("rejects unknown cell codes")
        void shouldRejectUnknownCodes() {
            assertThrows(IllegalArgumentException.class, () -> GridMap.fromRows(List.of(List.of(1, 3))));
        }

        @Test
        @DisplayName("rejects an empty grid")
        void shouldRejectEmptyGrid() {
            assertThrows(IllegalArgumentException.class, () -> GridMap.fromRows(List.of()));
        }
    }
}
