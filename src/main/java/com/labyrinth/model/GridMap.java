package com.labyrinth.model;

import com.labyrinth.exception.GridOutOfBoundsException;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable terrain of a labyrinth.
 * <p>
 * Dimensions and cell codes are fixed at construction; the per-round hazard
 * overlay lives on {@link Labyrinth}, not here.
 */
public final class GridMap {

    private final int[][] cells;
    private final int rows;
    private final int columns;

    private GridMap(int[][] cells) {
        this.cells = cells;
        this.rows = cells.length;
        this.columns = cells[0].length;
    }

    /**
     * Build a grid from row lists of cell codes.
     *
     * @throws IllegalArgumentException if the grid is empty, ragged or holds unknown codes
     */
    public static GridMap fromRows(List<List<Integer>> rows) {
        if (rows == null || rows.isEmpty() || rows.get(0).isEmpty()) {
            throw new IllegalArgumentException("Grid must have at least one row and one column");
        }
        int width = rows.get(0).size();
        int[][] cells = new int[rows.size()][width];
        for (int r = 0; r < rows.size(); r++) {
            List<Integer> row = rows.get(r);
            if (row.size() != width) {
                throw new IllegalArgumentException("Grid row " + r + " has " + row.size()
                        + " cells, expected " + width);
            }
            for (int c = 0; c < width; c++) {
                // validates the code
                cells[r][c] = CellType.fromCode(row.get(c)).getCode();
            }
        }
        return new GridMap(cells);
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public boolean isInBounds(int row, int column) {
        return row >= 0 && row < rows && column >= 0 && column < columns;
    }

    public boolean isInBounds(Coordinate coordinate) {
        return isInBounds(coordinate.row(), coordinate.column());
    }

    /**
     * Get the terrain code at a cell.
     *
     * @throws GridOutOfBoundsException if the cell lies outside the grid
     */
    public int cellCode(int row, int column) {
        if (!isInBounds(row, column)) {
            throw new GridOutOfBoundsException(row, column, rows, columns);
        }
        return cells[row][column];
    }

    public CellType cellType(Coordinate coordinate) {
        return CellType.fromCode(cellCode(coordinate.row(), coordinate.column()));
    }

    public boolean isPassable(int row, int column) {
        return isInBounds(row, column) && CellType.fromCode(cells[row][column]).isPassable();
    }

    public boolean isPassable(Coordinate coordinate) {
        return isPassable(coordinate.row(), coordinate.column());
    }

    public boolean isPlainFloor(Coordinate coordinate) {
        return isInBounds(coordinate) && cells[coordinate.row()][coordinate.column()] == CellType.FLOOR.getCode();
    }

    /**
     * All plain floor cells in row-major order.
     */
    public List<Coordinate> floorCells() {
        List<Coordinate> floor = new ArrayList<>();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                if (cells[r][c] == CellType.FLOOR.getCode()) {
                    floor.add(Coordinate.of(r, c));
                }
            }
        }
        return floor;
    }

    /**
     * Copy of the terrain as row lists, the shape used by layout and save files.
     */
    public List<List<Integer>> toRows() {
        List<List<Integer>> copy = new ArrayList<>(rows);
        for (int[] row : cells) {
            List<Integer> line = new ArrayList<>(columns);
            for (int code : row) {
                line.add(code);
            }
            copy.add(line);
        }
        return copy;
    }
}
