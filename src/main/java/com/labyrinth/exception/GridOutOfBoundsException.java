package com.labyrinth.exception;

/**
 * Thrown when a terrain query falls outside the grid.
 * Moves are bounds-checked before any terrain lookup, so this signals a programming error.
 */
public class GridOutOfBoundsException extends IndexOutOfBoundsException {

    public GridOutOfBoundsException(int row, int column, int rows, int columns) {
        super("Cell (" + row + ", " + column + ") is outside the " + rows + "x" + columns + " grid");
    }
}
