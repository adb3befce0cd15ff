package com.labyrinth.model;

/**
 * One-step movement directions offered to a hero.
 */
public enum Direction {
    UP("Up", -1, 0),
    DOWN("Down", 1, 0),
    LEFT("Left", 0, -1),
    RIGHT("Right", 0, 1);

    private final String label;
    private final int rowDelta;
    private final int columnDelta;

    Direction(String label, int rowDelta, int columnDelta) {
        this.label = label;
        this.rowDelta = rowDelta;
        this.columnDelta = columnDelta;
    }

    public String getLabel() { return label; }
    public int getRowDelta() { return rowDelta; }
    public int getColumnDelta() { return columnDelta; }
}
