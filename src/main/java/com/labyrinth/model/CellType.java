package com.labyrinth.model;

/**
 * Terrain codes used by labyrinth layouts.
 */
public enum CellType {
    WALL(0),
    FLOOR(1),
    SPECIAL_FLOOR(2);   // key and heart cells; never on fire, no retreat check on departure

    private final int code;

    CellType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isPassable() {
        return this != WALL;
    }

    public static CellType fromCode(int code) {
        for (CellType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown cell code: " + code);
    }
}
