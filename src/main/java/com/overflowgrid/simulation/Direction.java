package com.overflowgrid.simulation;

public enum Direction {
    UP(-1, 0),
    LEFT(0, -1),
    RIGHT(0, 1),
    DOWN(1, 0);

    private final int rowOffset;
    private final int columnOffset;

    Direction(int rowOffset, int columnOffset) {
        this.rowOffset = rowOffset;
        this.columnOffset = columnOffset;
    }

    public int rowOffset() {
        return rowOffset;
    }

    public int columnOffset() {
        return columnOffset;
    }
}
