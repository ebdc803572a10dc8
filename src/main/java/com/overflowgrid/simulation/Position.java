package com.overflowgrid.simulation;

public record Position(int row, int column) {

    public Position neighbor(Direction direction) {
        return new Position(row + direction.rowOffset(), column + direction.columnOffset());
    }
}
