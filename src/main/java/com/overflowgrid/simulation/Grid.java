package com.overflowgrid.simulation;

import java.util.Arrays;

/**
 * Rectangular grid of integer cells stored row by row.
 * Dimensions are fixed at construction.
 */
public final class Grid {

    private final int rows;
    private final int columns;
    private final int[] cells;

    public Grid(int rows, int columns) {
        if (rows <= 0 || columns <= 0) {
            throw new InvalidGridException("Grid dimensions must be positive but were " + rows + "x" + columns);
        }
        this.rows = rows;
        this.columns = columns;
        this.cells = new int[rows * columns];
    }

    private Grid(int rows, int columns, int[] cells) {
        this.rows = rows;
        this.columns = columns;
        this.cells = cells;
    }

    /**
     * Copies the given rows into a new grid. Every row must have the same, non-zero length.
     */
    public static Grid of(int[][] values) {
        if (values == null || values.length == 0) {
            throw new InvalidGridException("Grid must contain at least one row");
        }
        if (values[0] == null || values[0].length == 0) {
            throw new InvalidGridException("Row 0 must contain at least one column");
        }
        int columns = values[0].length;
        int[] cells = new int[values.length * columns];
        for (int row = 0; row < values.length; row++) {
            int[] source = values[row];
            if (source == null) {
                throw new InvalidGridException("Row " + row + " is missing");
            }
            if (source.length != columns) {
                throw new InvalidGridException(
                        "Row " + row + " has " + source.length + " columns, expected " + columns);
            }
            System.arraycopy(source, 0, cells, row * columns, columns);
        }
        return new Grid(values.length, columns, cells);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public int get(int row, int col) {
        return cells[index(row, col)];
    }

    public void set(int row, int col, int value) {
        cells[index(row, col)] = value;
    }

    void add(int row, int col, int amount) {
        cells[index(row, col)] += amount;
    }

    public boolean contains(Position position) {
        return contains(position.row(), position.column());
    }

    public boolean contains(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < columns;
    }

    public long total() {
        long sum = 0;
        for (int cell : cells) {
            sum += cell;
        }
        return sum;
    }

    public int activeCount(int threshold) {
        int count = 0;
        for (int cell : cells) {
            if (cell >= threshold) {
                count++;
            }
        }
        return count;
    }

    private int index(int row, int col) {
        if (!contains(row, col)) {
            throw new IndexOutOfBoundsException("Position out of range: (" + row + ", " + col + ")");
        }
        return row * columns + col;
    }

    public Grid copy() {
        return new Grid(rows, columns, Arrays.copyOf(cells, cells.length));
    }

    public int[][] toArray() {
        int[][] values = new int[rows][];
        for (int row = 0; row < rows; row++) {
            values[row] = Arrays.copyOfRange(cells, row * columns, (row + 1) * columns);
        }
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Grid other)) {
            return false;
        }
        return rows == other.rows && columns == other.columns && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(rows);
        result = 31 * result + Integer.hashCode(columns);
        result = 31 * result + Arrays.hashCode(cells);
        return result;
    }

    @Override
    public String toString() {
        return "Grid" + Arrays.deepToString(toArray());
    }
}
