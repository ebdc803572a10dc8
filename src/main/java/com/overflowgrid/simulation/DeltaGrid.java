package com.overflowgrid.simulation;

import java.util.Arrays;

/**
 * Net signed change per cell for a single round. Filled from a read-only snapshot,
 * then committed to the grid in one pass.
 */
public final class DeltaGrid {

    private final int rows;
    private final int columns;
    private final int[] deltas;

    public DeltaGrid(int rows, int columns) {
        if (rows <= 0 || columns <= 0) {
            throw new InvalidGridException("Delta dimensions must be positive but were " + rows + "x" + columns);
        }
        this.rows = rows;
        this.columns = columns;
        this.deltas = new int[rows * columns];
    }

    static DeltaGrid shapedLike(Grid grid) {
        return new DeltaGrid(grid.rows(), grid.columns());
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public void add(int row, int col, int amount) {
        deltas[index(row, col)] += amount;
    }

    public int get(int row, int col) {
        return deltas[index(row, col)];
    }

    public boolean isZero() {
        for (int delta : deltas) {
            if (delta != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Sum of all deltas. Every decrement is paired with a neighbor increment, so this is zero
     * for any delta produced by {@link GridSimulator}.
     */
    public long net() {
        long sum = 0;
        for (int delta : deltas) {
            sum += delta;
        }
        return sum;
    }

    /**
     * Adds another partial delta of the same shape into this one.
     */
    public DeltaGrid merge(DeltaGrid other) {
        requireSameShape(other.rows, other.columns);
        for (int i = 0; i < deltas.length; i++) {
            deltas[i] += other.deltas[i];
        }
        return this;
    }

    public void applyTo(Grid grid) {
        requireSameShape(grid.rows(), grid.columns());
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < columns; col++) {
                int delta = deltas[row * columns + col];
                if (delta != 0) {
                    grid.add(row, col, delta);
                }
            }
        }
    }

    private void requireSameShape(int otherRows, int otherColumns) {
        if (otherRows != rows || otherColumns != columns) {
            throw new IllegalArgumentException("Shape mismatch: " + rows + "x" + columns
                    + " vs " + otherRows + "x" + otherColumns);
        }
    }

    private int index(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= columns) {
            throw new IndexOutOfBoundsException("Position out of range: (" + row + ", " + col + ")");
        }
        return row * columns + col;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("DeltaGrid[");
        for (int row = 0; row < rows; row++) {
            if (row > 0) {
                builder.append(", ");
            }
            builder.append(Arrays.toString(Arrays.copyOfRange(deltas, row * columns, (row + 1) * columns)));
        }
        return builder.append(']').toString();
    }
}
