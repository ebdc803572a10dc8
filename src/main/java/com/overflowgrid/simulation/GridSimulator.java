package com.overflowgrid.simulation;

import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Runs the overflow rule: every cell holding at least {@link #THRESHOLD} units sends one unit
 * to each orthogonal neighbor that exists and loses one unit per neighbor served.
 *
 * <p>A round is two phases. All transfers are first accumulated into a {@link DeltaGrid}
 * from the grid as it stood when the round began, then the deltas are committed together.
 * No value written during a commit is read before the next round starts, so the visiting
 * order of cells never affects the outcome.
 */
public final class GridSimulator {

    public static final int THRESHOLD = 4;

    private static final Direction[] DIRECTIONS = Direction.values();

    private GridSimulator() {
    }

    public static Grid simulate(Grid grid, int rounds) {
        return simulate(grid, rounds, TraversalOrder.ROW_MAJOR);
    }

    /**
     * Applies {@code rounds} rounds to a copy of {@code grid}. The argument is never modified.
     */
    public static Grid simulate(Grid grid, int rounds, TraversalOrder order) {
        requireValid(grid, rounds);
        Objects.requireNonNull(order, "order");
        Grid current = grid.copy();
        for (int round = 0; round < rounds; round++) {
            computeDeltas(current, order).applyTo(current);
        }
        return current;
    }

    public static Grid advance(Grid grid, TraversalOrder order) {
        return simulate(grid, 1, order);
    }

    public static void requireValid(Grid grid, int rounds) {
        if (grid == null) {
            throw new InvalidGridException("Grid must be provided");
        }
        if (rounds < 0) {
            throw new InvalidRoundCountException(rounds);
        }
    }

    public static DeltaGrid computeDeltas(Grid snapshot, TraversalOrder order) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(order, "order");
        return switch (order) {
            case ROW_MAJOR -> rowMajor(snapshot);
            case COLUMN_MAJOR -> columnMajor(snapshot);
            case PARALLEL -> parallelRows(snapshot);
        };
    }

    /**
     * Computes deltas visiting cells in exactly the given order. Positions outside the grid are rejected.
     */
    public static DeltaGrid computeDeltas(Grid snapshot, Iterable<Position> order) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(order, "order");
        DeltaGrid delta = DeltaGrid.shapedLike(snapshot);
        for (Position position : order) {
            if (!snapshot.contains(position)) {
                throw new IndexOutOfBoundsException("Position outside the grid: " + position);
            }
            overflow(snapshot, position.row(), position.column(), delta);
        }
        return delta;
    }

    private static DeltaGrid rowMajor(Grid snapshot) {
        DeltaGrid delta = DeltaGrid.shapedLike(snapshot);
        for (int row = 0; row < snapshot.rows(); row++) {
            scanRow(snapshot, row, delta);
        }
        return delta;
    }

    private static DeltaGrid columnMajor(Grid snapshot) {
        DeltaGrid delta = DeltaGrid.shapedLike(snapshot);
        for (int col = 0; col < snapshot.columns(); col++) {
            for (int row = 0; row < snapshot.rows(); row++) {
                overflow(snapshot, row, col, delta);
            }
        }
        return delta;
    }

    // Each worker fills its own partial delta; partials are summed before the commit.
    private static DeltaGrid parallelRows(Grid snapshot) {
        return IntStream.range(0, snapshot.rows())
                .parallel()
                .collect(
                        () -> DeltaGrid.shapedLike(snapshot),
                        (delta, row) -> scanRow(snapshot, row, delta),
                        DeltaGrid::merge);
    }

    private static void scanRow(Grid snapshot, int row, DeltaGrid delta) {
        for (int col = 0; col < snapshot.columns(); col++) {
            overflow(snapshot, row, col, delta);
        }
    }

    private static void overflow(Grid snapshot, int row, int col, DeltaGrid delta) {
        if (snapshot.get(row, col) < THRESHOLD) {
            return;
        }
        for (Direction direction : DIRECTIONS) {
            int neighborRow = row + direction.rowOffset();
            int neighborCol = col + direction.columnOffset();
            if (!snapshot.contains(neighborRow, neighborCol)) {
                continue;
            }
            delta.add(neighborRow, neighborCol, 1);
            delta.add(row, col, -1);
        }
    }
}
