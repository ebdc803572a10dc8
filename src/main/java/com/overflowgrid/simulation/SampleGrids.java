package com.overflowgrid.simulation;

public final class SampleGrids {

    public static final int WORKED_EXAMPLE_ROUNDS = 2;

    private SampleGrids() {
    }

    /**
     * 3x4 grid whose state after {@link #WORKED_EXAMPLE_ROUNDS} rounds is
     * {@code [[2,4,1,3],[2,0,5,4],[1,4,3,3]]}.
     */
    public static Grid workedExample() {
        return Grid.of(new int[][] {
                {1, 2, 3, 4},
                {4, 3, 2, 1},
                {0, 2, 4, 6}
        });
    }
}
