package com.overflowgrid.simulation;

/**
 * Order in which cells are visited while deltas are computed. All orders give the same result.
 */
public enum TraversalOrder {
    ROW_MAJOR,
    COLUMN_MAJOR,
    PARALLEL
}
