package com.overflowgrid.simulation;

import java.time.Duration;

public record SimulationResult(
        Grid initialGrid,
        Grid finalGrid,
        int roundsRequested,
        int roundsSimulated,
        long initialTotal,
        long finalTotal,
        int activeCells,
        TraversalOrder traversal,
        String summary,
        Duration elapsed
) {
    public SimulationResult {
        initialGrid = initialGrid.copy();
        finalGrid = finalGrid.copy();
    }

    @Override
    public Grid initialGrid() {
        return initialGrid.copy();
    }

    @Override
    public Grid finalGrid() {
        return finalGrid.copy();
    }

    public boolean atRest() {
        return activeCells == 0;
    }
}
