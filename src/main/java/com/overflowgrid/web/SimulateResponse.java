package com.overflowgrid.web;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SimulateResponse(
        int[][] grid,
        int rows,
        int columns,
        int roundsRequested,
        int roundsSimulated,
        long initialTotal,
        long finalTotal,
        int activeCells,
        String traversal,
        String summary,
        @JsonProperty("elapsedMillis") long elapsedMillis
) {
}
