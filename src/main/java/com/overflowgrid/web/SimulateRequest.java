package com.overflowgrid.web;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SimulateRequest(
        @JsonProperty("grid") int[][] grid,
        @JsonProperty("rounds") Integer rounds,
        @JsonProperty("traversal") String traversal
) {
}
