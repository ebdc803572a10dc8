package com.overflowgrid.web;

import com.overflowgrid.config.AppProperties;
import com.overflowgrid.simulation.Grid;
import com.overflowgrid.simulation.SampleGrids;
import com.overflowgrid.simulation.SimulationOptions;
import com.overflowgrid.simulation.SimulationResult;
import com.overflowgrid.simulation.SimulationService;
import com.overflowgrid.simulation.TraversalOrder;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping
public class SimulationController {

    private static final Logger log = LoggerFactory.getLogger(SimulationController.class);

    private final SimulationService simulationService;
    private final AppProperties properties;

    public SimulationController(SimulationService simulationService, AppProperties properties) {
        this.simulationService = simulationService;
        this.properties = properties;
    }

    @PostMapping(path = "/simulate", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public SimulateResponse simulate(@RequestBody SimulateRequest request) {
        Grid grid = parseGrid(request.grid());
        int rounds = request.rounds() != null ? request.rounds() : SimulationOptions.DEFAULT_ROUNDS;
        if (rounds > properties.getMaxRounds()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Rounds " + rounds + " exceed the limit of " + properties.getMaxRounds());
        }
        TraversalOrder traversal = parseTraversal(request.traversal());

        SimulationOptions options;
        try {
            options = buildOptions(rounds, traversal);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
        return toResponse(run(grid, options));
    }

    @GetMapping(path = "/sample", produces = MediaType.APPLICATION_JSON_VALUE)
    public SimulateResponse sample() {
        SimulationOptions options = buildOptions(SampleGrids.WORKED_EXAMPLE_ROUNDS, properties.getDefaultTraversal());
        return toResponse(run(SampleGrids.workedExample(), options));
    }

    private SimulationResult run(Grid grid, SimulationOptions options) {
        SimulationResult result;
        try {
            result = simulationService.runSimulation(grid, options);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Simulation failed: " + ex.getMessage(), ex);
        }
        log.info("Served {} (rounds {} -> {}, active {})",
                result.summary(),
                result.roundsRequested(),
                result.roundsSimulated(),
                result.activeCells());
        return result;
    }

    private Grid parseGrid(int[][] values) {
        if (values == null || values.length == 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Grid must contain at least one row");
        }
        long cells = (long) values.length * (values[0] == null ? 0 : values[0].length);
        if (cells > properties.getMaxCells()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Grid has " + cells + " cells, limit is " + properties.getMaxCells());
        }
        try {
            return Grid.of(values);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    private TraversalOrder parseTraversal(String traversal) {
        if (!StringUtils.hasText(traversal)) {
            return properties.getDefaultTraversal();
        }
        String normalized = traversal.trim().toUpperCase(Locale.ROOT);
        try {
            return TraversalOrder.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported traversal: " + traversal, ex);
        }
    }

    private SimulationOptions buildOptions(int rounds, TraversalOrder traversal) {
        SimulationOptions.Builder builder = SimulationOptions.builder()
                .rounds(rounds)
                .traversal(traversal);
        properties.getProgressLogPercentStep().ifPresent(builder::progressLogPercentStep);
        return builder.build();
    }

    private SimulateResponse toResponse(SimulationResult result) {
        Grid finalGrid = result.finalGrid();
        return new SimulateResponse(
                finalGrid.toArray(),
                finalGrid.rows(),
                finalGrid.columns(),
                result.roundsRequested(),
                result.roundsSimulated(),
                result.initialTotal(),
                result.finalTotal(),
                result.activeCells(),
                result.traversal().name(),
                result.summary(),
                result.elapsed().toMillis());
    }
}
