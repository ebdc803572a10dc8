package com.overflowgrid.simulation;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    public SimulationResult runSimulation(Grid grid, SimulationOptions options) {
        Objects.requireNonNull(options, "options");
        GridSimulator.requireValid(grid, options.rounds());
        long start = System.nanoTime();

        Grid initialGrid = grid.copy();
        SimulationLoopResult loop = runRounds(initialGrid, options);
        Grid finalGrid = loop.finalGrid();

        SimulationResult result = new SimulationResult(
                initialGrid,
                finalGrid,
                options.rounds(),
                loop.roundsSimulated(),
                initialGrid.total(),
                finalGrid.total(),
                finalGrid.activeCount(GridSimulator.THRESHOLD),
                options.traversal(),
                buildSummary(initialGrid, options),
                Duration.ofNanos(System.nanoTime() - start));

        double seconds = result.elapsed().toNanos() / 1_000_000_000.0;
        String timeLabel = String.format(Locale.US, "%.3f s", seconds);
        log.info(
                "Simulation {}: rounds {} -> {}, total {} -> {}, active {} (spent={})",
                result.summary(),
                result.roundsRequested(),
                result.roundsSimulated(),
                result.initialTotal(),
                result.finalTotal(),
                result.activeCells(),
                timeLabel);
        if (log.isDebugEnabled()) {
            log.debug("Final grid:\n{}", GridTextFormat.format(finalGrid));
        }
        return result;
    }

    private SimulationLoopResult runRounds(Grid initialGrid, SimulationOptions options) {
        Grid current = initialGrid.copy();
        ProgressLogger progressLogger = ProgressLogger.create(options.progressLogPercentStep(), options.rounds());
        int roundsSimulated = 0;
        for (int round = 0; round < options.rounds(); round++) {
            if (options.stopAtRest() && current.activeCount(GridSimulator.THRESHOLD) == 0) {
                log.debug("Grid at rest after {} of {} rounds", roundsSimulated, options.rounds());
                break;
            }
            current = GridSimulator.advance(current, options.traversal());
            roundsSimulated = round + 1;
            if (progressLogger != null) {
                progressLogger.record(roundsSimulated);
            }
        }
        return new SimulationLoopResult(current, roundsSimulated);
    }

    private String buildSummary(Grid grid, SimulationOptions options) {
        return grid.rows() + "x" + grid.columns() + "_" + options.summary();
    }

    private static final class ProgressLogger {
        private final int totalRounds;
        private final int stepPercent;
        private int nextPercent;

        private ProgressLogger(int totalRounds, int stepPercent) {
            this.totalRounds = Math.max(totalRounds, 1);
            this.stepPercent = stepPercent;
            this.nextPercent = stepPercent;
        }

        static ProgressLogger create(Integer requestedPercentStep, int totalRounds) {
            if (requestedPercentStep == null || totalRounds <= 0) {
                return null;
            }
            return new ProgressLogger(totalRounds, requestedPercentStep);
        }

        void record(int roundsSimulated) {
            int percent = (int) Math.floor(roundsSimulated * 100.0 / totalRounds);
            percent = Math.min(percent, 100);
            while (nextPercent <= 100 && percent >= nextPercent) {
                log.info("Simulated {}% of rounds ({}/{}).", nextPercent, roundsSimulated, totalRounds);
                nextPercent += stepPercent;
            }
        }
    }

    private record SimulationLoopResult(Grid finalGrid, int roundsSimulated) {
    }
}
