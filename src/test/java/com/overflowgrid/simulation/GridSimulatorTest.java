package com.overflowgrid.simulation;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class GridSimulatorTest {

    @Test
    void zeroRoundsReturnsEqualGridWithoutSharingIt() {
        Grid grid = SampleGrids.workedExample();
        Grid result = GridSimulator.simulate(grid, 0);
        assertEquals(grid, result);
        assertNotSame(grid, result);
    }

    @Test
    void gridBelowThresholdStaysAtRest() {
        Grid grid = Grid.of(new int[][] {
                {3, 0, 3},
                {1, 3, 2},
                {-5, 3, 3}
        });
        assertEquals(grid, GridSimulator.simulate(grid, 25));
    }

    @Test
    void centerCellOverflowsToAllFourNeighbors() {
        Grid grid = Grid.of(new int[][] {
                {0, 0, 0},
                {0, 4, 0},
                {0, 0, 0}
        });
        Grid expected = Grid.of(new int[][] {
                {0, 1, 0},
                {1, 0, 1},
                {0, 1, 0}
        });
        assertEquals(expected, GridSimulator.simulate(grid, 1));
    }

    @Test
    void cornerCellOnlyServesExistingNeighbors() {
        Grid grid = Grid.of(new int[][] {{4, 0}, {0, 0}});
        Grid expected = Grid.of(new int[][] {{2, 1}, {1, 0}});
        assertEquals(expected, GridSimulator.simulate(grid, 1));
    }

    @Test
    void edgeCellLosesThreeUnits() {
        Grid grid = Grid.of(new int[][] {
                {0, 4, 0},
                {0, 0, 0},
                {0, 0, 0}
        });
        Grid expected = Grid.of(new int[][] {
                {1, 1, 1},
                {0, 1, 0},
                {0, 0, 0}
        });
        assertEquals(expected, GridSimulator.simulate(grid, 1));
    }

    @Test
    void cellFarAboveThresholdOverflowsOncePerRound() {
        Grid grid = Grid.of(new int[][] {
                {0, 0, 0},
                {0, 100, 0},
                {0, 0, 0}
        });
        Grid result = GridSimulator.simulate(grid, 1);
        assertEquals(96, result.get(1, 1));
        assertEquals(1, result.get(0, 1));
        assertEquals(0, result.get(0, 0));
    }

    @Test
    void singleCellGridNeverChanges() {
        Grid grid = Grid.of(new int[][] {{9}});
        assertEquals(grid, GridSimulator.simulate(grid, 10));
    }

    @Test
    void negativeValuesAreNotClamped() {
        Grid grid = Grid.of(new int[][] {{-7, 4}});
        assertEquals(Grid.of(new int[][] {{-6, 3}}), GridSimulator.simulate(grid, 1));
    }

    @Test
    void transfersReadThePreRoundSnapshot() {
        // Updating in place would let the right cell reach 4 and send the unit back.
        Grid grid = Grid.of(new int[][] {{4, 3}});
        assertEquals(Grid.of(new int[][] {{3, 4}}), GridSimulator.simulate(grid, 1));
    }

    @Test
    void workedExampleAfterEachRound() {
        Grid grid = SampleGrids.workedExample();
        Grid first = Grid.of(new int[][] {
                {2, 2, 4, 2},
                {1, 4, 3, 3},
                {1, 3, 2, 5}
        });
        Grid second = Grid.of(new int[][] {
                {2, 4, 1, 3},
                {2, 0, 5, 4},
                {1, 4, 3, 3}
        });
        assertEquals(first, GridSimulator.simulate(grid, 1));
        assertEquals(second, GridSimulator.simulate(grid, SampleGrids.WORKED_EXAMPLE_ROUNDS));
    }

    @Test
    void simulateDoesNotModifyItsArgument() {
        Grid grid = SampleGrids.workedExample();
        GridSimulator.simulate(grid, 5);
        assertEquals(SampleGrids.workedExample(), grid);
    }

    @Test
    void roundsCompose() {
        Random random = new Random(7);
        for (int trial = 0; trial < 20; trial++) {
            Grid grid = randomGrid(random);
            int m = random.nextInt(6);
            int n = random.nextInt(6);
            Grid direct = GridSimulator.simulate(grid, m + n);
            Grid staged = GridSimulator.simulate(GridSimulator.simulate(grid, m), n);
            assertEquals(direct, staged, "m=" + m + ", n=" + n + ", grid=" + grid);
        }
    }

    @Test
    void everyTraversalOrderGivesTheSameResult() {
        Random random = new Random(42);
        for (int trial = 0; trial < 20; trial++) {
            Grid grid = randomGrid(random);
            Grid expected = GridSimulator.simulate(grid, 8, TraversalOrder.ROW_MAJOR);
            assertEquals(expected, GridSimulator.simulate(grid, 8, TraversalOrder.COLUMN_MAJOR));
            assertEquals(expected, GridSimulator.simulate(grid, 8, TraversalOrder.PARALLEL));
        }
    }

    @Test
    void shuffledVisitOrderGivesTheSameDeltas() {
        Random random = new Random(1234);
        for (int trial = 0; trial < 20; trial++) {
            Grid grid = randomGrid(random);
            List<Position> positions = new ArrayList<>();
            for (int row = 0; row < grid.rows(); row++) {
                for (int col = 0; col < grid.columns(); col++) {
                    positions.add(new Position(row, col));
                }
            }
            Collections.shuffle(positions, random);

            Grid expected = GridSimulator.advance(grid, TraversalOrder.ROW_MAJOR);
            Grid shuffled = grid.copy();
            GridSimulator.computeDeltas(grid, positions).applyTo(shuffled);
            assertEquals(expected, shuffled);
        }
    }

    @Test
    void totalIsConservedEveryRound() {
        Random random = new Random(99);
        for (int trial = 0; trial < 20; trial++) {
            Grid grid = randomGrid(random);
            DeltaGrid delta = GridSimulator.computeDeltas(grid, TraversalOrder.ROW_MAJOR);
            assertEquals(0, delta.net());
            assertEquals(grid.total(), GridSimulator.simulate(grid, 4).total());
        }
    }

    @Test
    void deltasOfRestingGridAreZero() {
        Grid grid = Grid.of(new int[][] {{1, 2}, {3, 0}});
        assertTrue(GridSimulator.computeDeltas(grid, TraversalOrder.PARALLEL).isZero());
    }

    @Test
    void rejectsNegativeRoundCount() {
        Grid grid = SampleGrids.workedExample();
        InvalidRoundCountException ex = assertThrows(InvalidRoundCountException.class,
                () -> GridSimulator.simulate(grid, -1));
        assertTrue(ex.getMessage().contains("-1"));
    }

    @Test
    void rejectsMissingGrid() {
        assertThrows(InvalidGridException.class, () -> GridSimulator.simulate(null, 1));
    }

    @Test
    void rejectsVisitOrderOutsideTheGrid() {
        Grid grid = new Grid(2, 2);
        assertThrows(IndexOutOfBoundsException.class,
                () -> GridSimulator.computeDeltas(grid, List.of(new Position(2, 0))));
    }

    private static Grid randomGrid(Random random) {
        int rows = 1 + random.nextInt(7);
        int columns = 1 + random.nextInt(7);
        Grid grid = new Grid(rows, columns);
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < columns; col++) {
                grid.set(row, col, random.nextInt(10));
            }
        }
        return grid;
    }
}
