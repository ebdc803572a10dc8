package com.overflowgrid.simulation;

import java.util.Objects;

public final class SimulationOptions {

    public static final int DEFAULT_ROUNDS = 1;

    private final int rounds;
    private final TraversalOrder traversal;
    private final boolean stopAtRest;
    private final Integer progressLogPercentStep;

    private SimulationOptions(Builder builder) {
        this.rounds = builder.rounds;
        this.traversal = builder.traversal;
        this.stopAtRest = builder.stopAtRest;
        this.progressLogPercentStep = builder.progressLogPercentStep;
    }

    public int rounds() {
        return rounds;
    }

    public TraversalOrder traversal() {
        return traversal;
    }

    public boolean stopAtRest() {
        return stopAtRest;
    }

    public Integer progressLogPercentStep() {
        return progressLogPercentStep;
    }

    public String summary() {
        return rounds + "r_" + traversal.name();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return summary();
    }

    public static final class Builder {
        private int rounds = DEFAULT_ROUNDS;
        private TraversalOrder traversal = TraversalOrder.ROW_MAJOR;
        private boolean stopAtRest = true;
        private Integer progressLogPercentStep;

        public Builder rounds(int rounds) {
            if (rounds < 0) {
                throw new InvalidRoundCountException(rounds);
            }
            this.rounds = rounds;
            return this;
        }

        public Builder traversal(TraversalOrder traversal) {
            this.traversal = Objects.requireNonNull(traversal, "traversal");
            return this;
        }

        public Builder stopAtRest(boolean stopAtRest) {
            this.stopAtRest = stopAtRest;
            return this;
        }

        public Builder progressLogPercentStep(Integer percentStep) {
            if (percentStep != null) {
                if (percentStep <= 0 || percentStep > 100) {
                    throw new IllegalArgumentException("Progress log percent step must be between 1 and 100");
                }
            }
            this.progressLogPercentStep = percentStep;
            return this;
        }

        public SimulationOptions build() {
            if (traversal == null) {
                throw new IllegalStateException("Traversal order must be provided");
            }
            return new SimulationOptions(this);
        }
    }
}
