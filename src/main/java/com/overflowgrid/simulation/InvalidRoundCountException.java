package com.overflowgrid.simulation;

public class InvalidRoundCountException extends IllegalArgumentException {

    public InvalidRoundCountException(int rounds) {
        super("Round count must not be negative but was " + rounds);
    }
}
