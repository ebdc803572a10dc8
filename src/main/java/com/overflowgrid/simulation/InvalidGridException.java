package com.overflowgrid.simulation;

public class InvalidGridException extends IllegalArgumentException {

    public InvalidGridException(String message) {
        super(message);
    }

    public InvalidGridException(String message, Throwable cause) {
        super(message, cause);
    }
}
