package com.gridcalc.app.exceptions;

/**
 * Thrown when a cell reference points outside the grid,
 * e.g. "A2" in a grid with a single row.
 */
public class ReferenceOutOfRangeException extends RuntimeException {
    public ReferenceOutOfRangeException(String message) {
        super(message);
    }
}
