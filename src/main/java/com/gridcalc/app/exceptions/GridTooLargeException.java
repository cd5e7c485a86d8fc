package com.gridcalc.app.exceptions;

/**
 * Thrown when a grid submitted for evaluation has more cells
 * than the configured limit.
 */
public class GridTooLargeException extends RuntimeException {
    public GridTooLargeException(String message) {
        super(message);
    }
}
