package com.gridcalc.app.exceptions;

/**
 * Thrown when a cell is demanded again while its own evaluation is still
 * in progress (a cell referencing itself, or a multi-cell loop).
 * The message names the cell where the loop was closed, e.g. "B2".
 */
public class CircularReferenceException extends RuntimeException {
    public CircularReferenceException(String message) {
        super(message);
    }
}
