package com.gridcalc.app.exceptions;

/**
 * Thrown at construction time when the rows of a grid
 * do not all have the same number of cells.
 */
public class RaggedGridException extends RuntimeException {
    public RaggedGridException(String message) {
        super(message);
    }
}
