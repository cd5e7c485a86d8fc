package com.gridcalc.app.exceptions;

/**
 * Thrown when a negative column index is passed to the label encoder.
 */
public class InvalidIndexException extends RuntimeException {
    public InvalidIndexException(String message) {
        super(message);
    }
}
