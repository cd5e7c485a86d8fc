package com.gridcalc.app.exceptions;

/**
 * Thrown when a column label contains anything other than ASCII letters,
 * e.g. "A1" or "@".
 */
public class InvalidLabelException extends RuntimeException {
    public InvalidLabelException(String message) {
        super(message);
    }
}
