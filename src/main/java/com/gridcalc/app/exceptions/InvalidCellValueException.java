package com.gridcalc.app.exceptions;

/**
 * Thrown when a plain (non-formula, non-blank) cell is not a valid integer.
 * For example, "hello" in B3.
 */
public class InvalidCellValueException extends RuntimeException {
    public InvalidCellValueException(String message) {
        super(message);
    }
}
