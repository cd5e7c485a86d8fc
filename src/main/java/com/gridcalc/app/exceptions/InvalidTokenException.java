package com.gridcalc.app.exceptions;

/**
 * Thrown when a formula operand is neither a cell reference nor an integer.
 */
public class InvalidTokenException extends RuntimeException {
    public InvalidTokenException(String message) {
        super(message);
    }
}
