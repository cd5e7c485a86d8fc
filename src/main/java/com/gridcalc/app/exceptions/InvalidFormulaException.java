package com.gridcalc.app.exceptions;

/**
 * Thrown when a formula is not of the shape "token" or "token op token".
 */
public class InvalidFormulaException extends RuntimeException {
    public InvalidFormulaException(String message) {
        super(message);
    }
}
