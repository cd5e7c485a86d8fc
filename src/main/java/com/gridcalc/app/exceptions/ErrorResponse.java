package com.gridcalc.app.exceptions;

/**
 * JSON body of every error answer, e.g.
 * {"code": "CIRCULAR_REFERENCE", "message": "Circular reference detected at B2"}.
 * The code names the error kind; the message names the offending cell or text.
 */
public final class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    static ErrorResponse of(String code, Exception ex) {
        return new ErrorResponse(code, ex.getMessage());
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
