package com.gridcalc.app.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Catches evaluation exceptions from the controllers or services,
 * returning error JSON with an HTTP 4xx code instead of 500.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CircularReferenceException.class)
    public ResponseEntity<ErrorResponse> handleCircularRef(CircularReferenceException ex) {
        return badRequest("CIRCULAR_REFERENCE", ex);
    }

    @ExceptionHandler(RaggedGridException.class)
    public ResponseEntity<ErrorResponse> handleRaggedGrid(RaggedGridException ex) {
        return badRequest("RAGGED_GRID", ex);
    }

    @ExceptionHandler(InvalidLabelException.class)
    public ResponseEntity<ErrorResponse> handleInvalidLabel(InvalidLabelException ex) {
        return badRequest("INVALID_LABEL", ex);
    }

    @ExceptionHandler(InvalidIndexException.class)
    public ResponseEntity<ErrorResponse> handleInvalidIndex(InvalidIndexException ex) {
        return badRequest("INVALID_INDEX", ex);
    }

    @ExceptionHandler(InvalidCellValueException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCellValue(InvalidCellValueException ex) {
        return badRequest("INVALID_CELL_VALUE", ex);
    }

    @ExceptionHandler(InvalidFormulaException.class)
    public ResponseEntity<ErrorResponse> handleInvalidFormula(InvalidFormulaException ex) {
        return badRequest("INVALID_FORMULA", ex);
    }

    @ExceptionHandler(InvalidTokenException.class)
    public ResponseEntity<ErrorResponse> handleInvalidToken(InvalidTokenException ex) {
        return badRequest("INVALID_TOKEN", ex);
    }

    @ExceptionHandler(ReferenceOutOfRangeException.class)
    public ResponseEntity<ErrorResponse> handleOutOfRange(ReferenceOutOfRangeException ex) {
        return badRequest("REFERENCE_OUT_OF_RANGE", ex);
    }

    @ExceptionHandler(GridTooLargeException.class)
    public ResponseEntity<ErrorResponse> handleGridTooLarge(GridTooLargeException ex) {
        ErrorResponse error = ErrorResponse.of("GRID_TOO_LARGE", ex);
        return new ResponseEntity<>(error, HttpStatus.PAYLOAD_TOO_LARGE);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return badRequest("MALFORMED_REQUEST", ex);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleArgumentMismatch(MethodArgumentTypeMismatchException ex) {
        logger.warn("INVALID_ARGUMENT: {}", ex.getMessage());
        ErrorResponse error = new ErrorResponse("INVALID_ARGUMENT",
                "Invalid value '" + ex.getValue() + "' for parameter '" + ex.getName() + "'");
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        // Catch-all for other runtime exceptions not explicitly handled above
        logger.error("Unexpected error while handling request", ex);
        ErrorResponse error = ErrorResponse.of("SERVER_ERROR", ex);
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> badRequest(String code, RuntimeException ex) {
        logger.warn("{}: {}", code, ex.getMessage());
        ErrorResponse error = ErrorResponse.of(code, ex);
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }
}
