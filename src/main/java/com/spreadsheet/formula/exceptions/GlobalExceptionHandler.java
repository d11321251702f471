package com.spreadsheet.formula.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Turns failures that escape evaluation into error JSON.
 * Formula errors such as #DIV/0! never get here; they are result values.
 */
@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UnknownFunctionException.class)
    public ResponseEntity<ErrorResponse> handleUnknownFunction(UnknownFunctionException ex) {
        log.warn("Evaluation called an unregistered function: {}", ex.getFunctionName());
        ErrorResponse error = new ErrorResponse("UNKNOWN_FUNCTION", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidReferenceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidReference(InvalidReferenceException ex) {
        log.warn("Invalid reference in request: {}", ex.getMessage());
        ErrorResponse error = new ErrorResponse("INVALID_REFERENCE", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        log.warn("Request names a missing sheet: {}", ex.getMessage());
        ErrorResponse error = new ErrorResponse("SHEET_NOT_FOUND", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        log.warn("Evaluation failed", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
