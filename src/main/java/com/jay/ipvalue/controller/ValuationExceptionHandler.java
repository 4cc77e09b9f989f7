package com.jay.ipvalue.controller;

import com.jay.ipvalue.exception.ValuationErrorKind;
import com.jay.ipvalue.exception.ValuationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the valuation error taxonomy to HTTP: unknown ticker or segment is 404,
 * every other valuation failure is 422 with its kind in the body.
 */
@Slf4j
@RestControllerAdvice
public class ValuationExceptionHandler {

    @ExceptionHandler(ValuationException.class)
    public ResponseEntity<ErrorResponse> handle(ValuationException e) {
        HttpStatus status = e.getKind() == ValuationErrorKind.DATA_NOT_FOUND
            ? HttpStatus.NOT_FOUND
            : HttpStatus.UNPROCESSABLE_ENTITY;
        log.debug("{} -> {}: {}", e.getKind(), status.value(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(e.getKind(), e.getMessage()));
    }

    /** Range checks in asset and assumption constructors surface wrapped in the JSON error. */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof ValuationException valuationException) {
                return handle(valuationException);
            }
        }
        return ResponseEntity.badRequest().body(new ErrorResponse(null, "Malformed request body"));
    }
}
