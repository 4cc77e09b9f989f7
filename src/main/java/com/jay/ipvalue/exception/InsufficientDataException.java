package com.jay.ipvalue.exception;

/** Raised when fewer periods are available than a computation needs, including an empty revenue series. */
public class InsufficientDataException extends ValuationException {

    public InsufficientDataException(String message) {
        super(ValuationErrorKind.INSUFFICIENT_DATA, message);
    }
}
