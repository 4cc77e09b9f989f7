package com.jay.ipvalue.exception;

/** Raised when a ticker or segment is absent from the supplied data. */
public class DataNotFoundException extends ValuationException {

    public DataNotFoundException(String message) {
        super(ValuationErrorKind.DATA_NOT_FOUND, message);
    }
}
