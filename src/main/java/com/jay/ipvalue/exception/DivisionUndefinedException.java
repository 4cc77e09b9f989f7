package com.jay.ipvalue.exception;

/** Raised when a ratio's denominator is zero, e.g. cost of debt with no debt outstanding. */
public class DivisionUndefinedException extends ValuationException {

    public DivisionUndefinedException(String message) {
        super(ValuationErrorKind.DIVISION_UNDEFINED, message);
    }
}
