package com.jay.ipvalue.exception;

/** Raised when WACC does not exceed terminal growth or an assumption rate lies outside [0,1]. */
public class InvalidAssumptionsException extends ValuationException {

    public InvalidAssumptionsException(String message) {
        super(ValuationErrorKind.INVALID_ASSUMPTIONS, message);
    }
}
