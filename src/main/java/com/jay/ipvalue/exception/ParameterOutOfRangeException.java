package com.jay.ipvalue.exception;

/** Raised when an asset-level rate, margin, score or fraction is out of bounds. Values are never clamped. */
public class ParameterOutOfRangeException extends ValuationException {

    public ParameterOutOfRangeException(String message) {
        super(ValuationErrorKind.PARAMETER_OUT_OF_RANGE, message);
    }
}
