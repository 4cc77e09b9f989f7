package com.jay.ipvalue.exception;

public enum ValuationErrorKind {
    DATA_NOT_FOUND,        // ticker or segment absent
    INSUFFICIENT_DATA,     // fewer periods than required, empty series
    INVALID_ASSUMPTIONS,   // WACC <= terminal growth, rate outside [0,1]
    PARAMETER_OUT_OF_RANGE,
    DIVISION_UNDEFINED
}
