package com.jay.ipvalue.exception;

import lombok.Getter;

/**
 * Base type for every failure the valuation engine raises.
 * Engine operations are pure computations, so these are never retried;
 * the caller decides whether to surface them or fall back.
 */
@Getter
public abstract class ValuationException extends RuntimeException {

    private final ValuationErrorKind kind;

    protected ValuationException(ValuationErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
