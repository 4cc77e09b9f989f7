package com.jay.ipvalue.exception;

/**
 * No recent period had positive pre-tax income and a plausible tax rate, so no effective tax rate can be derived.
 * Callers must supply a fallback rate explicitly.
 */
public class TaxRateUndeterminedException extends DivisionUndefinedException {

    public TaxRateUndeterminedException(String message) {
        super(message);
    }
}
