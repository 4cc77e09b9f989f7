package com.jay.ipvalue.model;

import com.jay.ipvalue.exception.ParameterOutOfRangeException;

/** Range checks shared by asset definitions and valuation methods. */
public final class Fractions {

    private Fractions() {}

    /** Requires {@code value} in [0,1]. */
    public static double requireFraction(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 1) {
            throw new ParameterOutOfRangeException(
                String.format("%s must lie in [0,1] but was %s", name, value));
        }
        return value;
    }

    /** Requires {@code value} in (0,1]. Used for attribution, where zero means "not attributed". */
    public static double requirePositiveFraction(String name, double value) {
        if (Double.isNaN(value) || value <= 0 || value > 1) {
            throw new ParameterOutOfRangeException(
                String.format("%s must lie in (0,1] but was %s", name, value));
        }
        return value;
    }

    /** Null-tolerant variant for optional overrides; a present value is still range checked. */
    public static Double optionalFraction(String name, Double value) {
        return value == null ? null : requireFraction(name, value);
    }

    public static Double requirePresent(String name, Double value) {
        if (value == null) {
            throw new ParameterOutOfRangeException(name + " is required but was not supplied");
        }
        return requireFraction(name, value);
    }
}
