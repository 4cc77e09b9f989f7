package com.jay.ipvalue.model;

import com.jay.ipvalue.exception.InvalidAssumptionsException;

/**
 * Discount rate, tax rate and terminal growth rate for one valuation run.
 * Passed explicitly into every computation; there is no ambient default.
 */
public record AssumptionSet(double wacc, double taxRate, double terminalGrowth) {

    public AssumptionSet {
        requireRate("WACC", wacc);
        requireRate("tax rate", taxRate);
        requireRate("terminal growth", terminalGrowth);
    }

    /** A growing perpetuity only converges when the discount rate exceeds the growth rate. */
    public void requireTerminalValueDefined() {
        if (wacc <= terminalGrowth) {
            throw new InvalidAssumptionsException(String.format(
                "WACC %.4f must exceed terminal growth %.4f for a terminal value", wacc, terminalGrowth));
        }
    }

    public AssumptionSet withWacc(double value) {
        return new AssumptionSet(value, taxRate, terminalGrowth);
    }

    public AssumptionSet withTerminalGrowth(double value) {
        return new AssumptionSet(wacc, taxRate, value);
    }

    private static void requireRate(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 1) {
            throw new InvalidAssumptionsException(
                String.format("%s must lie in [0,1] but was %s", name, value));
        }
    }
}
