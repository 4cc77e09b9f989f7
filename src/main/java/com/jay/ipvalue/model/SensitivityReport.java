package com.jay.ipvalue.model;

import com.jay.ipvalue.model.enums.ValuationMethodType;

import java.util.List;

/**
 * One asset's value re-run with each driver moved down and up on its own,
 * plus the combined worst and best cases.
 */
public record SensitivityReport(
    String ticker,
    String assetId,
    ValuationMethodType method,
    double baseValue,
    List<Driver> drivers,
    Scenario worstCase,
    Scenario bestCase
) {

    /** Inputs are the driver's own values (a rate or a multiplier); values are asset totals. */
    public record Driver(String name,
                         double lowInput, double baseInput, double highInput,
                         double lowValue, double highValue) {

        public double swing() {
            return Math.abs(highValue - lowValue);
        }
    }

    public record Scenario(double royaltyRate, double attributionMultiplier,
                           double wacc, double terminalGrowth, double value) {}
}
