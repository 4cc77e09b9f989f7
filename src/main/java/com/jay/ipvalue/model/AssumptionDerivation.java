package com.jay.ipvalue.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Derived assumptions together with every intermediate figure, for audit and display.
 */
@Value
@Builder
public class AssumptionDerivation {
    String ticker;
    AssumptionSet assumptions;
    WaccBreakdown wacc;
    TaxRateBreakdown tax;
    GrowthBreakdown growth;

    /**
     * @param betaEstimated always true today: beta comes from a market-cap step function,
     *                      not from a regression against market returns
     */
    public record WaccBreakdown(
        double wacc,
        double riskFreeRate,
        double marketRiskPremium,
        double beta,
        boolean betaEstimated,
        double costOfEquity,
        double costOfDebt,
        double equityWeight,
        double debtWeight,
        double marketCap,
        double totalDebt,
        List<String> notes
    ) {}

    /** {@code periodRates} holds only periods that entered the average; {@code excludedPeriods} the rest. */
    public record TaxRateBreakdown(
        double effectiveTaxRate,
        boolean fallbackUsed,
        Map<String, Double> periodRates,
        List<String> excludedPeriods
    ) {}

    public record GrowthBreakdown(
        double terminalGrowth,
        double averageHistoricalGrowth,
        List<Double> growthHistory,
        boolean clamped
    ) {}
}
