package com.jay.ipvalue.layer4_aggregation;

import com.jay.ipvalue.config.ValuationConfig;
import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.IpAsset;
import com.jay.ipvalue.model.SensitivityReport;
import com.jay.ipvalue.model.SensitivityReport.Driver;
import com.jay.ipvalue.model.SensitivityReport.Scenario;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Moves royalty rate, attribution, WACC and terminal growth one at a time around the base case.
 * Deltas come from the {@code sensitivity} section of valuation.yaml.
 *
 * Shifted rates are clamped to [0,1] and attributions capped at 1. A shift that leaves WACC
 * at or below growth is not softened: the run fails with InvalidAssumptions like any other.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SensitivityAnalyzer {

    private final AssetPortfolioAggregator aggregator;
    private final ValuationConfig config;

    public SensitivityReport analyze(String ticker, IpAsset asset, AssumptionSet assumptions) {
        ValuationConfig.Sensitivity s = config.sensitivity();
        double base = value(ticker, asset, assumptions);

        double royaltyLow = clamp(asset.royaltyRate() - s.getRoyaltyRateDelta());
        double royaltyHigh = clamp(asset.royaltyRate() + s.getRoyaltyRateDelta());
        double attributionLow = 1 - s.getAttributionFactor();
        double attributionHigh = 1 + s.getAttributionFactor();
        double waccLow = clamp(assumptions.wacc() - s.getWaccDelta());
        double waccHigh = clamp(assumptions.wacc() + s.getWaccDelta());
        double growthLow = clamp(assumptions.terminalGrowth() - s.getTerminalGrowthDelta());
        double growthHigh = clamp(assumptions.terminalGrowth() + s.getTerminalGrowthDelta());

        List<Driver> drivers = List.of(
            new Driver("royalty_rate", royaltyLow, asset.royaltyRate(), royaltyHigh,
                value(ticker, withRoyalty(asset, royaltyLow), assumptions),
                value(ticker, withRoyalty(asset, royaltyHigh), assumptions)),
            new Driver("attribution", attributionLow, 1.0, attributionHigh,
                value(ticker, asset.withScaledAttribution(attributionLow), assumptions),
                value(ticker, asset.withScaledAttribution(attributionHigh), assumptions)),
            new Driver("wacc", waccLow, assumptions.wacc(), waccHigh,
                value(ticker, asset, assumptions.withWacc(waccLow)),
                value(ticker, asset, assumptions.withWacc(waccHigh))),
            new Driver("terminal_growth", growthLow, assumptions.terminalGrowth(), growthHigh,
                value(ticker, asset, assumptions.withTerminalGrowth(growthLow)),
                value(ticker, asset, assumptions.withTerminalGrowth(growthHigh)))
        );

        Scenario worst = scenario(ticker, asset, assumptions, royaltyLow, attributionLow, waccHigh, growthLow);
        Scenario best = scenario(ticker, asset, assumptions, royaltyHigh, attributionHigh, waccLow, growthHigh);

        log.debug("Sensitivity for {} on {}: base {}, range {} .. {}",
            asset.id(), ticker, base, worst.value(), best.value());
        return new SensitivityReport(ticker, asset.id(), asset.method(), base, drivers, worst, best);
    }

    private Scenario scenario(String ticker, IpAsset asset, AssumptionSet assumptions,
                              double royalty, double attribution, double wacc, double growth) {
        IpAsset shifted = withRoyalty(asset, royalty).withScaledAttribution(attribution);
        AssumptionSet shiftedAssumptions = assumptions.withWacc(wacc).withTerminalGrowth(growth);
        return new Scenario(royalty, attribution, wacc, growth, value(ticker, shifted, shiftedAssumptions));
    }

    private double value(String ticker, IpAsset asset, AssumptionSet assumptions) {
        return aggregator.valueAsset(ticker, asset, assumptions).getTotalValue();
    }

    private static IpAsset withRoyalty(IpAsset asset, double rate) {
        return asset.toBuilder().royaltyRate(rate).build();
    }

    private static double clamp(double rate) {
        return Math.max(0.0, Math.min(1.0, rate));
    }
}
