package com.jay.ipvalue.layer3_valuation;

import com.jay.ipvalue.config.ValuationConfig;
import com.jay.ipvalue.exception.ParameterOutOfRangeException;
import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.Fractions;
import com.jay.ipvalue.model.TechnologyScores;
import com.jay.ipvalue.model.ValuationResult;
import com.jay.ipvalue.model.enums.ValuationMethodType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Royalty relief with the base rate scaled by patent quality.
 *
 * The technology factor blends innovation (30%), commercial success (35%), legal strength (25%)
 * and remaining-life share (10%) into [0,1]; the adjusted royalty is {@code base × (1 + factor)}.
 * Cash flows decay linearly as the patent ages, never below the configured floor, and the
 * projection covers only the most recent remaining-life periods when more revenue history exists.
 */
@Component
@RequiredArgsConstructor
public class TechnologyFactorMethod extends IncomeApproachMethod {

    static final double INNOVATION_WEIGHT = 0.30;
    static final double COMMERCIAL_WEIGHT = 0.35;
    static final double LEGAL_WEIGHT = 0.25;
    static final double LIFE_WEIGHT = 0.10;

    private final ValuationConfig config;

    @Override
    public ValuationMethodType type() {
        return ValuationMethodType.TECHNOLOGY_FACTOR;
    }

    public static double technologyFactor(TechnologyScores scores) {
        double innovation = Fractions.requirePresent("innovation score", scores.innovation());
        double commercial = Fractions.requirePresent("commercial success score", scores.commercialSuccess());
        double legal = Fractions.requirePresent("legal strength score", scores.legalStrength());
        return innovation * INNOVATION_WEIGHT
            + commercial * COMMERCIAL_WEIGHT
            + legal * LEGAL_WEIGHT
            + lifeFraction(scores) * LIFE_WEIGHT;
    }

    /** All components of {@code scores} must be present. */
    public ValuationResult value(List<Double> revenues, AssumptionSet assumptions,
                                 double baseRoyaltyRate, TechnologyScores scores) {
        validate(revenues, assumptions);
        Fractions.requireFraction("base royalty rate", baseRoyaltyRate);
        ValuationConfig.Technology cfg = config.technology();

        double factor = technologyFactor(scores);
        double adjustedRoyalty = baseRoyaltyRate * (1 + factor);
        int remainingLife = scores.remainingLifeYears();
        int projectionYears = Math.min(revenues.size(), remainingLife);
        double decayHorizon = remainingLife * cfg.getDecayHorizonMultiplier();
        double afterTax = 1 - assumptions.taxRate();
        // Oldest first: the cap keeps the latest periods
        List<Double> projected = revenues.subList(revenues.size() - projectionYears, revenues.size());

        List<ProjectedCashFlow> flows = new ArrayList<>(projectionYears);
        for (int year = 1; year <= projectionYears; year++) {
            double revenue = projected.get(year - 1);
            double decay = Math.max(cfg.getDecayFloor(), 1 - year / decayHorizon);
            double cashFlow = revenue * adjustedRoyalty * afterTax * decay;
            flows.add(new ProjectedCashFlow(revenue, cashFlow, null, null, decay));
        }

        Map<String, Double> echo = new LinkedHashMap<>();
        echo.put("base_royalty_rate", baseRoyaltyRate);
        echo.put("technology_factor", factor);
        echo.put("adjusted_royalty_rate", adjustedRoyalty);
        echo.put("remaining_life_years", (double) remainingLife);
        echo.put("projection_years", (double) projectionYears);

        return CashFlowDiscounter.discount(flows, assumptions, cfg.isIncludeTerminalValue())
            .method(type())
            .parameters(Collections.unmodifiableMap(echo))
            .approximations(List.of("Technology factor rests on judgemental quality scores"))
            .build();
    }

    private static double lifeFraction(TechnologyScores scores) {
        Integer remaining = scores.remainingLifeYears();
        Integer total = scores.totalLifeYears();
        if (remaining == null || total == null) {
            throw new ParameterOutOfRangeException("remaining and total life are required for the technology factor");
        }
        return Fractions.requireFraction("remaining life share", (double) remaining / total);
    }
}
