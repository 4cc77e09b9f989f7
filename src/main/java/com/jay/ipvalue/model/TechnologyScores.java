package com.jay.ipvalue.model;

import com.jay.ipvalue.exception.ParameterOutOfRangeException;
import lombok.Builder;

/**
 * Quality scores feeding the technology factor. Scores are on a 0-1 scale; lives are in periods.
 * Null components fall back to configured defaults at valuation time.
 */
@Builder(toBuilder = true)
public record TechnologyScores(
    Double innovation,
    Double commercialSuccess,
    Double legalStrength,
    Integer remainingLifeYears,
    Integer totalLifeYears
) {

    public TechnologyScores {
        Fractions.optionalFraction("innovation score", innovation);
        Fractions.optionalFraction("commercial success score", commercialSuccess);
        Fractions.optionalFraction("legal strength score", legalStrength);
        if (remainingLifeYears != null && remainingLifeYears < 1) {
            throw new ParameterOutOfRangeException("remaining life must be at least 1 period but was " + remainingLifeYears);
        }
        if (totalLifeYears != null && totalLifeYears < 1) {
            throw new ParameterOutOfRangeException("total life must be at least 1 period but was " + totalLifeYears);
        }
        if (remainingLifeYears != null && totalLifeYears != null && remainingLifeYears > totalLifeYears) {
            throw new ParameterOutOfRangeException(String.format(
                "remaining life %d exceeds total life %d", remainingLifeYears, totalLifeYears));
        }
    }

    public static TechnologyScores empty() {
        return new TechnologyScores(null, null, null, null, null);
    }
}
