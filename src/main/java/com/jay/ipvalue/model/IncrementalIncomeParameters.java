package com.jay.ipvalue.model;

import lombok.Builder;

/**
 * "With and without" inputs.
 *
 * @param erosionFraction estimated share of segment revenue lost if the asset were absent
 * @param operatingMargin margin applied to the lost revenue; null means the segment's own history
 */
@Builder(toBuilder = true)
public record IncrementalIncomeParameters(Double erosionFraction, Double operatingMargin) {

    public IncrementalIncomeParameters {
        Fractions.optionalFraction("erosion fraction", erosionFraction);
        Fractions.optionalFraction("operating margin", operatingMargin);
    }
}
