package com.jay.ipvalue.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inputs to the multi-period excess earnings method. Any null component is filled in when the
 * asset is valued: the margin from the segment's history, the rest from configuration.
 *
 * @param operatingMargin          segment operating margin
 * @param contributoryAssetReturns required return per contributory asset category, in insertion order
 * @param ipContributionFraction   share of excess earnings attributable to the asset
 */
@Builder(toBuilder = true)
public record ExcessEarningsParameters(
    Double operatingMargin,
    Map<String, Double> contributoryAssetReturns,
    Double ipContributionFraction
) {

    public ExcessEarningsParameters {
        Fractions.optionalFraction("operating margin", operatingMargin);
        Fractions.optionalFraction("IP contribution fraction", ipContributionFraction);
        if (contributoryAssetReturns != null) {
            contributoryAssetReturns.forEach((category, rate) ->
                Fractions.requirePresent("required return for " + category, rate));
            contributoryAssetReturns = Collections.unmodifiableMap(
                new LinkedHashMap<>(contributoryAssetReturns));
        }
    }

    public static ExcessEarningsParameters empty() {
        return new ExcessEarningsParameters(null, null, null);
    }
}
