package com.jay.ipvalue.layer4_aggregation;

import com.jay.ipvalue.config.ValuationConfig;
import com.jay.ipvalue.model.ExcessEarningsParameters;
import com.jay.ipvalue.model.IncrementalIncomeParameters;
import com.jay.ipvalue.model.IpAsset;
import com.jay.ipvalue.model.SegmentSeries;
import com.jay.ipvalue.model.TechnologyScores;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Completes an asset's method parameters for one segment. Values pinned on the asset win;
 * operating margins otherwise come from the segment's history, everything else from configuration.
 */
@Component
@RequiredArgsConstructor
public class MethodParameterResolver {

    private final ValuationConfig config;

    public ExcessEarningsParameters excessEarnings(IpAsset asset, SegmentSeries series) {
        ExcessEarningsParameters pinned = asset.excessEarnings() != null
            ? asset.excessEarnings() : ExcessEarningsParameters.empty();
        ValuationConfig.ExcessEarnings defaults = config.excessEarnings();
        return new ExcessEarningsParameters(
            pinned.operatingMargin() != null ? pinned.operatingMargin() : series.averageOperatingMargin(),
            pinned.contributoryAssetReturns() != null
                ? pinned.contributoryAssetReturns() : defaults.getContributoryAssetReturns(),
            pinned.ipContributionFraction() != null
                ? pinned.ipContributionFraction() : defaults.getIpContributionFraction());
    }

    public TechnologyScores technology(IpAsset asset) {
        TechnologyScores pinned = asset.technology() != null ? asset.technology() : TechnologyScores.empty();
        ValuationConfig.Technology defaults = config.technology();
        return new TechnologyScores(
            pinned.innovation() != null ? pinned.innovation() : defaults.getInnovation(),
            pinned.commercialSuccess() != null ? pinned.commercialSuccess() : defaults.getCommercialSuccess(),
            pinned.legalStrength() != null ? pinned.legalStrength() : defaults.getLegalStrength(),
            pinned.remainingLifeYears() != null ? pinned.remainingLifeYears() : defaults.getRemainingLifeYears(),
            pinned.totalLifeYears() != null ? pinned.totalLifeYears() : defaults.getTotalLifeYears());
    }

    public IncrementalIncomeParameters incrementalIncome(IpAsset asset, SegmentSeries series) {
        IncrementalIncomeParameters pinned = asset.incrementalIncome() != null
            ? asset.incrementalIncome() : new IncrementalIncomeParameters(null, null);
        return new IncrementalIncomeParameters(
            pinned.erosionFraction() != null
                ? pinned.erosionFraction() : config.incrementalIncome().getErosionFraction(),
            pinned.operatingMargin() != null ? pinned.operatingMargin() : series.averageOperatingMargin());
    }
}
