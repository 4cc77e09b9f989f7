package com.jay.ipvalue.layer4_aggregation;

import com.jay.ipvalue.layer3_valuation.IncrementalIncomeMethod;
import com.jay.ipvalue.layer3_valuation.MultiPeriodExcessEarningsMethod;
import com.jay.ipvalue.layer3_valuation.ReliefFromRoyaltyMethod;
import com.jay.ipvalue.layer3_valuation.TechnologyFactorMethod;
import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.IpAsset;
import com.jay.ipvalue.model.SegmentSeries;
import com.jay.ipvalue.model.ValuationResult;
import com.jay.ipvalue.model.enums.ValuationMethodType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/** Routes an attributed revenue series to the requested method with resolved parameters. */
@Component
@RequiredArgsConstructor
public class ValuationMethodDispatcher {

    private final ReliefFromRoyaltyMethod reliefFromRoyalty;
    private final MultiPeriodExcessEarningsMethod excessEarnings;
    private final TechnologyFactorMethod technologyFactor;
    private final IncrementalIncomeMethod incrementalIncome;
    private final MethodParameterResolver resolver;

    public ValuationResult value(ValuationMethodType method, IpAsset asset, SegmentSeries series,
                                 List<Double> attributedRevenues, AssumptionSet assumptions) {
        return switch (method) {
            case RELIEF_FROM_ROYALTY ->
                reliefFromRoyalty.value(attributedRevenues, assumptions, asset.royaltyRate());
            case MULTI_PERIOD_EXCESS_EARNINGS ->
                excessEarnings.value(attributedRevenues, assumptions, resolver.excessEarnings(asset, series));
            case TECHNOLOGY_FACTOR ->
                technologyFactor.value(attributedRevenues, assumptions, asset.royaltyRate(), resolver.technology(asset));
            case INCREMENTAL_INCOME ->
                incrementalIncome.value(attributedRevenues, assumptions, resolver.incrementalIncome(asset, series));
        };
    }
}
