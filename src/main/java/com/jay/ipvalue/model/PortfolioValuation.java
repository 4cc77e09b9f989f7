package com.jay.ipvalue.model;

import com.jay.ipvalue.model.enums.PortfolioFailureMode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PortfolioValuation {
    String ticker;
    double totalValue;
    int assetCount;
    List<AssetValuation> assetValuations;   // input order, never re-sorted
    AssumptionSet assumptions;
    PortfolioFailureMode mode;
    List<AssetFailure> failures;            // always empty in FAIL_FAST mode
}
