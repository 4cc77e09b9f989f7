package com.jay.ipvalue.controller;

import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.IpAsset;
import com.jay.ipvalue.model.enums.PortfolioFailureMode;

import java.util.List;

/**
 * Request bodies of the valuation endpoints. Omitted assumptions are derived from the
 * company's own filings.
 */
public final class ValuationRequest {

    private ValuationRequest() {}

    public record Asset(IpAsset asset, AssumptionSet assumptions) {}

    /** A null mode falls back to {@code portfolio.failure_mode} from valuation.yaml. */
    public record Portfolio(List<IpAsset> assets, AssumptionSet assumptions, PortfolioFailureMode mode) {}
}
