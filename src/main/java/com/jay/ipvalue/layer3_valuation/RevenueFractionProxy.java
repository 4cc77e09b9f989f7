package com.jay.ipvalue.layer3_valuation;

import com.jay.ipvalue.config.ValuationConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Approximates every contributory asset category as a fixed fraction of revenue. */
@Component
@RequiredArgsConstructor
public class RevenueFractionProxy implements ContributoryAssetProxy {

    private final ValuationConfig config;

    @Override
    public double assetValue(double revenue) {
        return revenue * config.excessEarnings().getProxyAssetFraction();
    }

    @Override
    public String describe() {
        return String.format("Contributory asset values approximated as %.0f%% of revenue per category, "
            + "not derived from a balance-sheet allocation", config.excessEarnings().getProxyAssetFraction() * 100);
    }
}
