package com.jay.ipvalue.layer4_aggregation;

import com.jay.ipvalue.config.ValuationConfig;
import com.jay.ipvalue.exception.ValuationException;
import com.jay.ipvalue.layer1_data.SegmentDataPreparer;
import com.jay.ipvalue.model.AssetFailure;
import com.jay.ipvalue.model.AssetValuation;
import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.IpAsset;
import com.jay.ipvalue.model.PortfolioValuation;
import com.jay.ipvalue.model.SegmentAttribution;
import com.jay.ipvalue.model.SegmentSeries;
import com.jay.ipvalue.model.ValuationResult;
import com.jay.ipvalue.model.enums.PortfolioFailureMode;
import com.jay.ipvalue.model.enums.ValuationMethodType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 4: Asset & Portfolio Aggregator.
 * Values each (segment, attribution) pair of an asset and sums them; sums assets into a portfolio.
 *
 * Attribution scales segment revenue period by period and is never re-normalised across
 * segments or assets. Breakdowns keep input order so reports are reproducible.
 * Assets share no state, so callers may value them in parallel.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssetPortfolioAggregator {

    private final SegmentDataPreparer preparer;
    private final ValuationMethodDispatcher dispatcher;
    private final ValuationConfig config;

    public AssetValuation valueAsset(String ticker, IpAsset asset, AssumptionSet assumptions) {
        return valueAsset(ticker, asset, assumptions, asset.method());
    }

    /** Values the asset with {@code method} in place of the one it declares. */
    public AssetValuation valueAsset(String ticker, IpAsset asset, AssumptionSet assumptions,
                                     ValuationMethodType method) {
        int periods = config.segments().getDefaultPeriods();
        List<ValuationResult> segmentValuations = new ArrayList<>(asset.segments().size());
        double total = 0;

        for (SegmentAttribution attribution : asset.segments()) {
            SegmentSeries series = preparer.prepare(ticker, attribution.segmentName(), periods);
            List<Double> attributed = series.getRevenues().stream()
                .map(revenue -> revenue * attribution.attributionFraction())
                .toList();

            ValuationResult result = dispatcher.value(method, asset, series, attributed, assumptions)
                .toBuilder()
                .segmentName(attribution.segmentName())
                .attributionFraction(attribution.attributionFraction())
                .build();
            segmentValuations.add(result);
            total += result.getTotalValue();
        }

        log.debug("Valued {} ({}) on {} segment(s) of {}: {}",
            asset.id(), method, segmentValuations.size(), ticker, total);

        return AssetValuation.builder()
            .assetId(asset.id())
            .kind(asset.kind())
            .description(asset.description())
            .ticker(ticker)
            .method(method)
            .totalValue(total)
            .segmentValuations(List.copyOf(segmentValuations))
            .build();
    }

    public PortfolioValuation valuePortfolio(String ticker, List<IpAsset> assets, AssumptionSet assumptions) {
        return valuePortfolio(ticker, assets, assumptions, config.portfolio().getFailureMode());
    }

    /**
     * In {@link PortfolioFailureMode#FAIL_FAST} the first failing asset's exception propagates.
     * In {@link PortfolioFailureMode#BEST_EFFORT} failing assets are left out of the total and
     * listed in {@link PortfolioValuation#getFailures()}.
     */
    public PortfolioValuation valuePortfolio(String ticker, List<IpAsset> assets, AssumptionSet assumptions,
                                             PortfolioFailureMode mode) {
        List<AssetValuation> valuations = new ArrayList<>(assets.size());
        List<AssetFailure> failures = new ArrayList<>();
        double total = 0;

        for (IpAsset asset : assets) {
            AssetValuation valuation;
            try {
                valuation = valueAsset(ticker, asset, assumptions);
            } catch (ValuationException e) {
                if (mode != PortfolioFailureMode.BEST_EFFORT) throw e;
                log.warn("Best-effort portfolio {}: skipping asset {}: {}", ticker, asset.id(), e.getMessage());
                failures.add(new AssetFailure(asset.id(), e.getKind(), e.getMessage()));
                continue;
            }
            valuations.add(valuation);
            total += valuation.getTotalValue();
        }

        log.info("Portfolio {} valued: {} asset(s), {} failure(s), total {}",
            ticker, valuations.size(), failures.size(), total);

        return PortfolioValuation.builder()
            .ticker(ticker)
            .totalValue(total)
            .assetCount(valuations.size())
            .assetValuations(List.copyOf(valuations))
            .assumptions(assumptions)
            .mode(mode)
            .failures(List.copyOf(failures))
            .build();
    }

    /** Values one asset under every method, for side-by-side comparison. */
    public Map<ValuationMethodType, AssetValuation> compareMethods(String ticker, IpAsset asset,
                                                                  AssumptionSet assumptions) {
        Map<ValuationMethodType, AssetValuation> byMethod = new EnumMap<>(ValuationMethodType.class);
        for (ValuationMethodType method : ValuationMethodType.values()) {
            byMethod.put(method, valueAsset(ticker, asset, assumptions, method));
        }
        return byMethod;
    }
}
