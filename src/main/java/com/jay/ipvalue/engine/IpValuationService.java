package com.jay.ipvalue.engine;

import com.jay.ipvalue.config.ValuationConfig;
import com.jay.ipvalue.layer1_data.FinancialDataSource;
import com.jay.ipvalue.layer2_assumptions.AssumptionCalculator;
import com.jay.ipvalue.layer4_aggregation.AssetPortfolioAggregator;
import com.jay.ipvalue.layer4_aggregation.SensitivityAnalyzer;
import com.jay.ipvalue.layer5_insight.FinancialHealthAnalyzer;
import com.jay.ipvalue.model.AssetValuation;
import com.jay.ipvalue.model.AssumptionDerivation;
import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.FinancialHealthReport;
import com.jay.ipvalue.model.IpAsset;
import com.jay.ipvalue.model.MarketSnapshot;
import com.jay.ipvalue.model.PortfolioValuation;
import com.jay.ipvalue.model.RawStatementPeriod;
import com.jay.ipvalue.model.SensitivityReport;
import com.jay.ipvalue.model.enums.PortfolioFailureMode;
import com.jay.ipvalue.model.enums.ValuationMethodType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entry point for callers: normalises the ticker, fetches what each operation needs from the
 * data source and runs the layers in order. Valuations take their assumptions explicitly;
 * use {@link #deriveAssumptions(String)} first when they should come from the company's filings.
 *
 * Used by the /api endpoints in {@code ValuationController}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IpValuationService {

    private final FinancialDataSource dataSource;
    private final AssumptionCalculator assumptionCalculator;
    private final AssetPortfolioAggregator aggregator;
    private final SensitivityAnalyzer sensitivityAnalyzer;
    private final FinancialHealthAnalyzer healthAnalyzer;
    private final ValuationConfig config;

    public AssumptionDerivation deriveAssumptions(String ticker) {
        return deriveAssumptions(ticker, null);
    }

    /** @param fallbackTaxRate applied only when no recent period yields a usable tax rate */
    public AssumptionDerivation deriveAssumptions(String rawTicker, Double fallbackTaxRate) {
        String ticker = normalise(rawTicker);
        List<RawStatementPeriod> statements = dataSource.fetchStatementSeries(ticker, periods());
        MarketSnapshot snapshot = dataSource.fetchMarketSnapshot(ticker);

        AssumptionDerivation derivation = assumptionCalculator.derive(ticker, statements, snapshot, fallbackTaxRate);
        AssumptionSet a = derivation.getAssumptions();
        log.info("Assumptions for {}: WACC {}, tax {}, growth {}{}", ticker,
            pct(a.wacc()), pct(a.taxRate()), pct(a.terminalGrowth()),
            derivation.getTax().fallbackUsed() ? " (fallback tax rate)" : "");
        return derivation;
    }

    public AssetValuation valueAsset(String rawTicker, IpAsset asset, AssumptionSet assumptions) {
        String ticker = normalise(rawTicker);
        log.info("Valuing {} on {} with {}", asset.id(), ticker, asset.method().displayName());
        AssetValuation valuation = aggregator.valueAsset(ticker, asset, assumptions);
        log.info("{} on {}: {}", asset.id(), ticker, valuation.getTotalValue());
        return valuation;
    }

    public PortfolioValuation valuePortfolio(String rawTicker, List<IpAsset> assets, AssumptionSet assumptions) {
        return valuePortfolio(rawTicker, assets, assumptions, config.portfolio().getFailureMode());
    }

    public PortfolioValuation valuePortfolio(String rawTicker, List<IpAsset> assets, AssumptionSet assumptions,
                                             PortfolioFailureMode mode) {
        String ticker = normalise(rawTicker);
        log.info("Valuing portfolio of {} asset(s) on {} ({})", assets.size(), ticker, mode);
        return aggregator.valuePortfolio(ticker, assets, assumptions, mode);
    }

    public Map<ValuationMethodType, AssetValuation> compareMethods(String rawTicker, IpAsset asset,
                                                                  AssumptionSet assumptions) {
        String ticker = normalise(rawTicker);
        log.info("Comparing all methods for {} on {}", asset.id(), ticker);
        return aggregator.compareMethods(ticker, asset, assumptions);
    }

    public SensitivityReport analyzeSensitivity(String rawTicker, IpAsset asset, AssumptionSet assumptions) {
        String ticker = normalise(rawTicker);
        log.info("Sensitivity analysis for {} on {}", asset.id(), ticker);
        return sensitivityAnalyzer.analyze(ticker, asset, assumptions);
    }

    public FinancialHealthReport analyzeFinancialHealth(String rawTicker) {
        String ticker = normalise(rawTicker);
        log.info("Financial health analysis for {}", ticker);
        return healthAnalyzer.analyze(ticker,
            dataSource.fetchStatementSeries(ticker, periods()),
            dataSource.fetchMarketSnapshot(ticker));
    }

    private int periods() {
        return config.segments().getDefaultPeriods();
    }

    private static String normalise(String ticker) {
        return ticker.trim().toUpperCase(Locale.ROOT);
    }

    private static String pct(double rate) {
        return String.format("%.2f%%", rate * 100);
    }
}
