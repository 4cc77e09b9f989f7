package com.jay.ipvalue.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.ipvalue.model.enums.PortfolioFailureMode;
import com.jay.ipvalue.model.enums.SegmentMatchMode;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and exposes the engine's tunable defaults from valuation.yaml.
 * Values are read once at startup and handed to the calculators explicitly;
 * a computation never consults configuration on its own.
 */
@Slf4j
@Component
public class ValuationConfig {

    @Value("${ipvalue.config-file:valuation.yaml}")
    private String configFile = "valuation.yaml";

    // ── Sections ──────────────────────────────────────────────────────────────
    private Capm capm = new Capm();
    private Tax tax = new Tax();
    private Growth growth = new Growth();
    private Segments segments = new Segments();
    private ExcessEarnings excessEarnings = new ExcessEarnings();
    private Technology technology = new Technology();
    private IncrementalIncome incrementalIncome = new IncrementalIncome();
    private Portfolio portfolio = new Portfolio();
    private Sensitivity sensitivity = new Sensitivity();

    @PostConstruct
    public void load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (is == null) {
                log.warn("Config file '{}' not found on classpath: using built-in defaults", configFile);
                return;
            }
            ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
            this.capm              = root.getCapm();
            this.tax               = root.getTax();
            this.growth            = root.getGrowth();
            this.segments          = root.getSegments();
            this.excessEarnings    = root.getExcessEarnings();
            this.technology        = root.getTechnology();
            this.incrementalIncome = root.getIncrementalIncome();
            this.portfolio         = root.getPortfolio();
            this.sensitivity       = root.getSensitivity();
            log.info("ValuationConfig loaded from '{}'. Segment match mode: {}, portfolio mode: {}",
                configFile, segments.getMatchMode(), portfolio.getFailureMode());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + configFile + ": " + e.getMessage(), e);
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Capm capm()                           { return capm; }
    public Tax tax()                             { return tax; }
    public Growth growth()                       { return growth; }
    public Segments segments()                   { return segments; }
    public ExcessEarnings excessEarnings()       { return excessEarnings; }
    public Technology technology()               { return technology; }
    public IncrementalIncome incrementalIncome() { return incrementalIncome; }
    public Portfolio portfolio()                 { return portfolio; }
    public Sensitivity sensitivity()             { return sensitivity; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Capm capm = new Capm();
        private Tax tax = new Tax();
        private Growth growth = new Growth();
        private Segments segments = new Segments();
        private ExcessEarnings excessEarnings = new ExcessEarnings();
        private Technology technology = new Technology();
        private IncrementalIncome incrementalIncome = new IncrementalIncome();
        private Portfolio portfolio = new Portfolio();
        private Sensitivity sensitivity = new Sensitivity();
    }

    @Data public static class Capm {
        private double riskFreeRate = 0.045;       // 10-year Treasury proxy
        private double marketRiskPremium = 0.06;
        // Beta by market cap, checked top-down; first band whose floor is exceeded wins
        private List<BetaBand> betaBands = List.of(
            new BetaBand(500e9, 1.0),
            new BetaBand(100e9, 1.1),
            new BetaBand(10e9, 1.2));
        private double smallCapBeta = 1.3;
        private double costOfDebtCap = 0.15;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BetaBand {
        private double minMarketCap;
        private double beta;
    }

    @Data public static class Tax {
        private int recentPeriods = 3;
        private double maxPlausibleRate = 0.50;    // period rates above this are treated as one-offs
    }

    @Data public static class Growth {
        private double floor = 0.01;
        private double ceiling = 0.04;             // long-run nominal GDP plus inflation
    }

    @Data public static class Segments {
        private SegmentMatchMode matchMode = SegmentMatchMode.EXACT;
        private int defaultPeriods = 5;
    }

    @Data public static class ExcessEarnings {
        private Map<String, Double> contributoryAssetReturns = defaultContributoryReturns();
        private double ipContributionFraction = 0.50;
        private double proxyAssetFraction = 0.50;  // contributory asset value as a share of revenue
    }

    @Data public static class Technology {
        private double innovation = 0.7;
        private double commercialSuccess = 0.7;
        private double legalStrength = 0.7;
        private int remainingLifeYears = 10;
        private int totalLifeYears = 20;           // statutory patent term
        private double decayHorizonMultiplier = 1.5;
        private double decayFloor = 0.30;
        private boolean includeTerminalValue = true;
    }

    @Data public static class IncrementalIncome {
        private double erosionFraction = 0.10;
    }

    @Data public static class Portfolio {
        private PortfolioFailureMode failureMode = PortfolioFailureMode.FAIL_FAST;
    }

    @Data public static class Sensitivity {
        private double royaltyRateDelta = 0.02;    // absolute, e.g. 5% -> 3% / 7%
        private double attributionFactor = 0.25;   // relative, e.g. 20% -> 15% / 25%
        private double waccDelta = 0.02;
        private double terminalGrowthDelta = 0.01;
    }

    private static Map<String, Double> defaultContributoryReturns() {
        Map<String, Double> returns = new LinkedHashMap<>();
        returns.put("working_capital", 0.02);
        returns.put("fixed_assets", 0.10);
        returns.put("other_intangibles", 0.12);
        return returns;
    }
}
