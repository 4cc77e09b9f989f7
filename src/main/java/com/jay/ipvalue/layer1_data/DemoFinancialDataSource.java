package com.jay.ipvalue.layer1_data;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.ipvalue.exception.DataNotFoundException;
import com.jay.ipvalue.model.MarketSnapshot;
import com.jay.ipvalue.model.RawStatementPeriod;
import com.jay.ipvalue.model.SegmentedRevenuePeriod;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Offline data source backed by a bundled snapshot of provider responses.
 * Lets the engine run without API credits; active unless another data source is configured.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "ipvalue.data-source", havingValue = "demo", matchIfMissing = true)
public class DemoFinancialDataSource implements FinancialDataSource {

    private final Map<String, DemoCompany> companies;

    public DemoFinancialDataSource(@Value("${ipvalue.demo-file:demo-financials.yaml}") String demoFile) {
        this.companies = load(demoFile);
        log.info("Demo data source ready with {} companies: {}", companies.size(), companies.keySet());
    }

    @Override
    public List<SegmentedRevenuePeriod> fetchSegmentedRevenues(String ticker, int periods) {
        return limit(company(ticker).getSegmentedRevenues(), periods);
    }

    @Override
    public List<RawStatementPeriod> fetchStatementSeries(String ticker, int periods) {
        return limit(company(ticker).getStatements(), periods);
    }

    @Override
    public MarketSnapshot fetchMarketSnapshot(String ticker) {
        MarketSnapshot market = company(ticker).getMarket();
        if (market == null) {
            throw new DataNotFoundException("No market snapshot for " + ticker);
        }
        return market;
    }

    public boolean hasTicker(String ticker) {
        return ticker != null && companies.containsKey(ticker.toUpperCase(Locale.ROOT));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private DemoCompany company(String ticker) {
        DemoCompany company = ticker == null ? null : companies.get(ticker.toUpperCase(Locale.ROOT));
        if (company == null) {
            throw new DataNotFoundException(
                "No demo data for ticker '" + ticker + "'. Available: " + companies.keySet());
        }
        return company;
    }

    private static <T> List<T> limit(List<T> items, int periods) {
        if (items == null) return List.of();
        return items.stream().limit(Math.max(0, periods)).toList();
    }

    private static Map<String, DemoCompany> load(String demoFile) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try (InputStream is = DemoFinancialDataSource.class.getClassLoader().getResourceAsStream(demoFile)) {
            if (is == null) {
                throw new IllegalStateException("Demo data file '" + demoFile + "' not found on classpath");
            }
            DemoDocument document = mapper.readValue(is, DemoDocument.class);
            return document.getCompanies() != null ? Collections.unmodifiableMap(document.getCompanies()) : Map.of();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read demo data '" + demoFile + "': " + e.getMessage(), e);
        }
    }

    @Data static class DemoDocument {
        private Map<String, DemoCompany> companies;
    }

    @Data static class DemoCompany {
        private String name;
        private MarketSnapshot market;
        private List<SegmentedRevenuePeriod> segmentedRevenues;
        private List<RawStatementPeriod> statements;
    }
}
