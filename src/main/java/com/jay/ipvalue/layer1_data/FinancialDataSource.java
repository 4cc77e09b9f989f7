package com.jay.ipvalue.layer1_data;

import com.jay.ipvalue.model.MarketSnapshot;
import com.jay.ipvalue.model.RawStatementPeriod;
import com.jay.ipvalue.model.SegmentedRevenuePeriod;

import java.util.List;

/**
 * Port to the external financial-data provider.
 * Implementations own transport, caching and authentication; the engine only sees these
 * value objects. Every list is ordered newest period first.
 */
public interface FinancialDataSource {

    /**
     * Disclosed segment revenue lines per period.
     *
     * @param ticker  company ticker, e.g. "AAPL"
     * @param periods maximum number of periods to return
     */
    List<SegmentedRevenuePeriod> fetchSegmentedRevenues(String ticker, int periods);

    /** Company-wide income statement, balance sheet and cash flow figures per period. */
    List<RawStatementPeriod> fetchStatementSeries(String ticker, int periods);

    /** Latest share price and market capitalisation. */
    MarketSnapshot fetchMarketSnapshot(String ticker);

    /**
     * Revenue of one exactly named segment per period, skipping periods that do not disclose it.
     */
    default List<PeriodAmount> fetchSegmentSeries(String ticker, String segmentName, int periods) {
        return fetchSegmentedRevenues(ticker, periods).stream()
            .flatMap(period -> period.getSegments().stream()
                .filter(s -> segmentName.equals(s.getLabel()))
                .limit(1)
                .map(s -> new PeriodAmount(period.getPeriodLabel(), s.getAmount())))
            .toList();
    }

    record PeriodAmount(String periodLabel, double amount) {}
}
