package com.jay.ipvalue.layer1_data;

import com.jay.ipvalue.config.ValuationConfig;
import com.jay.ipvalue.exception.DataNotFoundException;
import com.jay.ipvalue.exception.InsufficientDataException;
import com.jay.ipvalue.exception.ParameterOutOfRangeException;
import com.jay.ipvalue.model.RawStatementPeriod;
import com.jay.ipvalue.model.SegmentRevenue;
import com.jay.ipvalue.model.SegmentSeries;
import com.jay.ipvalue.model.SegmentedRevenuePeriod;
import com.jay.ipvalue.model.enums.SegmentMatchMode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Layer 1: Segment Data Preparer.
 * Turns disclosed segment revenue plus company-wide statements into an aligned,
 * oldest-first {@link SegmentSeries}. Segment gross profit, R&D and operating income are
 * estimated through the configured {@link SegmentAllocationStrategy}.
 *
 * Periods are aligned on their period label. A period that does not disclose the segment,
 * or has no matching statement, is left out.
 */
@Component
@RequiredArgsConstructor
public class SegmentDataPreparer {

    private final FinancialDataSource dataSource;
    private final ValuationConfig config;
    private final SegmentAllocationStrategy allocation;

    /** Fetches and prepares up to {@code periods} periods of one segment. */
    public SegmentSeries prepare(String ticker, String segmentName, int periods) {
        if (periods < 1) {
            throw new InsufficientDataException("At least one period must be requested, got " + periods);
        }
        return prepare(ticker, segmentName, periods,
            dataSource.fetchSegmentedRevenues(ticker, periods),
            dataSource.fetchStatementSeries(ticker, periods));
    }

    /**
     * Prepares a segment from already fetched data. Both lists are newest first.
     */
    public SegmentSeries prepare(String ticker, String segmentName, int periods,
                                 List<SegmentedRevenuePeriod> segmentedRevenues,
                                 List<RawStatementPeriod> statements) {
        if (periods < 1) {
            throw new InsufficientDataException("At least one period must be requested, got " + periods);
        }
        if (segmentedRevenues == null || segmentedRevenues.isEmpty()) {
            throw new InsufficientDataException("No segmented revenue periods available for " + ticker);
        }
        SegmentMatchMode matchMode = config.segments().getMatchMode();

        Map<String, RawStatementPeriod> statementsByPeriod = new HashMap<>();
        if (statements != null) {
            for (RawStatementPeriod s : statements) statementsByPeriod.putIfAbsent(s.getPeriodLabel(), s);
        }

        boolean segmentSeen = false;
        List<String> labels = new ArrayList<>();
        List<Double> revenues = new ArrayList<>();
        List<Double> grossProfits = new ArrayList<>();
        List<Double> rdExpenses = new ArrayList<>();
        List<Double> operatingIncomes = new ArrayList<>();
        List<Double> operatingMargins = new ArrayList<>();
        List<Double> shares = new ArrayList<>();

        for (SegmentedRevenuePeriod period : segmentedRevenues) {
            Optional<SegmentRevenue> line = findSegment(period, segmentName, matchMode);
            if (line.isEmpty()) continue;
            segmentSeen = true;
            if (labels.size() >= periods) continue;

            RawStatementPeriod statement = statementsByPeriod.get(period.getPeriodLabel());
            if (statement == null) continue;

            double segmentRevenue = line.get().getAmount();
            if (segmentRevenue < 0) {
                throw new ParameterOutOfRangeException(String.format(
                    "Segment '%s' of %s reports negative revenue %.2f for %s",
                    segmentName, ticker, segmentRevenue, period.getPeriodLabel()));
            }
            double companyRevenue = statement.getRevenue();

            labels.add(period.getPeriodLabel());
            revenues.add(segmentRevenue);
            shares.add(allocation.share(segmentRevenue, companyRevenue));
            grossProfits.add(allocation.allocate(statement.getGrossProfit(), segmentRevenue, companyRevenue));
            rdExpenses.add(allocation.allocate(statement.getResearchAndDevelopment(), segmentRevenue, companyRevenue));
            operatingIncomes.add(allocation.allocate(statement.getOperatingIncome(), segmentRevenue, companyRevenue));
            operatingMargins.add(companyRevenue > 0 ? statement.getOperatingIncome() / companyRevenue : 0);
        }

        if (!segmentSeen) {
            throw new DataNotFoundException(String.format(
                "Segment '%s' not found for %s (match mode %s). Available segments: %s",
                segmentName, ticker, matchMode, availableSegments(segmentedRevenues)));
        }
        if (labels.isEmpty()) {
            throw new InsufficientDataException(String.format(
                "Segment '%s' of %s has no period with a matching income statement", segmentName, ticker));
        }

        return SegmentSeries.builder()
            .ticker(ticker)
            .segmentName(segmentName)
            .periodLabels(chronological(labels))
            .revenues(chronological(revenues))
            .grossProfits(chronological(grossProfits))
            .rdExpenses(chronological(rdExpenses))
            .operatingIncomes(chronological(operatingIncomes))
            .operatingMargins(chronological(operatingMargins))
            .allocationShares(chronological(shares))
            .build();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static Optional<SegmentRevenue> findSegment(SegmentedRevenuePeriod period, String name,
                                                        SegmentMatchMode mode) {
        return period.getSegments().stream()
            .filter(s -> mode.matches(name, s.getLabel()))
            .findFirst();
    }

    private static TreeSet<String> availableSegments(List<SegmentedRevenuePeriod> periods) {
        TreeSet<String> names = new TreeSet<>();
        for (SegmentedRevenuePeriod p : periods) {
            for (SegmentRevenue s : p.getSegments()) {
                if (s.getLabel() != null) names.add(s.getLabel());
            }
        }
        return names;
    }

    // Provider order is newest first
    private static <T> List<T> chronological(List<T> newestFirst) {
        List<T> copy = new ArrayList<>(newestFirst);
        Collections.reverse(copy);
        return List.copyOf(copy);
    }
}
