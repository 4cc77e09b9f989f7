package com.jay.ipvalue.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Aligned per-period financials for one segment, oldest period first.
 * Gross profit, R&D and operating income are allocation estimates, not disclosed figures.
 */
@Value
@Builder
public class SegmentSeries {
    String ticker;
    String segmentName;
    List<String> periodLabels;
    List<Double> revenues;
    List<Double> grossProfits;
    List<Double> rdExpenses;
    List<Double> operatingIncomes;
    List<Double> operatingMargins;   // company-wide margin of each period
    List<Double> allocationShares;   // segment revenue / company revenue

    public int size() {
        return revenues.size();
    }

    public double averageOperatingMargin() {
        return operatingMargins.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }
}
