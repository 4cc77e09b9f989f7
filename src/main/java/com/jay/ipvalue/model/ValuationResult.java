package com.jay.ipvalue.model;

import com.jay.ipvalue.model.enums.ValuationMethodType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Value of one asset on one segment.
 * {@code totalValue} is always {@code pvExplicit + pvTerminal}.
 */
@Value
@Builder(toBuilder = true)
public class ValuationResult {
    ValuationMethodType method;
    String segmentName;
    double attributionFraction;

    double pvExplicit;
    double terminalValue;        // undiscounted perpetuity value at the end of the explicit period
    double pvTerminal;
    double totalValue;

    List<YearlyCashFlow> yearly;
    Map<String, Double> parameters;   // effective method inputs, e.g. adjusted royalty rate
    List<String> approximations;      // heuristics the figure relies on
}
