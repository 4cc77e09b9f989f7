package com.jay.ipvalue.model;

import com.jay.ipvalue.exception.ParameterOutOfRangeException;
import com.jay.ipvalue.model.enums.AssetKind;
import com.jay.ipvalue.model.enums.ValuationMethodType;
import lombok.Builder;

import java.util.List;

/**
 * A logical intangible asset mapped onto one or more business segments.
 * Ranges are checked here so that invalid definitions never reach the valuation math.
 */
@Builder(toBuilder = true)
public record IpAsset(
    String id,
    AssetKind kind,
    String description,
    List<SegmentAttribution> segments,
    double royaltyRate,
    ValuationMethodType method,
    ExcessEarningsParameters excessEarnings,
    TechnologyScores technology,
    IncrementalIncomeParameters incrementalIncome
) {

    public IpAsset {
        if (id == null || id.isBlank()) {
            throw new ParameterOutOfRangeException("asset id must not be blank");
        }
        if (segments == null || segments.isEmpty()) {
            throw new ParameterOutOfRangeException("asset " + id + " must be attributed to at least one segment");
        }
        Fractions.requireFraction("royalty rate of " + id, royaltyRate);
        segments = List.copyOf(segments);
        if (kind == null) kind = AssetKind.OTHER;
        if (method == null) method = ValuationMethodType.RELIEF_FROM_ROYALTY;
    }

    /** Same asset with every attribution fraction replaced by {@code min(1, fraction × factor)}. */
    public IpAsset withScaledAttribution(double factor) {
        List<SegmentAttribution> scaled = segments.stream()
            .map(s -> new SegmentAttribution(s.segmentName(), Math.min(1.0, s.attributionFraction() * factor)))
            .toList();
        return toBuilder().segments(scaled).build();
    }
}
