package com.jay.ipvalue.model;

import java.util.Objects;

/**
 * Share of one segment's economic value ascribed to an asset.
 * Fractions are independent per asset; several assets may draw on the same segment.
 */
public record SegmentAttribution(String segmentName, double attributionFraction) {

    public SegmentAttribution {
        Objects.requireNonNull(segmentName, "segmentName");
        Fractions.requirePositiveFraction("attribution fraction for " + segmentName, attributionFraction);
    }
}
