package com.jay.ipvalue.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class SegmentedRevenuePeriod {
    String periodLabel;
    @Builder.Default
    List<SegmentRevenue> segments = List.of();
}
