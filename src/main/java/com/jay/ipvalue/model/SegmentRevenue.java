package com.jay.ipvalue.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** One disclosed segment revenue line within a period. */
@Value
@Builder
@Jacksonized
public class SegmentRevenue {
    String label;
    double amount;
}
