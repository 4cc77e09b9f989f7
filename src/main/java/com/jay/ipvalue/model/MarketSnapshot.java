package com.jay.ipvalue.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class MarketSnapshot {
    double price;
    double marketCap;
}
