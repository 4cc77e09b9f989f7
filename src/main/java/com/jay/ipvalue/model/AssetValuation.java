package com.jay.ipvalue.model;

import com.jay.ipvalue.model.enums.AssetKind;
import com.jay.ipvalue.model.enums.ValuationMethodType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** One asset's value summed across its segments; breakdown keeps the asset's segment order. */
@Value
@Builder
public class AssetValuation {
    String assetId;
    AssetKind kind;
    String description;
    String ticker;
    ValuationMethodType method;
    double totalValue;
    List<ValuationResult> segmentValuations;
}
