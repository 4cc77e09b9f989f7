package com.jay.ipvalue.model.enums;

public enum AssetKind {
    PATENT,
    TRADEMARK,
    TRADE_SECRET,
    COPYRIGHT,
    OTHER
}
