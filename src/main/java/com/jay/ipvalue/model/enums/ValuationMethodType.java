package com.jay.ipvalue.model.enums;

public enum ValuationMethodType {
    RELIEF_FROM_ROYALTY("Relief from Royalty"),
    MULTI_PERIOD_EXCESS_EARNINGS("Multi-Period Excess Earnings"),
    TECHNOLOGY_FACTOR("Technology Factor"),
    INCREMENTAL_INCOME("Incremental Income");

    private final String displayName;

    ValuationMethodType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
