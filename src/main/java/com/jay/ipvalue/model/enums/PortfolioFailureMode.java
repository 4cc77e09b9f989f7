package com.jay.ipvalue.model.enums;

public enum PortfolioFailureMode {
    FAIL_FAST,   // first failing asset aborts the whole portfolio call
    BEST_EFFORT  // failing assets are skipped and reported in PortfolioValuation.failures
}
