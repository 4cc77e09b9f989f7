package com.jay.ipvalue.layer3_valuation;

/**
 * Stands in for the value of the contributory assets (working capital, fixed assets, other
 * intangibles) that support a period's revenue, when no balance-sheet allocation exists.
 */
public interface ContributoryAssetProxy {

    double assetValue(double revenue);

    /** Human readable statement of the approximation, reported with every result. */
    String describe();
}
