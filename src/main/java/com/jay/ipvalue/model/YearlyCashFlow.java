package com.jay.ipvalue.model;

/**
 * One explicit-period row of a valuation.
 * {@code operatingIncome}, {@code contributoryAssetCharge} and {@code decayFactor} are only set
 * by the methods that use them.
 */
public record YearlyCashFlow(
    int year,
    double revenue,
    double cashFlow,
    double discountFactor,
    double presentValue,
    Double operatingIncome,
    Double contributoryAssetCharge,
    Double decayFactor
) {}
