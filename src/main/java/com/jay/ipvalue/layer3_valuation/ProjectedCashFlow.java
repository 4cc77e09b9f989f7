package com.jay.ipvalue.layer3_valuation;

/** Undiscounted cash flow of one explicit period, with the components that produced it. */
record ProjectedCashFlow(
    double revenue,
    double cashFlow,
    Double operatingIncome,
    Double contributoryAssetCharge,
    Double decayFactor
) {
    static ProjectedCashFlow of(double revenue, double cashFlow) {
        return new ProjectedCashFlow(revenue, cashFlow, null, null, null);
    }
}
