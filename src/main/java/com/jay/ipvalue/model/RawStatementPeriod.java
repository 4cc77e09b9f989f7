package com.jay.ipvalue.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One fiscal period of disclosed company financials, as delivered by the data provider.
 * Amounts are in the reporting currency; fields the provider does not disclose stay 0.
 */
@Value
@Builder
@Jacksonized
public class RawStatementPeriod {
    String periodLabel;           // e.g. fiscal year end "2024-09-28"

    // Income statement
    double revenue;
    double grossProfit;
    double operatingIncome;
    double netIncome;
    double researchAndDevelopment;
    double incomeTaxExpense;
    double interestExpense;

    // Balance sheet
    double totalDebt;
    double totalAssets;
    double totalLiabilities;
    double totalEquity;
    double currentAssets;
    double currentLiabilities;
    double cash;
    double receivables;
    double sharesOutstanding;

    // Cash flow
    double operatingCashFlow;
    double capitalExpenditure;    // reported negative for outflows

    public double pretaxIncome() {
        return netIncome + incomeTaxExpense;
    }
}
