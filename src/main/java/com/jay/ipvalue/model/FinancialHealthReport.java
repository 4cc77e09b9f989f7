package com.jay.ipvalue.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Advisory ratios and labels describing the company behind a valuation.
 * A null ratio means its denominator was zero or absent; nothing here feeds the valuation math.
 */
@Value
@Builder
public class FinancialHealthReport {
    String ticker;
    String latestPeriod;
    Health financialHealth;
    Profitability profitability;
    ResearchAndDevelopment researchAndDevelopment;
    CapitalStructure capitalStructure;
    MarketPosition marketPosition;
    Risk risk;

    public record Health(
        Double currentRatio,
        Double quickRatio,
        Double debtToEquity,
        Double interestCoverage,
        double freeCashFlow,
        Double fcfMargin,
        String assessment
    ) {}

    public record Profitability(
        Double grossMargin,
        Double operatingMargin,
        Double netMargin,
        Double returnOnEquity,
        Double returnOnAssets,
        String grossMarginTrend,
        String operatingMarginTrend,
        String insight
    ) {}

    public record ResearchAndDevelopment(
        double rdIntensity,
        double latestRdSpend,
        Double rdGrowthRate,
        List<Double> rdHistory,
        String ipGenerationPotential
    ) {}

    public record CapitalStructure(
        double totalDebt,
        double totalEquity,
        double marketCap,
        Double debtToAssets,
        Double debtToEquity,
        Double equityToAssets,
        Double marketToBook,
        String leverageAssessment
    ) {}

    public record MarketPosition(
        double marketCap,
        double enterpriseValue,
        double price,
        Double priceToEarnings,
        Double evToRevenue,
        Double evToEbitda,
        String insight
    ) {}

    public record Risk(
        Double cashToCurrentLiabilities,
        Double solvencyRatio,
        Double revenueVolatility,
        String assessment
    ) {}
}
