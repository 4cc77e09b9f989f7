package com.jay.ipvalue.layer2_assumptions;

import com.jay.ipvalue.config.ValuationConfig;
import com.jay.ipvalue.exception.DivisionUndefinedException;
import com.jay.ipvalue.exception.InsufficientDataException;
import com.jay.ipvalue.exception.TaxRateUndeterminedException;
import com.jay.ipvalue.model.AssumptionDerivation;
import com.jay.ipvalue.model.AssumptionDerivation.GrowthBreakdown;
import com.jay.ipvalue.model.AssumptionDerivation.TaxRateBreakdown;
import com.jay.ipvalue.model.AssumptionDerivation.WaccBreakdown;
import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.MarketSnapshot;
import com.jay.ipvalue.model.RawStatementPeriod;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 2: Assumption Calculator.
 * Derives WACC, effective tax rate and terminal growth from company statements and the
 * latest market snapshot. All statement lists are newest period first.
 *
 * Beta is not regressed against market returns: it is read off a step function of market
 * capitalisation (bigger company, lower beta). Treat the resulting cost of equity as an
 * approximation; {@link WaccBreakdown#betaEstimated()} says so on every result.
 */
@Component
@RequiredArgsConstructor
public class AssumptionCalculator {

    private final ValuationConfig config;

    /**
     * Derives the full assumption set.
     *
     * @param fallbackTaxRate used only when no recent period yields a usable tax rate;
     *                        null means such a company fails with {@link TaxRateUndeterminedException}
     */
    public AssumptionDerivation derive(String ticker, List<RawStatementPeriod> statements,
                                       MarketSnapshot snapshot, Double fallbackTaxRate) {
        TaxRateBreakdown tax;
        try {
            tax = deriveTaxRate(statements);
        } catch (TaxRateUndeterminedException e) {
            if (fallbackTaxRate == null) throw e;
            tax = new TaxRateBreakdown(fallbackTaxRate, true, Map.of(), excludedPeriods(statements));
        }
        WaccBreakdown wacc = deriveWacc(statements, snapshot, tax.effectiveTaxRate());
        GrowthBreakdown growth = deriveTerminalGrowth(statements);

        return AssumptionDerivation.builder()
            .ticker(ticker)
            .assumptions(new AssumptionSet(wacc.wacc(), tax.effectiveTaxRate(), growth.terminalGrowth()))
            .wacc(wacc)
            .tax(tax)
            .growth(growth)
            .build();
    }

    // ── Effective tax rate ────────────────────────────────────────────────────

    /**
     * Averages tax / (net income + tax) over the most recent periods with positive pre-tax income.
     * Loss periods, tax-benefit periods and rates above the configured maximum are skipped so that
     * one-off credits and charges do not distort the rate.
     */
    public TaxRateBreakdown deriveTaxRate(List<RawStatementPeriod> statements) {
        requirePeriods(statements, 1, "effective tax rate");
        Map<String, Double> rates = new LinkedHashMap<>();
        List<String> excluded = new ArrayList<>();

        List<RawStatementPeriod> recent = recent(statements);
        for (int i = 0; i < recent.size(); i++) {
            RawStatementPeriod period = recent.get(i);
            String label = label(period, i);
            if (qualifies(period)) {
                rates.put(label, period.getIncomeTaxExpense() / period.pretaxIncome());
            } else {
                excluded.add(label);
            }
        }
        if (rates.isEmpty()) {
            throw new TaxRateUndeterminedException(String.format(
                "No period in the last %d (%s) has positive pre-tax income and a tax rate in [0, %.2f]; "
                    + "supply a fallback tax rate",
                recent.size(), String.join(", ", excluded), config.tax().getMaxPlausibleRate()));
        }
        double average = rates.values().stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        return new TaxRateBreakdown(average, false, rates, excluded);
    }

    // ── WACC ──────────────────────────────────────────────────────────────────

    /** WACC = E/V × Re + D/V × Rd × (1 − T), with Re from CAPM and Rd from the latest period. */
    public WaccBreakdown deriveWacc(List<RawStatementPeriod> statements, MarketSnapshot snapshot, double taxRate) {
        requirePeriods(statements, 1, "WACC");
        ValuationConfig.Capm capm = config.capm();
        RawStatementPeriod latest = statements.get(0);
        List<String> notes = new ArrayList<>();

        double marketCap = marketCap(latest, snapshot, notes);
        double totalDebt = Math.max(0, latest.getTotalDebt());
        double totalCapital = marketCap + totalDebt;
        if (totalCapital <= 0) {
            throw new DivisionUndefinedException("Market capitalisation plus debt is zero; capital weights undefined");
        }

        double beta = estimateBeta(marketCap);
        double costOfEquity = capm.getRiskFreeRate() + beta * capm.getMarketRiskPremium();
        notes.add(String.format("Beta %.2f estimated from market-cap band, not regressed", beta));

        double costOfDebt;
        try {
            costOfDebt = costOfDebt(latest);
        } catch (DivisionUndefinedException e) {
            // No debt outstanding: its weight is zero, so the rate cannot move WACC
            costOfDebt = 0;
            notes.add("No debt outstanding; cost of debt set to 0");
        }

        double equityWeight = marketCap / totalCapital;
        double debtWeight = totalDebt / totalCapital;
        double wacc = equityWeight * costOfEquity + debtWeight * costOfDebt * (1 - taxRate);

        return new WaccBreakdown(wacc, capm.getRiskFreeRate(), capm.getMarketRiskPremium(), beta, true,
            costOfEquity, costOfDebt, equityWeight, debtWeight, marketCap, totalDebt, List.copyOf(notes));
    }

    /** Step function: first configured band whose floor the market cap exceeds, else the small-cap beta. */
    public double estimateBeta(double marketCap) {
        ValuationConfig.Capm capm = config.capm();
        return capm.getBetaBands().stream()
            .sorted((a, b) -> Double.compare(b.getMinMarketCap(), a.getMinMarketCap()))
            .filter(band -> marketCap > band.getMinMarketCap())
            .map(ValuationConfig.BetaBand::getBeta)
            .findFirst()
            .orElse(capm.getSmallCapBeta());
    }

    /** Interest expense over total debt of one period, capped at the configured ceiling. */
    public double costOfDebt(RawStatementPeriod period) {
        if (period.getTotalDebt() <= 0) {
            throw new DivisionUndefinedException("Total debt is zero for " + period.getPeriodLabel()
                + "; cost of debt undefined");
        }
        double rate = Math.max(0, period.getInterestExpense()) / period.getTotalDebt();
        return Math.min(rate, config.capm().getCostOfDebtCap());
    }

    // ── Terminal growth ───────────────────────────────────────────────────────

    /**
     * Average period-over-period revenue growth, clamped to the configured band so that a
     * burst of short-term growth is never projected into perpetuity.
     */
    public GrowthBreakdown deriveTerminalGrowth(List<RawStatementPeriod> statements) {
        requirePeriods(statements, 2, "terminal growth");
        ValuationConfig.Growth cfg = config.growth();

        List<Double> history = new ArrayList<>();
        for (int i = 0; i < statements.size() - 1; i++) {
            double current = statements.get(i).getRevenue();
            double prior = statements.get(i + 1).getRevenue();
            if (prior > 0) history.add((current - prior) / prior);
        }
        if (history.isEmpty()) {
            throw new InsufficientDataException("No consecutive periods with positive prior revenue; growth undefined");
        }
        double average = history.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        double clamped = Math.max(cfg.getFloor(), Math.min(cfg.getCeiling(), average));
        return new GrowthBreakdown(clamped, average, List.copyOf(history), clamped != average);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private double marketCap(RawStatementPeriod latest, MarketSnapshot snapshot, List<String> notes) {
        if (snapshot != null && snapshot.getMarketCap() > 0) {
            return snapshot.getMarketCap();
        }
        if (snapshot != null && snapshot.getPrice() > 0 && latest.getSharesOutstanding() > 0) {
            notes.add("Market cap computed as shares outstanding × price");
            return snapshot.getPrice() * latest.getSharesOutstanding();
        }
        notes.add("No market price available; book equity used as equity value");
        return Math.max(0, latest.getTotalEquity());
    }

    private boolean qualifies(RawStatementPeriod period) {
        double pretax = period.pretaxIncome();
        if (pretax <= 0 || period.getIncomeTaxExpense() < 0) return false;
        return period.getIncomeTaxExpense() / pretax <= config.tax().getMaxPlausibleRate();
    }

    private List<RawStatementPeriod> recent(List<RawStatementPeriod> statements) {
        return statements.subList(0, Math.min(statements.size(), config.tax().getRecentPeriods()));
    }

    private List<String> excludedPeriods(List<RawStatementPeriod> statements) {
        List<String> excluded = new ArrayList<>();
        List<RawStatementPeriod> recent = recent(statements);
        for (int i = 0; i < recent.size(); i++) {
            if (!qualifies(recent.get(i))) excluded.add(label(recent.get(i), i));
        }
        return excluded;
    }

    private static String label(RawStatementPeriod period, int index) {
        return period.getPeriodLabel() != null ? period.getPeriodLabel() : "period-" + (index + 1);
    }

    private static void requirePeriods(List<RawStatementPeriod> statements, int minimum, String what) {
        int available = statements == null ? 0 : statements.size();
        if (available < minimum) {
            throw new InsufficientDataException(String.format(
                "%s needs at least %d period(s), %d available", what, minimum, available));
        }
    }
}
