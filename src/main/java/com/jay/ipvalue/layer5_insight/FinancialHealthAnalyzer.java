package com.jay.ipvalue.layer5_insight;

import com.jay.ipvalue.exception.InsufficientDataException;
import com.jay.ipvalue.model.FinancialHealthReport;
import com.jay.ipvalue.model.FinancialHealthReport.CapitalStructure;
import com.jay.ipvalue.model.FinancialHealthReport.Health;
import com.jay.ipvalue.model.FinancialHealthReport.MarketPosition;
import com.jay.ipvalue.model.FinancialHealthReport.Profitability;
import com.jay.ipvalue.model.FinancialHealthReport.ResearchAndDevelopment;
import com.jay.ipvalue.model.FinancialHealthReport.Risk;
import com.jay.ipvalue.model.MarketSnapshot;
import com.jay.ipvalue.model.RawStatementPeriod;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 5: Financial Health Analyzer.
 * Advisory ratios and labels giving context to a valuation. Statements are newest period first.
 *
 * A ratio whose denominator is zero or negative is reported as null. Labels treat an undefined
 * ratio as the weakest band, except interest coverage where no interest expense means no burden.
 */
@Component
public class FinancialHealthAnalyzer {

    private static final int TREND_PERIODS = 3;
    private static final int RD_HISTORY_PERIODS = 5;

    public FinancialHealthReport analyze(String ticker, List<RawStatementPeriod> statements,
                                         MarketSnapshot snapshot) {
        if (statements == null || statements.isEmpty()) {
            throw new InsufficientDataException("No financial statements for " + ticker);
        }
        if (snapshot == null) {
            throw new InsufficientDataException("No market snapshot for " + ticker);
        }
        RawStatementPeriod latest = statements.get(0);

        return FinancialHealthReport.builder()
            .ticker(ticker)
            .latestPeriod(latest.getPeriodLabel())
            .financialHealth(health(latest))
            .profitability(profitability(statements))
            .researchAndDevelopment(researchAndDevelopment(statements))
            .capitalStructure(capitalStructure(latest, snapshot))
            .marketPosition(marketPosition(latest, snapshot))
            .risk(risk(statements))
            .build();
    }

    // ── Financial health ──────────────────────────────────────────────────────

    Health health(RawStatementPeriod p) {
        Double current = ratio(p.getCurrentAssets(), p.getCurrentLiabilities());
        Double quick = ratio(p.getCash() + p.getReceivables(), p.getCurrentLiabilities());
        Double debtToEquity = ratio(p.getTotalDebt(), p.getTotalEquity());
        Double coverage = ratio(p.getOperatingIncome(), p.getInterestExpense());
        double fcf = p.getOperatingCashFlow() + p.getCapitalExpenditure();
        Double fcfMargin = ratio(fcf, p.getRevenue());

        return new Health(current, quick, debtToEquity, coverage, fcf, fcfMargin,
            assessHealth(current, debtToEquity, coverage, p.getInterestExpense() <= 0));
    }

    static String assessHealth(Double current, Double debtToEquity, Double coverage, boolean noInterest) {
        int score = 0;
        score += current == null ? 1 : current > 1.5 ? 3 : current > 1.0 ? 2 : 1;
        score += debtToEquity == null ? 1 : debtToEquity < 0.5 ? 3 : debtToEquity < 1.0 ? 2 : 1;
        if (coverage == null) {
            score += noInterest ? 3 : 1;
        } else {
            score += coverage > 10 ? 3 : coverage > 5 ? 2 : 1;
        }

        if (score >= 8) return "Excellent - Strong financial position supports IP development";
        if (score >= 6) return "Good - Healthy balance sheet for IP investment";
        if (score >= 4) return "Moderate - Some financial constraints on IP spending";
        return "Weak - Financial stress may limit IP development";
    }

    // ── Profitability ─────────────────────────────────────────────────────────

    Profitability profitability(List<RawStatementPeriod> statements) {
        RawStatementPeriod p = statements.get(0);
        Double grossMargin = ratio(p.getGrossProfit(), p.getRevenue());
        Double operatingMargin = ratio(p.getOperatingIncome(), p.getRevenue());
        Double netMargin = ratio(p.getNetIncome(), p.getRevenue());

        List<Double> grossMargins = new ArrayList<>();
        List<Double> operatingMargins = new ArrayList<>();
        for (RawStatementPeriod s : statements.subList(0, Math.min(TREND_PERIODS, statements.size()))) {
            if (s.getRevenue() > 0) {
                grossMargins.add(s.getGrossProfit() / s.getRevenue());
                operatingMargins.add(s.getOperatingIncome() / s.getRevenue());
            }
        }

        return new Profitability(grossMargin, operatingMargin, netMargin,
            ratio(p.getNetIncome(), p.getTotalEquity()),
            ratio(p.getNetIncome(), p.getTotalAssets()),
            trend(grossMargins), trend(operatingMargins),
            profitabilityInsight(grossMargin));
    }

    /** Latest against the prior period; null with fewer than two usable periods. */
    static String trend(List<Double> newestFirst) {
        if (newestFirst.size() < 2) return null;
        int cmp = Double.compare(newestFirst.get(0), newestFirst.get(1));
        return cmp > 0 ? "improving" : cmp < 0 ? "declining" : "stable";
    }

    static String profitabilityInsight(Double grossMargin) {
        if (grossMargin != null && grossMargin > 0.6) return "High gross margins suggest strong IP/brand pricing power";
        if (grossMargin != null && grossMargin > 0.4) return "Healthy margins indicate IP contributing to competitive advantage";
        return "Lower margins may indicate IP is less differentiated";
    }

    // ── R&D ───────────────────────────────────────────────────────────────────

    ResearchAndDevelopment researchAndDevelopment(List<RawStatementPeriod> statements) {
        double intensitySum = 0;
        int intensityCount = 0;
        List<Double> history = new ArrayList<>();
        for (RawStatementPeriod s : statements) {
            if (history.size() < RD_HISTORY_PERIODS) history.add(s.getResearchAndDevelopment());
            if (s.getRevenue() > 0 && s.getResearchAndDevelopment() > 0) {
                intensitySum += s.getResearchAndDevelopment() / s.getRevenue();
                intensityCount++;
            }
        }
        double intensity = intensityCount == 0 ? 0 : intensitySum / intensityCount;
        double latest = statements.get(0).getResearchAndDevelopment();

        Double growth = null;
        if (statements.size() >= 2) {
            double prior = statements.get(1).getResearchAndDevelopment();
            growth = ratio(latest - prior, prior);
        }

        return new ResearchAndDevelopment(intensity, latest, growth, List.copyOf(history),
            ipGenerationPotential(intensity, growth));
    }

    static String ipGenerationPotential(double intensity, Double growth) {
        if (intensity > 0.15) {
            return growth != null && growth > 0.10
                ? "Excellent - Heavy R&D investment with growth suggests strong IP pipeline"
                : "Good - Significant R&D spend indicates active IP development";
        }
        if (intensity > 0.08) return "Moderate - Average R&D investment for IP generation";
        return "Low - Limited R&D suggests less IP-intensive business model";
    }

    // ── Capital structure ─────────────────────────────────────────────────────

    CapitalStructure capitalStructure(RawStatementPeriod p, MarketSnapshot snapshot) {
        Double debtToEquity = ratio(p.getTotalDebt(), p.getTotalEquity());
        return new CapitalStructure(
            p.getTotalDebt(), p.getTotalEquity(), snapshot.getMarketCap(),
            ratio(p.getTotalDebt(), p.getTotalAssets()),
            debtToEquity,
            ratio(p.getTotalEquity(), p.getTotalAssets()),
            ratio(snapshot.getMarketCap(), p.getTotalEquity()),
            leverage(debtToEquity));
    }

    static String leverage(Double debtToEquity) {
        if (debtToEquity == null) return "High - Significant leverage limits financial flexibility";
        if (debtToEquity < 0.3) return "Conservative - Low debt supports IP investment flexibility";
        if (debtToEquity < 0.7) return "Moderate - Balanced capital structure";
        if (debtToEquity < 1.5) return "Elevated - Higher debt may constrain IP spending";
        return "High - Significant leverage limits financial flexibility";
    }

    // ── Market position ───────────────────────────────────────────────────────

    MarketPosition marketPosition(RawStatementPeriod p, MarketSnapshot snapshot) {
        double enterpriseValue = snapshot.getMarketCap() + p.getTotalDebt() - p.getCash();
        Double eps = ratio(p.getNetIncome(), p.getSharesOutstanding());
        Double pe = eps == null ? null : ratio(snapshot.getPrice(), eps);
        Double evToRevenue = ratio(enterpriseValue, p.getRevenue());
        // operating income stands in for EBITDA
        Double evToEbitda = ratio(enterpriseValue, p.getOperatingIncome());

        return new MarketPosition(snapshot.getMarketCap(), enterpriseValue, snapshot.getPrice(),
            pe, evToRevenue, evToEbitda, marketInsight(evToRevenue));
    }

    static String marketInsight(Double evToRevenue) {
        if (evToRevenue != null && evToRevenue > 10) return "Premium valuation suggests market values IP/intangibles highly";
        if (evToRevenue != null && evToRevenue > 5) return "Above-average valuation indicates IP contributes to market value";
        return "Standard valuation multiples";
    }

    // ── Risk ──────────────────────────────────────────────────────────────────

    Risk risk(List<RawStatementPeriod> statements) {
        RawStatementPeriod p = statements.get(0);
        Double liquidity = ratio(p.getCash(), p.getCurrentLiabilities());
        Double solvency = ratio(p.getTotalAssets() - p.getTotalLiabilities(), p.getTotalAssets());
        Double volatility = statements.size() >= TREND_PERIODS
            ? revenueVolatility(statements.subList(0, TREND_PERIODS))
            : null;
        return new Risk(liquidity, solvency, volatility, assessRisk(liquidity, solvency));
    }

    /** Mean absolute period-over-period revenue change; null when no prior period has revenue. */
    static Double revenueVolatility(List<RawStatementPeriod> newestFirst) {
        double sum = 0;
        int count = 0;
        for (int i = 0; i + 1 < newestFirst.size(); i++) {
            double prior = newestFirst.get(i + 1).getRevenue();
            if (prior > 0) {
                sum += Math.abs((newestFirst.get(i).getRevenue() - prior) / prior);
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }

    static String assessRisk(Double liquidity, Double solvency) {
        double l = liquidity == null ? 0 : liquidity;
        double s = solvency == null ? 0 : solvency;
        if (l > 0.5 && s > 0.3) return "Low Risk - Strong financial position supports IP value stability";
        if (l > 0.3 && s > 0.2) return "Moderate Risk - Adequate financial cushion";
        return "Higher Risk - Financial constraints may affect IP development/value";
    }

    private static Double ratio(double numerator, double denominator) {
        return denominator > 0 ? numerator / denominator : null;
    }
}
