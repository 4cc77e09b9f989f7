package com.jay.ipvalue.layer3_valuation;

import com.jay.ipvalue.exception.InsufficientDataException;
import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.ValuationResult;
import com.jay.ipvalue.model.YearlyCashFlow;

import java.util.ArrayList;
import java.util.List;

/**
 * Explicit-period plus growing-perpetuity decomposition shared by every method:
 * <pre>
 *   PV_explicit   = Σ CF_t / (1+WACC)^t
 *   TerminalValue = CF_n × (1+g) / (WACC − g)
 *   PV_terminal   = TerminalValue / (1+WACC)^n
 * </pre>
 */
final class CashFlowDiscounter {

    private CashFlowDiscounter() {}

    static ValuationResult.ValuationResultBuilder discount(List<ProjectedCashFlow> flows,
                                                           AssumptionSet assumptions,
                                                           boolean includeTerminalValue) {
        if (flows.isEmpty()) {
            throw new InsufficientDataException("Cannot discount an empty cash-flow series");
        }
        assumptions.requireTerminalValueDefined();
        double wacc = assumptions.wacc();

        double pvExplicit = 0;
        List<YearlyCashFlow> yearly = new ArrayList<>(flows.size());
        for (int t = 1; t <= flows.size(); t++) {
            ProjectedCashFlow flow = flows.get(t - 1);
            double discountFactor = Math.pow(1 + wacc, t);
            double pv = flow.cashFlow() / discountFactor;
            pvExplicit += pv;
            yearly.add(new YearlyCashFlow(t, flow.revenue(), flow.cashFlow(), discountFactor, pv,
                flow.operatingIncome(), flow.contributoryAssetCharge(), flow.decayFactor()));
        }

        double terminalValue = 0;
        double pvTerminal = 0;
        if (includeTerminalValue) {
            int n = flows.size();
            double terminalCashFlow = flows.get(n - 1).cashFlow() * (1 + assumptions.terminalGrowth());
            terminalValue = terminalCashFlow / (wacc - assumptions.terminalGrowth());
            pvTerminal = terminalValue / Math.pow(1 + wacc, n);
        }

        return ValuationResult.builder()
            .pvExplicit(pvExplicit)
            .terminalValue(terminalValue)
            .pvTerminal(pvTerminal)
            .totalValue(pvExplicit + pvTerminal)
            .yearly(List.copyOf(yearly));
    }
}
