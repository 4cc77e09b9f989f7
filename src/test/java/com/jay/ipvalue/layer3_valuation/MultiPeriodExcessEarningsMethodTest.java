package com.jay.ipvalue.layer3_valuation;

import com.jay.ipvalue.config.ValuationConfig;
import com.jay.ipvalue.exception.ParameterOutOfRangeException;
import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.ExcessEarningsParameters;
import com.jay.ipvalue.model.ValuationResult;
import com.jay.ipvalue.model.YearlyCashFlow;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MultiPeriodExcessEarningsMethodTest {

    private final ValuationConfig config = new ValuationConfig();
    private final MultiPeriodExcessEarningsMethod method =
        new MultiPeriodExcessEarningsMethod(new RevenueFractionProxy(config));
    private final AssumptionSet assumptions = new AssumptionSet(0.10, 0.21, 0.02);

    private ExcessEarningsParameters parameters(double margin) {
        return new ExcessEarningsParameters(margin, config.excessEarnings().getContributoryAssetReturns(), 0.5);
    }

    @Test
    void chargesContributoryAssetsBeforeSharingExcessEarnings() {
        ValuationResult result = method.value(List.of(100.0), assumptions, parameters(0.30));

        YearlyCashFlow year = result.getYearly().get(0);
        assertThat(year.operatingIncome()).isCloseTo(30.0, within(1e-9));
        // proxy 50 × (0.02 + 0.10 + 0.12)
        assertThat(year.contributoryAssetCharge()).isCloseTo(12.0, within(1e-9));
        assertThat(year.cashFlow()).isCloseTo(18.0 * 0.5 * 0.79, within(1e-9));
        assertThat(result.getPvExplicit()).isCloseTo(7.11 / 1.10, within(1e-9));
        assertThat(result.getTerminalValue()).isCloseTo(7.11 * 1.02 / 0.08, within(1e-9));
    }

    @Test
    void proxyApproximationIsReported() {
        ValuationResult result = method.value(List.of(100.0), assumptions, parameters(0.30));

        assertThat(result.getApproximations()).singleElement().asString().contains("50% of revenue");
        assertThat(result.getParameters()).containsKeys("return_working_capital", "return_fixed_assets",
            "return_other_intangibles");
    }

    @Test
    void excessEarningsMayTurnNegative() {
        ValuationResult result = method.value(List.of(100.0), assumptions, parameters(0.05));

        assertThat(result.getYearly().get(0).cashFlow()).isNegative();
        assertThat(result.getTotalValue()).isNegative();
    }

    @Test
    void missingParametersAreRejected() {
        ExcessEarningsParameters noReturns = new ExcessEarningsParameters(0.3, null, 0.5);

        assertThatThrownBy(() -> method.value(List.of(100.0), assumptions, noReturns))
            .isInstanceOf(ParameterOutOfRangeException.class)
            .hasMessageContaining("contributory");
        assertThatThrownBy(() -> method.value(List.of(100.0), assumptions, ExcessEarningsParameters.empty()))
            .isInstanceOf(ParameterOutOfRangeException.class);
    }

    @Test
    void requiredReturnOutsideUnitIntervalIsRejected() {
        assertThatThrownBy(() -> new ExcessEarningsParameters(0.3, Map.of("fixed_assets", 1.5), 0.5))
            .isInstanceOf(ParameterOutOfRangeException.class);
    }
}
