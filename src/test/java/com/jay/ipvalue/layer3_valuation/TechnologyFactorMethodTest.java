package com.jay.ipvalue.layer3_valuation;

import com.jay.ipvalue.config.ValuationConfig;
import com.jay.ipvalue.exception.ParameterOutOfRangeException;
import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.TechnologyScores;
import com.jay.ipvalue.model.ValuationResult;
import com.jay.ipvalue.model.YearlyCashFlow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.jay.ipvalue.TestFixtures.flat;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TechnologyFactorMethodTest {

    private final ValuationConfig config = new ValuationConfig();
    private final TechnologyFactorMethod method = new TechnologyFactorMethod(config);
    private final AssumptionSet assumptions = new AssumptionSet(0.10, 0.21, 0.02);

    private static TechnologyScores strongPatent() {
        return new TechnologyScores(0.92, 0.88, 0.90, 12, 20);
    }

    @Test
    void technologyFactorWeighsQualityScoresAndRemainingLife() {
        assertThat(TechnologyFactorMethod.technologyFactor(strongPatent())).isCloseTo(0.869, within(1e-9));
    }

    @Test
    void adjustedRoyaltyScalesBaseByOnePlusFactor() {
        ValuationResult result = method.value(flat(100.0, 5), assumptions, 0.05, strongPatent());

        assertThat(result.getParameters().get("technology_factor")).isCloseTo(0.869, within(1e-9));
        assertThat(result.getParameters().get("adjusted_royalty_rate")).isCloseTo(0.05 * 1.869, within(1e-9));
    }

    @Test
    void projectionStopsAtRemainingLifeAndDecaysLinearly() {
        TechnologyScores ageing = new TechnologyScores(0.8, 0.8, 0.8, 3, 20);
        ValuationResult result = method.value(flat(100.0, 5), assumptions, 0.05, ageing);

        assertThat(result.getYearly()).hasSize(3);
        // horizon = 3 × 1.5 periods
        assertThat(result.getYearly()).extracting(YearlyCashFlow::decayFactor)
            .containsExactly(1 - 1 / 4.5, 1 - 2 / 4.5, 1 - 3 / 4.5);
    }

    @Test
    void lifeCapKeepsTheMostRecentRevenue() {
        TechnologyScores ageing = new TechnologyScores(0.8, 0.8, 0.8, 2, 20);

        ValuationResult result = method.value(List.of(10.0, 20.0, 30.0, 40.0, 50.0), assumptions, 0.05, ageing);

        assertThat(result.getYearly()).extracting(YearlyCashFlow::revenue).containsExactly(40.0, 50.0);
        ValuationResult latestOnly = method.value(List.of(40.0, 50.0), assumptions, 0.05, ageing);
        assertThat(result.getTotalValue()).isCloseTo(latestOnly.getTotalValue(), within(1e-9));
    }

    @Test
    void decayNeverFallsBelowConfiguredFloor() {
        config.technology().setDecayHorizonMultiplier(1.0);
        TechnologyScores ageing = new TechnologyScores(0.8, 0.8, 0.8, 2, 20);

        ValuationResult result = method.value(flat(100.0, 5), assumptions, 0.05, ageing);

        assertThat(result.getYearly()).extracting(YearlyCashFlow::decayFactor).containsExactly(0.5, 0.30);
    }

    @Test
    void terminalValueCanBeSwitchedOff() {
        config.technology().setIncludeTerminalValue(false);

        ValuationResult result = method.value(flat(100.0, 5), assumptions, 0.05, strongPatent());

        assertThat(result.getPvTerminal()).isZero();
        assertThat(result.getTotalValue()).isEqualTo(result.getPvExplicit());
    }

    @Test
    void missingScoreIsRejected() {
        TechnologyScores partial = new TechnologyScores(null, 0.8, 0.8, 5, 20);

        assertThatThrownBy(() -> method.value(flat(100.0, 5), assumptions, 0.05, partial))
            .isInstanceOf(ParameterOutOfRangeException.class)
            .hasMessageContaining("innovation");
    }

    @Test
    void remainingLifeBeyondTotalLifeIsRejected() {
        assertThatThrownBy(() -> new TechnologyScores(0.8, 0.8, 0.8, 25, 20))
            .isInstanceOf(ParameterOutOfRangeException.class);
    }
}
