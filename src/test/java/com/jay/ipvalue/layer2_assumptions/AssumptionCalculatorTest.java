package com.jay.ipvalue.layer2_assumptions;

import com.jay.ipvalue.config.ValuationConfig;
import com.jay.ipvalue.exception.DivisionUndefinedException;
import com.jay.ipvalue.exception.InsufficientDataException;
import com.jay.ipvalue.exception.TaxRateUndeterminedException;
import com.jay.ipvalue.model.AssumptionDerivation;
import com.jay.ipvalue.model.AssumptionDerivation.GrowthBreakdown;
import com.jay.ipvalue.model.AssumptionDerivation.TaxRateBreakdown;
import com.jay.ipvalue.model.AssumptionDerivation.WaccBreakdown;
import com.jay.ipvalue.model.MarketSnapshot;
import com.jay.ipvalue.model.RawStatementPeriod;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.jay.ipvalue.TestFixtures.statement;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AssumptionCalculatorTest {

    private final ValuationConfig config = new ValuationConfig();
    private final AssumptionCalculator calculator = new AssumptionCalculator(config);

    private static RawStatementPeriod taxed(String label, double netIncome, double tax) {
        return RawStatementPeriod.builder()
            .periodLabel(label).revenue(1000).netIncome(netIncome).incomeTaxExpense(tax).build();
    }

    @Nested
    class TaxRate {

        @Test
        void averagesRecentPeriodRates() {
            TaxRateBreakdown tax = calculator.deriveTaxRate(List.of(
                taxed("2024", 75.9, 24.1),
                taxed("2023", 85.3, 14.7),
                taxed("2022", 83.8, 16.2)));

            assertThat(tax.effectiveTaxRate()).isCloseTo(0.18333, within(1e-4));
            assertThat(tax.periodRates()).containsOnlyKeys("2024", "2023", "2022");
            assertThat(tax.excludedPeriods()).isEmpty();
            assertThat(tax.fallbackUsed()).isFalse();
        }

        @Test
        void lossPeriodIsExcludedFromAverage() {
            List<RawStatementPeriod> statements = List.of(
                taxed("2024", 75.9, 24.1),
                taxed("2023", -50, 5),
                taxed("2022", 85.3, 14.7));

            TaxRateBreakdown tax = calculator.deriveTaxRate(statements);

            assertThat(tax.effectiveTaxRate()).isCloseTo((0.241 + 0.147) / 2, within(1e-9));
            assertThat(tax.excludedPeriods()).containsExactly("2023");
            double naive = (0.241 + 5.0 / -45.0 + 0.147) / 3;
            assertThat(tax.effectiveTaxRate()).isNotCloseTo(naive, within(1e-3));
        }

        @Test
        void onlyTheMostRecentThreePeriodsCount() {
            TaxRateBreakdown tax = calculator.deriveTaxRate(List.of(
                taxed("2024", 80, 20),
                taxed("2023", 80, 20),
                taxed("2022", 80, 20),
                taxed("2021", 50, 50)));

            assertThat(tax.effectiveTaxRate()).isCloseTo(0.20, within(1e-9));
        }

        @Test
        void taxBenefitPeriodIsExcludedFromAverage() {
            TaxRateBreakdown tax = calculator.deriveTaxRate(List.of(
                taxed("2024", 130, -30),
                taxed("2023", 90, 10),
                taxed("2022", 95, 5)));

            assertThat(tax.effectiveTaxRate()).isCloseTo((0.10 + 0.05) / 2, within(1e-9));
            assertThat(tax.excludedPeriods()).containsExactly("2024");
        }

        @Test
        void rateAboveConfiguredMaximumIsExcluded() {
            TaxRateBreakdown tax = calculator.deriveTaxRate(List.of(
                taxed("2024", 40, 60),
                taxed("2023", 80, 20)));

            assertThat(tax.effectiveTaxRate()).isCloseTo(0.20, within(1e-9));
            assertThat(tax.excludedPeriods()).containsExactly("2024");

            config.tax().setMaxPlausibleRate(0.70);
            assertThat(calculator.deriveTaxRate(List.of(taxed("2024", 40, 60))).effectiveTaxRate())
                .isCloseTo(0.60, within(1e-9));
        }

        @Test
        void onlyTaxBenefitPeriodsAreUndetermined() {
            assertThatThrownBy(() -> calculator.deriveTaxRate(List.of(taxed("2024", 130, -30))))
                .isInstanceOf(TaxRateUndeterminedException.class)
                .hasMessageContaining("2024");
        }

        @Test
        void noPositivePretaxIncomeIsUndetermined() {
            List<RawStatementPeriod> losses = List.of(taxed("2024", -100, 0), taxed("2023", -20, -5));

            assertThatThrownBy(() -> calculator.deriveTaxRate(losses))
                .isInstanceOf(TaxRateUndeterminedException.class)
                .isInstanceOf(DivisionUndefinedException.class);
        }
    }

    @Nested
    class Beta {

        @Test
        void stepsDownAsMarketCapGrows() {
            assertThat(calculator.estimateBeta(600e9)).isEqualTo(1.0);
            assertThat(calculator.estimateBeta(200e9)).isEqualTo(1.1);
            assertThat(calculator.estimateBeta(50e9)).isEqualTo(1.2);
            assertThat(calculator.estimateBeta(5e9)).isEqualTo(1.3);
        }

        @Test
        void bandFloorsAreExclusive() {
            assertThat(calculator.estimateBeta(500e9)).isEqualTo(1.1);
            assertThat(calculator.estimateBeta(10e9)).isEqualTo(1.3);
        }
    }

    @Nested
    class Wacc {

        private RawStatementPeriod balanceSheet(double debt, double interest) {
            return RawStatementPeriod.builder()
                .periodLabel("2024").revenue(1000).totalDebt(debt).interestExpense(interest)
                .totalEquity(300e9).sharesOutstanding(1e9).build();
        }

        @Test
        void blendsCapmEquityCostWithAfterTaxDebtCost() {
            WaccBreakdown wacc = calculator.deriveWacc(
                List.of(balanceSheet(200e9, 8e9)),
                MarketSnapshot.builder().price(800).marketCap(800e9).build(),
                0.20);

            assertThat(wacc.beta()).isEqualTo(1.0);
            assertThat(wacc.betaEstimated()).isTrue();
            assertThat(wacc.costOfEquity()).isCloseTo(0.105, within(1e-12));
            assertThat(wacc.costOfDebt()).isCloseTo(0.04, within(1e-12));
            assertThat(wacc.equityWeight()).isCloseTo(0.8, within(1e-12));
            assertThat(wacc.debtWeight()).isCloseTo(0.2, within(1e-12));
            assertThat(wacc.wacc()).isCloseTo(0.0904, within(1e-9));
        }

        @Test
        void debtFreeCompanyUsesCostOfEquityAndSaysSo() {
            WaccBreakdown wacc = calculator.deriveWacc(
                List.of(balanceSheet(0, 0)), MarketSnapshot.builder().marketCap(50e9).build(), 0.2);

            assertThat(wacc.costOfDebt()).isZero();
            assertThat(wacc.wacc()).isCloseTo(0.045 + 1.2 * 0.06, within(1e-12));
            assertThat(wacc.notes()).anyMatch(note -> note.contains("No debt outstanding"));
        }

        @Test
        void costOfDebtIsCapped() {
            assertThat(calculator.costOfDebt(balanceSheet(100, 40))).isEqualTo(0.15);
        }

        @Test
        void costOfDebtWithoutDebtIsUndefined() {
            assertThatThrownBy(() -> calculator.costOfDebt(balanceSheet(0, 5)))
                .isInstanceOf(DivisionUndefinedException.class);
        }

        @Test
        void marketCapFallsBackToSharesTimesPrice() {
            WaccBreakdown wacc = calculator.deriveWacc(
                List.of(balanceSheet(0, 0)), MarketSnapshot.builder().price(10).build(), 0.2);

            assertThat(wacc.marketCap()).isEqualTo(10e9);
            assertThat(wacc.beta()).isEqualTo(1.3);
            assertThat(wacc.notes()).anyMatch(note -> note.contains("shares outstanding"));
        }

        @Test
        void noCapitalAtAllIsUndefined() {
            RawStatementPeriod empty = RawStatementPeriod.builder().periodLabel("2024").build();

            assertThatThrownBy(() -> calculator.deriveWacc(List.of(empty), null, 0.2))
                .isInstanceOf(DivisionUndefinedException.class);
        }
    }

    @Nested
    class TerminalGrowth {

        @Test
        void fastHistoricalGrowthIsCappedAtCeiling() {
            GrowthBreakdown growth = calculator.deriveTerminalGrowth(
                List.of(statement("2024", 121), statement("2023", 110), statement("2022", 100)));

            assertThat(growth.averageHistoricalGrowth()).isCloseTo(0.10, within(1e-9));
            assertThat(growth.terminalGrowth()).isEqualTo(0.04);
            assertThat(growth.clamped()).isTrue();
        }

        @Test
        void shrinkingRevenueIsRaisedToFloor() {
            GrowthBreakdown growth = calculator.deriveTerminalGrowth(
                List.of(statement("2024", 95), statement("2023", 100)));

            assertThat(growth.terminalGrowth()).isEqualTo(0.01);
        }

        @Test
        void moderateGrowthPassesThrough() {
            GrowthBreakdown growth = calculator.deriveTerminalGrowth(
                List.of(statement("2024", 102), statement("2023", 100)));

            assertThat(growth.terminalGrowth()).isCloseTo(0.02, within(1e-12));
            assertThat(growth.clamped()).isFalse();
        }

        @Test
        void singlePeriodIsInsufficient() {
            assertThatThrownBy(() -> calculator.deriveTerminalGrowth(List.of(statement("2024", 100))))
                .isInstanceOf(InsufficientDataException.class);
        }
    }

    @Test
    void deriveUsesFallbackOnlyWhenTaxRateIsUndetermined() {
        List<RawStatementPeriod> losses = List.of(
            RawStatementPeriod.builder().periodLabel("2024").revenue(110).netIncome(-10).totalDebt(0).build(),
            RawStatementPeriod.builder().periodLabel("2023").revenue(100).netIncome(-20).build());
        MarketSnapshot snapshot = MarketSnapshot.builder().marketCap(5e9).build();

        AssumptionDerivation derivation = calculator.derive("LOSS", losses, snapshot, 0.25);

        assertThat(derivation.getTax().fallbackUsed()).isTrue();
        assertThat(derivation.getAssumptions().taxRate()).isEqualTo(0.25);
        assertThat(derivation.getTax().excludedPeriods()).containsExactly("2024", "2023");
        assertThatThrownBy(() -> calculator.derive("LOSS", losses, snapshot, null))
            .isInstanceOf(TaxRateUndeterminedException.class);
    }

    @Test
    void deriveSurvivesATaxBenefitYear() {
        List<RawStatementPeriod> statements = List.of(
            taxed("2024", 130, -30),
            taxed("2023", 90, 10),
            taxed("2022", 95, 5));
        MarketSnapshot snapshot = MarketSnapshot.builder().marketCap(5e9).build();

        AssumptionDerivation derivation = calculator.derive("CREDIT", statements, snapshot, null);

        assertThat(derivation.getAssumptions().taxRate()).isCloseTo(0.075, within(1e-9));
        assertThat(derivation.getTax().fallbackUsed()).isFalse();
        assertThat(derivation.getTax().excludedPeriods()).containsExactly("2024");
    }
}
