package com.srtpnl.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.srtpnl.domain.enums.AmortisationRegime;
import com.srtpnl.domain.model.DealParameters;
import com.srtpnl.domain.model.ScenarioInput;
import com.srtpnl.engine.PeriodCashflow;
import com.srtpnl.engine.SimulationState;
import com.srtpnl.engine.WaterfallEngine;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for WaterfallEngine: loss accrual, regime selection, the sequential latch,
 * pro-rata principal and the degenerate zero-notional case.
 */
class WaterfallEngineTest {

    private static final double EPS = 1e-6;

    private WaterfallEngine waterfallEngine;
    private DealParameters deal;

    @BeforeEach
    void setUp() {
        waterfallEngine = new WaterfallEngine();
        deal = referenceDeal();
    }

    static DealParameters referenceDeal() {
        return DealParameters.builder()
                .trancheSize(50_000_000)
                .notionalAmount(500_000_000)
                .couponRate(0.11)
                .annualLossRate(0.0006)
                .clnPrice(45_000_000)
                .amortisationRate(0.33)
                .riskFreeRates(Collections.nCopies(8, 0.01))
                .build();
    }

    /** Runs the engine quarter by quarter for {@code years} years and collects regimes. */
    private List<AmortisationRegime> regimesFor(ScenarioInput scenario, int years) {
        SimulationState state = SimulationState.initial(deal);
        List<AmortisationRegime> regimes = new ArrayList<>();
        for (int year = 1; year <= years; year++) {
            for (int quarter = 1; quarter <= deal.getPeriodsPerYear(); quarter++) {
                regimes.add(waterfallEngine.advance(deal, scenario, state, year).getRegime());
            }
        }
        return regimes;
    }

    // ==============================
    // REPLENISHMENT
    // ==============================

    @Nested
    @DisplayName("Replenishment period")
    class Replenishment {

        @Test
        @DisplayName("First quarter accrues 75,000 of losses and pays coupon only")
        void firstQuarter() {
            SimulationState state = SimulationState.initial(deal);

            PeriodCashflow cashflow = waterfallEngine.advance(deal, ScenarioInput.of(1, 4), state, 1);

            assertThat(cashflow.getRegime()).isEqualTo(AmortisationRegime.REPLENISHMENT);
            assertThat(cashflow.getPeriodLosses()).isCloseTo(75_000, within(EPS));
            assertThat(cashflow.getPrincipalPayment()).isZero();
            // Coupon on post-loss exposure: 49,925,000 * 0.11 / 4
            assertThat(cashflow.getQuarterlyCoupon()).isCloseTo(1_372_937.5, within(EPS));
            assertThat(cashflow.getQuarterlyCashflow()).isCloseTo(1_372_937.5, within(EPS));
            assertThat(state.getTrancheExposure()).isCloseTo(49_925_000, within(EPS));
            assertThat(state.getRemainingNotional()).isEqualTo(500_000_000);
            assertThat(state.getCumulativePnl()).isCloseTo(-45_000_000 + 1_372_937.5, within(EPS));
        }

        @Test
        @DisplayName("Stress multiplier scales losses linearly")
        void stressScalesLosses() {
            SimulationState state = SimulationState.initial(deal);

            PeriodCashflow cashflow = waterfallEngine.advance(deal, ScenarioInput.of(2.5, 7), state, 1);

            assertThat(cashflow.getPeriodLosses()).isCloseTo(187_500, within(EPS));
        }

        @Test
        @DisplayName("Notional does not amortise while replenishing")
        void noAmortisation() {
            SimulationState state = SimulationState.initial(deal);

            for (int quarter = 0; quarter < 12; quarter++) {
                PeriodCashflow cashflow =
                        waterfallEngine.advance(deal, ScenarioInput.of(1, 4), state, quarter / 4 + 1);
                assertThat(cashflow.getPrincipalPayment()).isZero();
            }

            assertThat(state.getRemainingNotional()).isEqualTo(500_000_000);
            assertThat(state.getTrancheExposure()).isCloseTo(50_000_000 - 12 * 75_000, within(EPS));
        }
    }

    // ==============================
    // REGIME TRANSITIONS
    // ==============================

    @Nested
    @DisplayName("Regime transitions")
    class RegimeTransitions {

        @Test
        @DisplayName("Pro-rata until the trigger year, sequential from then on")
        void proRataThenSequential() {
            List<AmortisationRegime> regimes = regimesFor(ScenarioInput.of(2.5, 7), 8);

            assertThat(regimes.subList(0, 12)).containsOnly(AmortisationRegime.REPLENISHMENT);
            assertThat(regimes.subList(12, 24)).containsOnly(AmortisationRegime.PRO_RATA);
            assertThat(regimes.subList(24, 32)).containsOnly(AmortisationRegime.SEQUENTIAL);
        }

        @Test
        @DisplayName("Trigger in the first post-replenishment year goes straight to sequential")
        void directToSequential() {
            List<AmortisationRegime> regimes = regimesFor(ScenarioInput.of(1, 4), 8);

            assertThat(regimes.subList(12, 32)).containsOnly(AmortisationRegime.SEQUENTIAL);
            assertThat(regimes).doesNotContain(AmortisationRegime.PRO_RATA);
        }

        @Test
        @DisplayName("Sequential stays latched after the trigger year has passed")
        void sequentialIsSticky() {
            SimulationState state = SimulationState.initial(deal);
            ScenarioInput scenario = ScenarioInput.of(1, 5);

            assertThat(waterfallEngine.advance(deal, scenario, state, 4).getRegime())
                    .isEqualTo(AmortisationRegime.PRO_RATA);
            assertThat(waterfallEngine.advance(deal, scenario, state, 5).getRegime())
                    .isEqualTo(AmortisationRegime.SEQUENTIAL);
            assertThat(waterfallEngine.advance(deal, scenario, state, 6).getRegime())
                    .isEqualTo(AmortisationRegime.SEQUENTIAL);
            // Going back to a pre-trigger year must not undo the latch
            assertThat(waterfallEngine.advance(deal, scenario, state, 4).getRegime())
                    .isEqualTo(AmortisationRegime.SEQUENTIAL);
            assertThat(state.isSequentialMode()).isTrue();
        }

        @Test
        @DisplayName("Trigger year inside the replenishment period never latches")
        void triggerDuringReplenishment() {
            List<AmortisationRegime> regimes = regimesFor(ScenarioInput.of(1, 2), 8);

            assertThat(regimes.subList(12, 32)).containsOnly(AmortisationRegime.PRO_RATA);
        }
    }

    // ==============================
    // AMORTISATION
    // ==============================

    @Nested
    @DisplayName("Amortisation cash flows")
    class Amortisation {

        @Test
        @DisplayName("Pro-rata principal is the tranche share of structural amortisation")
        void proRataPrincipal() {
            SimulationState state = SimulationState.initial(deal);
            ScenarioInput scenario = ScenarioInput.of(1, 8);
            double exposureBefore = state.getTrancheExposure();

            PeriodCashflow cashflow = waterfallEngine.advance(deal, scenario, state, 4);

            double expectedPrincipal = exposureBefore * 0.33 / 4;
            assertThat(cashflow.getRegime()).isEqualTo(AmortisationRegime.PRO_RATA);
            assertThat(cashflow.getPrincipalPayment()).isCloseTo(expectedPrincipal, within(EPS));
            assertThat(state.getRemainingNotional()).isCloseTo(500_000_000 * (1 - 0.33 / 4), within(EPS));
            assertThat(state.getTrancheExposure())
                    .isCloseTo(exposureBefore - expectedPrincipal - 75_000, within(EPS));
            assertThat(cashflow.getQuarterlyCashflow())
                    .isCloseTo(cashflow.getQuarterlyCoupon() + expectedPrincipal, within(EPS));
        }

        @Test
        @DisplayName("Sequential pays no principal and deducts losses twice")
        void sequentialAbsorbsLosses() {
            SimulationState state = SimulationState.initial(deal);
            ScenarioInput scenario = ScenarioInput.of(1, 4);

            PeriodCashflow cashflow = waterfallEngine.advance(deal, scenario, state, 4);

            assertThat(cashflow.getRegime()).isEqualTo(AmortisationRegime.SEQUENTIAL);
            assertThat(cashflow.getPrincipalPayment()).isZero();
            assertThat(state.getTrancheExposure()).isCloseTo(50_000_000 - 2 * 75_000, within(EPS));
            assertThat(state.getRemainingNotional()).isCloseTo(458_750_000, within(EPS));
            assertThat(cashflow.getQuarterlyCoupon()).isCloseTo(49_850_000 * 0.11 / 4, within(EPS));
        }

        @Test
        @DisplayName("Zero remaining notional yields zero pro-rata principal instead of a division fault")
        void zeroNotionalGuard() {
            DealParameters emptyPool = deal.toBuilder().notionalAmount(0).build();
            SimulationState state = SimulationState.initial(emptyPool);

            PeriodCashflow cashflow = waterfallEngine.advance(emptyPool, ScenarioInput.of(1, 8), state, 4);

            assertThat(cashflow.getRegime()).isEqualTo(AmortisationRegime.PRO_RATA);
            assertThat(cashflow.getPrincipalPayment()).isZero();
            assertThat(cashflow.getPeriodLosses()).isZero();
            assertThat(Double.isNaN(state.getTrancheExposure())).isFalse();
            assertThat(state.getTrancheExposure()).isEqualTo(50_000_000);
        }

        @Test
        @DisplayName("Negative exposure propagates unclamped")
        void negativeExposurePropagates() {
            SimulationState state = SimulationState.initial(deal);
            ScenarioInput scenario = ScenarioInput.of(500, 4);

            waterfallEngine.advance(deal, scenario, state, 1);
            PeriodCashflow second = waterfallEngine.advance(deal, scenario, state, 1);

            // 37.5m of losses per quarter against a 50m tranche
            assertThat(state.getTrancheExposure()).isCloseTo(-25_000_000, within(EPS));
            assertThat(second.getQuarterlyCoupon()).isNegative();
        }
    }
}
