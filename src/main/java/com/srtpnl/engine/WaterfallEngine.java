package com.srtpnl.engine;

import com.srtpnl.domain.enums.AmortisationRegime;
import com.srtpnl.domain.model.DealParameters;
import com.srtpnl.domain.model.ScenarioInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Advances a scenario's {@link SimulationState} by one period of the amortisation
 * waterfall.
 *
 * <p>Per period ({@code q = periodsPerYear}):
 * <ol>
 *   <li>Losses accrue on the pre-update notional:
 *       {@code notional * annualLossRate * stressMultiplier / q}</li>
 *   <li>REPLENISHMENT: no principal, no amortisation</li>
 *   <li>PRO_RATA: the tranche receives its pro-rata share of the structural
 *       amortisation as principal; notional amortises by {@code amortisationRate / q}</li>
 *   <li>SEQUENTIAL: no principal; the tranche absorbs the period's losses in full on top
 *       of the regular loss deduction; notional amortises as in PRO_RATA</li>
 *   <li>Every regime: losses are deducted from the tranche exposure</li>
 *   <li>Coupon accrues on the post-loss, post-amortisation exposure:
 *       {@code exposure * couponRate / q}</li>
 * </ol>
 *
 * <p>Regime selection: REPLENISHMENT while {@code year <= replenishmentPeriod}. After
 * that, reaching the trigger year latches sequential mode on the state, and the regime
 * is SEQUENTIAL whenever the latch is set, PRO_RATA otherwise. The latch is never
 * re-derived from the current year, so SEQUENTIAL cannot revert to PRO_RATA.
 *
 * <p>Degenerate arithmetic is defined rather than raised: a zero or negative notional
 * gives a zero pro-rata share, and a negative tranche exposure simply keeps
 * propagating.
 *
 * <p>Stateless; safe to share across concurrently running scenarios.
 */
@Component
public class WaterfallEngine {

    private static final Logger log = LoggerFactory.getLogger(WaterfallEngine.class);

    /**
     * Applies one period to the given state.
     *
     * @param dealParameters deal economics
     * @param scenarioInput  stress multiplier and trigger year of the running scenario
     * @param state          the scenario's state, mutated in place
     * @param year           1-based year of the period being simulated
     * @return the period's regime and investor cash flow
     */
    public PeriodCashflow advance(
            DealParameters dealParameters, ScenarioInput scenarioInput, SimulationState state, int year) {
        double periodsPerYear = dealParameters.getPeriodsPerYear();
        double periodAmortisationRate = dealParameters.getAmortisationRate() / periodsPerYear;

        double periodLosses = state.getRemainingNotional()
                * dealParameters.getAnnualLossRate()
                * scenarioInput.getStressMultiplier()
                / periodsPerYear;

        AmortisationRegime regime = resolveRegime(dealParameters, scenarioInput, state, year);
        double principalPayment = 0.0;

        switch (regime) {
            case REPLENISHMENT -> {
                // portfolio is replenished, nothing amortises
            }
            case PRO_RATA -> {
                principalPayment = proRataPrincipal(
                        state.getTrancheExposure(),
                        state.getRemainingNotional(),
                        dealParameters.getAmortisationRate(),
                        periodsPerYear);
                state.reduceExposure(principalPayment);
                state.amortiseNotional(periodAmortisationRate);
            }
            case SEQUENTIAL -> {
                state.reduceExposure(periodLosses);
                state.amortiseNotional(periodAmortisationRate);
            }
        }

        state.reduceExposure(periodLosses);

        double quarterlyCoupon = state.getTrancheExposure() * dealParameters.getCouponRate() / periodsPerYear;
        double quarterlyCashflow = quarterlyCoupon + principalPayment;
        state.receive(quarterlyCashflow);

        return PeriodCashflow.builder()
                .regime(regime)
                .periodLosses(periodLosses)
                .principalPayment(principalPayment)
                .quarterlyCoupon(quarterlyCoupon)
                .quarterlyCashflow(quarterlyCashflow)
                .build();
    }

    AmortisationRegime resolveRegime(
            DealParameters dealParameters, ScenarioInput scenarioInput, SimulationState state, int year) {
        if (year <= dealParameters.getReplenishmentPeriod()) {
            return AmortisationRegime.REPLENISHMENT;
        }
        if (!state.isSequentialMode() && year == scenarioInput.getTriggerYear()) {
            state.latchSequential();
            log.debug(
                    "Sequential amortisation triggered in year {} (stress {})",
                    year,
                    scenarioInput.getStressMultiplier());
        }
        return state.isSequentialMode() ? AmortisationRegime.SEQUENTIAL : AmortisationRegime.PRO_RATA;
    }

    /**
     * Tranche share of the period's structural amortisation:
     * {@code (exposure / notional) * (notional * amortisationRate / q)}.
     * A non-positive notional has no meaningful share and pays nothing.
     */
    double proRataPrincipal(
            double trancheExposure, double remainingNotional, double amortisationRate, double periodsPerYear) {
        if (remainingNotional <= 0) {
            return 0.0;
        }
        return (trancheExposure / remainingNotional) * (remainingNotional * amortisationRate / periodsPerYear);
    }
}
