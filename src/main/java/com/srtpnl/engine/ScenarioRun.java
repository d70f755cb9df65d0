package com.srtpnl.engine;

import com.srtpnl.domain.model.DealParameters;
import com.srtpnl.domain.model.PeriodRecord;
import com.srtpnl.domain.model.ScenarioInput;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A single, in-progress simulation of one scenario.
 *
 * <p>Yields one {@link PeriodRecord} per period in chronological order, computing each
 * period only when requested. The run consumes its {@link SimulationState} in place and
 * cannot be restarted: once exhausted, start a new run from {@link ScenarioRunner}.
 */
public class ScenarioRun implements Iterator<PeriodRecord> {

    private final DealParameters dealParameters;
    private final ScenarioInput scenarioInput;
    private final int scenarioIndex;
    private final String scenarioId;
    private final WaterfallEngine waterfallEngine;
    private final SimulationState state;
    private final DiscountingAccumulator accumulator;
    private final int totalPeriods;

    private int nextPeriod = 1;

    ScenarioRun(
            DealParameters dealParameters,
            ScenarioInput scenarioInput,
            int scenarioIndex,
            WaterfallEngine waterfallEngine) {
        this.dealParameters = dealParameters;
        this.scenarioInput = scenarioInput;
        this.scenarioIndex = scenarioIndex;
        this.scenarioId = ScenarioRunner.scenarioId(scenarioIndex);
        this.waterfallEngine = waterfallEngine;
        this.state = SimulationState.initial(dealParameters);
        this.accumulator = new DiscountingAccumulator(dealParameters);
        this.totalPeriods = dealParameters.getTotalPeriods();
    }

    @Override
    public boolean hasNext() {
        return nextPeriod <= totalPeriods;
    }

    @Override
    public PeriodRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException(scenarioId + " already ran all " + totalPeriods + " periods");
        }
        int period = nextPeriod++;
        int periodsPerYear = dealParameters.getPeriodsPerYear();
        int year = (period - 1) / periodsPerYear + 1;
        int quarter = (period - 1) % periodsPerYear + 1;

        PeriodCashflow cashflow = waterfallEngine.advance(dealParameters, scenarioInput, state, year);
        double riskAdjustedPnl = accumulator.accumulate(year, cashflow.getQuarterlyCashflow());

        return PeriodRecord.builder()
                .scenarioId(scenarioId)
                .scenarioIndex(scenarioIndex)
                .period(period)
                .year(year)
                .quarter(quarter)
                .triggerYear(scenarioInput.getTriggerYear())
                .stressMultiplier(scenarioInput.getStressMultiplier())
                .periodLosses(cashflow.getPeriodLosses())
                .remainingNotional(state.getRemainingNotional())
                .trancheExposure(state.getTrancheExposure())
                .principalPayment(cashflow.getPrincipalPayment())
                .quarterlyCoupon(cashflow.getQuarterlyCoupon())
                .quarterlyCashflow(cashflow.getQuarterlyCashflow())
                .amortisationRegime(cashflow.getRegime())
                .cumulativePnl(state.getCumulativePnl())
                .riskAdjustedPnl(riskAdjustedPnl)
                .trancheWipedOut(state.getTrancheExposure() < 0)
                .build();
    }

    public String getScenarioId() {
        return scenarioId;
    }

    /** Investor PnL before any period has run, or after the last emitted period. */
    public double currentCumulativePnl() {
        return state.getCumulativePnl();
    }
}
