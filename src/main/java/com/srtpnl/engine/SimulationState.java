package com.srtpnl.engine;

import com.srtpnl.domain.model.DealParameters;
import lombok.Getter;

/**
 * Mutable balances of a single scenario run.
 *
 * <p>Owned by exactly one {@link ScenarioRun}; never shared across scenarios or threads.
 * The sequential flag is a one-way latch: there is no operation that clears it.
 */
@Getter
public class SimulationState {

    private double remainingNotional;
    private double trancheExposure;
    private double cumulativePnl;
    private boolean sequentialMode;

    SimulationState(double remainingNotional, double trancheExposure, double cumulativePnl) {
        this.remainingNotional = remainingNotional;
        this.trancheExposure = trancheExposure;
        this.cumulativePnl = cumulativePnl;
    }

    /** Fresh state at inception: full notional and tranche, upfront CLN price paid. */
    public static SimulationState initial(DealParameters dealParameters) {
        return new SimulationState(
                dealParameters.getNotionalAmount(), dealParameters.getTrancheSize(), -dealParameters.getClnPrice());
    }

    void latchSequential() {
        this.sequentialMode = true;
    }

    void reduceExposure(double amount) {
        this.trancheExposure -= amount;
    }

    void amortiseNotional(double periodAmortisationRate) {
        this.remainingNotional *= (1 - periodAmortisationRate);
    }

    void receive(double cashflow) {
        this.cumulativePnl += cashflow;
    }
}
