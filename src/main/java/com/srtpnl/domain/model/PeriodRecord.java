package com.srtpnl.domain.model;

import com.srtpnl.domain.enums.AmortisationRegime;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One row of the cash-flow ledger: the outcome of a single quarter of one scenario.
 *
 * <p>Balances ({@code remainingNotional}, {@code trancheExposure}) are post-update
 * values for the period. They are reported exactly as computed: a negative tranche
 * exposure means the tranche has been wiped out by losses and is flagged through
 * {@code trancheWipedOut}, never clamped.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class PeriodRecord {

    /** Scenario label, e.g. "Stress 1". */
    private final String scenarioId;

    /** 0-based position of the scenario in the requested scenario list. */
    private final int scenarioIndex;

    /** Global 1-based period number across the horizon (1..maturity * periodsPerYear). */
    private final int period;

    private final int year;
    private final int quarter;
    private final int triggerYear;
    private final double stressMultiplier;
    private final double periodLosses;
    private final double remainingNotional;
    private final double trancheExposure;
    private final double principalPayment;
    private final double quarterlyCoupon;
    private final double quarterlyCashflow;
    private final AmortisationRegime amortisationRegime;
    private final double cumulativePnl;
    private final double riskAdjustedPnl;
    private final boolean trancheWipedOut;
}
