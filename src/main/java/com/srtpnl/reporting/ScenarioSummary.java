package com.srtpnl.reporting;

import lombok.Builder;
import lombok.Data;

/**
 * End-of-horizon figures for one scenario.
 *
 * <p>{@code firstSequentialPeriod} and {@code firstWipedOutPeriod} are null when the
 * scenario never switched to sequential amortisation or never exhausted the tranche.
 */
@Data
@Builder
public class ScenarioSummary {

    private String scenarioId;
    private double stressMultiplier;
    private int triggerYear;
    private int periods;
    private double finalCumulativePnl;
    private double finalRiskAdjustedPnl;
    private double totalLosses;
    private double totalPrincipalReceived;
    private double totalCouponReceived;
    private double minimumTrancheExposure;
    private double finalRemainingNotional;
    private Integer firstSequentialPeriod;
    private boolean trancheWipedOut;
    private Integer firstWipedOutPeriod;
}
