package com.srtpnl.engine;

import com.srtpnl.domain.model.DealParameters;

/**
 * Compounds received cash forward at the risk-free rate and reports the
 * risk-adjusted PnL.
 *
 * <p>Each period: {@code balance = (balance + cashflow) * (1 + rate(year) / q)} and
 * {@code riskAdjustedPnl = balance - clnPrice}. Every cash flow is treated as
 * reinvested from receipt until the latest period seen. This is carry-forward
 * compounding, not a present-value discount.
 *
 * <p>One instance per scenario run; the balance starts at zero.
 */
public class DiscountingAccumulator {

    private final DealParameters dealParameters;
    private double compoundedBalance;

    public DiscountingAccumulator(DealParameters dealParameters) {
        this.dealParameters = dealParameters;
        this.compoundedBalance = 0.0;
    }

    /**
     * Adds one period's cash flow and compounds the balance over that period.
     *
     * @param year      1-based year of the period, selects the risk-free rate
     * @param cashflow  investor cash flow received in the period
     * @return risk-adjusted PnL after this period
     */
    public double accumulate(int year, double cashflow) {
        double periodRate = dealParameters.riskFreeRateForYear(year) / dealParameters.getPeriodsPerYear();
        compoundedBalance = (compoundedBalance + cashflow) * (1 + periodRate);
        return getRiskAdjustedPnl();
    }

    public double getCompoundedBalance() {
        return compoundedBalance;
    }

    public double getRiskAdjustedPnl() {
        return compoundedBalance - dealParameters.getClnPrice();
    }
}
