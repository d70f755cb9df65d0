package com.srtpnl.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Economics of one SRT first-loss tranche, fixed for the lifetime of an analysis.
 *
 * <p>Amounts are in deal currency; rates are annual fractions. Losses accrue on the
 * remaining reference-portfolio notional, the coupon accrues on the tranche exposure.
 *
 * <p>{@code riskFreeRates} holds one annual rate per year of the horizon. Years beyond
 * the end of the list reuse the last rate (see {@link #riskFreeRateForYear(int)}).
 *
 * <p>Structural defaults: 8-year maturity, 3-year replenishment period, quarterly
 * periods. Nothing is checked here; {@code ConfigurationValidator} rejects unusable
 * values (including null rates) before a simulation starts.
 */
@Getter
@ToString
@EqualsAndHashCode
public class DealParameters {

    public static final int DEFAULT_MATURITY = 8;
    public static final int DEFAULT_REPLENISHMENT_PERIOD = 3;
    public static final int DEFAULT_PERIODS_PER_YEAR = 4;

    private final double trancheSize;
    private final double notionalAmount;
    private final double couponRate;
    private final double annualLossRate;
    private final double clnPrice;
    private final double amortisationRate;
    private final int maturity;
    private final int replenishmentPeriod;
    private final int periodsPerYear;
    private final List<Double> riskFreeRates;

    @Builder(toBuilder = true)
    public DealParameters(
            double trancheSize,
            double notionalAmount,
            double couponRate,
            double annualLossRate,
            double clnPrice,
            double amortisationRate,
            int maturity,
            int replenishmentPeriod,
            int periodsPerYear,
            List<Double> riskFreeRates) {
        this.trancheSize = trancheSize;
        this.notionalAmount = notionalAmount;
        this.couponRate = couponRate;
        this.annualLossRate = annualLossRate;
        this.clnPrice = clnPrice;
        this.amortisationRate = amortisationRate;
        this.maturity = maturity;
        this.replenishmentPeriod = replenishmentPeriod;
        this.periodsPerYear = periodsPerYear;
        this.riskFreeRates = riskFreeRates != null
                ? Collections.unmodifiableList(new ArrayList<>(riskFreeRates))
                : List.of();
    }

    /**
     * Number of simulated periods: {@code maturity * periodsPerYear}.
     *
     * @throws ArithmeticException if the product overflows an int
     */
    public int getTotalPeriods() {
        return Math.multiplyExact(maturity, periodsPerYear);
    }

    /**
     * Annual risk-free rate for a 1-based year. The last supplied rate is held flat
     * for years past the end of the curve.
     */
    public double riskFreeRateForYear(int year) {
        int index = Math.min(year - 1, riskFreeRates.size() - 1);
        return riskFreeRates.get(Math.max(index, 0));
    }

    public static class DealParametersBuilder {
        private int maturity = DEFAULT_MATURITY;
        private int replenishmentPeriod = DEFAULT_REPLENISHMENT_PERIOD;
        private int periodsPerYear = DEFAULT_PERIODS_PER_YEAR;
    }
}
