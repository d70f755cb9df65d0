package com.srtpnl.config;

import com.srtpnl.domain.model.DealParameters;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Default deal economics, loaded from application.properties.
 *
 * <p>Properties prefix: {@code srt.deal.*}. Used by the default analysis; API callers
 * can supply their own deal instead.
 *
 * <p>Defaults:
 * <ul>
 *   <li>trancheSize: 50,000,000 (first-loss tranche)</li>
 *   <li>notionalAmount: 500,000,000</li>
 *   <li>couponRate: 0.11</li>
 *   <li>annualLossRate: 0.0006 (6bps, unstressed)</li>
 *   <li>clnPrice: 45,000,000</li>
 *   <li>amortisationRate: 0.33 per year</li>
 *   <li>maturity 8 years, replenishment 3 years, quarterly periods</li>
 *   <li>riskFreeRates: 1% flat for 8 years</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "srt.deal")
public class SrtDealProperties {

    private double trancheSize = 50_000_000;
    private double notionalAmount = 500_000_000;
    private double couponRate = 0.11;
    private double annualLossRate = 0.0006;
    private double clnPrice = 45_000_000;
    private double amortisationRate = 0.33;
    private int maturity = DealParameters.DEFAULT_MATURITY;
    private int replenishmentPeriod = DealParameters.DEFAULT_REPLENISHMENT_PERIOD;
    private int periodsPerYear = DealParameters.DEFAULT_PERIODS_PER_YEAR;
    private List<Double> riskFreeRates = new ArrayList<>(List.of(0.01, 0.01, 0.01, 0.01, 0.01, 0.01, 0.01, 0.01));

    public DealParameters toDealParameters() {
        return DealParameters.builder()
                .trancheSize(trancheSize)
                .notionalAmount(notionalAmount)
                .couponRate(couponRate)
                .annualLossRate(annualLossRate)
                .clnPrice(clnPrice)
                .amortisationRate(amortisationRate)
                .maturity(maturity)
                .replenishmentPeriod(replenishmentPeriod)
                .periodsPerYear(periodsPerYear)
                .riskFreeRates(riskFreeRates)
                .build();
    }
}
