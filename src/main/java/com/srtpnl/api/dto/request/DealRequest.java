package com.srtpnl.api.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Deal economics supplied by the caller. Structural terms (maturity, replenishment
 * period, periods per year) are optional and default to 8 / 3 / 4.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DealRequest {

    @NotNull
    private Double trancheSize;

    @NotNull
    private Double notionalAmount;

    @NotNull
    private Double couponRate;

    @NotNull
    private Double annualLossRate;

    @NotNull
    private Double clnPrice;

    @NotNull
    private Double amortisationRate;

    private Integer maturity;
    private Integer replenishmentPeriod;
    private Integer periodsPerYear;

    /** One annual rate per year; the last rate is held flat past the end of the list. */
    @NotEmpty
    private List<@NotNull Double> riskFreeRates;
}
