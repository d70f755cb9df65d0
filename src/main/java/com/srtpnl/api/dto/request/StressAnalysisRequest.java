package com.srtpnl.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for an ad-hoc stress analysis.
 * Range constraints (trigger year within maturity, positive multipliers) are enforced
 * by the domain validator, not here, so that one bad scenario does not reject the rest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StressAnalysisRequest {

    @NotNull
    @Valid
    private DealRequest deal;

    @NotEmpty
    private List<@NotNull @Valid ScenarioRequest> scenarios;

    /** Trigger year for the PnL time series in the response. Defaults to the configured base year. */
    private Integer seriesTriggerYear;
}
