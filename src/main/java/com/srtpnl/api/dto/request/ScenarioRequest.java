package com.srtpnl.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioRequest {

    @NotNull
    private Double stressMultiplier;

    @NotNull
    private Integer triggerYear;
}
