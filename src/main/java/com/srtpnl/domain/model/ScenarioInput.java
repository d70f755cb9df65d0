package com.srtpnl.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One stress scenario: a multiplier on the expected annual loss rate and the year in
 * which the deal is contractually forced into sequential amortisation.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class ScenarioInput {

    private final double stressMultiplier;
    private final int triggerYear;

    public static ScenarioInput of(double stressMultiplier, int triggerYear) {
        return ScenarioInput.builder()
                .stressMultiplier(stressMultiplier)
                .triggerYear(triggerYear)
                .build();
    }
}
