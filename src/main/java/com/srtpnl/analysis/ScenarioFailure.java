package com.srtpnl.analysis;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A scenario that could not be simulated. Other scenarios of the same analysis are
 * unaffected.
 */
@Getter
@Builder
@ToString
public class ScenarioFailure {

    private final String scenarioId;
    private final int scenarioIndex;
    /** Null when the scenario entry itself was missing. */
    private final Double stressMultiplier;

    private final Integer triggerYear;
    private final String errorCode;
    private final String message;
}
