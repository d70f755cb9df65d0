package com.srtpnl.exception;

/**
 * A scenario failed while running, after its inputs passed validation. Unlike
 * {@link InvalidConfigurationException} this points at a defect, not at bad input.
 */
public class SimulationException extends AnalysisException {

    public SimulationException(String message, Throwable cause) {
        super(ErrorCode.SIMULATION_ERROR, message, null, cause);
    }
}
