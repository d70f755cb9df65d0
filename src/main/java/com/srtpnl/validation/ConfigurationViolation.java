package com.srtpnl.validation;

import lombok.Builder;
import lombok.Getter;

/**
 * A single violated configuration constraint.
 *
 * <p>{@code field} names the offending input (e.g. "periodsPerYear"), {@code message}
 * states the constraint and the value that broke it.
 */
@Getter
@Builder
public class ConfigurationViolation {

    private final String field;
    private final String message;
    private final Object rejectedValue;

    public static ConfigurationViolation of(String field, String constraint, Object rejectedValue) {
        return ConfigurationViolation.builder()
                .field(field)
                .message(field + " " + constraint + " (was " + rejectedValue + ")")
                .rejectedValue(rejectedValue)
                .build();
    }

    @Override
    public String toString() {
        return message;
    }
}
