package com.srtpnl.exception;

import com.srtpnl.validation.ConfigurationViolation;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Thrown when deal parameters or a stress scenario violate a structural constraint
 * (e.g. non-positive periods per year, trigger year outside the deal's life).
 *
 * <p>Fatal for the affected deal or scenario and never retried. The message lists every
 * violated constraint with its offending value; {@link #getDetails()} maps each field
 * to its violation message.
 */
@Getter
public class InvalidConfigurationException extends AnalysisException {

    private final List<ConfigurationViolation> violations;

    public InvalidConfigurationException(String subject, List<ConfigurationViolation> violations) {
        super(ErrorCode.INVALID_CONFIGURATION, buildMessage(subject, violations), toDetails(violations), null);
        this.violations = List.copyOf(violations);
    }

    private static String buildMessage(String subject, List<ConfigurationViolation> violations) {
        return "Invalid " + subject + ": "
                + violations.stream().map(ConfigurationViolation::toString).collect(Collectors.joining("; "));
    }

    private static Map<String, Object> toDetails(List<ConfigurationViolation> violations) {
        Map<String, Object> details = new LinkedHashMap<>();
        violations.forEach(v -> details.put(v.getField(), v.getMessage()));
        return details;
    }
}
