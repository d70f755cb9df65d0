package com.srtpnl.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.srtpnl.exception.ErrorCode;
import com.srtpnl.validation.ConfigurationViolation;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error body returned by {@link com.srtpnl.exception.GlobalExceptionHandler}.
 *
 * <p>{@code details} maps a request field to what was wrong with it. {@code violations}
 * is only present for invalid deal or scenario configurations and keeps the rejected
 * values.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {

    private final String code;
    private final int status;
    private final String message;
    private final Map<String, Object> details;
    private final List<Violation> violations;
    private final String path;
    private final Instant timestamp;

    public static ErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return ErrorResponse.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details)
                .path(path)
                .timestamp(Instant.now())
                .build();
    }

    @Getter
    @Builder
    public static class Violation {
        private final String field;
        private final String message;
        private final Object rejectedValue;

        public static Violation from(ConfigurationViolation violation) {
            return Violation.builder()
                    .field(violation.getField())
                    .message(violation.getMessage())
                    .rejectedValue(violation.getRejectedValue())
                    .build();
        }
    }
}
