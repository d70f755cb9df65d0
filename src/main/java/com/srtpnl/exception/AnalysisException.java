package com.srtpnl.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Root of the stress-analysis exception hierarchy. The {@link ErrorCode} decides the
 * HTTP status; {@code details} carries per-field context for the error body.
 */
@Getter
public abstract class AnalysisException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected AnalysisException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public boolean isServerError() {
        return errorCode.getHttpStatus() >= 500;
    }
}
