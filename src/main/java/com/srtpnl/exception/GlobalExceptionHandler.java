package com.srtpnl.exception;

import com.srtpnl.api.dto.response.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Translates exceptions into {@link ErrorResponse} bodies.
 *
 * <p>Request-shape problems (missing fields, unreadable JSON, bad query parameters) are
 * 400s. Structurally invalid deals or scenarios are 422s carrying every violation.
 * Anything else is a 500 and logged with its stack trace.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequestBody(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> details.putIfAbsent(error.getField(), String.valueOf(error.getDefaultMessage())));
        return respond(ErrorCode.VALIDATION_ERROR, "Request validation failed", details, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        ex.getConstraintViolations()
                .forEach(violation -> details.putIfAbsent(violation.getPropertyPath().toString(), violation.getMessage()));
        return respond(ErrorCode.VALIDATION_ERROR, "Request validation failed", details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.debug("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(ErrorCode.BAD_REQUEST, "Request body is not valid JSON for this endpoint", null, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleParameterType(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String message = "Query parameter '" + ex.getName() + "' has an invalid value: " + ex.getValue();
        return respond(ErrorCode.BAD_REQUEST, message, null, request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleUnknownPath(NoResourceFoundException ex, HttpServletRequest request) {
        return respond(ErrorCode.NOT_FOUND, "No endpoint at " + request.getRequestURI(), null, request);
    }

    @ExceptionHandler(InvalidConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidConfiguration(
            InvalidConfigurationException ex, HttpServletRequest request) {
        log.warn("Rejected configuration: {}", ex.getMessage());
        ErrorResponse body = ErrorResponse.builder()
                .code(ex.getErrorCode().getCode())
                .status(ex.getErrorCode().getHttpStatus())
                .message(ex.getMessage())
                .details(ex.getDetails())
                .violations(ex.getViolations().stream()
                        .map(ErrorResponse.Violation::from)
                        .toList())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(body.getStatus()).body(body);
    }

    @ExceptionHandler(AnalysisException.class)
    public ResponseEntity<ErrorResponse> handleAnalysisFailure(AnalysisException ex, HttpServletRequest request) {
        if (ex.isServerError()) {
            log.error("Stress analysis failed: {}", ex.getMessage(), ex);
        } else {
            log.warn("Stress analysis rejected: {}", ex.getMessage());
        }
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request);
    }

    private ResponseEntity<ErrorResponse> respond(
            ErrorCode errorCode, String message, Map<String, Object> details, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(errorCode, message, details, request.getRequestURI());
        return ResponseEntity.status(errorCode.getHttpStatus()).body(body);
    }
}
