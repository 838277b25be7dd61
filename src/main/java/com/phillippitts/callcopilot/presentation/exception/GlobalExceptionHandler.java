package com.phillippitts.callcopilot.presentation.exception;

import com.phillippitts.callcopilot.exception.ConfigurationException;
import com.phillippitts.callcopilot.exception.UpstreamException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the REST surface.
 *
 * Carrier frames never reach this handler; per-frame failures are absorbed by the
 * orchestrator.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Misconfiguration discovered at runtime (HTTP 503).
     */
    @ExceptionHandler(ConfigurationException.class)
    ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex) {
        LOG.error("Configuration error: property={}", ex.getPropertyName(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Service misconfigured",
                "Contact administrator.",
                Instant.now()
            ));
    }

    /**
     * Downstream failure (HTTP 502, or 503 when retrying may help).
     */
    @ExceptionHandler(UpstreamException.class)
    ResponseEntity<ApiError> handleUpstream(UpstreamException ex) {
        LOG.warn("Upstream failure: destination={}, status={}, retryable={}",
                ex.getDestination(), ex.getStatusCode(), ex.isRetryable());
        HttpStatus status = ex.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
        return ResponseEntity
            .status(status)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Downstream service unavailable",
                ex.isRetryable() ? "Please retry in a few seconds" : "Request could not be completed",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
