package com.phillippitts.voiceorders.presentation.exception;

import com.phillippitts.voiceorders.exception.BackendCallException;
import com.phillippitts.voiceorders.exception.MissingCredentialException;
import com.phillippitts.voiceorders.exception.OrderSnapshotException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Configuration error - the service runs but cannot serve voice sessions (HTTP 503).
     */
    @ExceptionHandler(MissingCredentialException.class)
    ResponseEntity<ApiError> handleMissingCredential(MissingCredentialException ex) {
        LOG.error("Missing credential: {}", ex.getPropertyName());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Voice service unavailable",
                "Backend credentials are not configured. Contact administrator.");
    }

    /**
     * Order data unusable (HTTP 503).
     */
    @ExceptionHandler(OrderSnapshotException.class)
    ResponseEntity<ApiError> handleSnapshot(OrderSnapshotException ex) {
        LOG.error("Order snapshot unavailable: status={}", ex.getStatus().database(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Order data unavailable", ex.getStatus().message());
    }

    /**
     * Transient backend error - retry possible (HTTP 502).
     */
    @ExceptionHandler(BackendCallException.class)
    ResponseEntity<ApiError> handleBackend(BackendCallException ex) {
        LOG.error("Backend call failed: backend={}", ex.getBackendName(), ex);
        return error(HttpStatus.BAD_GATEWAY, ex, "Upstream service temporarily unavailable",
                "Please retry in a few seconds");
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

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
