package com.phillippitts.grillstats.presentation.exception;

import com.phillippitts.grillstats.exception.CacheUnavailableException;
import com.phillippitts.grillstats.exception.DeviceSourceException;
import com.phillippitts.grillstats.exception.InvalidAlertRuleException;
import com.phillippitts.grillstats.exception.InvalidEventException;
import com.phillippitts.grillstats.exception.ProfileNotFoundException;
import com.phillippitts.grillstats.exception.RateLimitExceededException;
import com.phillippitts.grillstats.exception.UnauthorizedStreamException;
import com.phillippitts.grillstats.exception.UnknownDeviceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping internal details away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown device, channel or profile (HTTP 404).
     */
    @ExceptionHandler({UnknownDeviceException.class, ProfileNotFoundException.class})
    ResponseEntity<ApiError> handleNotFound(RuntimeException ex) {
        LOG.info("Not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), "Resource not found", ex.getMessage());
    }

    /**
     * Client error - malformed rule or event (HTTP 400).
     */
    @ExceptionHandler({InvalidAlertRuleException.class, InvalidEventException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleBadRequest(RuntimeException ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid request", ex.getMessage());
    }

    /**
     * Request body failed bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOG.warn("Validation failed: {}", details);
        return error(HttpStatus.BAD_REQUEST, "ValidationFailed", "Invalid request", details);
    }

    /**
     * Unparseable body, for example an unknown enum constant (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return error(HttpStatus.BAD_REQUEST, "MalformedBody", "Invalid request", "Request body could not be parsed");
    }

    @ExceptionHandler(RateLimitExceededException.class)
    ResponseEntity<ApiError> handleRateLimit(RateLimitExceededException ex) {
        return error(HttpStatus.TOO_MANY_REQUESTS, ex.getClass().getSimpleName(),
                "Too many requests", "Please retry after the current window");
    }

    @ExceptionHandler(UnauthorizedStreamException.class)
    ResponseEntity<ApiError> handleUnauthorized(UnauthorizedStreamException ex) {
        LOG.info("Unauthorized stream request: {}", ex.getMessage());
        return error(HttpStatus.UNAUTHORIZED, ex.getClass().getSimpleName(), "Unauthorized", ex.getMessage());
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler({CacheUnavailableException.class, DeviceSourceException.class})
    ResponseEntity<ApiError> handleUnavailable(RuntimeException ex) {
        LOG.error("Service unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Telemetry temporarily unavailable", "Please retry in a few seconds");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
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
