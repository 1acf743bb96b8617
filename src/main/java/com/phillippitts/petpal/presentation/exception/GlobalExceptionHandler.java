package com.phillippitts.petpal.presentation.exception;

import com.phillippitts.petpal.exception.AdapterFailureException;
import com.phillippitts.petpal.exception.BusyException;
import com.phillippitts.petpal.exception.CapabilityTimeoutException;
import com.phillippitts.petpal.exception.CommandNotFoundException;
import com.phillippitts.petpal.exception.InvalidCommandException;
import jakarta.servlet.ServletException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Command-level failures never reach this class; they are terminal command states.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - malformed or unknown command (HTTP 400). Not retryable.
     */
    @ExceptionHandler(InvalidCommandException.class)
    ResponseEntity<ApiError> handleInvalidCommand(InvalidCommandException ex) {
        LOG.warn("Invalid request: {}", ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid request", ex.getReason());
    }

    /**
     * Another command is executing (HTTP 409). Callers retry with backoff.
     */
    @ExceptionHandler(BusyException.class)
    ResponseEntity<ApiError> handleBusy(BusyException ex) {
        LOG.info("Command rejected, busy with {}", ex.getActiveRequestId());
        return error(HttpStatus.CONFLICT, ex.getClass().getSimpleName(),
                "Another command is executing",
                "Active request: " + ex.getActiveRequestId());
    }

    /**
     * Unknown or evicted request id (HTTP 404).
     */
    @ExceptionHandler(CommandNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(CommandNotFoundException ex) {
        LOG.debug("Status lookup for unknown request {}", ex.getRequestId());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(),
                "Unknown request id",
                "Request " + ex.getRequestId() + " is unknown or has been evicted");
    }

    /**
     * Direct action exceeded its bound (HTTP 504).
     */
    @ExceptionHandler(CapabilityTimeoutException.class)
    ResponseEntity<ApiError> handleCapabilityTimeout(CapabilityTimeoutException ex) {
        LOG.warn("Capability {} timed out after {} ms", ex.getCapability(), ex.getTimeoutMs());
        return error(HttpStatus.GATEWAY_TIMEOUT, ex.getClass().getSimpleName(),
                "Device did not respond in time",
                "Please retry in a few seconds");
    }

    /**
     * Direct action failed in the device adapter (HTTP 502).
     */
    @ExceptionHandler(AdapterFailureException.class)
    ResponseEntity<ApiError> handleAdapterFailure(AdapterFailureException ex) {
        LOG.error("Capability {} failed: {}", ex.getCapability(), ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, ex.getClass().getSimpleName(),
                "Device call failed",
                "Capability: " + ex.getCapability());
    }

    /**
     * Unparseable body or a parameter of the wrong type (HTTP 400).
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleMalformedRequest(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "MalformedRequest", "Malformed request",
                "Request body or parameters could not be parsed");
    }

    /**
     * Spring MVC errors that already carry a status (unknown path, wrong method, missing parameter).
     */
    @ExceptionHandler(ServletException.class)
    ResponseEntity<ApiError> handleFrameworkError(ServletException ex) {
        if (!(ex instanceof ErrorResponse response)) {
            return handleUnexpected(ex);
        }
        HttpStatusCode status = response.getStatusCode();
        LOG.debug("Request rejected by framework: {} {}", status.value(), ex.getMessage());
        return error(status, ex.getClass().getSimpleName(), "Request rejected", ex.getMessage());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatusCode status, String code, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(code, message, details, Instant.now()));
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
