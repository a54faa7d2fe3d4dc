package com.phillippitts.denoisebatch.presentation.exception;

import com.phillippitts.denoisebatch.exception.EngineFailureException;
import com.phillippitts.denoisebatch.exception.InvalidStateException;
import com.phillippitts.denoisebatch.exception.MediaException;
import com.phillippitts.denoisebatch.exception.OutOfRangeException;
import com.phillippitts.denoisebatch.exception.PathException;
import com.phillippitts.denoisebatch.exception.UnsupportedConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Operation not allowed in the current batch state (HTTP 409).
     */
    @ExceptionHandler(InvalidStateException.class)
    ResponseEntity<ApiError> handleInvalidState(InvalidStateException ex) {
        LOG.info("Rejected: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex, "Operation not allowed in the current batch state");
    }

    /**
     * Engine cannot handle this config or input (HTTP 422).
     */
    @ExceptionHandler(UnsupportedConfigurationException.class)
    ResponseEntity<ApiError> handleUnsupportedConfiguration(UnsupportedConfigurationException ex) {
        LOG.info("Unsupported configuration: engine={}, reason={}", ex.getEngineKind(), ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex, "Engine configuration not supported for this input");
    }

    @ExceptionHandler(OutOfRangeException.class)
    ResponseEntity<ApiError> handleOutOfRange(OutOfRangeException ex) {
        LOG.info("Parameter out of range: {}={}", ex.getParameter(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Parameter out of range");
    }

    @ExceptionHandler(PathException.class)
    ResponseEntity<ApiError> handlePath(PathException ex) {
        LOG.warn("Output path problem: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Output path not usable");
    }

    /**
     * Unsupported, missing or unreadable media (HTTP 415).
     */
    @ExceptionHandler(MediaException.class)
    ResponseEntity<ApiError> handleMedia(MediaException ex) {
        LOG.warn("Media error: {}", ex.getMessage());
        return error(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ex, "Media file cannot be processed");
    }

    /**
     * Engine or external tool unavailable (HTTP 503).
     */
    @ExceptionHandler(EngineFailureException.class)
    ResponseEntity<ApiError> handleEngineFailure(EngineFailureException ex) {
        LOG.error("Engine failure: engine={}", ex.getEngineName(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Noise reduction engine unavailable");
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentNotValidException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.info("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request");
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

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, ex.getMessage(), Instant.now()));
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
