package com.phillippitts.windowanalysis.presentation.exception;

import com.phillippitts.windowanalysis.exception.AllProvidersFailedException;
import com.phillippitts.windowanalysis.exception.AnalysisNotFoundException;
import com.phillippitts.windowanalysis.exception.InvalidAnalysisRequestException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

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
     * Client error - invalid submission (HTTP 400).
     */
    @ExceptionHandler(InvalidAnalysisRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidAnalysisRequestException ex) {
        LOG.warn("Invalid analysis request: {}", ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid analysis request",
                ex.getReason(),
                Instant.now()
            ));
    }

    /**
     * Client error - body failed bean validation or could not be parsed (HTTP 400).
     */
    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleMalformedBody(Exception ex) {
        String details = ex instanceof MethodArgumentNotValidException invalid
                ? invalid.getBindingResult().getFieldErrors().stream()
                        .map(e -> e.getField() + " " + e.getDefaultMessage())
                        .collect(Collectors.joining("; "))
                : "Request body is not valid JSON";
        LOG.warn("Malformed analysis submission: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "InvalidAnalysisRequestException",
                "Invalid analysis request",
                details,
                Instant.now()
            ));
    }

    /**
     * Unknown request id (HTTP 404).
     */
    @ExceptionHandler(AnalysisNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(AnalysisNotFoundException ex) {
        LOG.debug("Analysis not found: {}", ex.getRequestId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Analysis not found",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * No provider contributed (HTTP 503). Details list the reason per provider.
     */
    @ExceptionHandler(AllProvidersFailedException.class)
    ResponseEntity<ApiError> handleAllProvidersFailed(AllProvidersFailedException ex) {
        LOG.error("All providers failed: request={}, failures={}", ex.getRequestId(), ex.getFailures());
        String details = ex.getFailures().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                ex.isRetryable()
                        ? "Analysis providers temporarily unavailable, please retry"
                        : "No analysis provider could process the image",
                details,
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

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
