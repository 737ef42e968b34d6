package com.mosaic.calculator.presentation.exception;

import com.mosaic.calculator.exception.CalculatorException;
import com.mosaic.calculator.presentation.dto.ApiError;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.Comparator;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts binding failures and stray domain exceptions to the {@link ApiError} envelope.
 * Logs errors for monitoring while keeping internal details away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    static final String MALFORMED_BODY = "Malformed JSON request body";
    static final String UNEXPECTED = "An unexpected error occurred";

    /**
     * Client error - required field missing from the body (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .sorted(Comparator.comparing(FieldError::getField))
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        if (message.isEmpty()) {
            message = "Request validation failed";
        }
        LOG.warn("Request validation failed: {}", message);
        return ResponseEntity.badRequest().body(ApiError.badRequest(message));
    }

    /**
     * Client error - body is not valid JSON or has wrong field types (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(ApiError.badRequest(MALFORMED_BODY));
    }

    /**
     * Client error - domain exception that escaped the dispatcher (HTTP 400).
     */
    @ExceptionHandler(CalculatorException.class)
    ResponseEntity<ApiError> handleCalculator(CalculatorException ex) {
        LOG.warn("Calculation rejected: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiError.badRequest(ex.getMessage()));
    }

    /**
     * Catch-all. Spring MVC exceptions that already carry a status (404, 405, 415...) keep it;
     * anything else becomes HTTP 500.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            HttpStatusCode status = framework.getStatusCode();
            LOG.warn("Request failed with status {}: {}", status.value(), ex.getMessage());
            return ResponseEntity.status(status)
                    .body(new ApiError(reasonPhrase(status), ex.getMessage()));
        }
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase(), UNEXPECTED));
    }

    private static String reasonPhrase(HttpStatusCode status) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return resolved != null ? resolved.getReasonPhrase() : "Error";
    }
}
