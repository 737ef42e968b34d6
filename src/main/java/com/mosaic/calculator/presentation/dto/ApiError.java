package com.mosaic.calculator.presentation.dto;

import com.mosaic.calculator.domain.OperationError;

/**
 * Standardized error response for API clients.
 *
 * <pre>
 * {"error": "Bad Request", "message": "division by zero is not allowed"}
 * </pre>
 *
 * @param error   HTTP reason phrase of the status, e.g. {@code "Bad Request"}
 * @param message human-readable reason; never contains stack traces
 */
public record ApiError(
        String error,
        String message
) {

    public static ApiError badRequest(String message) {
        return new ApiError(OperationError.BAD_REQUEST, message);
    }

    public static ApiError from(OperationError error) {
        return new ApiError(error.error(), error.message());
    }
}
