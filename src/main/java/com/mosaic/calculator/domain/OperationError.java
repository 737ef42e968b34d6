package com.mosaic.calculator.domain;

import java.util.Objects;

/**
 * A calculation request that could not be satisfied.
 *
 * @param error   category label; always {@link #BAD_REQUEST} for dispatcher errors
 * @param message human-readable reason
 */
public record OperationError(
        String error,
        String message
) {

    public static final String BAD_REQUEST = "Bad Request";

    public OperationError {
        Objects.requireNonNull(error, "Error category must not be null");
        Objects.requireNonNull(message, "Error message must not be null");
    }

    public static OperationError badRequest(String message) {
        return new OperationError(BAD_REQUEST, message);
    }
}
