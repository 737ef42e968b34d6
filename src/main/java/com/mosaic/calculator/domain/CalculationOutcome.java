package com.mosaic.calculator.domain;

/**
 * Outcome of dispatching a calculation: exactly one of a result or an error.
 *
 * @param result the successful result, or null on failure
 * @param error  the failure, or null on success
 */
public record CalculationOutcome(
        CalculationResult result,
        OperationError error
) {

    public CalculationOutcome {
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of result or error must be present");
        }
    }

    public static CalculationOutcome success(CalculationResult result) {
        return new CalculationOutcome(result, null);
    }

    public static CalculationOutcome failure(OperationError error) {
        return new CalculationOutcome(null, error);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
