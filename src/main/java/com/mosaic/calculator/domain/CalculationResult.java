package com.mosaic.calculator.domain;

import java.util.Objects;

/**
 * Immutable result of a successful calculation, echoing the operation and its operands.
 *
 * @param result    computed value (may be NaN or infinite for {@link Operation#POWER})
 * @param operation operation that produced the value
 * @param a         first operand
 * @param b         second operand; non-null iff {@code operation} is binary
 */
public record CalculationResult(
        double result,
        Operation operation,
        double a,
        Double b
) {

    /**
     * Compact constructor with validation.
     *
     * @throws NullPointerException if operation is null
     * @throws IllegalArgumentException if the presence of {@code b} does not match the arity
     */
    public CalculationResult {
        Objects.requireNonNull(operation, "Operation must not be null");
        if (operation.isBinary() && b == null) {
            throw new IllegalArgumentException("Operand b must be present for binary operation " + operation.wireName());
        }
        if (!operation.isBinary() && b != null) {
            throw new IllegalArgumentException("Operand b must be absent for unary operation " + operation.wireName());
        }
    }

    public static CalculationResult binary(double result, Operation operation, double a, double b) {
        return new CalculationResult(result, operation, a, b);
    }

    public static CalculationResult unary(double result, Operation operation, double a) {
        return new CalculationResult(result, operation, a, null);
    }
}
