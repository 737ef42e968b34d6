package com.mosaic.calculator.domain;

/**
 * A calculation request as seen by the dispatcher.
 *
 * <p>All fields are nullable so that the dispatcher, not the constructor, decides how a
 * missing operand or operation is reported.
 *
 * @param a         first operand (always required)
 * @param b         second operand (required for binary operations, ignored for unary ones)
 * @param operation operation wire name, e.g. {@code "add"}
 */
public record CalculationRequest(
        Double a,
        Double b,
        String operation
) {

    public static CalculationRequest binary(double a, double b, String operation) {
        return new CalculationRequest(a, b, operation);
    }

    public static CalculationRequest unary(double a, String operation) {
        return new CalculationRequest(a, null, operation);
    }
}
