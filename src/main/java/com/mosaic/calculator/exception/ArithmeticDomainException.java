package com.mosaic.calculator.exception;

/**
 * Thrown when a well-formed request violates a mathematical precondition, such as
 * division by zero or the square root of a negative number.
 *
 * <p>The message is surfaced to clients verbatim.
 */
public class ArithmeticDomainException extends CalculatorException {

    private final String operation;

    public ArithmeticDomainException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
