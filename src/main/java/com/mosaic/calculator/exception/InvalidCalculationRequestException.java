package com.mosaic.calculator.exception;

/**
 * Thrown when a calculation request is malformed: the operation is missing or unknown,
 * or a required operand is absent.
 */
public class InvalidCalculationRequestException extends CalculatorException {

    private final String field;

    public InvalidCalculationRequestException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * @return name of the offending request field ({@code a}, {@code b} or {@code operation})
     */
    public String getField() {
        return field;
    }
}
