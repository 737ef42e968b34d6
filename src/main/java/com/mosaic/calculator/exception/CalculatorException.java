package com.mosaic.calculator.exception;

/**
 * Base exception for all calculator-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CalculatorException extends RuntimeException {

    public CalculatorException(String message) {
        super(message);
    }
}
