/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.mosaic.calculator.exception.CalculatorException} - Base exception for all
 *       application-specific errors</li>
 *   <li>{@link com.mosaic.calculator.exception.InvalidCalculationRequestException} - Missing or
 *       unknown operation, or a missing required operand</li>
 *   <li>{@link com.mosaic.calculator.exception.ArithmeticDomainException} - Mathematically
 *       undefined operation (division by zero, negative square root, factorial out of range)</li>
 * </ul>
 *
 * <p>Both concrete kinds surface to clients as a {@code "Bad Request"} error envelope; the
 * distinction only affects the message text.
 *
 * @see com.mosaic.calculator.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.mosaic.calculator.exception;
