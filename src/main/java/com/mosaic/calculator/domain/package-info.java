/**
 * Domain models for calculation requests and their outcomes.
 *
 * <p>All domain models are:
 * <ul>
 *   <li>Immutable (Java records)</li>
 *   <li>Self-validating (validation in compact constructors)</li>
 *   <li>Free of serialization concerns (no Jackson or Bean Validation annotations)</li>
 * </ul>
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.mosaic.calculator.domain.Operation} - the enumerated operation set</li>
 *   <li>{@link com.mosaic.calculator.domain.CalculationRequest} - operands plus operation name</li>
 *   <li>{@link com.mosaic.calculator.domain.CalculationResult} - value with echoed operands</li>
 *   <li>{@link com.mosaic.calculator.domain.OperationError} - category label plus message</li>
 *   <li>{@link com.mosaic.calculator.domain.CalculationOutcome} - exactly one of result or error</li>
 * </ul>
 *
 * @since 1.0
 */
package com.mosaic.calculator.domain;
