/**
 * Request validation and operation routing.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.mosaic.calculator.service.dispatch.CalculationDispatcher} - maps a
 *       {@link com.mosaic.calculator.domain.CalculationRequest} to a
 *       {@link com.mosaic.calculator.domain.CalculationOutcome} via an enum switch over
 *       {@link com.mosaic.calculator.domain.Operation}</li>
 * </ul>
 *
 * <p>Error mapping:
 * <ul>
 *   <li>Missing or unknown operation, missing operand - {@code "Bad Request"}, validation message</li>
 *   <li>Engine domain failure - {@code "Bad Request"}, engine message verbatim</li>
 * </ul>
 *
 * @since 1.0
 */
package com.mosaic.calculator.service.dispatch;
