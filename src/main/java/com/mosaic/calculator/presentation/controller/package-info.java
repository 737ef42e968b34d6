/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@link com.mosaic.calculator.presentation.controller.HealthController} - liveness probe
 *       ({@code GET /health})</li>
 *   <li>{@link com.mosaic.calculator.presentation.controller.CalculatorController} - calculation,
 *       service info, operation listing and sample history under {@code /api/v1}</li>
 * </ul>
 *
 * <p>Controller Responsibilities:
 * <ul>
 *   <li>Accept HTTP requests and bind DTOs</li>
 *   <li>Validate request shape (presence checks - operation rules live in the dispatcher)</li>
 *   <li>Delegate to the service layer and convert outcomes to HTTP responses</li>
 *   <li>Let {@code GlobalExceptionHandler} handle exceptions</li>
 * </ul>
 *
 * @see com.mosaic.calculator.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.mosaic.calculator.presentation.controller;
