/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@code MethodArgumentNotValidException} (missing {@code a} or {@code operation}) → 400</li>
 *   <li>{@code HttpMessageNotReadableException} (malformed JSON) → 400</li>
 *   <li>{@link com.mosaic.calculator.exception.CalculatorException} → 400</li>
 *   <li>Spring MVC exceptions carrying a status → that status</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "error": "Bad Request",
 *   "message": "a: must not be null"
 * }
 * </pre>
 *
 * @see com.mosaic.calculator.exception
 * @since 1.0
 */
package com.mosaic.calculator.presentation.exception;
