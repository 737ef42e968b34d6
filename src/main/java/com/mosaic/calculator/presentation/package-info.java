/**
 * Presentation layer (REST API controllers, DTOs and exception handling).
 *
 * <p>Presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.dto} - request/response bodies</li>
 *   <li>{@code presentation.exception} - global exception handling for HTTP responses</li>
 * </ul>
 *
 * @since 1.0
 */
package com.mosaic.calculator.presentation;
