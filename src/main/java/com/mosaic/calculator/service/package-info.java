/**
 * Service layer containing business logic.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.arithmetic} - pure arithmetic operations</li>
 *   <li>{@code service.dispatch} - request validation and operation routing</li>
 *   <li>{@code service.metrics} - Micrometer instrumentation</li>
 *   <li>{@code service.health} - Actuator health indicators</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services are stateless Spring beans ({@code @Component}, {@code @Service})</li>
 *   <li>Services depend on domain models, not the presentation layer</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.mosaic.calculator.service;
