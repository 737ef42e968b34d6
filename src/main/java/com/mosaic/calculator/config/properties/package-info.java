/**
 * Type-safe configuration properties bound from {@code application.properties}.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.mosaic.calculator.config.properties.ServiceInfoProperties} - service
 *       identity ({@code calculator.service.*}) exposed by the metadata endpoints</li>
 * </ul>
 *
 * @since 1.0
 */
package com.mosaic.calculator.config.properties;
