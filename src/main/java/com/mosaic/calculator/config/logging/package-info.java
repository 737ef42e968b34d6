/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Structured logging uses Log4j2 with MDC for request correlation.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.mosaic.calculator.config.logging.MdcFilter} - Servlet filter that injects
 *       {@code requestId}, {@code method} and {@code uri} into MDC for every HTTP request</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [thread-name] [requestId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.mosaic.calculator.config.logging.MdcFilter
 * @since 1.0
 */
package com.mosaic.calculator.config.logging;
