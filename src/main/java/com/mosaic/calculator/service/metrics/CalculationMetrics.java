package com.mosaic.calculator.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for calculation requests.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Calculation latency per operation</li>
 *   <li>Success/failure counts per operation, with failure reason</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class CalculationMetrics {

    private static final String METRIC_PREFIX = "calculator.calculation";

    /** Failure reason tag for malformed requests. */
    public static final String REASON_VALIDATION = "validation";
    /** Failure reason tag for mathematically undefined operations. */
    public static final String REASON_DOMAIN = "domain";
    /** Failure reason tag for unexpected faults. */
    public static final String REASON_INTERNAL = "internal";

    private final MeterRegistry registry;

    public CalculationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records calculation latency for a specific operation.
     *
     * @param operation operation wire name, or "unknown" if it did not parse
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String operation, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to dispatch a calculation")
                .tag("operation", operation)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the success counter for a specific operation.
     *
     * @param operation operation wire name
     */
    public void incrementSuccess(String operation) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful calculations")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter for a specific operation.
     *
     * @param operation operation wire name, or "unknown"
     * @param reason one of {@link #REASON_VALIDATION}, {@link #REASON_DOMAIN}, {@link #REASON_INTERNAL}
     */
    public void incrementFailure(String operation, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed calculations")
                .tag("operation", operation)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
