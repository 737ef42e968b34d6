package com.mosaic.calculator.service.health;

import com.mosaic.calculator.service.arithmetic.ArithmeticEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator running known-answer checks against the {@link ArithmeticEngine}.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: every check produced the expected value</li>
 *   <li>DOWN: at least one check failed or threw</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class ArithmeticEngineHealthIndicator implements HealthIndicator {

    private final ArithmeticEngine engine;

    public ArithmeticEngineHealthIndicator(ArithmeticEngine engine) {
        this.engine = engine;
    }

    @Override
    public Health health() {
        try {
            boolean add = engine.add(2, 3) == 5.0;
            boolean divide = engine.divide(10, 4) == 2.5;
            boolean sqrt = engine.sqrt(16) == 4.0;
            boolean factorial = engine.factorial(5) == 120L;

            Health.Builder builder = (add && divide && sqrt && factorial)
                    ? Health.up().withDetail("status", "Arithmetic self-check passed")
                    : Health.down().withDetail("status", "Arithmetic self-check failed");

            return builder
                    .withDetail("add", checkStatus(add))
                    .withDetail("divide", checkStatus(divide))
                    .withDetail("sqrt", checkStatus(sqrt))
                    .withDetail("factorial", checkStatus(factorial))
                    .build();
        } catch (RuntimeException e) {
            return Health.down(e)
                    .withDetail("status", "Arithmetic self-check threw")
                    .build();
        }
    }

    private static String checkStatus(boolean passed) {
        return passed ? "ok" : "mismatch";
    }
}
