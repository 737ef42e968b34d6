package com.mosaic.calculator.presentation.dto;

import com.mosaic.calculator.domain.CalculationRequest;
import jakarta.validation.constraints.NotNull;

/**
 * JSON body of {@code POST /api/v1/calculate}.
 *
 * <pre>
 * {"a": 10, "b": 5, "operation": "add"}
 * </pre>
 *
 * <p>Presence of {@code a} and {@code operation} is enforced by Bean Validation before the
 * dispatcher runs. Membership of {@code operation} in the supported set is left to the
 * dispatcher.
 */
public record CalculationRequestBody(
        @NotNull Double a,
        Double b,
        @NotNull String operation
) {

    public CalculationRequest toDomain() {
        return new CalculationRequest(a, b, operation);
    }
}
