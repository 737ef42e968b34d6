package com.mosaic.calculator.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mosaic.calculator.domain.CalculationResult;

/**
 * JSON body of a successful calculation. {@code b} is omitted for unary operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalculationResponse(
        double result,
        String operation,
        double a,
        Double b
) {

    public static CalculationResponse from(CalculationResult result) {
        return new CalculationResponse(
                result.result(),
                result.operation().wireName(),
                result.a(),
                result.b()
        );
    }
}
