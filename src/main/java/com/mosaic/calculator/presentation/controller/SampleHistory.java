package com.mosaic.calculator.presentation.controller;

import com.mosaic.calculator.domain.CalculationResult;
import com.mosaic.calculator.domain.Operation;
import com.mosaic.calculator.presentation.dto.CalculationResponse;

import java.util.List;

/**
 * Fixed demonstration data served by {@code GET /api/v1/history}.
 *
 * <p>Nothing records real requests; this list never changes.
 */
final class SampleHistory {

    static final List<CalculationResponse> ENTRIES = List.of(
            CalculationResponse.from(CalculationResult.binary(15, Operation.ADD, 10, 5)),
            CalculationResponse.from(CalculationResult.binary(50, Operation.MULTIPLY, 10, 5))
    );

    private SampleHistory() {}
}
