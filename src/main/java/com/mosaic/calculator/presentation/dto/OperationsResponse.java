package com.mosaic.calculator.presentation.dto;

import java.util.List;

/** Body of {@code GET /api/v1/operations}. */
public record OperationsResponse(List<String> operations) {

    public OperationsResponse {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }
}
