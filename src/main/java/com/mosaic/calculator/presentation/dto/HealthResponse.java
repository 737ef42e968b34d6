package com.mosaic.calculator.presentation.dto;

/** Body of {@code GET /health}. */
public record HealthResponse(
        String status,
        String service,
        String version
) {}
