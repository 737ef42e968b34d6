package com.mosaic.calculator.presentation.dto;

/** Body of {@code GET /api/v1/}. */
public record RootResponse(
        String message,
        String version,
        String status
) {}
