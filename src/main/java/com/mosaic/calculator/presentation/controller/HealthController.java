package com.mosaic.calculator.presentation.controller;

import com.mosaic.calculator.config.properties.ServiceInfoProperties;
import com.mosaic.calculator.presentation.dto.HealthResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight liveness probe returning static service identity.
 *
 * <p>Deeper checks (arithmetic self-test) live under /actuator/health.
 */
@RestController
@Tag(name = "health", description = "Liveness probe")
class HealthController {

    private static final Logger log = LogManager.getLogger(HealthController.class);

    private final ServiceInfoProperties serviceInfo;

    HealthController(ServiceInfoProperties serviceInfo) {
        this.serviceInfo = serviceInfo;
    }

    @GetMapping("/health")
    @Operation(summary = "Health check endpoint", description = "Check if the service is healthy")
    @ApiResponse(responseCode = "200", description = "Service identity",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                    schema = @Schema(implementation = HealthResponse.class)))
    ResponseEntity<HealthResponse> health() {
        log.debug("Health probe received");
        return ResponseEntity.ok(new HealthResponse(
                "healthy",
                serviceInfo.getName(),
                serviceInfo.getVersion()
        ));
    }
}
