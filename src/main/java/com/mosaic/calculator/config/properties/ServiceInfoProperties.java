package com.mosaic.calculator.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Static service identity reported by the health and root endpoints.
 *
 * <p>Note: Bean created via {@link com.mosaic.calculator.CalculatorApplication}'s
 * {@code @EnableConfigurationProperties}.
 */
@ConfigurationProperties(prefix = "calculator.service")
@Validated
public class ServiceInfoProperties {

    /** Service name reported by {@code GET /health}. */
    @NotBlank(message = "Service name must not be blank")
    private String name = "calculator-api";

    /** Semantic version reported by {@code GET /health} and {@code GET /api/v1/}. */
    @NotBlank(message = "Service version must not be blank")
    private String version = "1.0.0";

    /** Welcome message returned by {@code GET /api/v1/}. */
    @NotBlank(message = "Service message must not be blank")
    private String message = "Calculator API";

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
