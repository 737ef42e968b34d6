package com.mosaic.calculator.config.openapi;

import com.mosaic.calculator.config.properties.ServiceInfoProperties;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI document metadata served at /v3/api-docs and rendered by Swagger UI at /swagger.
 *
 * <p>Title and version follow {@link ServiceInfoProperties} so the docs match /health.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI calculatorOpenApi(ServiceInfoProperties serviceInfo) {
        return new OpenAPI().info(new Info()
                .title(serviceInfo.getMessage())
                .version(serviceInfo.getVersion())
                .description("Basic arithmetic operations over a JSON HTTP API")
                .license(new License().name("MIT").url("https://opensource.org/licenses/MIT")));
    }
}
