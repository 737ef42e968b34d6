package com.mosaic.calculator.config.properties;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceInfoPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(PropertiesConfig.class);

    @Test
    void usesDefaultsWhenNothingConfigured() {
        runner.run(ctx -> {
            ServiceInfoProperties props = ctx.getBean(ServiceInfoProperties.class);
            assertThat(props.getName()).isEqualTo("calculator-api");
            assertThat(props.getVersion()).isEqualTo("1.0.0");
            assertThat(props.getMessage()).isEqualTo("Calculator API");
        });
    }

    @Test
    void bindsConfiguredValues() {
        runner.withPropertyValues(
                "calculator.service.name=calc-staging",
                "calculator.service.version=2.1.0",
                "calculator.service.message=Staging Calculator"
        ).run(ctx -> {
            ServiceInfoProperties props = ctx.getBean(ServiceInfoProperties.class);
            assertThat(props.getName()).isEqualTo("calc-staging");
            assertThat(props.getVersion()).isEqualTo("2.1.0");
            assertThat(props.getMessage()).isEqualTo("Staging Calculator");
        });
    }

    @Test
    void failsStartupOnBlankVersion() {
        runner.withPropertyValues("calculator.service.version= ")
                .run(ctx -> assertThat(ctx).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(ServiceInfoProperties.class)
    static class PropertiesConfig {
    }
}
