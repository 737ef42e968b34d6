package com.mosaic.calculator.presentation.controller;

import com.mosaic.calculator.config.properties.ServiceInfoProperties;
import com.mosaic.calculator.service.arithmetic.ArithmeticEngine;
import com.mosaic.calculator.service.dispatch.CalculationDispatcher;
import com.mosaic.calculator.service.metrics.CalculationMetrics;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {CalculatorController.class, HealthController.class},
        properties = {
                "calculator.service.name=calculator-api",
                "calculator.service.version=1.0.0",
                "calculator.service.message=Calculator API"
        })
@Import({CalculationDispatcher.class, ArithmeticEngine.class, CalculatorControllerTest.PropertiesConfig.class})
class CalculatorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CalculationMetrics metrics;

    @Test
    void healthReportsServiceIdentity() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value("calculator-api"))
                .andExpect(jsonPath("$.version").value("1.0.0"));
    }

    @Test
    void rootReportsRunning() throws Exception {
        mockMvc.perform(get("/api/v1/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Calculator API"))
                .andExpect(jsonPath("$.version").value("1.0.0"))
                .andExpect(jsonPath("$.status").value("running"));
    }

    @Test
    void addReturnsResultAndEchoesOperands() throws Exception {
        mockMvc.perform(post("/api/v1/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"a\": 10, \"b\": 5, \"operation\": \"add\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value(15.0))
                .andExpect(jsonPath("$.operation").value("add"))
                .andExpect(jsonPath("$.a").value(10.0))
                .andExpect(jsonPath("$.b").value(5.0));
    }

    @Test
    void sqrtOmitsB() throws Exception {
        mockMvc.perform(post("/api/v1/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"a\": 16, \"operation\": \"sqrt\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value(4.0))
                .andExpect(jsonPath("$.operation").value("sqrt"))
                .andExpect(jsonPath("$.a").value(16.0))
                .andExpect(jsonPath("$.b").doesNotExist());
    }

    @Test
    void sqrtIgnoresSuppliedB() throws Exception {
        mockMvc.perform(post("/api/v1/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"a\": 25, \"b\": 3, \"operation\": \"sqrt\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value(5.0))
                .andExpect(jsonPath("$.b").doesNotExist());
    }

    @Test
    void divisionByZeroIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"a\": 10, \"b\": 0, \"operation\": \"divide\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"))
                .andExpect(jsonPath("$.message").value("division by zero is not allowed"));
    }

    @Test
    void negativeSqrtIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"a\": -1, \"operation\": \"sqrt\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("cannot calculate square root of negative number"));
    }

    @Test
    void unknownOperationIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"a\": 1, \"b\": 2, \"operation\": \"modulo\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"))
                .andExpect(jsonPath("$.message").value("Invalid operation"));
    }

    @Test
    void missingBForBinaryOperationIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"a\": 1, \"operation\": \"multiply\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Operand 'b' is required for operation 'multiply'"));
    }

    @Test
    void missingAIsRejectedByValidation() throws Exception {
        mockMvc.perform(post("/api/v1/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"b\": 2, \"operation\": \"add\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"))
                .andExpect(jsonPath("$.message").value(startsWith("a: ")));
    }

    @Test
    void missingOperationIsRejectedByValidation() throws Exception {
        mockMvc.perform(post("/api/v1/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"a\": 1, \"b\": 2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(startsWith("operation: ")));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"a\": 1, \"b\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"))
                .andExpect(jsonPath("$.message").value("Malformed JSON request body"));
    }

    @Test
    void nonNumericOperandIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"a\": \"ten\", \"b\": 5, \"operation\": \"add\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed JSON request body"));
    }

    @Test
    void powerNanSerializesAsString() throws Exception {
        mockMvc.perform(post("/api/v1/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"a\": -8, \"b\": 0.5, \"operation\": \"power\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("NaN"));
    }

    @Test
    void wrongMethodKeepsFrameworkStatus() throws Exception {
        mockMvc.perform(get("/api/v1/calculate"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error").value("Method Not Allowed"));
    }

    @Test
    void operationsListsFixedSet() throws Exception {
        mockMvc.perform(get("/api/v1/operations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.operations", hasSize(6)))
                .andExpect(jsonPath("$.operations[0]").value("add"))
                .andExpect(jsonPath("$.operations[5]").value("sqrt"));
    }

    @Test
    void historyReturnsTwoSampleEntries() throws Exception {
        mockMvc.perform(get("/api/v1/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].result").value(15.0))
                .andExpect(jsonPath("$[0].operation").value("add"))
                .andExpect(jsonPath("$[0].a").value(10.0))
                .andExpect(jsonPath("$[0].b").value(5.0))
                .andExpect(jsonPath("$[1].result").value(50.0))
                .andExpect(jsonPath("$[1].operation").value("multiply"));
    }

    @Test
    void echoesRequestIdHeader() throws Exception {
        mockMvc.perform(get("/health").header("X-Request-ID", "trace-7"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-ID", "trace-7"));
    }

    @TestConfiguration
    @EnableConfigurationProperties(ServiceInfoProperties.class)
    static class PropertiesConfig {
    }
}
