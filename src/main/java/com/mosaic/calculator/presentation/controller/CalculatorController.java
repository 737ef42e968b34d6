package com.mosaic.calculator.presentation.controller;

import com.mosaic.calculator.config.properties.ServiceInfoProperties;
import com.mosaic.calculator.domain.CalculationOutcome;
import com.mosaic.calculator.presentation.dto.ApiError;
import com.mosaic.calculator.presentation.dto.CalculationRequestBody;
import com.mosaic.calculator.presentation.dto.CalculationResponse;
import com.mosaic.calculator.presentation.dto.OperationsResponse;
import com.mosaic.calculator.presentation.dto.RootResponse;
import com.mosaic.calculator.service.dispatch.CalculationDispatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Version 1 of the calculator API.
 *
 * <ul>
 *   <li>{@code GET  /api/v1/} - service info</li>
 *   <li>{@code POST /api/v1/calculate} - perform a calculation</li>
 *   <li>{@code GET  /api/v1/operations} - supported operation names</li>
 *   <li>{@code GET  /api/v1/history} - fixed sample of prior results</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "calculator", description = "Arithmetic operations and calculator metadata")
class CalculatorController {

    private final CalculationDispatcher dispatcher;
    private final ServiceInfoProperties serviceInfo;

    CalculatorController(CalculationDispatcher dispatcher, ServiceInfoProperties serviceInfo) {
        this.dispatcher = dispatcher;
        this.serviceInfo = serviceInfo;
    }

    @GetMapping({"", "/"})
    @Tag(name = "info")
    @Operation(summary = "Root endpoint", description = "Get basic information about the API")
    @ApiResponse(responseCode = "200", description = "Service info",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                    schema = @Schema(implementation = RootResponse.class)))
    ResponseEntity<RootResponse> root() {
        return ResponseEntity.ok(new RootResponse(
                serviceInfo.getMessage(),
                serviceInfo.getVersion(),
                "running"
        ));
    }

    /**
     * Dispatches the calculation. Dispatcher errors become 400 with an {@link ApiError} body;
     * missing fields and unreadable JSON are handled by {@code GlobalExceptionHandler}.
     */
    @PostMapping("/calculate")
    @Operation(summary = "Perform calculation",
            description = "Perform a mathematical calculation based on the operation")
    @ApiResponse(responseCode = "200", description = "Calculation result",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                    schema = @Schema(implementation = CalculationResponse.class)))
    @ApiResponse(responseCode = "400",
            description = "Unknown operation, missing operand, malformed body or undefined result",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                    schema = @Schema(implementation = ApiError.class)))
    ResponseEntity<?> calculate(@Valid @RequestBody CalculationRequestBody body) {
        CalculationOutcome outcome = dispatcher.dispatch(body.toDomain());
        if (outcome.isSuccess()) {
            return ResponseEntity.ok(CalculationResponse.from(outcome.result()));
        }
        return ResponseEntity.badRequest().body(ApiError.from(outcome.error()));
    }

    @GetMapping("/operations")
    @Operation(summary = "List available operations",
            description = "Get a list of all available mathematical operations")
    @ApiResponse(responseCode = "200", description = "Supported operation names",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                    schema = @Schema(implementation = OperationsResponse.class)))
    ResponseEntity<OperationsResponse> operations() {
        return ResponseEntity.ok(new OperationsResponse(
                com.mosaic.calculator.domain.Operation.wireNames()));
    }

    @GetMapping("/history")
    @Operation(summary = "Get calculation history",
            description = "Get a fixed sample of recent calculations; nothing is recorded")
    @ApiResponse(responseCode = "200", description = "Sample calculations",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                    array = @ArraySchema(schema = @Schema(implementation = CalculationResponse.class))))
    ResponseEntity<List<CalculationResponse>> history() {
        return ResponseEntity.ok(SampleHistory.ENTRIES);
    }
}
