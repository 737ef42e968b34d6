package com.mosaic.calculator.service.dispatch;

import com.mosaic.calculator.domain.CalculationOutcome;
import com.mosaic.calculator.domain.CalculationRequest;
import com.mosaic.calculator.domain.CalculationResult;
import com.mosaic.calculator.domain.Operation;
import com.mosaic.calculator.domain.OperationError;
import com.mosaic.calculator.exception.ArithmeticDomainException;
import com.mosaic.calculator.exception.InvalidCalculationRequestException;
import com.mosaic.calculator.service.arithmetic.ArithmeticEngine;
import com.mosaic.calculator.service.metrics.CalculationMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

/**
 * Validates a {@link CalculationRequest}, routes it to the {@link ArithmeticEngine} and
 * shapes the outcome.
 *
 * <p>Validation order:
 * <ol>
 *   <li>operation present and one of {@link Operation#wireNames()}</li>
 *   <li>operand {@code a} present</li>
 *   <li>operand {@code b} present when the operation is binary</li>
 * </ol>
 *
 * <p>{@link #dispatch(CalculationRequest)} never throws: validation failures, engine domain
 * failures and unexpected faults all resolve to an {@link OperationError}.
 *
 * <p><b>Thread Safety:</b> stateless apart from the thread-safe metrics registry.
 */
@Service
public class CalculationDispatcher {

    private static final Logger LOG = LogManager.getLogger(CalculationDispatcher.class);

    static final String INVALID_OPERATION = "Invalid operation";
    static final String OPERATION_REQUIRED = "Operation is required";
    static final String OPERAND_A_REQUIRED = "Operand 'a' is required";
    static final String CALCULATION_FAILED = "Calculation failed";

    private static final String UNKNOWN_OPERATION_TAG = "unknown";

    private final ArithmeticEngine engine;
    private final CalculationMetrics metrics;

    public CalculationDispatcher(ArithmeticEngine engine, CalculationMetrics metrics) {
        this.engine = engine;
        this.metrics = metrics;
    }

    /**
     * Dispatches a calculation.
     *
     * @param request the request (must not be null)
     * @return success with a {@link CalculationResult} or failure with an {@link OperationError}
     */
    public CalculationOutcome dispatch(CalculationRequest request) {
        long start = System.nanoTime();
        String tag = UNKNOWN_OPERATION_TAG;
        try {
            Operation op = parseOperation(request.operation());
            tag = op.wireName();
            requireOperands(op, request);

            CalculationResult result = compute(op, request.a(), request.b());
            logResult(result);
            metrics.incrementSuccess(tag);
            return CalculationOutcome.success(result);
        } catch (InvalidCalculationRequestException e) {
            LOG.warn("Rejected calculation request: field={}, reason={}", e.getField(), e.getMessage());
            metrics.incrementFailure(tag, CalculationMetrics.REASON_VALIDATION);
            return CalculationOutcome.failure(OperationError.badRequest(e.getMessage()));
        } catch (ArithmeticDomainException e) {
            LOG.warn("Calculation error: operation={}, reason={}", e.getOperation(), e.getMessage());
            metrics.incrementFailure(tag, CalculationMetrics.REASON_DOMAIN);
            return CalculationOutcome.failure(OperationError.badRequest(e.getMessage()));
        } catch (RuntimeException e) {
            LOG.error("Unexpected calculation failure: operation={}", tag, e);
            metrics.incrementFailure(tag, CalculationMetrics.REASON_INTERNAL);
            return CalculationOutcome.failure(OperationError.badRequest(CALCULATION_FAILED));
        } finally {
            metrics.recordLatency(tag, System.nanoTime() - start);
        }
    }

    private static Operation parseOperation(String name) {
        if (name == null) {
            throw new InvalidCalculationRequestException("operation", OPERATION_REQUIRED);
        }
        return Operation.fromWireName(name)
                .orElseThrow(() -> new InvalidCalculationRequestException("operation", INVALID_OPERATION));
    }

    private static void requireOperands(Operation op, CalculationRequest request) {
        if (request.a() == null) {
            throw new InvalidCalculationRequestException("a", OPERAND_A_REQUIRED);
        }
        if (op.isBinary() && request.b() == null) {
            throw new InvalidCalculationRequestException("b",
                    "Operand 'b' is required for operation '" + op.wireName() + "'");
        }
    }

    private static void logResult(CalculationResult result) {
        if (result.operation().isBinary()) {
            LOG.info("Calculation: {} {} {} = {}",
                    result.a(), result.operation().wireName(), result.b(), result.result());
        } else {
            LOG.info("Calculation: {}({}) = {}",
                    result.operation().wireName(), result.a(), result.result());
        }
    }

    private CalculationResult compute(Operation op, double a, Double b) {
        return switch (op) {
            case ADD -> CalculationResult.binary(engine.add(a, b), op, a, b);
            case SUBTRACT -> CalculationResult.binary(engine.subtract(a, b), op, a, b);
            case MULTIPLY -> CalculationResult.binary(engine.multiply(a, b), op, a, b);
            case DIVIDE -> CalculationResult.binary(engine.divide(a, b), op, a, b);
            case POWER -> CalculationResult.binary(engine.power(a, b), op, a, b);
            case SQRT -> CalculationResult.unary(engine.sqrt(a), op, a);
        };
    }
}
