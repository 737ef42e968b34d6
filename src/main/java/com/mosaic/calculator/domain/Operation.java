package com.mosaic.calculator.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The fixed set of operations accepted by the calculation endpoint.
 *
 * <p>Each constant carries its wire name (the string clients send in the {@code operation}
 * field) and its arity. Only {@link #SQRT} is unary; it ignores a supplied {@code b}.
 */
public enum Operation {
    ADD("add", true),
    SUBTRACT("subtract", true),
    MULTIPLY("multiply", true),
    DIVIDE("divide", true),
    POWER("power", true),
    SQRT("sqrt", false);

    private static final List<String> WIRE_NAMES = Arrays.stream(values())
            .map(Operation::wireName)
            .toList();

    private final String wireName;
    private final boolean binary;

    Operation(String wireName, boolean binary) {
        this.wireName = wireName;
        this.binary = binary;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return true if the operation consumes operand {@code b}
     */
    public boolean isBinary() {
        return binary;
    }

    /**
     * Parses a wire name. Matching is exact and case-sensitive.
     *
     * @param name wire name such as {@code "add"}; may be null
     * @return the matching operation, or empty if {@code name} is null or unknown
     */
    public static Optional<Operation> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (Operation op : values()) {
            if (op.wireName.equals(name)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    /**
     * @return wire names of all operations in declaration order
     */
    public static List<String> wireNames() {
        return WIRE_NAMES;
    }
}
