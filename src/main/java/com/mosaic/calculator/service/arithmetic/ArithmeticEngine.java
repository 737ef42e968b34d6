package com.mosaic.calculator.service.arithmetic;

import com.mosaic.calculator.exception.ArithmeticDomainException;
import org.springframework.stereotype.Component;

/**
 * Stateless arithmetic operations over doubles, plus integer helpers.
 *
 * <p>Floating-point operations follow IEEE-754 double semantics; only division by zero and
 * the square root of a negative number are rejected. NaN and infinities produced by
 * {@link #power(double, double)} propagate unchanged.
 *
 * <p><b>Thread Safety:</b> holds no state; safe for concurrent use.
 */
@Component
public class ArithmeticEngine {

    /** Largest n whose factorial fits in a signed 64-bit long (20! = 2432902008176640000). */
    public static final int MAX_FACTORIAL_INPUT = 20;

    static final String DIVISION_BY_ZERO = "division by zero is not allowed";
    static final String NEGATIVE_SQRT = "cannot calculate square root of negative number";
    static final String NEGATIVE_FACTORIAL = "factorial is only defined for non-negative integers";
    static final String FACTORIAL_TOO_LARGE = "factorial too large to calculate";
    static final String GCD_OUT_OF_RANGE = "gcd magnitude exceeds 64-bit range";

    public double add(double a, double b) {
        return a + b;
    }

    public double subtract(double a, double b) {
        return a - b;
    }

    public double multiply(double a, double b) {
        return a * b;
    }

    /**
     * @throws ArithmeticDomainException if {@code b} is zero (either sign)
     */
    public double divide(double a, double b) {
        if (b == 0) {
            throw new ArithmeticDomainException("divide", DIVISION_BY_ZERO);
        }
        return a / b;
    }

    public double power(double base, double exponent) {
        return Math.pow(base, exponent);
    }

    /**
     * @throws ArithmeticDomainException if {@code n} is negative
     */
    public double sqrt(double n) {
        if (n < 0) {
            throw new ArithmeticDomainException("sqrt", NEGATIVE_SQRT);
        }
        return Math.sqrt(n);
    }

    /**
     * Computes n! iteratively.
     *
     * @param n value in [0, {@value #MAX_FACTORIAL_INPUT}]
     * @return n! as a long
     * @throws ArithmeticDomainException if {@code n} is negative or the result would overflow
     */
    public long factorial(int n) {
        if (n < 0) {
            throw new ArithmeticDomainException("factorial", NEGATIVE_FACTORIAL);
        }
        if (n > MAX_FACTORIAL_INPUT) {
            throw new ArithmeticDomainException("factorial", FACTORIAL_TOO_LARGE);
        }
        long result = 1L;
        for (int i = 2; i <= n; i++) {
            result *= i;
        }
        return result;
    }

    /**
     * Greatest common divisor by iterative Euclidean reduction; the sign is dropped after
     * the reduction. {@code gcd(0, b) == |b|} and {@code gcd(0, 0) == 0}.
     *
     * @throws ArithmeticDomainException if the result would be 2^63, which happens only when
     *         both operands are in {0, Long.MIN_VALUE} and at least one is Long.MIN_VALUE
     */
    public long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        if (a == Long.MIN_VALUE) {
            throw new ArithmeticDomainException("gcd", GCD_OUT_OF_RANGE);
        }
        return Math.abs(a);
    }

    /**
     * Least common multiple, {@code |a*b| / gcd(a, b)}; returns 0 when either operand is 0.
     */
    public long lcm(long a, long b) {
        if (a == 0 || b == 0) {
            return 0;
        }
        // divide first to keep the intermediate product small
        return Math.abs(a / gcd(a, b) * b);
    }
}
