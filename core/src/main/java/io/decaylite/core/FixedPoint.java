// file: src/main/java/io/decaylite/core/FixedPoint.java
package io.decaylite.core;

import java.math.BigInteger;

/**
 * Fixed-point helpers over {@link BigInteger}.
 * <p>
 * Every value quantity in the engine (balances, multipliers, bias, slope,
 * scheduled slope deltas, shares) is an integer scaled by {@link #SCALE}, so
 * "1.0" is {@code 10^18}.
 * <p>
 * Rules:
 *  - All division truncates toward zero (no rounding up).
 *  - Unsigned quantities (balances, multipliers) must fit in 256 bits.
 *  - Signed quantities (bias, slope, deltas) must fit in signed 256 bits;
 *    leaving that range raises {@link ArithmeticException}.
 */
public final class FixedPoint {

    /** The unit: 1.0 in fixed-point. */
    public static final BigInteger SCALE = BigInteger.TEN.pow(18);

    public static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
    public static final BigInteger INT256_MAX = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);
    public static final BigInteger INT256_MIN = BigInteger.ONE.shiftLeft(255).negate();

    private FixedPoint() {
        // utility
    }

    /** Whole units to fixed-point: {@code of(3) == 3 * SCALE}. */
    public static BigInteger of(long units) {
        return BigInteger.valueOf(units).multiply(SCALE);
    }

    /** {@code a * b / SCALE}, truncated. */
    public static BigInteger mulDown(BigInteger a, BigInteger b) {
        return checkInt256(a.multiply(b).divide(SCALE));
    }

    /** {@code a * SCALE / b}, truncated. */
    public static BigInteger divDown(BigInteger a, BigInteger b) {
        if (b.signum() == 0) throw new ArithmeticException("division by zero");
        return checkInt256(a.multiply(SCALE).divide(b));
    }

    /** {@code max(0, x)}. */
    public static BigInteger floorAtZero(BigInteger x) {
        return x.signum() < 0 ? BigInteger.ZERO : x;
    }

    /**
     * Validate an unsigned 256-bit input value.
     *
     * @throws IllegalArgumentException if negative or wider than 256 bits
     */
    public static BigInteger requireUint256(BigInteger value, String name) {
        if (value == null) throw new NullPointerException(name);
        if (value.signum() < 0 || value.compareTo(UINT256_MAX) > 0) {
            throw new IllegalArgumentException(name + " must be in [0, 2^256), got " + value);
        }
        return value;
    }

    /**
     * Overflow guard for signed intermediate and stored values.
     *
     * @throws ArithmeticException if the value does not fit in signed 256 bits
     */
    public static BigInteger checkInt256(BigInteger value) {
        if (value.compareTo(INT256_MAX) > 0 || value.compareTo(INT256_MIN) < 0) {
            throw new ArithmeticException("int256 overflow: " + value);
        }
        return value;
    }
}
