// file: src/main/java/io/decaylite/core/Point.java
package io.decaylite.core;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Immutable linearly decaying quantity.
 * <p>
 * At any {@code t >= lastUpdate} the instantaneous value is
 * {@code max(0, bias - slope * (t - lastUpdate))}.
 * <p>
 * Fields:
 *  - bias:       value at {@code lastUpdate}, fixed-point, never negative.
 *  - slope:      decay per second, fixed-point, never negative.
 *  - period:     original duration (seconds) of the lock that produced the slope.
 *                Fixed at lock creation and carried forward; it does not decay.
 *  - lastUpdate: timestamp of the last write; 0 means "never written".
 */
public record Point(BigInteger bias, BigInteger slope, long period, long lastUpdate) {

    public static final Point ZERO = new Point(BigInteger.ZERO, BigInteger.ZERO, 0, 0);

    public Point {
        Objects.requireNonNull(bias, "bias");
        Objects.requireNonNull(slope, "slope");
        if (bias.signum() < 0) throw new IllegalArgumentException("bias must be >= 0, got " + bias);
        if (slope.signum() < 0) throw new IllegalArgumentException("slope must be >= 0, got " + slope);
        FixedPoint.checkInt256(bias);
        FixedPoint.checkInt256(slope);
    }

    /** Fresh point at {@code now} with no bias and no slope. */
    public static Point emptyAt(long now) {
        return new Point(BigInteger.ZERO, BigInteger.ZERO, 0, now);
    }

    /** True once this point has been written at least once. */
    public boolean noted() {
        return lastUpdate != 0;
    }

    /**
     * Value at {@code timestamp} by straight-line decay, floored at zero.
     * Timestamps before {@code lastUpdate} are treated as {@code lastUpdate}.
     */
    public BigInteger valueAt(long timestamp) {
        long elapsed = Math.max(0, timestamp - lastUpdate);
        BigInteger v = bias.subtract(slope.multiply(BigInteger.valueOf(elapsed)));
        return FixedPoint.floorAtZero(v);
    }
}
