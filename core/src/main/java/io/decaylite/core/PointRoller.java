// file: src/main/java/io/decaylite/core/PointRoller.java
package io.decaylite.core;

import java.math.BigInteger;
import java.util.Objects;
import java.util.function.LongFunction;

/**
 * Advances a pool's aggregate point forward in time, one weekly epoch at a time,
 * applying the slope changes scheduled at each epoch boundary.
 * <p>
 * Algorithm:
 *  - Start the cursor at {@code align(last.lastUpdate)}.
 *  - Each step moves the cursor one WEEK ahead; if that passes {@code now} the
 *    cursor is clamped to {@code now} and no scheduled delta is read.
 *  - bias -= slope * (cursor - previous); slope += delta(cursor);
 *    both floored at zero.
 *  - Stop when the cursor reaches {@code now}, or after {@link #MAX_WEEKLY_STEPS}.
 * <p>
 * Cost is O(weeks elapsed), independent of the number of locks in the pool.
 * The step cap bounds a single call; a pool left alone for longer than the cap
 * must be rolled repeatedly (see {@link Rolled#reachedTarget()}).
 */
public final class PointRoller {

    /** Upper bound on weekly steps per roll. */
    public static final int MAX_WEEKLY_STEPS = 64;

    private PointRoller() {
        // utility
    }

    /**
     * Result of a roll.
     *
     * @param point         rolled point; {@code lastUpdate} is where the cursor stopped
     * @param reachedTarget true if the cursor reached the requested time
     */
    public record Rolled(Point point, boolean reachedTarget) {}

    /**
     * Roll {@code last} forward to {@code now}.
     *
     * @param last          stored aggregate point (use {@link Point#emptyAt(long)} if none)
     * @param now           target timestamp, must not precede {@code last.lastUpdate()}
     * @param slopeChangeAt signed scheduled delta at an epoch timestamp (zero if none)
     */
    public static Rolled roll(Point last, long now, LongFunction<BigInteger> slopeChangeAt) {
        return roll(last, now, slopeChangeAt, MAX_WEEKLY_STEPS);
    }

    static Rolled roll(Point last, long now, LongFunction<BigInteger> slopeChangeAt, int maxSteps) {
        Objects.requireNonNull(last, "last");
        Objects.requireNonNull(slopeChangeAt, "slopeChangeAt");
        if (now < last.lastUpdate()) {
            throw new IllegalStateException(
                    "clock moved backwards: now=%d < lastUpdate=%d".formatted(now, last.lastUpdate()));
        }

        BigInteger bias = last.bias();
        BigInteger slope = last.slope();
        long checkpointed = last.lastUpdate();
        long cursor = Epochs.align(checkpointed);

        if (checkpointed == now) {
            return new Rolled(new Point(bias, slope, last.period(), now), true);
        }

        for (int i = 0; i < maxSteps; i++) {
            cursor += Epochs.WEEK;
            BigInteger dSlope = BigInteger.ZERO;
            if (cursor > now) {
                cursor = now;
            } else {
                dSlope = slopeChangeAt.apply(cursor);
            }

            bias = bias.subtract(slope.multiply(BigInteger.valueOf(cursor - checkpointed)));
            slope = slope.add(dSlope);
            bias = FixedPoint.floorAtZero(FixedPoint.checkInt256(bias));
            slope = FixedPoint.floorAtZero(FixedPoint.checkInt256(slope));
            checkpointed = cursor;

            if (cursor == now) {
                return new Rolled(new Point(bias, slope, last.period(), now), true);
            }
        }
        return new Rolled(new Point(bias, slope, last.period(), checkpointed), false);
    }
}
