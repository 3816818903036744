// file: src/main/java/io/decaylite/core/LockPoints.java
package io.decaylite.core;

import java.math.BigInteger;

/**
 * Derives the decaying {@link Point} a single lock contributes.
 * <p>
 * For a live lock (end in the future, non-zero balance):
 * <pre>
 *   rawSlope = balance / maxLockDuration
 *   slope    = mulDown(rawSlope, multiplier * lockPeriod) / maxLockDuration
 *   bias     = slope * (end - now)
 * </pre>
 * Any other lock contributes a zero point.
 */
public final class LockPoints {

    private LockPoints() {
        // utility
    }

    /**
     * Period to weight a lock with: the period already stored on the user
     * point, or the distance from {@code now} to {@code end} for a fresh lock.
     */
    public static long lockPeriod(Point stored, long end, long now) {
        return stored.period() != 0 ? stored.period() : end - now;
    }

    /**
     * Compute the point for {@code lock} as of {@code now}.
     *
     * @param lockPeriod weighting period, see {@link #lockPeriod(Point, long, long)}
     */
    public static Point pointFor(LockedBalance lock, PoolConfig cfg, long now, long lockPeriod) {
        if (!lock.liveAt(now)) {
            return new Point(BigInteger.ZERO, BigInteger.ZERO, Math.max(0, lockPeriod), now);
        }
        BigInteger maxLock = BigInteger.valueOf(cfg.maxLockDuration());
        BigInteger rawSlope = lock.balance().divide(maxLock);
        BigInteger weighted = cfg.multiplier().multiply(BigInteger.valueOf(lockPeriod));
        BigInteger slope = FixedPoint.mulDown(rawSlope, weighted).divide(maxLock);
        BigInteger bias = FixedPoint.checkInt256(slope.multiply(BigInteger.valueOf(lock.end() - now)));
        return new Point(bias, slope, lockPeriod, now);
    }
}
