// file: src/main/java/io/decaylite/core/LockedBalance.java
package io.decaylite.core;

import java.math.BigInteger;

/**
 * Caller-supplied view of a lock for a single mutation. Never persisted
 * directly; only its effect (a {@link Point}) is stored.
 *
 * @param balance fixed-point amount committed, unsigned 256-bit
 * @param end     unlock timestamp in seconds (0 for "no lock")
 */
public record LockedBalance(BigInteger balance, long end) {

    public static final LockedBalance NONE = new LockedBalance(BigInteger.ZERO, 0);

    public LockedBalance {
        FixedPoint.requireUint256(balance, "balance");
    }

    /** True if this lock still contributes weight at {@code now}. */
    public boolean liveAt(long now) {
        return end > now && balance.signum() > 0;
    }
}
