// file: src/main/java/io/decaylite/core/PoolConfig.java
package io.decaylite.core;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Immutable per-pool configuration.
 * <p>
 * A pool without a stored {@code PoolConfig} is unconfigured; there is no
 * zero-valued "unset" config.
 *
 * @param multiplier      fixed-point weight multiplier, at least {@link FixedPoint#SCALE}
 * @param maxLockDuration longest lock the pool accepts, in seconds, strictly positive
 */
public record PoolConfig(BigInteger multiplier, long maxLockDuration) {

    public PoolConfig {
        Objects.requireNonNull(multiplier, "multiplier");
        if (multiplier.compareTo(FixedPoint.SCALE) < 0) {
            throw new VotingEscrowException(Failure.MULTIPLIER_TOO_LOW,
                    "multiplier " + multiplier + " is below " + FixedPoint.SCALE);
        }
        FixedPoint.requireUint256(multiplier, "multiplier");
        if (maxLockDuration <= 0) {
            throw new VotingEscrowException(Failure.INVALID_MAX_LOCK_DURATION,
                    "maxLockDuration must be > 0, got " + maxLockDuration);
        }
    }
}
