// file: engine/src/main/java/io/decaylite/engine/PoolRegistry.java
package io.decaylite.engine;

import io.decaylite.core.Failure;
import io.decaylite.core.PoolConfig;
import io.decaylite.core.VotingEscrowException;
import io.decaylite.storage.VoteStore;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Per-pool configuration: weight multiplier and maximum lock duration.
 * Configuration is set once and never changes afterwards.
 */
public final class PoolRegistry {
    private static final Logger log = Logger.getLogger(PoolRegistry.class.getName());

    private final VoteStore store;
    private final AccessControl access;
    private final PoolLocks locks;

    PoolRegistry(VoteStore store, AccessControl access, PoolLocks locks) {
        this.store = Objects.requireNonNull(store, "store");
        this.access = Objects.requireNonNull(access, "access");
        this.locks = Objects.requireNonNull(locks, "locks");
    }

    /**
     * One-time setup of a pool.
     *
     * @throws VotingEscrowException UNAUTHORIZED, ALREADY_CONFIGURED, MULTIPLIER_TOO_LOW
     *                               or INVALID_MAX_LOCK_DURATION
     */
    public PoolConfig configure(String caller, long poolId, BigInteger multiplier, long maxLockDuration) {
        access.requireAuthorized(caller, "configure pools");
        return configureTrusted(poolId, multiplier, maxLockDuration);
    }

    /** Configure without an authorization check; for host bootstrap only. */
    PoolConfig configureTrusted(long poolId, BigInteger multiplier, long maxLockDuration) {
        Objects.requireNonNull(multiplier, "multiplier");
        return locks.withPool(poolId, () -> {
            if (store.poolConfig(poolId).isPresent()) {
                throw new VotingEscrowException(Failure.ALREADY_CONFIGURED,
                        "pool " + poolId + " is already configured");
            }
            var config = new PoolConfig(multiplier, maxLockDuration);
            store.putPoolConfig(poolId, config);
            log.info(() -> "Configured pool %d: multiplier=%s maxLockDuration=%ds"
                    .formatted(poolId, multiplier, maxLockDuration));
            return config;
        });
    }

    public Optional<PoolConfig> config(long poolId) {
        return store.poolConfig(poolId);
    }

    /**
     * @throws VotingEscrowException POOL_NOT_CONFIGURED if the pool has no config
     */
    public PoolConfig require(long poolId) {
        return store.poolConfig(poolId).orElseThrow(() -> new VotingEscrowException(
                Failure.POOL_NOT_CONFIGURED, "pool " + poolId + " is not configured"));
    }

    public boolean isOpen(long poolId) {
        return store.poolConfig(poolId).isPresent();
    }

    /** Maximum lock duration in seconds, 0 for an unconfigured pool. */
    public long maximumLockTime(long poolId) {
        return store.poolConfig(poolId).map(PoolConfig::maxLockDuration).orElse(0L);
    }

    /** Fixed-point multiplier, 0 for an unconfigured pool. */
    public BigInteger multiplier(long poolId) {
        return store.poolConfig(poolId).map(PoolConfig::multiplier).orElse(BigInteger.ZERO);
    }
}
