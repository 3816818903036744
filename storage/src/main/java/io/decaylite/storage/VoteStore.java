// file: src/main/java/io/decaylite/storage/VoteStore.java
package io.decaylite.storage;

import io.decaylite.core.Point;
import io.decaylite.core.PoolConfig;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Persisted state used by the engine.
 * <p>
 * Layout (conceptual):
 *  - PoolConfig[poolId]
 *  - GlobalPoint[poolId]
 *  - SlopeChangeSchedule[poolId][epochTimestamp]
 *  - UserPoint[user][lockId]
 *  - nextLockId (global, starts at 1)
 * <p>
 * Semantics:
 *  - Reads return the latest committed values and never block on writers.
 *  - {@link #commit(CheckpointWrite)} applies all of its parts or none of them,
 *    atomically with respect to other commits.
 *  - Callers serialize writes per pool; the store does not order them.
 */
public interface VoteStore {

    /** Pool configuration, empty while the pool is unconfigured. */
    Optional<PoolConfig> poolConfig(long poolId);

    /**
     * Store the configuration for a pool.
     *
     * @throws IllegalStateException if the pool already has one
     */
    void putPoolConfig(long poolId, PoolConfig config);

    /** Latest aggregate point for a pool, empty if never written. */
    Optional<Point> globalPoint(long poolId);

    /** Signed slope delta scheduled at {@code epoch}, or zero. */
    BigInteger slopeChange(long poolId, long epoch);

    /** Point for a (user, lock) pair, empty if never written or if {@code user} is null or blank. */
    Optional<Point> userPoint(String user, long lockId);

    /** Reserve the next lock id. Ids are never handed out twice. */
    long allocateLockId();

    /** Next id {@link #allocateLockId()} would return. */
    long peekNextLockId();

    /** Apply a batch of writes for one pool. */
    void commit(CheckpointWrite write);
}
