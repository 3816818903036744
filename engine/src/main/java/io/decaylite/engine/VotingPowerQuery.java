// file: engine/src/main/java/io/decaylite/engine/VotingPowerQuery.java
package io.decaylite.engine;

import io.decaylite.core.Epochs;
import io.decaylite.core.Failure;
import io.decaylite.core.FixedPoint;
import io.decaylite.core.Point;
import io.decaylite.core.VotingEscrowException;
import io.decaylite.storage.VoteStore;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read-only views over the persisted points. Nothing here writes to the store
 * or takes a pool monitor.
 * <p>
 * Two tiers of aggregate reads:
 *  - {@link #getGlobalVotingPower(long)} decays the last persisted aggregate
 *    in a straight line. It ignores slope changes scheduled since the last
 *    checkpoint, so it is exact only while no such epoch has been crossed.
 *  - {@link #getRolledGlobalVotingPower(long)} runs the weekly rolling routine
 *    in memory and is exact for pools idle up to the rolling cap.
 */
public final class VotingPowerQuery {

    private final VoteStore store;
    private final PoolRegistry registry;
    private final DecayCheckpointEngine engine;

    VotingPowerQuery(VoteStore store, PoolRegistry registry, DecayCheckpointEngine engine) {
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Current weight of one lock.
     *
     * @throws VotingEscrowException NO_LOCK_FOUND if the lock was never created
     */
    public BigInteger getVotingPower(String user, long lockId) {
        Point p = store.userPoint(user, lockId)
                .filter(Point::noted)
                .orElseThrow(() -> new VotingEscrowException(Failure.NO_LOCK_FOUND,
                        "no lock %d for user %s".formatted(lockId, user)));
        return p.valueAt(engine.now());
    }

    /** Last persisted aggregate, decayed linearly to now. */
    public BigInteger getGlobalVotingPower(long poolId) {
        return store.globalPoint(poolId)
                .map(p -> p.valueAt(engine.now()))
                .orElse(BigInteger.ZERO);
    }

    /** Aggregate rolled through scheduled slope changes to now, without persisting. */
    public BigInteger getRolledGlobalVotingPower(long poolId) {
        long now = engine.now();
        return engine.rollGlobal(poolId, now).point().valueAt(now);
    }

    /**
     * Fixed-point fraction of the pool's aggregate held by one lock;
     * zero when the aggregate is zero.
     *
     * @throws VotingEscrowException NO_LOCK_FOUND if the lock was never created
     */
    public BigInteger getVotingPowerShare(String user, long poolId, long lockId) {
        BigInteger power = getVotingPower(user, lockId);
        BigInteger global = getGlobalVotingPower(poolId);
        if (global.signum() == 0) {
            return BigInteger.ZERO;
        }
        return FixedPoint.divDown(power, global);
    }

    /** {@link #getVotingPowerShare} for several locks, in input order. */
    public List<BigInteger> getVotingPowerShareBatch(String user, long poolId, List<Long> lockIds) {
        List<BigInteger> shares = new ArrayList<>(lockIds.size());
        for (long lockId : lockIds) {
            shares.add(getVotingPowerShare(user, poolId, lockId));
        }
        return shares;
    }

    public boolean isOpenPool(long poolId) {
        return registry.isOpen(poolId);
    }

    public boolean isOnceNotedPoint(String user, long lockId) {
        return store.userPoint(user, lockId).map(Point::noted).orElse(false);
    }

    public long getMaximumLockTime(long poolId) {
        return registry.maximumLockTime(poolId);
    }

    public BigInteger getMultiplier(long poolId) {
        return registry.multiplier(poolId);
    }

    /** Stored aggregate point, not decayed; {@link Point#ZERO} if none. */
    public Point getGlobalPoint(long poolId) {
        return store.globalPoint(poolId).orElse(Point.ZERO);
    }

    /** Stored user point, not decayed; {@link Point#ZERO} if none. */
    public Point getUserPoint(String user, long lockId) {
        return store.userPoint(user, lockId).orElse(Point.ZERO);
    }

    /** Start of the current week. */
    public long getEpochTime() {
        return Epochs.align(engine.now());
    }

    public long getEpochTime(long timestamp) {
        return Epochs.align(timestamp);
    }
}
