// file: engine/src/main/java/io/decaylite/engine/VotingEscrow.java
package io.decaylite.engine;

import io.decaylite.core.Failure;
import io.decaylite.core.Point;
import io.decaylite.core.PoolConfig;
import io.decaylite.core.VotingEscrowException;
import io.decaylite.storage.VoteStore;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Entry point for hosts embedding the engine.
 * <p>
 * Responsibilities:
 *  - Wire the pool registry, checkpoint engine and query layer over one store.
 *  - Expose every operation with typed arguments and documented failures.
 *  - Log each call with its outcome and latency via {@link OperationLogger}.
 * <p>
 * Thread-safety: any number of threads may call in. Writes to the same pool
 * are serialized; reads never block.
 */
public final class VotingEscrow {
    private static final Logger log = Logger.getLogger(VotingEscrow.class.getName());

    private final PoolRegistry registry;
    private final DecayCheckpointEngine engine;
    private final VotingPowerQuery query;

    public VotingEscrow(VoteStore store, AccessControl access, Clock clock) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(access, "access");
        Objects.requireNonNull(clock, "clock");
        var locks = new PoolLocks();
        this.registry = new PoolRegistry(store, access, locks);
        this.engine = new DecayCheckpointEngine(store, registry, access, locks, clock);
        this.query = new VotingPowerQuery(store, registry, engine);
    }

    /**
     * Build an engine from a bootstrap config: authorize the listed callers and
     * configure every listed pool. Pools already present in {@code store} with
     * identical settings are left alone.
     *
     * @throws VotingEscrowException ALREADY_CONFIGURED if a stored pool differs from the config
     */
    public static VotingEscrow bootstrap(EngineConfig config, VoteStore store, Clock clock) {
        var escrow = new VotingEscrow(store, AccessControl.allowList(config.authorizedCallers()), clock);
        for (EngineConfig.Pool pool : config.pools()) {
            var wanted = new PoolConfig(pool.multiplier(), pool.maxLockDurationSeconds());
            var existing = escrow.registry.config(pool.poolId());
            if (existing.isPresent()) {
                if (!existing.get().equals(wanted)) {
                    throw new VotingEscrowException(Failure.ALREADY_CONFIGURED,
                            "pool %d is stored as %s but configured as %s"
                                    .formatted(pool.poolId(), existing.get(), wanted));
                }
                log.info(() -> "Pool " + pool.poolId() + " already configured, skipping");
                continue;
            }
            escrow.registry.configureTrusted(pool.poolId(), pool.multiplier(), pool.maxLockDurationSeconds());
        }
        return escrow;
    }

    // ---------- pool registry ----------

    public PoolConfig configure(String caller, long poolId, BigInteger multiplier, long maxLockDuration) {
        return logged("configure", poolId, -1, true,
                () -> registry.configure(caller, poolId, multiplier, maxLockDuration));
    }

    // ---------- checkpoint engine ----------

    /** @see DecayCheckpointEngine#checkpoint(long) */
    public boolean checkpoint(long poolId) {
        return logged("checkpoint", poolId, -1, true, () -> engine.checkpoint(poolId));
    }

    /** @see DecayCheckpointEngine#noteLockCreation */
    public long noteLockCreation(String caller, String user, long poolId, BigInteger balance, long unlockTime) {
        return logged("noteLockCreation", poolId, -1, true,
                () -> engine.noteLockCreation(caller, user, poolId, balance, unlockTime));
    }

    public void noteLockBalanceChange(String caller, String user, long poolId, long lockId,
                                      BigInteger oldBalance, BigInteger newBalance, long unlockTime) {
        logged("noteLockBalanceChange", poolId, lockId, true, () -> {
            engine.noteLockBalanceChange(caller, user, poolId, lockId, oldBalance, newBalance, unlockTime);
            return null;
        });
    }

    public void noteLockExtension(String caller, String user, long poolId, long lockId,
                                  BigInteger balance, long oldUnlockTime, long newUnlockTime) {
        logged("noteLockExtension", poolId, lockId, true, () -> {
            engine.noteLockExtension(caller, user, poolId, lockId, balance, oldUnlockTime, newUnlockTime);
            return null;
        });
    }

    // ---------- query layer ----------

    public BigInteger getVotingPower(String user, long lockId) {
        return logged("getVotingPower", -1, lockId, false, () -> query.getVotingPower(user, lockId));
    }

    public BigInteger getGlobalVotingPower(long poolId) {
        return logged("getGlobalVotingPower", poolId, -1, false, () -> query.getGlobalVotingPower(poolId));
    }

    public BigInteger getRolledGlobalVotingPower(long poolId) {
        return logged("getRolledGlobalVotingPower", poolId, -1, false,
                () -> query.getRolledGlobalVotingPower(poolId));
    }

    public BigInteger getVotingPowerShare(String user, long poolId, long lockId) {
        return logged("getVotingPowerShare", poolId, lockId, false,
                () -> query.getVotingPowerShare(user, poolId, lockId));
    }

    public List<BigInteger> getVotingPowerShareBatch(String user, long poolId, List<Long> lockIds) {
        return logged("getVotingPowerShareBatch", poolId, -1, false,
                () -> query.getVotingPowerShareBatch(user, poolId, lockIds));
    }

    public boolean isOpenPool(long poolId) {
        return query.isOpenPool(poolId);
    }

    public boolean isOnceNotedPoint(String user, long lockId) {
        return query.isOnceNotedPoint(user, lockId);
    }

    public long getMaximumLockTime(long poolId) {
        return query.getMaximumLockTime(poolId);
    }

    public BigInteger getMultiplier(long poolId) {
        return query.getMultiplier(poolId);
    }

    public Point getGlobalPoint(long poolId) {
        return query.getGlobalPoint(poolId);
    }

    public Point getUserPoint(String user, long lockId) {
        return query.getUserPoint(user, lockId);
    }

    public long getEpochTime() {
        return query.getEpochTime();
    }

    public long getEpochTime(long timestamp) {
        return query.getEpochTime(timestamp);
    }

    // ---------- helpers ----------

    private static <T> T logged(String operation, long poolId, long lockId, boolean mutating, Supplier<T> call) {
        long start = System.nanoTime();
        Throwable error = null;
        try {
            return call.get();
        } catch (RuntimeException e) {
            error = e;
            throw e;
        } finally {
            OperationLogger.logOperation(operation, poolId, lockId, mutating, System.nanoTime() - start, error);
        }
    }
}
