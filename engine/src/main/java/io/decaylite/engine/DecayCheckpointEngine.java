// file: engine/src/main/java/io/decaylite/engine/DecayCheckpointEngine.java
package io.decaylite.engine;

import io.decaylite.core.Epochs;
import io.decaylite.core.Failure;
import io.decaylite.core.FixedPoint;
import io.decaylite.core.LockPoints;
import io.decaylite.core.LockedBalance;
import io.decaylite.core.Point;
import io.decaylite.core.PointRoller;
import io.decaylite.core.PoolConfig;
import io.decaylite.core.VotingEscrowException;
import io.decaylite.storage.CheckpointWrite;
import io.decaylite.storage.UserLock;
import io.decaylite.storage.VoteStore;

import java.math.BigInteger;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Maintains the decaying aggregate point of every pool and the decaying point
 * of every (user, lock).
 * <p>
 * Every mutation runs the same routine under the pool's monitor:
 *  1) Derive the lock's old and new points as of now (nothing persisted yet).
 *  2) Read the slope deltas already scheduled at the old and new unlock epochs.
 *  3) Roll the pool's aggregate point forward to now, consuming scheduled deltas.
 *  4) Add (new - old) bias and slope to the aggregate, floored at zero.
 *  5) Reschedule the old and new unlock epochs so the lock's slope leaves the
 *     aggregate exactly when the lock ends.
 *  6) Commit aggregate, schedule entries and user point as one write.
 * <p>
 * Validation and arithmetic all happen before step 6, so a failed call leaves
 * no trace, not even a consumed lock id.
 */
public final class DecayCheckpointEngine {
    private static final Logger log = Logger.getLogger(DecayCheckpointEngine.class.getName());

    private final VoteStore store;
    private final PoolRegistry registry;
    private final AccessControl access;
    private final PoolLocks locks;
    private final Clock clock;

    DecayCheckpointEngine(VoteStore store, PoolRegistry registry, AccessControl access, PoolLocks locks, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.access = Objects.requireNonNull(access, "access");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Roll the pool's aggregate point towards now without touching any lock.
     * <p>
     * A pool idle for more than {@link PointRoller#MAX_WEEKLY_STEPS} weeks is
     * only advanced that far; the partially rolled point is persisted and the
     * call returns false. Call again until it returns true.
     * <p>
     * Unconfigured pools have nothing to roll; the call returns true and
     * stores nothing.
     *
     * @return true if the aggregate point now sits at the current time
     */
    public boolean checkpoint(long poolId) {
        if (registry.config(poolId).isEmpty()) {
            log.fine(() -> "Pool " + poolId + " is not configured, nothing to checkpoint");
            return true;
        }
        return locks.withPool(poolId, () -> {
            long now = now();
            PointRoller.Rolled rolled = rollGlobal(poolId, now);
            store.commit(CheckpointWrite.globalOnly(poolId, rolled.point()));
            if (!rolled.reachedTarget()) {
                log.warning(() -> "Pool %d checkpoint stopped at %d after %d weekly steps; now=%d, call again"
                        .formatted(poolId, rolled.point().lastUpdate(), PointRoller.MAX_WEEKLY_STEPS, now));
            }
            return rolled.reachedTarget();
        });
    }

    /**
     * Register a new lock.
     *
     * @param balance    fixed-point amount locked, non-zero
     * @param unlockTime epoch-aligned, at least one week and at most the pool's
     *                   maximum lock duration away
     * @return the new lock id
     */
    public long noteLockCreation(String caller, String user, long poolId, BigInteger balance, long unlockTime) {
        access.requireAuthorized(caller, "create locks");
        requireUser(user);
        FixedPoint.requireUint256(balance, "balance");
        return locks.withPool(poolId, () -> {
            PoolConfig cfg = registry.require(poolId);
            long now = now();
            requireAligned(unlockTime);
            if (unlockTime < now + Epochs.WEEK) {
                throw new VotingEscrowException(Failure.LOCK_TOO_SHORT,
                        "unlockTime %d is less than a week after %d".formatted(unlockTime, now));
            }
            requireWithinMax(cfg, unlockTime, now);
            if (balance.signum() == 0) {
                throw new VotingEscrowException(Failure.ZERO_LOCK, "balance must be non-zero");
            }

            Update update = rollAndApply(poolId, cfg, now, Point.ZERO,
                    LockedBalance.NONE, new LockedBalance(balance, unlockTime));
            long lockId = store.allocateLockId();
            store.commit(update.toWrite(poolId, new UserLock(user, lockId)));
            return lockId;
        });
    }

    /**
     * Record a balance change on an existing lock. The unlock time is unchanged.
     */
    public void noteLockBalanceChange(String caller, String user, long poolId, long lockId,
                                      BigInteger oldBalance, BigInteger newBalance, long unlockTime) {
        access.requireAuthorized(caller, "change lock balances");
        requireUser(user);
        FixedPoint.requireUint256(oldBalance, "oldBalance");
        FixedPoint.requireUint256(newBalance, "newBalance");
        locks.withPool(poolId, () -> {
            PoolConfig cfg = registry.require(poolId);
            long now = now();
            Point stored = requireNoted(user, lockId);
            if (unlockTime <= now) {
                throw new VotingEscrowException(Failure.LOCK_EXPIRED,
                        "lock %d expired at %d (now=%d)".formatted(lockId, unlockTime, now));
            }

            Update update = rollAndApply(poolId, cfg, now, stored,
                    new LockedBalance(oldBalance, unlockTime), new LockedBalance(newBalance, unlockTime));
            store.commit(update.toWrite(poolId, new UserLock(user, lockId)));
            return null;
        });
    }

    /**
     * Move a lock's unlock time later. Shortening is rejected.
     */
    public void noteLockExtension(String caller, String user, long poolId, long lockId,
                                  BigInteger balance, long oldUnlockTime, long newUnlockTime) {
        access.requireAuthorized(caller, "extend locks");
        requireUser(user);
        FixedPoint.requireUint256(balance, "balance");
        locks.withPool(poolId, () -> {
            PoolConfig cfg = registry.require(poolId);
            long now = now();
            requireAligned(newUnlockTime);
            if (newUnlockTime < now) {
                throw new VotingEscrowException(Failure.LOCK_TOO_SHORT,
                        "newUnlockTime %d is in the past (now=%d)".formatted(newUnlockTime, now));
            }
            if (newUnlockTime < oldUnlockTime) {
                throw new VotingEscrowException(Failure.ONLY_EXTENSIONS,
                        "newUnlockTime %d precedes oldUnlockTime %d".formatted(newUnlockTime, oldUnlockTime));
            }
            requireWithinMax(cfg, newUnlockTime, now);
            Point stored = requireNoted(user, lockId);

            Update update = rollAndApply(poolId, cfg, now, stored,
                    new LockedBalance(balance, oldUnlockTime), new LockedBalance(balance, newUnlockTime));
            store.commit(update.toWrite(poolId, new UserLock(user, lockId)));
            return null;
        });
    }

    /**
     * Roll the stored aggregate point of a pool to {@code now} in memory.
     * Nothing is persisted.
     */
    PointRoller.Rolled rollGlobal(long poolId, long now) {
        Point last = store.globalPoint(poolId).orElseGet(() -> Point.emptyAt(now));
        return PointRoller.roll(last, now, epoch -> store.slopeChange(poolId, epoch));
    }

    long now() {
        return clock.instant().getEpochSecond();
    }

    // ---------- core routine ----------

    /** Values one lock mutation writes, minus the user key. */
    private record Update(Point global, Map<Long, BigInteger> slopeChanges, Point userPoint) {
        CheckpointWrite toWrite(long poolId, UserLock userLock) {
            return new CheckpointWrite(poolId, global, slopeChanges, userLock, userPoint);
        }
    }

    private Update rollAndApply(long poolId, PoolConfig cfg, long now, Point stored,
                                LockedBalance oldLocked, LockedBalance newLocked) {
        // 1) old and new contributions of this lock
        long period = LockPoints.lockPeriod(stored, newLocked.end(), now);
        Point pointOld = LockPoints.pointFor(oldLocked, cfg, now, period);
        Point pointNew = LockPoints.pointFor(newLocked, cfg, now, period);

        // 2) deltas already scheduled at both ends
        BigInteger dSlopeOld = store.slopeChange(poolId, oldLocked.end());
        BigInteger dSlopeNew = newLocked.end() == oldLocked.end()
                ? dSlopeOld
                : store.slopeChange(poolId, newLocked.end());

        // 3) aggregate up to now
        PointRoller.Rolled rolled = rollGlobal(poolId, now);
        if (!rolled.reachedTarget()) {
            throw new VotingEscrowException(Failure.CHECKPOINT_REQUIRED,
                    "pool %d is more than %d weeks behind; checkpoint it first"
                            .formatted(poolId, PointRoller.MAX_WEEKLY_STEPS));
        }
        Point g = rolled.point();

        // 4) swap the lock's old contribution for its new one
        BigInteger slope = g.slope().add(pointNew.slope()).subtract(pointOld.slope());
        BigInteger bias = g.bias().add(pointNew.bias()).subtract(pointOld.bias());
        Point global = new Point(
                FixedPoint.floorAtZero(FixedPoint.checkInt256(bias)),
                FixedPoint.floorAtZero(FixedPoint.checkInt256(slope)),
                g.period(),
                now);

        // 5) schedule
        Map<Long, BigInteger> changes = new HashMap<>(4);
        if (oldLocked.end() > now) {
            dSlopeOld = dSlopeOld.add(pointOld.slope());
            if (newLocked.end() == oldLocked.end()) {
                dSlopeOld = dSlopeOld.subtract(pointNew.slope());
            }
            changes.put(oldLocked.end(), FixedPoint.checkInt256(dSlopeOld));
        }
        if (newLocked.end() > now && newLocked.end() > oldLocked.end()) {
            dSlopeNew = dSlopeNew.subtract(pointNew.slope());
            changes.put(newLocked.end(), FixedPoint.checkInt256(dSlopeNew));
        }
        return new Update(global, changes, pointNew);
    }

    // ---------- validation helpers ----------

    private static void requireUser(String user) {
        Objects.requireNonNull(user, "user");
        if (user.isBlank()) throw new IllegalArgumentException("user must not be blank");
    }

    private static void requireAligned(long unlockTime) {
        if (!Epochs.isAligned(unlockTime)) {
            throw new VotingEscrowException(Failure.UNALIGNED_UNLOCK_TIME,
                    "unlockTime %d is not aligned to a week boundary".formatted(unlockTime));
        }
    }

    private static void requireWithinMax(PoolConfig cfg, long unlockTime, long now) {
        if (unlockTime > now + cfg.maxLockDuration()) {
            throw new VotingEscrowException(Failure.LOCK_TOO_LONG,
                    "unlockTime %d exceeds max lock duration %ds from %d"
                            .formatted(unlockTime, cfg.maxLockDuration(), now));
        }
    }

    private Point requireNoted(String user, long lockId) {
        return store.userPoint(user, lockId)
                .filter(Point::noted)
                .orElseThrow(() -> new VotingEscrowException(Failure.NO_LOCK_FOUND,
                        "no lock %d for user %s".formatted(lockId, user)));
    }
}
