// file: src/main/java/io/decaylite/storage/InMemoryVoteStore.java
package io.decaylite.storage;

import io.decaylite.core.Point;
import io.decaylite.core.PoolConfig;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Heap-backed {@link VoteStore}.
 * <p>
 * Concurrency:
 *  - All maps are ConcurrentHashMaps, so single-entry reads are lock-free.
 *  - commit(), putPoolConfig() and image() synchronize on the store, so an
 *    image never contains half of a commit.
 * <p>
 * Durability is the host's concern; {@link #image()} together with a
 * {@link Snapshotter} gives a simple way to save and restore the state.
 */
public final class InMemoryVoteStore implements VoteStore {
    private final Map<Long, PoolConfig> configs = new ConcurrentHashMap<>();
    private final Map<Long, Point> globals = new ConcurrentHashMap<>();
    private final Map<Long, Map<Long, BigInteger>> schedules = new ConcurrentHashMap<>();
    private final Map<UserLock, Point> users = new ConcurrentHashMap<>();
    private final AtomicLong nextLockId;

    public InMemoryVoteStore() {
        this(StoreImage.empty());
    }

    private InMemoryVoteStore(StoreImage image) {
        configs.putAll(image.poolConfigs());
        globals.putAll(image.globalPoints());
        image.slopeChanges().forEach((pool, schedule) ->
                schedules.put(pool, new ConcurrentHashMap<>(schedule)));
        users.putAll(image.userPoints());
        nextLockId = new AtomicLong(image.nextLockId());
    }

    /** Rebuild a store from a previously taken image. */
    public static InMemoryVoteStore restore(StoreImage image) {
        return new InMemoryVoteStore(Objects.requireNonNull(image, "image"));
    }

    @Override
    public Optional<PoolConfig> poolConfig(long poolId) {
        return Optional.ofNullable(configs.get(poolId));
    }

    @Override
    public synchronized void putPoolConfig(long poolId, PoolConfig config) {
        Objects.requireNonNull(config, "config");
        if (configs.putIfAbsent(poolId, config) != null) {
            throw new IllegalStateException("pool " + poolId + " is already configured");
        }
    }

    @Override
    public Optional<Point> globalPoint(long poolId) {
        return Optional.ofNullable(globals.get(poolId));
    }

    @Override
    public BigInteger slopeChange(long poolId, long epoch) {
        Map<Long, BigInteger> schedule = schedules.get(poolId);
        if (schedule == null) {
            return BigInteger.ZERO;
        }
        return schedule.getOrDefault(epoch, BigInteger.ZERO);
    }

    @Override
    public Optional<Point> userPoint(String user, long lockId) {
        if (user == null || user.isBlank()) {
            // no such key can ever have been committed
            return Optional.empty();
        }
        return Optional.ofNullable(users.get(new UserLock(user, lockId)));
    }

    @Override
    public long allocateLockId() {
        return nextLockId.getAndIncrement();
    }

    @Override
    public long peekNextLockId() {
        return nextLockId.get();
    }

    @Override
    public synchronized void commit(CheckpointWrite write) {
        Objects.requireNonNull(write, "write");
        if (!write.slopeChanges().isEmpty()) {
            schedules.computeIfAbsent(write.poolId(), k -> new ConcurrentHashMap<>())
                    .putAll(write.slopeChanges());
        }
        globals.put(write.poolId(), write.globalPoint());
        if (write.lockSpecific()) {
            users.put(write.userLock(), write.userPoint());
        }
    }

    /** Consistent copy of the whole state. */
    public synchronized StoreImage image() {
        Map<Long, Map<Long, BigInteger>> sc = new HashMap<>(schedules.size() * 2);
        schedules.forEach((pool, schedule) -> sc.put(pool, Map.copyOf(schedule)));
        return new StoreImage(configs, globals, sc, users, nextLockId.get());
    }
}
