// file: src/main/java/io/decaylite/storage/StoreImage.java
package io.decaylite.storage;

import io.decaylite.core.Point;
import io.decaylite.core.PoolConfig;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable copy of the whole persisted state at one instant.
 * Used to snapshot a store to disk and to rebuild one on restart.
 */
public record StoreImage(
        Map<Long, PoolConfig> poolConfigs,
        Map<Long, Point> globalPoints,
        Map<Long, Map<Long, BigInteger>> slopeChanges,
        Map<UserLock, Point> userPoints,
        long nextLockId
) {
    public StoreImage {
        if (nextLockId < 1) throw new IllegalArgumentException("nextLockId must be >= 1");
        poolConfigs = Map.copyOf(poolConfigs);
        globalPoints = Map.copyOf(globalPoints);
        Map<Long, Map<Long, BigInteger>> sc = new HashMap<>(slopeChanges.size() * 2);
        slopeChanges.forEach((pool, schedule) -> sc.put(pool, Map.copyOf(schedule)));
        slopeChanges = Map.copyOf(sc);
        userPoints = Map.copyOf(userPoints);
    }

    /** State of a store nobody has written to. */
    public static StoreImage empty() {
        return new StoreImage(Map.of(), Map.of(), Map.of(), Map.of(), 1);
    }
}
