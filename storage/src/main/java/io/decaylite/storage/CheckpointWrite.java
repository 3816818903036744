// file: src/main/java/io/decaylite/storage/CheckpointWrite.java
package io.decaylite.storage;

import io.decaylite.core.Point;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one checkpoint or lock mutation writes, computed up front so the
 * store can apply it in a single step.
 *
 * @param poolId       pool being written
 * @param globalPoint  new aggregate point for the pool
 * @param slopeChanges schedule entries to overwrite (epoch -> signed delta)
 * @param userLock     owner of {@code userPoint}, null for a bare checkpoint
 * @param userPoint    new user point, null for a bare checkpoint
 */
public record CheckpointWrite(
        long poolId,
        Point globalPoint,
        Map<Long, BigInteger> slopeChanges,
        UserLock userLock,
        Point userPoint
) {
    public CheckpointWrite {
        Objects.requireNonNull(globalPoint, "globalPoint");
        slopeChanges = Map.copyOf(slopeChanges);
        if ((userLock == null) != (userPoint == null)) {
            throw new IllegalArgumentException("userLock and userPoint must be set together");
        }
    }

    /** Global-only write produced by a bare checkpoint. */
    public static CheckpointWrite globalOnly(long poolId, Point globalPoint) {
        return new CheckpointWrite(poolId, globalPoint, Map.of(), null, null);
    }

    public boolean lockSpecific() {
        return userLock != null;
    }
}
