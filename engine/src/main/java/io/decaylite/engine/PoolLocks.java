// file: engine/src/main/java/io/decaylite/engine/PoolLocks.java
package io.decaylite.engine;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * One monitor per pool.
 * <p>
 * Every write to a pool's aggregate point and slope schedule runs while holding
 * that pool's monitor, so read-modify-write cycles on the same pool never
 * interleave. Writes to different pools proceed in parallel. Readers do not
 * take these monitors.
 */
final class PoolLocks {
    private final Map<Long, Object> monitors = new ConcurrentHashMap<>();

    <T> T withPool(long poolId, Supplier<T> action) {
        Object monitor = monitors.computeIfAbsent(poolId, k -> new Object());
        synchronized (monitor) {
            return action.get();
        }
    }
}
