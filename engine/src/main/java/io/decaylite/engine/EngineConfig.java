// file: engine/src/main/java/io/decaylite/engine/EngineConfig.java
package io.decaylite.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.decaylite.engine.dto.JsonConfig;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Bootstrap configuration: who may mutate, and which pools exist.
 */
public final class EngineConfig {

    public record Pool(
            long poolId,
            BigInteger multiplier,
            long maxLockDurationSeconds
    ) {
        public Pool {
            Objects.requireNonNull(multiplier, "multiplier");
            if (maxLockDurationSeconds <= 0) throw new IllegalArgumentException("maxLockDurationSeconds must be > 0");
        }
    }

    private final Set<String> authorizedCallers;
    private final List<Pool> pools;

    public EngineConfig(Set<String> authorizedCallers, List<Pool> pools) {
        this.authorizedCallers = Set.copyOf(Objects.requireNonNull(authorizedCallers, "authorizedCallers"));
        this.pools = List.copyOf(Objects.requireNonNull(pools, "pools"));
        long distinct = this.pools.stream().mapToLong(Pool::poolId).distinct().count();
        if (distinct != this.pools.size()) throw new IllegalArgumentException("duplicate poolId in pools");
    }

    public static EngineConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonConfig cfg = mapper.readValue(path.toFile(), JsonConfig.class);
            List<String> callers = cfg.authorizedCallers == null ? List.of() : cfg.authorizedCallers;
            List<Pool> poolList = cfg.pools == null
                    ? List.of()
                    : cfg.pools.stream()
                        .map(p -> new Pool(p.poolId, p.multiplier, p.maxLockDurationSeconds))
                        .toList();
            return new EngineConfig(Set.copyOf(callers), poolList);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load EngineConfig from " + path, e);
        }
    }

    public Set<String> authorizedCallers() {
        return authorizedCallers;
    }

    public List<Pool> pools() {
        return pools;
    }
}
