// file: src/main/java/io/decaylite/storage/Snapshotter.java
package io.decaylite.storage;

/**
 * Snapshot abstraction for saving and restoring the engine state.
 * <p>
 * A snapshot is a full {@link StoreImage}. On restart the host loads the
 * latest one and rebuilds its store with {@link InMemoryVoteStore#restore(StoreImage)}.
 */
public interface Snapshotter {

    /**
     * Persist a full image.
     *
     * @return snapshot identifier (e.g., file name)
     */
    String writeSnapshot(StoreImage image);

    /** Load the latest snapshot, or null if none has been written. */
    LoadedSnapshot loadLatest();

    /** Snapshot id and its contents. */
    record LoadedSnapshot(String id, StoreImage image) {}
}
