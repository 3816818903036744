// file: src/main/java/io/decaylite/core/Epochs.java
package io.decaylite.core;

/**
 * Weekly epoch arithmetic. Timestamps are seconds since the Unix epoch.
 */
public final class Epochs {

    /** Epoch width in seconds. */
    public static final long WEEK = 7L * 24 * 60 * 60;

    private Epochs() {
        // utility
    }

    /** {@code floor(t / WEEK) * WEEK}. */
    public static long align(long timestamp) {
        return Math.floorDiv(timestamp, WEEK) * WEEK;
    }

    public static boolean isAligned(long timestamp) {
        return Math.floorMod(timestamp, WEEK) == 0;
    }
}
