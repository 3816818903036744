// file: src/main/java/io/decaylite/core/Failure.java
package io.decaylite.core;

/**
 * Failure kinds surfaced by the engine. Every kind is local, synchronous and
 * leaves state untouched.
 */
public enum Failure {
    // configuration
    ALREADY_CONFIGURED,
    MULTIPLIER_TOO_LOW,
    INVALID_MAX_LOCK_DURATION,
    POOL_NOT_CONFIGURED,

    // lock validity
    ZERO_LOCK,
    UNALIGNED_UNLOCK_TIME,
    LOCK_TOO_SHORT,
    LOCK_TOO_LONG,
    ONLY_EXTENSIONS,
    NO_LOCK_FOUND,
    LOCK_EXPIRED,

    // host boundary
    UNAUTHORIZED,
    CHECKPOINT_REQUIRED
}
