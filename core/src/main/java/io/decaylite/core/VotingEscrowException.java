// file: src/main/java/io/decaylite/core/VotingEscrowException.java
package io.decaylite.core;

import java.util.Objects;

/**
 * Domain failure raised by the engine. The {@link Failure} kind is the
 * machine-readable part; the message is for logs.
 */
public class VotingEscrowException extends RuntimeException {

    private final Failure failure;

    public VotingEscrowException(Failure failure, String message) {
        super(failure + ": " + message);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public Failure failure() {
        return failure;
    }
}
