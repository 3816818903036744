// file: engine/src/main/java/io/decaylite/engine/AccessControl.java
package io.decaylite.engine;

import io.decaylite.core.Failure;
import io.decaylite.core.VotingEscrowException;

import java.util.Set;

/**
 * Host-provided authorization check for mutating operations
 * (configure and the three lock mutators). Checkpoints and reads are open.
 */
@FunctionalInterface
public interface AccessControl {

    boolean isAuthorized(String caller);

    /** Every caller is authorized. Useful for tests and single-tenant hosts. */
    static AccessControl permitAll() {
        return caller -> true;
    }

    /** Only the listed callers are authorized. */
    static AccessControl allowList(Set<String> callers) {
        Set<String> allowed = Set.copyOf(callers);
        return caller -> caller != null && allowed.contains(caller);
    }

    /**
     * Fail with {@link Failure#UNAUTHORIZED} unless {@code caller} is authorized.
     */
    default void requireAuthorized(String caller, String operation) {
        if (!isAuthorized(caller)) {
            throw new VotingEscrowException(Failure.UNAUTHORIZED,
                    "caller " + caller + " may not " + operation);
        }
    }
}
