// file: engine/src/main/java/io/decaylite/engine/OperationLogger.java
package io.decaylite.engine;

import io.decaylite.core.VotingEscrowException;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place to log engine calls with their outcome and latency.
 */
public final class OperationLogger {
    private static final Logger log = Logger.getLogger(OperationLogger.class.getName());

    private OperationLogger() {
        // utility
    }

    /**
     * Log a completed engine call.
     *
     * @param operation    operation name (checkpoint, noteLockCreation, ...)
     * @param poolId       pool the call targeted
     * @param lockId       lock id, or -1 when not applicable
     * @param mutating     true for writes; reads are logged at FINE
     * @param elapsedNanos wall-clock latency of the call
     * @param error        failure, null on success; only unexpected
     *                     exceptions are logged at WARNING with a stack trace
     */
    public static void logOperation(
            String operation,
            long poolId,
            long lockId,
            boolean mutating,
            long elapsedNanos,
            Throwable error
    ) {
        String msg = String.format(
                "%s pool=%d%s -> %s (%dus)",
                operation,
                poolId,
                lockId >= 0 ? " lock=" + lockId : "",
                outcome(error),
                elapsedNanos / 1_000L
        );

        if (error instanceof VotingEscrowException) {
            log.log(Level.INFO, msg);
        } else if (error != null) {
            log.log(Level.WARNING, msg, error);
        } else if (mutating) {
            log.log(Level.INFO, msg);
        } else {
            log.log(Level.FINE, msg);
        }
    }

    private static String outcome(Throwable error) {
        if (error == null) return "ok";
        if (error instanceof VotingEscrowException ve) return ve.failure().name();
        return error.getClass().getSimpleName();
    }
}
