package io.decaylite.engine;

import io.decaylite.core.Epochs;
import io.decaylite.core.Failure;
import io.decaylite.core.FixedPoint;
import io.decaylite.core.Point;
import io.decaylite.core.VotingEscrowException;
import io.decaylite.storage.InMemoryVoteStore;
import io.decaylite.storage.StoreImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.math.BigInteger;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Preconditions and all-or-nothing behavior of the lock mutators.
 */
class DecayCheckpointEngineTest {

    private static final long W = Epochs.WEEK;
    private static final long T0 = 1_700_000_000L;
    private static final long ALIGNED = Epochs.align(T0);
    private static final long POOL = 1;
    private static final String LOCKER = "locker";
    private static final BigInteger HUNDRED = FixedPoint.of(100);

    private MutableClock clock;
    private InMemoryVoteStore store;
    private VotingEscrow escrow;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryVoteStore();
        escrow = new VotingEscrow(store, AccessControl.allowList(Set.of(LOCKER)), clock);
        escrow.configure(LOCKER, POOL, FixedPoint.SCALE, 52 * W);
    }

    private void assertFailsCleanly(Failure expected, Executable call) {
        StoreImage before = store.image();
        var e = assertThrows(VotingEscrowException.class, call);
        assertEquals(expected, e.failure());
        assertEquals(before, store.image(), "failed call must not change state");
    }

    @Test
    void only_authorized_callers_may_mutate() {
        long unlock = ALIGNED + 4 * W;
        assertFailsCleanly(Failure.UNAUTHORIZED,
                () -> escrow.configure("mallory", 2, FixedPoint.SCALE, W));
        assertFailsCleanly(Failure.UNAUTHORIZED,
                () -> escrow.noteLockCreation("mallory", "alice", POOL, HUNDRED, unlock));
        assertFailsCleanly(Failure.UNAUTHORIZED,
                () -> escrow.noteLockCreation(null, "alice", POOL, HUNDRED, unlock));

        long lockId = escrow.noteLockCreation(LOCKER, "alice", POOL, HUNDRED, unlock);
        assertFailsCleanly(Failure.UNAUTHORIZED, () -> escrow.noteLockBalanceChange(
                "mallory", "alice", POOL, lockId, HUNDRED, BigInteger.ZERO, unlock));
        assertFailsCleanly(Failure.UNAUTHORIZED, () -> escrow.noteLockExtension(
                "mallory", "alice", POOL, lockId, HUNDRED, unlock, unlock + W));

        // checkpoints are open to anyone
        assertTrue(escrow.checkpoint(POOL));
    }

    @Test
    void lock_operations_need_a_configured_pool() {
        long unlock = ALIGNED + 4 * W;
        long lockId = escrow.noteLockCreation(LOCKER, "alice", POOL, HUNDRED, unlock);

        assertFailsCleanly(Failure.POOL_NOT_CONFIGURED,
                () -> escrow.noteLockCreation(LOCKER, "alice", 2, HUNDRED, unlock));
        assertFailsCleanly(Failure.POOL_NOT_CONFIGURED, () -> escrow.noteLockBalanceChange(
                LOCKER, "alice", 2, lockId, HUNDRED, HUNDRED, unlock));
        assertFailsCleanly(Failure.POOL_NOT_CONFIGURED, () -> escrow.noteLockExtension(
                LOCKER, "alice", 2, lockId, HUNDRED, unlock, unlock + W));
    }

    @Test
    void configure_rejects_multiplier_below_one_and_empty_duration() {
        assertFailsCleanly(Failure.MULTIPLIER_TOO_LOW,
                () -> escrow.configure(LOCKER, 2, FixedPoint.SCALE.subtract(BigInteger.ONE), W));
        assertFailsCleanly(Failure.INVALID_MAX_LOCK_DURATION,
                () -> escrow.configure(LOCKER, 2, FixedPoint.SCALE, 0));
        assertFalse(escrow.isOpenPool(2));
    }

    @Test
    void creation_enforces_alignment_and_duration_bounds() {
        assertFailsCleanly(Failure.UNALIGNED_UNLOCK_TIME,
                () -> escrow.noteLockCreation(LOCKER, "alice", POOL, HUNDRED, ALIGNED + 4 * W + 1));
        // next boundary is only 92800s away
        assertFailsCleanly(Failure.LOCK_TOO_SHORT,
                () -> escrow.noteLockCreation(LOCKER, "alice", POOL, HUNDRED, ALIGNED + W));
        assertFailsCleanly(Failure.LOCK_TOO_LONG,
                () -> escrow.noteLockCreation(LOCKER, "alice", POOL, HUNDRED, ALIGNED + 54 * W));
        assertFailsCleanly(Failure.ZERO_LOCK,
                () -> escrow.noteLockCreation(LOCKER, "alice", POOL, BigInteger.ZERO, ALIGNED + 4 * W));

        // none of the failures consumed an id
        assertEquals(1, store.peekNextLockId());
        assertEquals(1, escrow.noteLockCreation(LOCKER, "alice", POOL, HUNDRED, ALIGNED + 2 * W));
        assertEquals(2, escrow.noteLockCreation(LOCKER, "alice", POOL, HUNDRED, ALIGNED + 52 * W));
    }

    @Test
    void negative_balances_are_argument_errors() {
        assertThrows(IllegalArgumentException.class, () -> escrow.noteLockCreation(
                LOCKER, "alice", POOL, BigInteger.valueOf(-1), ALIGNED + 4 * W));
        assertEquals(1, store.peekNextLockId());
    }

    @Test
    void blank_user_is_rejected_before_an_id_is_taken() {
        long unlock = ALIGNED + 4 * W;
        StoreImage before = store.image();

        assertThrows(IllegalArgumentException.class,
                () -> escrow.noteLockCreation(LOCKER, " ", POOL, HUNDRED, unlock));
        assertThrows(NullPointerException.class,
                () -> escrow.noteLockCreation(LOCKER, null, POOL, HUNDRED, unlock));
        assertThrows(IllegalArgumentException.class, () -> escrow.noteLockBalanceChange(
                LOCKER, "", POOL, 1, HUNDRED, HUNDRED, unlock));
        assertThrows(IllegalArgumentException.class, () -> escrow.noteLockExtension(
                LOCKER, "", POOL, 1, HUNDRED, unlock, unlock + W));

        assertEquals(1, store.peekNextLockId());
        assertEquals(before, store.image());
        assertEquals(1, escrow.noteLockCreation(LOCKER, "alice", POOL, HUNDRED, unlock));
    }

    @Test
    void balance_change_needs_a_live_existing_lock() {
        long unlock = ALIGNED + 4 * W;
        assertFailsCleanly(Failure.NO_LOCK_FOUND, () -> escrow.noteLockBalanceChange(
                LOCKER, "alice", POOL, 42, HUNDRED, HUNDRED, unlock));

        long lockId = escrow.noteLockCreation(LOCKER, "alice", POOL, HUNDRED, unlock);
        // lock ids belong to their creator
        assertFailsCleanly(Failure.NO_LOCK_FOUND, () -> escrow.noteLockBalanceChange(
                LOCKER, "bob", POOL, lockId, HUNDRED, HUNDRED, unlock));

        clock.set(unlock);
        assertFailsCleanly(Failure.LOCK_EXPIRED, () -> escrow.noteLockBalanceChange(
                LOCKER, "alice", POOL, lockId, HUNDRED, FixedPoint.of(200), unlock));
    }

    @Test
    void extension_checks_run_in_order() {
        long unlock = ALIGNED + 4 * W;
        long lockId = escrow.noteLockCreation(LOCKER, "alice", POOL, HUNDRED, unlock);

        assertFailsCleanly(Failure.UNALIGNED_UNLOCK_TIME, () -> escrow.noteLockExtension(
                LOCKER, "alice", POOL, lockId, HUNDRED, unlock, unlock + W + 1));
        assertFailsCleanly(Failure.LOCK_TOO_SHORT, () -> escrow.noteLockExtension(
                LOCKER, "alice", POOL, lockId, HUNDRED, unlock, ALIGNED));
        assertFailsCleanly(Failure.ONLY_EXTENSIONS, () -> escrow.noteLockExtension(
                LOCKER, "alice", POOL, lockId, HUNDRED, unlock, unlock - W));
        assertFailsCleanly(Failure.LOCK_TOO_LONG, () -> escrow.noteLockExtension(
                LOCKER, "alice", POOL, lockId, HUNDRED, unlock, ALIGNED + 54 * W));
        assertFailsCleanly(Failure.NO_LOCK_FOUND, () -> escrow.noteLockExtension(
                LOCKER, "alice", POOL, lockId + 1, HUNDRED, unlock, unlock + W));

        // same unlock time is a valid (no-op) extension
        escrow.noteLockExtension(LOCKER, "alice", POOL, lockId, HUNDRED, unlock, unlock);
        assertEquals(escrow.getUserPoint("alice", lockId).bias(), escrow.getGlobalVotingPower(POOL));
    }

    @Test
    void reading_an_unknown_lock_fails() {
        var e = assertThrows(VotingEscrowException.class, () -> escrow.getVotingPower("alice", 1));
        assertEquals(Failure.NO_LOCK_FOUND, e.failure());

        e = assertThrows(VotingEscrowException.class, () -> escrow.getVotingPower("", 1));
        assertEquals(Failure.NO_LOCK_FOUND, e.failure());
        assertFalse(escrow.isOnceNotedPoint("", 1));
        assertFalse(escrow.isOnceNotedPoint(null, 1));
        assertEquals(Point.ZERO, escrow.getUserPoint(" ", 1));
    }

    @Test
    void share_of_an_unknown_lock_fails_whether_or_not_the_pool_is_empty() {
        var e = assertThrows(VotingEscrowException.class,
                () -> escrow.getVotingPowerShare("alice", POOL, 1));
        assertEquals(Failure.NO_LOCK_FOUND, e.failure());

        escrow.noteLockCreation(LOCKER, "alice", POOL, HUNDRED, ALIGNED + 4 * W);
        e = assertThrows(VotingEscrowException.class,
                () -> escrow.getVotingPowerShare("bob", POOL, 1));
        assertEquals(Failure.NO_LOCK_FOUND, e.failure());
    }

    @Test
    void checkpoint_of_an_unconfigured_pool_stores_nothing() {
        StoreImage before = store.image();

        assertTrue(escrow.checkpoint(99));

        assertEquals(before, store.image());
        assertTrue(store.globalPoint(99).isEmpty());
        assertEquals(BigInteger.ZERO, escrow.getGlobalVotingPower(99));
    }

    @Test
    void pool_idle_past_the_rolling_cap_must_be_checkpointed_first() {
        long lockId = escrow.noteLockCreation(LOCKER, "alice", POOL, HUNDRED, ALIGNED + 10 * W);
        clock.advance(70 * W);
        long unlock = Epochs.align(clock.now()) + 4 * W;

        assertFailsCleanly(Failure.CHECKPOINT_REQUIRED,
                () -> escrow.noteLockCreation(LOCKER, "bob", POOL, HUNDRED, unlock));
        assertEquals(2, store.peekNextLockId());

        assertFalse(escrow.checkpoint(POOL), "first call only covers 64 weeks");
        assertEquals(ALIGNED + 64 * W, escrow.getGlobalPoint(POOL).lastUpdate());
        assertTrue(escrow.checkpoint(POOL));
        assertEquals(clock.now(), escrow.getGlobalPoint(POOL).lastUpdate());
        assertEquals(BigInteger.ZERO, escrow.getGlobalVotingPower(POOL));
        assertEquals(BigInteger.ZERO, escrow.getVotingPower("alice", lockId));

        long bobLock = escrow.noteLockCreation(LOCKER, "bob", POOL, HUNDRED, unlock);
        assertEquals(escrow.getVotingPower("bob", bobLock), escrow.getGlobalVotingPower(POOL));
    }

    @Test
    void clock_regression_is_rejected() {
        escrow.noteLockCreation(LOCKER, "alice", POOL, HUNDRED, ALIGNED + 4 * W);
        clock.set(T0 - 10);

        assertThrows(IllegalStateException.class, () -> escrow.checkpoint(POOL));
    }
}
