package io.decaylite.engine;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/** Test-only clock with second resolution that only moves when told to. */
final class MutableClock extends Clock {
    private final AtomicLong seconds;

    MutableClock(long epochSecond) {
        this.seconds = new AtomicLong(epochSecond);
    }

    long now() { return seconds.get(); }

    void advance(long deltaSeconds) { seconds.addAndGet(deltaSeconds); }

    void set(long epochSecond) { seconds.set(epochSecond); }

    @Override public ZoneId getZone() { return ZoneOffset.UTC; }

    @Override public Clock withZone(ZoneId zone) { return this; }

    @Override public Instant instant() { return Instant.ofEpochSecond(seconds.get()); }
}
