package com.eci.notification;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Clock that only moves when a test advances it. */
public final class TestClock extends Clock {

    private volatile Instant now;

    public TestClock(final Instant start) {
        this.now = start;
    }

    public void advance(final Duration d) {
        now = now.plus(d);
    }

    public void set(final Instant instant) {
        now = instant;
    }

    @Override public ZoneId  getZone()                    { return ZoneOffset.UTC; }
    @Override public Clock   withZone(final ZoneId zone)  { return this; }
    @Override public Instant instant()                    { return now; }
}
