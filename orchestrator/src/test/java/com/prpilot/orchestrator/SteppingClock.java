package com.prpilot.orchestrator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Clock for tests that can be moved forwards and backwards by hand. */
public class SteppingClock extends Clock {

    private volatile Instant now;

    public SteppingClock(Instant start) {
        this.now = start;
    }

    public void advance(Duration d) {
        now = now.plus(d);
    }

    public void set(Instant instant) {
        now = instant;
    }

    @Override public ZoneId getZone()                { return ZoneOffset.UTC; }
    @Override public Clock withZone(ZoneId zone)     { return this; }
    @Override public Instant instant()               { return now; }
}
