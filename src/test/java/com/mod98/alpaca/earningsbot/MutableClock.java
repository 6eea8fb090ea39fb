package com.mod98.alpaca.earningsbot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Test clock that only moves when told to.
 */
public class MutableClock extends Clock {

    public static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private Instant now;
    private final ZoneId zone;

    public MutableClock(Instant now, ZoneId zone) {
        this.now = now;
        this.zone = zone;
    }

    public static MutableClock at(LocalDateTime newYorkTime) {
        return new MutableClock(newYorkTime.atZone(NEW_YORK).toInstant(), NEW_YORK);
    }

    public void advance(Duration d) {
        now = now.plus(d);
    }

    public void set(LocalDateTime newYorkTime) {
        now = newYorkTime.atZone(zone).toInstant();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(now, zone);
    }

    @Override
    public Instant instant() {
        return now;
    }
}
