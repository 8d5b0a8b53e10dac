package com.autopost.test.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 可拨动的测试时钟（UTC）。
 */
public class MutableClock extends Clock {

    private Instant instant;

    public MutableClock(LocalDateTime now) {
        this.instant = now.toInstant(ZoneOffset.UTC);
    }

    public void set(LocalDateTime now) {
        this.instant = now.toInstant(ZoneOffset.UTC);
    }

    public void advance(Duration duration) {
        this.instant = this.instant.plus(duration);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return Clock.fixed(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
