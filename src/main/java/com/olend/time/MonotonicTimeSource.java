package com.olend.time;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Default {@link TimeSource} backed by the system clock, clamped so it never moves backwards
 * (e.g. after an NTP correction).
 */
@Component
public class MonotonicTimeSource implements TimeSource {

    private final Clock clock;
    private final AtomicLong lastSeconds = new AtomicLong(0);

    public MonotonicTimeSource() {
        this(Clock.systemUTC());
    }

    public MonotonicTimeSource(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long nowSeconds() {
        long wall = clock.millis() / 1000;
        return lastSeconds.accumulateAndGet(wall, Math::max);
    }
}
