package com.example.chat.util;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wall-clock milliseconds that never repeat or go backwards within this process.
 */
public class MonotonicClock {

    private final Clock clock;
    private final AtomicLong last = new AtomicLong();

    public MonotonicClock(Clock clock) {
        this.clock = clock;
    }

    public long nextTimestamp() {
        long now = clock.millis();
        return last.updateAndGet(previous -> Math.max(now, previous + 1));
    }
}
