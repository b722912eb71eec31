package com.opsagent.tracker.service;

import com.google.common.base.Ticker;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ticker that only moves when told to.
 */
class ManualTicker extends Ticker {

    private final AtomicLong nanos = new AtomicLong(1_000L);

    @Override
    public long read() {
        return nanos.get();
    }

    void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }
}
