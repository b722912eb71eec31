package com.opsagent.tracker.model;

import java.time.Duration;

/**
 * Immutable snapshot of one metadata category plus the ticker reading taken when it was loaded.
 * A reload produces a new bucket; buckets are never edited in place.
 */
public record CacheBucket<T>(T values, long loadedAtNanos) {

    public boolean isExpired(long nowNanos, Duration ttl) {
        return nowNanos - loadedAtNanos > ttl.toNanos();
    }
}
