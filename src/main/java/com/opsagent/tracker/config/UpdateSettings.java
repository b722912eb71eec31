package com.opsagent.tracker.config;

/**
 * Write-path limits: concurrent writes in flight, rate-limit retries and the base backoff.
 */
public record UpdateSettings(int maxConcurrentWrites, int maxRetries, long baseBackoffMs) {

    public static UpdateSettings defaults() {
        return new UpdateSettings(2, 3, 1000L);
    }
}
