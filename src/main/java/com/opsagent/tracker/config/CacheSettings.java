package com.opsagent.tracker.config;

import java.time.Duration;

/**
 * TTLs and size bounds for the metadata buckets.
 */
public record CacheSettings(
        Duration workspaceTtl,
        Duration typeTtl,
        Duration fieldTtl,
        Duration userTtl,
        int workspaceMaxEntries
) {
    public static CacheSettings defaults() {
        return new CacheSettings(Duration.ofHours(1), Duration.ofMinutes(30),
                Duration.ofMinutes(30), Duration.ofMinutes(30), 50);
    }
}
