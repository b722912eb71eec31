package com.opsagent.tracker.config;

/**
 * Bounds for client-side scans and cross-type fan-out.
 */
public record ScanSettings(
        int maxTotalItems,
        int maxPages,
        int pageSize,
        int concurrentPages,
        int typeBatchSize
) {
    public static ScanSettings defaults() {
        return new ScanSettings(500, 10, 50, 3, 5);
    }
}
