package com.opsagent.tracker.config;

import com.google.common.base.Ticker;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class TrackerSettingsConfig {

    @Bean
    public CacheSettings cacheSettings(@Value("${tracker.cache.workspace-ttl-seconds:3600}") long workspaceTtl,
                                       @Value("${tracker.cache.type-ttl-seconds:1800}") long typeTtl,
                                       @Value("${tracker.cache.field-ttl-seconds:1800}") long fieldTtl,
                                       @Value("${tracker.cache.user-ttl-seconds:1800}") long userTtl,
                                       @Value("${tracker.cache.workspace-max-entries:50}") int workspaceMaxEntries) {
        return new CacheSettings(
                Duration.ofSeconds(workspaceTtl),
                Duration.ofSeconds(typeTtl),
                Duration.ofSeconds(fieldTtl),
                Duration.ofSeconds(userTtl),
                Math.max(1, workspaceMaxEntries));
    }

    @Bean
    public UpdateSettings updateSettings(@Value("${tracker.update.max-concurrent-writes:2}") int maxConcurrentWrites,
                                         @Value("${tracker.update.max-retries:3}") int maxRetries,
                                         @Value("${tracker.update.base-backoff-ms:1000}") long baseBackoffMs) {
        return new UpdateSettings(Math.max(1, maxConcurrentWrites), Math.max(0, maxRetries), Math.max(1L, baseBackoffMs));
    }

    @Bean
    public ScanSettings scanSettings(@Value("${tracker.scan.max-total-items:500}") int maxTotalItems,
                                     @Value("${tracker.scan.max-pages:10}") int maxPages,
                                     @Value("${tracker.scan.page-size:50}") int pageSize,
                                     @Value("${tracker.scan.concurrent-pages:3}") int concurrentPages,
                                     @Value("${tracker.lookup.type-batch-size:5}") int typeBatchSize) {
        return new ScanSettings(maxTotalItems, maxPages, pageSize, Math.max(1, concurrentPages), Math.max(1, typeBatchSize));
    }

    @Bean
    public WorkspaceDefaults workspaceDefaults(@Value("${tracker.workspace.default-key:}") String workspaceKey,
                                               @Value("${tracker.workspace.default-name:}") String workspaceName,
                                               @Value("${tracker.workspace.default-type:" + WorkspaceDefaults.FALLBACK_TYPE_NAME + "}") String typeName) {
        return new WorkspaceDefaults(workspaceKey, workspaceName, typeName);
    }

    // TTL checks read this clock; tests swap in a manual one.
    @Bean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }
}
