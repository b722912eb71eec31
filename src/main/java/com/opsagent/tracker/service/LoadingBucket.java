package com.opsagent.tracker.service;

import com.google.common.base.Ticker;
import com.opsagent.tracker.model.CacheBucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * One independently locked, TTL-scoped cache slot.
 *
 * Readers take an unlocked fast path while the snapshot is fresh and satisfies them. Otherwise they
 * queue on the bucket's lock, re-check, and only the first one performs the remote fetch; the rest see
 * its result. The snapshot is swapped as a whole. A failed load leaves the previous snapshot in place.
 */
public class LoadingBucket<T> {

    private static final Logger logger = LoggerFactory.getLogger(LoadingBucket.class);

    private final String name;
    private final Duration ttl;
    private final Ticker ticker;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile CacheBucket<T> current;

    public LoadingBucket(String name, Duration ttl, Ticker ticker) {
        this.name = name;
        this.ttl = ttl;
        this.ticker = ticker;
    }

    /**
     * Fresh snapshot, loading it when absent or expired.
     */
    public T get(Supplier<T> loader) {
        return getOrReload(values -> true, loader);
    }

    /**
     * Returns the snapshot when it is fresh and {@code satisfied} accepts it; otherwise reloads once.
     * A snapshot that is fresh but does not satisfy the caller is still reloaded, so names added
     * remotely since the last load become visible.
     */
    public T getOrReload(Predicate<T> satisfied, Supplier<T> loader) {
        CacheBucket<T> snapshot = current;
        if (isFresh(snapshot) && satisfied.test(snapshot.values())) {
            logger.debug("Cache hit: bucket '{}'", name);
            return snapshot.values();
        }

        lock.lock();
        try {
            snapshot = current;
            if (isFresh(snapshot) && satisfied.test(snapshot.values())) {
                return snapshot.values();
            }
            T loaded = loader.get();
            current = new CacheBucket<>(loaded, ticker.read());
            logger.debug("Cache set: bucket '{}' reloaded", name);
            return loaded;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy-on-write extension: when the fresh snapshot does not satisfy the caller, {@code merge}
     * derives a new snapshot from it (or from {@code empty} after expiry) and that replaces it.
     * The merged snapshot expires when the snapshot it was derived from would have.
     */
    public T merge(Predicate<T> satisfied, UnaryOperator<T> merge, T empty) {
        CacheBucket<T> snapshot = current;
        if (isFresh(snapshot) && satisfied.test(snapshot.values())) {
            logger.debug("Cache hit: bucket '{}'", name);
            return snapshot.values();
        }

        lock.lock();
        try {
            snapshot = current;
            boolean fresh = isFresh(snapshot);
            T base = fresh ? snapshot.values() : empty;
            if (satisfied.test(base)) {
                return base;
            }
            T merged = merge.apply(base);
            // additions keep the original load time so the bucket still expires on schedule
            current = new CacheBucket<>(merged, fresh ? snapshot.loadedAtNanos() : ticker.read());
            return merged;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current snapshot without loading; empty when absent or expired.
     */
    public Optional<T> peek() {
        CacheBucket<T> snapshot = current;
        return isFresh(snapshot) ? Optional.of(snapshot.values()) : Optional.empty();
    }

    public void invalidate() {
        lock.lock();
        try {
            current = null;
        } finally {
            lock.unlock();
        }
    }

    private boolean isFresh(CacheBucket<T> snapshot) {
        return snapshot != null && !snapshot.isExpired(ticker.read(), ttl);
    }
}
