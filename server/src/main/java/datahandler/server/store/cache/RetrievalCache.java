package datahandler.server.store.cache;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import datahandler.model.TimeSeriesTable;

/**
 * Process wide memoization of post-processed retrievals. Entries never expire and there is no size bound, the only way
 * to drop them is {@link #purge()}. When disabled every operation is a no-op.
 */
public class RetrievalCache {

    private static final Logger log = LoggerFactory.getLogger(RetrievalCache.class);

    private final boolean enabled;
    private final Cache<RetrievalFingerprint,TimeSeriesTable> cache;
    // get and put share the read lock, purge takes the write lock
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public RetrievalCache(boolean enabled) {
        this.enabled = enabled;
        this.cache = Caffeine.newBuilder().initialCapacity(64).build();
        log.info("Retrieval cache {}", enabled ? "enabled" : "disabled");
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Optional<TimeSeriesTable> get(RetrievalFingerprint fingerprint) {
        if (!enabled) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            TimeSeriesTable table = cache.getIfPresent(fingerprint);
            log.debug("Cache {} for {}", table == null ? "miss" : "hit", fingerprint);
            return Optional.ofNullable(table);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void put(RetrievalFingerprint fingerprint, TimeSeriesTable table) {
        if (!enabled) {
            return;
        }
        lock.readLock().lock();
        try {
            cache.put(fingerprint, table);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void purge() {
        lock.writeLock().lock();
        try {
            long size = cache.estimatedSize();
            cache.invalidateAll();
            cache.cleanUp();
            log.info("Retrieval cache purged, {} entries dropped", size);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long size() {
        return cache.estimatedSize();
    }
}
