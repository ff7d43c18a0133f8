package io.splitdrive.sql.exec.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Selects the memory backend of the tasks created with it: passthrough, or the process wide
 * {@link AsyncDataCache}. The cache is created by the first context enabling it and reused by
 * every other one. Disabling a context does not destroy the cache.
 */
public class CacheContext {

    private static final Logger logger = LoggerFactory.getLogger(CacheContext.class);
    private static final Object LOCK = new Object();
    private static AsyncDataCache sharedCache;

    private final int loaderThreads;
    private volatile MemoryBackend active = DefaultMemoryBackend.INSTANCE;

    public CacheContext(int loaderThreads) {
        this.loaderThreads = loaderThreads;
    }

    public AsyncDataCache enableBoundedCache(long capacityBytes) {
        AsyncDataCache cache;
        synchronized (LOCK) {
            if (sharedCache == null) {
                logger.info("Creating async data cache with capacity {} bytes", capacityBytes);
                sharedCache = new AsyncDataCache(capacityBytes, loaderThreads);
            } else if (sharedCache.capacityBytes() != capacityBytes) {
                logger.warn("Async data cache already exists with capacity {} bytes, ignoring requested capacity {}",
                        sharedCache.capacityBytes(), capacityBytes);
            }
            cache = sharedCache;
        }
        active = cache;
        return cache;
    }

    public void disable() {
        active = DefaultMemoryBackend.INSTANCE;
    }

    public MemoryBackend active() {
        return active;
    }

    public boolean isBoundedCacheEnabled() {
        return active instanceof AsyncDataCache;
    }

    public static Optional<AsyncDataCache> sharedCache() {
        synchronized (LOCK) {
            return Optional.ofNullable(sharedCache);
        }
    }
}
