package io.splitdrive.sql.exec.cache;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.cache.RemovalListener;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import io.splitdrive.sql.exec.split.ConnectorSplit;
import io.splitdrive.sql.exec.split.Split;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.ipc.ArrowStreamWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Bounded cache of split data. Each split is read once, serialized in the arrow stream format and
 * kept until evicted by weight. Loads run on a small pool, concurrent loads of one split share the
 * same read. Memory of tasks using this backend is bounded by the cache capacity.
 */
public class AsyncDataCache implements MemoryBackend {

    private static final Logger logger = LoggerFactory.getLogger(AsyncDataCache.class);

    private final long capacityBytes;
    private final BufferAllocator allocator;
    private final Cache<String, byte[]> cache;
    private final ExecutorService loaderPool;

    public AsyncDataCache(long capacityBytes, int loaderThreads) {
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacityBytes);
        }
        this.capacityBytes = capacityBytes;
        this.allocator = DefaultMemoryBackend.rootAllocator()
                .newChildAllocator("async-data-cache", 0, capacityBytes);
        this.cache = CacheBuilder.newBuilder()
                .maximumWeight(capacityBytes)
                .weigher((String key, byte[] value) -> value.length)
                .removalListener((RemovalListener<String, byte[]>) notification ->
                        logger.debug("Split {} removed from cache: {}", notification.getKey(), notification.getCause()))
                .recordStats()
                .build();
        this.loaderPool = Executors.newFixedThreadPool(loaderThreads,
                new ThreadFactoryBuilder().setNameFormat("async-data-cache-%d").setDaemon(true).build());
    }

    public long capacityBytes() {
        return capacityBytes;
    }

    @Override
    public String backendName() {
        return "async-data-cache";
    }

    @Override
    public BufferAllocator newAllocator(String name) {
        return allocator.newChildAllocator(name, 0, capacityBytes);
    }

    /**
     * Serialized data of the split, read on the loader pool on a miss.
     */
    public CompletableFuture<byte[]> load(ConnectorSplit split) {
        return CompletableFuture.supplyAsync(() -> get(split), loaderPool);
    }

    @Override
    public ArrowReader openSplit(Split split, BufferAllocator allocator) throws IOException {
        byte[] bytes;
        try {
            bytes = load(split.connectorSplit()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted loading " + split, e);
        } catch (ExecutionException e) {
            throw new IOException("Cannot load " + split, e.getCause());
        }
        return new ArrowStreamReader(new ByteArrayInputStream(bytes), allocator);
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public long size() {
        return cache.size();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private byte[] get(ConnectorSplit split) {
        try {
            return cache.get(split.splitId(), () -> serialize(split));
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException ioException) {
                throw new UncheckedIOException(ioException);
            }
            throw new IllegalStateException(e.getCause());
        } catch (UncheckedExecutionException e) {
            throw (RuntimeException) e.getCause();
        }
    }

    private byte[] serialize(ConnectorSplit split) throws IOException {
        logger.debug("Loading split {}", split.splitId());
        try (BufferAllocator loadAllocator = allocator.newChildAllocator("load-" + split.splitId(), 0, capacityBytes);
             ArrowReader reader = split.openReader(loadAllocator);
             ByteArrayOutputStream out = new ByteArrayOutputStream();
             ArrowStreamWriter writer = new ArrowStreamWriter(reader.getVectorSchemaRoot(), null, out)) {
            writer.start();
            while (reader.loadNextBatch()) {
                writer.writeBatch();
            }
            writer.end();
            return out.toByteArray();
        }
    }
}
