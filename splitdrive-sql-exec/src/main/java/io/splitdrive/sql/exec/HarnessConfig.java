package io.splitdrive.sql.exec;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import static io.splitdrive.sql.commons.ConfigConstants.*;

/**
 * Settings of the harness, read from the {@code splitdrive} block of the typesafe configuration.
 * Defaults live in {@code reference.conf}.
 */
public record HarnessConfig(int cursorQueueCapacity,
                            long taskCloseTimeoutMs,
                            int taskBatchSize,
                            long cacheCapacityBytes,
                            int cacheLoaderThreads,
                            int referenceBatchSize) {

    public static HarnessConfig load() {
        return fromConfig(ConfigFactory.load().getConfig(CONFIG_PATH));
    }

    public static HarnessConfig fromConfig(Config config) {
        return new HarnessConfig(
                config.getInt(CURSOR_QUEUE_CAPACITY_KEY),
                config.getLong(TASK_CLOSE_TIMEOUT_MS_KEY),
                config.getInt(TASK_BATCH_SIZE_KEY),
                config.getBytes(CACHE_CAPACITY_BYTES_KEY),
                config.getInt(CACHE_LOADER_THREADS_KEY),
                config.getInt(REFERENCE_BATCH_SIZE_KEY));
    }
}
