package io.splitdrive.sql.commons;

public class ConfigConstants {

    public static final String CONFIG_PATH = "splitdrive";

    // Cursor
    public static final String CURSOR_QUEUE_CAPACITY_KEY = "cursor.queue_capacity";

    // Task
    public static final String TASK_CLOSE_TIMEOUT_MS_KEY = "task.close_timeout_ms";
    public static final String TASK_BATCH_SIZE_KEY = "task.batch_size";

    // Async data cache
    public static final String CACHE_CAPACITY_BYTES_KEY = "cache.capacity_bytes";
    public static final String CACHE_LOADER_THREADS_KEY = "cache.loader_threads";

    // Reference evaluator
    public static final String REFERENCE_BATCH_SIZE_KEY = "reference.batch_size";
}
