package io.splitdrive.sql.exec.task;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.splitdrive.sql.exec.HarnessConfig;
import io.splitdrive.sql.exec.cache.CacheContext;
import io.splitdrive.sql.exec.plan.PlanNode;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates {@link LocalTask}s running on a pool owned by the factory.
 */
public class LocalTaskFactory implements TaskFactory, AutoCloseable {

    private static final AtomicLong TASK_COUNTER = new AtomicLong();

    private final HarnessConfig config;
    private final ExecutorService executorService;

    public LocalTaskFactory(HarnessConfig config) {
        this.config = config;
        this.executorService = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat("local-task-%d").setDaemon(true).build());
    }

    @Override
    public Task createTask(PlanNode planNode, CacheContext cacheContext) {
        var taskId = "task-" + TASK_COUNTER.incrementAndGet();
        return new LocalTask(taskId, planNode, cacheContext.active(), executorService, config);
    }

    @Override
    public void close() {
        executorService.shutdownNow();
    }
}
