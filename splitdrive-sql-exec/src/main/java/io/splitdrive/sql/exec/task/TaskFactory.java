package io.splitdrive.sql.exec.task;

import io.splitdrive.sql.exec.cache.CacheContext;
import io.splitdrive.sql.exec.plan.PlanNode;

@FunctionalInterface
public interface TaskFactory {

    /**
     * Creates a task for the plan. Its memory comes from the backend active in {@code cacheContext}
     * at creation time.
     */
    Task createTask(PlanNode planNode, CacheContext cacheContext);
}
