package io.splitdrive.sql.exec.cursor;

import io.splitdrive.sql.exec.cache.CacheContext;
import io.splitdrive.sql.exec.plan.PlanNode;
import io.splitdrive.sql.exec.task.TaskFactory;
import org.apache.arrow.memory.BufferAllocator;

import java.util.Objects;

/**
 * Everything needed to run a plan through a cursor.
 *
 * @param resultAllocator batches handed out by the cursor are transferred to this allocator
 */
public record CursorParameters(PlanNode planNode,
                               TaskFactory taskFactory,
                               CacheContext cacheContext,
                               BufferAllocator resultAllocator) {

    public CursorParameters {
        Objects.requireNonNull(planNode, "planNode");
        Objects.requireNonNull(taskFactory, "taskFactory");
        Objects.requireNonNull(cacheContext, "cacheContext");
        Objects.requireNonNull(resultAllocator, "resultAllocator");
    }

    public CursorParameters withPlanNode(PlanNode planNode) {
        return new CursorParameters(planNode, taskFactory, cacheContext, resultAllocator);
    }
}
