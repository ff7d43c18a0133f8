package io.splitdrive.sql.exec.task;

import io.splitdrive.sql.exec.split.Split;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Executes one plan against the splits added to it and hands out its output batch by batch.
 */
public interface Task extends AutoCloseable {

    String taskId();

    Schema outputSchema();

    /**
     * @throws io.splitdrive.sql.exec.UnknownOrClosedNodeException if {@code nodeId} is not a
     *         split consuming node of the plan or its input is already closed
     */
    void addSplit(String nodeId, Split split);

    /**
     * Closes the input of a node. Repeating it for the same node has no effect.
     *
     * @throws io.splitdrive.sql.exec.UnknownOrClosedNodeException if {@code nodeId} is not a
     *         split consuming node of the plan
     */
    void noMoreSplits(String nodeId);

    void start();

    /**
     * Blocks until the next batch is produced. The caller owns the returned batch.
     *
     * @return the next batch, {@code null} once the output is complete
     * @throws io.splitdrive.sql.exec.ExecutorFailureException if execution failed
     */
    VectorSchemaRoot next();

    TaskState state();

    void cancel();

    /**
     * Releases every resource of the task. Batches already handed out are not affected.
     */
    @Override
    void close();
}
