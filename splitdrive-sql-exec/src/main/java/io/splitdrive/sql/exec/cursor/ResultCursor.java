package io.splitdrive.sql.exec.cursor;

import io.splitdrive.sql.exec.task.Task;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

/**
 * Pulls the output of a task batch by batch. The task is started and handed to {@code addSplits}
 * on the first {@link #hasNext()}. {@link #hasNext()} blocks until the task produces a batch,
 * finishes or fails, with no time limit.
 * <p>
 * Batches are returned in the order the task produced them and are owned by the caller. The
 * cursor closes itself once the output is exhausted or the task failed.
 */
public class ResultCursor implements Iterator<VectorSchemaRoot>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ResultCursor.class);

    private final Task task;
    private final Consumer<Task> addSplits;
    private final BufferAllocator resultAllocator;
    private VectorSchemaRoot nextBatch;
    private boolean started = false;
    private boolean closed = false;

    ResultCursor(Task task, Consumer<Task> addSplits, BufferAllocator resultAllocator) {
        this.task = task;
        this.addSplits = addSplits;
        this.resultAllocator = resultAllocator;
    }

    public static ResultCursor open(CursorParameters parameters, Consumer<Task> addSplits) {
        var task = parameters.taskFactory().createTask(parameters.planNode(), parameters.cacheContext());
        return new ResultCursor(task, addSplits, parameters.resultAllocator());
    }

    public Task task() {
        return task;
    }

    @Override
    public boolean hasNext() {
        if (nextBatch != null) {
            return true;
        }
        if (closed) {
            return false;
        }
        try {
            if (!started) {
                started = true;
                task.start();
                addSplits.accept(task);
            }
            var batch = task.next();
            if (batch == null) {
                close();
                return false;
            }
            nextBatch = transfer(batch);
            return true;
        } catch (RuntimeException e) {
            close();
            throw e;
        }
    }

    @Override
    public VectorSchemaRoot next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        var batch = nextBatch;
        nextBatch = null;
        return batch;
    }

    /**
     * Moves the batch out of the task's allocator so it outlives the task.
     */
    private VectorSchemaRoot transfer(VectorSchemaRoot batch) {
        try (batch) {
            var vectors = new ArrayList<FieldVector>(batch.getFieldVectors().size());
            for (var vector : batch.getFieldVectors()) {
                var transferPair = vector.getTransferPair(resultAllocator);
                transferPair.transfer();
                vectors.add((FieldVector) transferPair.getTo());
            }
            return new VectorSchemaRoot(batch.getSchema(), vectors, batch.getRowCount());
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (nextBatch != null) {
            nextBatch.close();
            nextBatch = null;
        }
        try {
            if (!task.state().isDone()) {
                logger.debug("Canceling unfinished task {}", task.taskId());
                task.cancel();
            }
        } finally {
            task.close();
        }
    }
}
