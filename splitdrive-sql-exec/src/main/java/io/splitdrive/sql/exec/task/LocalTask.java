package io.splitdrive.sql.exec.task;

import io.splitdrive.sql.exec.ExecutorFailureException;
import io.splitdrive.sql.exec.HarnessConfig;
import io.splitdrive.sql.exec.UnknownOrClosedNodeException;
import io.splitdrive.sql.exec.cache.MemoryBackend;
import io.splitdrive.sql.exec.plan.PlanNode;
import io.splitdrive.sql.exec.plan.PlanTopology;
import io.splitdrive.sql.exec.plan.TableScanNode;
import io.splitdrive.sql.exec.split.Split;
import io.splitdrive.sql.exec.task.operator.LocalPlanner;
import io.splitdrive.sql.exec.task.operator.OperatorContext;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process task. {@link #start()} submits one driver that pulls the operator tree and pushes
 * batches into a bounded queue, {@link #next()} takes them from the queue.
 */
public class LocalTask implements Task {

    private static final Logger logger = LoggerFactory.getLogger(LocalTask.class);
    private static final long POLL_INTERVAL_MS = 100;

    private final String taskId;
    private final PlanNode planNode;
    private final MemoryBackend backend;
    private final BufferAllocator allocator;
    private final ExecutorService executorService;
    private final long closeTimeoutMs;
    private final int batchSize;
    private final Map<String, SplitQueue> splitQueues = new LinkedHashMap<>();
    private final Map<String, PlanNode> nodes;
    private final BlockingQueue<Output> output;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.RUNNING);
    private final AtomicBoolean started = new AtomicBoolean();
    private final Object driverLock = new Object();
    private Thread driverThread;
    private volatile boolean canceled = false;
    private boolean endReached = false;
    private boolean closed = false;

    public LocalTask(String taskId,
                     PlanNode planNode,
                     MemoryBackend backend,
                     ExecutorService executorService,
                     HarnessConfig config) {
        this.taskId = taskId;
        this.planNode = planNode;
        this.backend = backend;
        this.executorService = executorService;
        this.closeTimeoutMs = config.taskCloseTimeoutMs();
        this.batchSize = config.taskBatchSize();
        this.output = new LinkedBlockingQueue<>(config.cursorQueueCapacity());
        this.nodes = PlanTopology.nodesById(planNode);
        for (var node : nodes.values()) {
            if (node instanceof TableScanNode) {
                splitQueues.put(node.id(), new SplitQueue(node.id()));
            }
        }
        this.allocator = backend.newAllocator("task-" + taskId);
    }

    @Override
    public String taskId() {
        return taskId;
    }

    @Override
    public Schema outputSchema() {
        return planNode.outputSchema();
    }

    @Override
    public void addSplit(String nodeId, Split split) {
        splitQueue(nodeId).add(split);
    }

    @Override
    public void noMoreSplits(String nodeId) {
        splitQueue(nodeId).noMoreSplits();
    }

    private SplitQueue splitQueue(String nodeId) {
        var queue = splitQueues.get(nodeId);
        if (queue != null) {
            return queue;
        }
        if (nodes.containsKey(nodeId)) {
            throw new UnknownOrClosedNodeException(nodeId, nodes.get(nodeId) + " does not consume splits");
        }
        throw new UnknownOrClosedNodeException(nodeId, "no such node in plan of task " + taskId);
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Task " + taskId + " already started");
        }
        logger.debug("Starting task {} with backend {}", taskId, backend.backendName());
        executorService.submit(this::drive);
    }

    private void drive() {
        synchronized (driverLock) {
            if (canceled) {
                finished.countDown();
                return;
            }
            driverThread = Thread.currentThread();
        }
        var context = new OperatorContext(taskId, allocator, backend, splitQueues, batchSize);
        try (var operator = LocalPlanner.plan(planNode, context)) {
            VectorSchemaRoot batch;
            while ((batch = operator.next()) != null) {
                if (!put(Output.of(batch))) {
                    batch.close();
                    break;
                }
            }
            if (!canceled) {
                state.compareAndSet(TaskState.RUNNING, TaskState.FINISHED);
                put(Output.END);
            }
        } catch (Throwable t) {
            if (canceled) {
                logger.debug("Task {} stopped after cancel: {}", taskId, t.toString());
            } else {
                logger.atError().setCause(t).log("Task {} failed", taskId);
                state.compareAndSet(TaskState.RUNNING, TaskState.FAILED);
                put(Output.failed(t));
            }
        } finally {
            synchronized (driverLock) {
                driverThread = null;
                // pool threads are reused, clear an interrupt left by cancel
                Thread.interrupted();
            }
            finished.countDown();
        }
    }

    private boolean put(Output item) {
        try {
            while (!canceled) {
                if (output.offer(item, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    @Override
    public VectorSchemaRoot next() {
        if (!started.get()) {
            throw new IllegalStateException("Task " + taskId + " not started");
        }
        if (endReached) {
            return null;
        }
        Output item;
        try {
            item = output.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            while (item == null) {
                if (finished.getCount() == 0 && output.isEmpty()) {
                    // driver ended without an end marker, it was canceled
                    endReached = true;
                    return null;
                }
                item = output.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorFailureException(taskId, e);
        }
        if (item.failure() != null) {
            endReached = true;
            throw new ExecutorFailureException(taskId, item.failure());
        }
        if (item.batch() == null) {
            endReached = true;
            return null;
        }
        return item.batch();
    }

    @Override
    public TaskState state() {
        return state.get();
    }

    @Override
    public void cancel() {
        synchronized (driverLock) {
            canceled = true;
            if (driverThread != null) {
                driverThread.interrupt();
            }
        }
        if (state.compareAndSet(TaskState.RUNNING, TaskState.CANCELED)) {
            logger.debug("Task {} canceled", taskId);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        // a finished driver may still be blocked putting its end marker into a full queue
        cancel();
        if (started.get()) {
            try {
                if (!finished.await(closeTimeoutMs, TimeUnit.MILLISECONDS)) {
                    logger.warn("Task {} did not stop within {} ms", taskId, closeTimeoutMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        Output item;
        while ((item = output.poll()) != null) {
            if (item.batch() != null) {
                item.batch().close();
            }
        }
        try {
            allocator.close();
        } catch (Exception e) {
            logger.atError().setCause(e).log("Error closing allocator of task {}", taskId);
        }
    }

    private record Output(VectorSchemaRoot batch, Throwable failure) {
        static final Output END = new Output(null, null);

        static Output of(VectorSchemaRoot batch) {
            return new Output(batch, null);
        }

        static Output failed(Throwable failure) {
            return new Output(null, failure);
        }
    }
}
