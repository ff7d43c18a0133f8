package io.splitdrive.sql.exec.task;

import io.splitdrive.sql.commons.types.JavaRow;
import io.splitdrive.sql.exec.HarnessConfig;
import io.splitdrive.sql.exec.TestSchemas;
import io.splitdrive.sql.exec.UnknownOrClosedNodeException;
import io.splitdrive.sql.exec.cache.DefaultMemoryBackend;
import io.splitdrive.sql.exec.cache.MemoryBackend;
import io.splitdrive.sql.exec.plan.PlanBuilder;
import io.splitdrive.sql.exec.plan.PlanNode;
import io.splitdrive.sql.exec.plan.PlanNodeIdGenerator;
import io.splitdrive.sql.exec.split.RowsSplit;
import io.splitdrive.sql.exec.split.Split;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

public class LocalTaskTest {

    private static final HarnessConfig CONFIG = HarnessConfig.load();

    private ExecutorService executorService;
    private BufferAllocator parent;
    private MemoryBackend backend;

    @BeforeEach
    public void setUp() {
        executorService = Executors.newCachedThreadPool();
        parent = DefaultMemoryBackend.INSTANCE.newAllocator("local-task-test");
        backend = new MemoryBackend() {
            @Override
            public String backendName() {
                return "tracking";
            }

            @Override
            public BufferAllocator newAllocator(String name) {
                return parent.newChildAllocator(name, 0, parent.getLimit());
            }

            @Override
            public ArrowReader openSplit(Split split, BufferAllocator allocator) throws IOException {
                return split.connectorSplit().openReader(allocator);
            }
        };
    }

    @AfterEach
    public void tearDown() {
        executorService.shutdownNow();
        assertEquals(0, parent.getAllocatedMemory());
        // fails when a task allocator was left open
        parent.close();
    }

    private LocalTask task(PlanNode plan) {
        return new LocalTask("local-test", plan, backend, executorService, CONFIG);
    }

    private static Split split(String id, List<JavaRow> rows) {
        return Split.of(new RowsSplit(id, TestSchemas.ID_NAME, rows));
    }

    @Test
    public void testScanSplits() {
        var plan = new PlanBuilder().tableScan(TestSchemas.ID_NAME).planNode();
        try (var task = task(plan)) {
            task.start();
            task.addSplit(plan.id(), split("s1", TestSchemas.S1_ROWS));
            task.addSplit(plan.id(), split("s2", TestSchemas.S2_ROWS));
            task.noMoreSplits(plan.id());
            try (var first = task.next(); var second = task.next()) {
                assertEquals(3, first.getRowCount());
                assertEquals(2, second.getRowCount());
            }
            assertNull(task.next());
            assertNull(task.next());
            await().atMost(Duration.ofSeconds(5)).until(() -> task.state() == TaskState.FINISHED);
        }
    }

    @Test
    public void testUnknownNode() {
        var plan = new PlanBuilder().tableScan(TestSchemas.ID_NAME).limit(1).planNode();
        try (var task = task(plan)) {
            var unknown = assertThrows(UnknownOrClosedNodeException.class,
                    () -> task.addSplit("42", split("s1", TestSchemas.S1_ROWS)));
            assertEquals("42", unknown.getNodeId());
            assertThrows(UnknownOrClosedNodeException.class, () -> task.noMoreSplits("42"));
            // the limit node exists but takes no splits
            assertThrows(UnknownOrClosedNodeException.class,
                    () -> task.addSplit(plan.id(), split("s1", TestSchemas.S1_ROWS)));
        }
    }

    @Test
    public void testClosedNode() {
        var plan = new PlanBuilder().tableScan(TestSchemas.ID_NAME).planNode();
        try (var task = task(plan)) {
            task.noMoreSplits(plan.id());
            task.noMoreSplits(plan.id());
            assertThrows(UnknownOrClosedNodeException.class,
                    () -> task.addSplit(plan.id(), split("s1", TestSchemas.S1_ROWS)));
        }
    }

    @Test
    public void testValuesWithoutSplits() {
        var plan = new PlanBuilder()
                .values(TestSchemas.ID_NAME, List.of(TestSchemas.S1_ROWS, TestSchemas.S2_ROWS))
                .planNode();
        try (var task = task(plan)) {
            task.start();
            long rows = 0;
            for (var batch = task.next(); batch != null; batch = task.next()) {
                rows += batch.getRowCount();
                batch.close();
            }
            assertEquals(5, rows);
        }
    }

    @Test
    public void testCancelWhileWaitingForSplits() {
        var plan = new PlanBuilder().tableScan(TestSchemas.ID_NAME).planNode();
        var task = task(plan);
        task.start();
        task.cancel();
        assertEquals(TaskState.CANCELED, task.state());
        assertNull(task.next());
        task.close();
    }

    @Test
    public void testCloseReleasesUnreadBatches() {
        var ids = new PlanNodeIdGenerator();
        var plan = new PlanBuilder(ids)
                .values(TestSchemas.ID_NAME, List.of(TestSchemas.S1_ROWS, TestSchemas.S2_ROWS, TestSchemas.S1_ROWS))
                .planNode();
        var task = task(plan);
        task.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> task.state() == TaskState.FINISHED);
        task.close();
        task.close();
    }

    @Test
    public void testCloseAfterFinishedDoesNotWaitForTimeout() {
        var config = new HarnessConfig(1, 10_000, CONFIG.taskBatchSize(), CONFIG.cacheCapacityBytes(),
                CONFIG.cacheLoaderThreads(), CONFIG.referenceBatchSize());
        var plan = new PlanBuilder()
                .values(TestSchemas.ID_NAME, List.of(TestSchemas.S1_ROWS, TestSchemas.S2_ROWS))
                .planNode();
        var task = new LocalTask("abandoned", plan, backend, executorService, config);
        task.start();
        task.next().close();
        // second batch fills the queue, the end marker cannot be queued yet
        await().atMost(Duration.ofSeconds(5)).until(() -> task.state() == TaskState.FINISHED);
        long start = System.nanoTime();
        task.close();
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        assertTrue(elapsedMs < 5_000, "close took " + elapsedMs + " ms");
        assertEquals(TaskState.FINISHED, task.state());
    }

    @Test
    public void testStartTwice() {
        var plan = new PlanBuilder().tableScan(TestSchemas.ID_NAME).planNode();
        try (var task = task(plan)) {
            task.start();
            assertThrows(IllegalStateException.class, task::start);
        }
    }
}
