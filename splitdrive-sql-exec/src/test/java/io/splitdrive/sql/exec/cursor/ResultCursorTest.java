package io.splitdrive.sql.exec.cursor;

import io.splitdrive.sql.commons.types.JavaRow;
import io.splitdrive.sql.commons.types.JavaRowReader;
import io.splitdrive.sql.exec.ExecutorFailureException;
import io.splitdrive.sql.exec.TestSchemas;
import io.splitdrive.sql.exec.cache.DefaultMemoryBackend;
import io.splitdrive.sql.exec.task.ScriptedTask;
import io.splitdrive.sql.exec.task.Task;
import io.splitdrive.sql.exec.task.TaskState;
import org.apache.arrow.memory.BufferAllocator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

public class ResultCursorTest {

    private BufferAllocator taskAllocator;
    private BufferAllocator resultAllocator;

    @BeforeEach
    public void setUp() {
        taskAllocator = DefaultMemoryBackend.INSTANCE.newAllocator("scripted-task");
        resultAllocator = DefaultMemoryBackend.INSTANCE.newAllocator("cursor-result");
    }

    @AfterEach
    public void tearDown() {
        // fails on leaked buffers
        taskAllocator.close();
        resultAllocator.close();
    }

    private ScriptedTask twoBatches() {
        return new ScriptedTask(TestSchemas.ID_NAME, Set.of("0"))
                .thenBatch(TestSchemas.batch(taskAllocator, TestSchemas.ID_NAME, TestSchemas.S1_ROWS))
                .thenBatch(TestSchemas.batch(taskAllocator, TestSchemas.ID_NAME, TestSchemas.S2_ROWS));
    }

    @Test
    public void testHookRunsOnceOnFirstPull() {
        var task = twoBatches();
        var calls = new AtomicInteger();
        Consumer<Task> hook = t -> {
            calls.incrementAndGet();
            task.events().add("hook");
        };
        try (var cursor = new ResultCursor(task, hook, resultAllocator)) {
            assertEquals(0, calls.get());
            assertTrue(task.events().isEmpty());
            assertTrue(cursor.hasNext());
            assertEquals(List.of("start", "hook"), task.events());
            assertTrue(cursor.hasNext());
            cursor.next().close();
            assertTrue(cursor.hasNext());
            cursor.next().close();
            assertFalse(cursor.hasNext());
            assertEquals(1, calls.get());
        }
    }

    @Test
    public void testBatchesInOrderAndClosedWhenExhausted() {
        var task = twoBatches();
        var rows = new ArrayList<JavaRow>();
        var cursor = new ResultCursor(task, t -> { }, resultAllocator);
        while (cursor.hasNext()) {
            try (var batch = cursor.next()) {
                rows.addAll(JavaRowReader.read(batch));
            }
        }
        assertEquals(5, rows.size());
        assertEquals(List.of(1, "a"), rows.get(0).values());
        assertEquals(List.of(5, "e"), rows.get(4).values());
        assertTrue(cursor.isClosed());
        assertTrue(task.isClosed());
        assertFalse(task.events().contains("cancel"));
        assertThrows(NoSuchElementException.class, cursor::next);
    }

    @Test
    public void testBatchOutlivesTask() {
        var task = twoBatches();
        var cursor = new ResultCursor(task, t -> { }, resultAllocator);
        var first = cursor.next();
        cursor.close();
        assertTrue(task.isClosed());
        try (first) {
            assertEquals(3, first.getRowCount());
            assertEquals(resultAllocator, first.getVector(0).getAllocator());
        }
    }

    @Test
    public void testFailureClosesCursor() {
        var failure = new ExecutorFailureException("scripted", new IOException("disk on fire"));
        var task = new ScriptedTask(TestSchemas.ID_NAME, Set.of("0"))
                .thenBatch(TestSchemas.batch(taskAllocator, TestSchemas.ID_NAME, TestSchemas.S1_ROWS))
                .thenFail(failure);
        var cursor = new ResultCursor(task, t -> { }, resultAllocator);
        assertTrue(cursor.hasNext());
        cursor.next().close();
        var thrown = assertThrows(ExecutorFailureException.class, cursor::hasNext);
        assertSame(failure, thrown);
        assertTrue(cursor.isClosed());
        assertTrue(task.isClosed());
        assertEquals(TaskState.FAILED, task.state());
        assertFalse(cursor.hasNext());
    }

    @Test
    public void testEarlyCloseCancelsTask() {
        var task = twoBatches();
        var cursor = new ResultCursor(task, t -> { }, resultAllocator);
        assertTrue(cursor.hasNext());
        cursor.close();
        assertEquals(List.of("start", "cancel", "close"), task.events());
        assertEquals(TaskState.CANCELED, task.state());
    }

    @Test
    public void testCloseBeforeStart() {
        var task = twoBatches();
        var calls = new AtomicInteger();
        var cursor = new ResultCursor(task, t -> calls.incrementAndGet(), resultAllocator);
        cursor.close();
        cursor.close();
        assertEquals(0, calls.get());
        assertEquals(List.of("cancel", "close"), task.events());
        assertFalse(cursor.hasNext());
    }
}
