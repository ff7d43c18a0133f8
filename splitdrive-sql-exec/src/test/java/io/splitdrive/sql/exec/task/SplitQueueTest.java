package io.splitdrive.sql.exec.task;

import io.splitdrive.sql.exec.TestSchemas;
import io.splitdrive.sql.exec.UnknownOrClosedNodeException;
import io.splitdrive.sql.exec.split.RowsSplit;
import io.splitdrive.sql.exec.split.Split;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

public class SplitQueueTest {

    private static Split split(String id) {
        return Split.of(new RowsSplit(id, TestSchemas.ID_NAME, List.of()));
    }

    @Test
    public void testTakeInOrder() throws InterruptedException {
        var queue = new SplitQueue("0");
        var a = split("a");
        var b = split("b");
        queue.add(a);
        queue.add(b);
        queue.noMoreSplits();
        assertSame(a, queue.take());
        assertSame(b, queue.take());
        assertNull(queue.take());
    }

    @Test
    public void testAddAfterCloseFails() {
        var queue = new SplitQueue("3");
        queue.noMoreSplits();
        queue.noMoreSplits();
        assertTrue(queue.isClosed());
        var e = assertThrows(UnknownOrClosedNodeException.class, () -> queue.add(split("a")));
        assertEquals("3", e.getNodeId());
    }

    @Test
    public void testTakeWaitsForSplits() {
        var queue = new SplitQueue("0");
        var taken = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.take();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        assertFalse(taken.isDone());
        var a = split("a");
        queue.add(a);
        await().atMost(Duration.ofSeconds(5)).until(taken::isDone);
        assertSame(a, taken.join());
    }
}
