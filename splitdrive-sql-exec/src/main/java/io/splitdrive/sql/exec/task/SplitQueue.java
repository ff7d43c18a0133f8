package io.splitdrive.sql.exec.task;

import io.splitdrive.sql.exec.UnknownOrClosedNodeException;
import io.splitdrive.sql.exec.split.Split;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Splits added for one scan node, taken in the order they were added.
 */
public class SplitQueue {

    private final String nodeId;
    private final Deque<Split> splits = new ArrayDeque<>();
    private boolean noMoreSplits = false;

    public SplitQueue(String nodeId) {
        this.nodeId = nodeId;
    }

    public synchronized void add(Split split) {
        if (noMoreSplits) {
            throw new UnknownOrClosedNodeException(nodeId, "input already closed");
        }
        splits.addLast(split);
        notifyAll();
    }

    public synchronized void noMoreSplits() {
        noMoreSplits = true;
        notifyAll();
    }

    /**
     * Waits for the next split.
     *
     * @return the next split, {@code null} when the input is closed and every split was taken
     */
    public synchronized Split take() throws InterruptedException {
        while (splits.isEmpty() && !noMoreSplits) {
            wait();
        }
        return splits.pollFirst();
    }

    public synchronized boolean isClosed() {
        return noMoreSplits;
    }

    public String nodeId() {
        return nodeId;
    }
}
