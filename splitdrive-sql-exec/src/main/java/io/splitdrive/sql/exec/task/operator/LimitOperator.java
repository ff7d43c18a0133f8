package io.splitdrive.sql.exec.task.operator;

import org.apache.arrow.vector.VectorSchemaRoot;

import java.io.IOException;

/**
 * Passes through the first {@code count} rows and stops pulling from its source afterwards.
 */
public class LimitOperator implements Operator {

    private final Operator source;
    private long remaining;

    public LimitOperator(Operator source, long count) {
        this.source = source;
        this.remaining = count;
    }

    @Override
    public VectorSchemaRoot next() throws IOException, InterruptedException {
        if (remaining == 0) {
            return null;
        }
        var batch = source.next();
        if (batch == null) {
            return null;
        }
        if (batch.getRowCount() <= remaining) {
            remaining -= batch.getRowCount();
            return batch;
        }
        try (batch) {
            var sliced = batch.slice(0, (int) remaining);
            remaining = 0;
            return sliced;
        }
    }

    @Override
    public void close() throws IOException {
        source.close();
    }
}
