package io.splitdrive.sql.exec.task.operator;

import io.splitdrive.sql.exec.task.SplitQueue;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Reads the splits of one scan node in queue order, waiting for more splits until the node's
 * input is closed.
 */
public class TableScanOperator implements Operator {

    private static final Logger logger = LoggerFactory.getLogger(TableScanOperator.class);

    private final OperatorContext context;
    private final SplitQueue splitQueue;
    private ArrowReader reader;

    public TableScanOperator(OperatorContext context, SplitQueue splitQueue) {
        this.context = context;
        this.splitQueue = splitQueue;
    }

    @Override
    public VectorSchemaRoot next() throws IOException, InterruptedException {
        while (true) {
            if (reader == null) {
                var split = splitQueue.take();
                if (split == null) {
                    return null;
                }
                logger.debug("Task {} scanning {} for node {}", context.taskId(), split, splitQueue.nodeId());
                reader = context.backend().openSplit(split, context.allocator());
            }
            if (reader.loadNextBatch()) {
                var root = reader.getVectorSchemaRoot();
                return Batches.copy(root, root.getSchema(), context.allocator());
            }
            reader.close();
            reader = null;
        }
    }

    @Override
    public void close() throws IOException {
        if (reader != null) {
            reader.close();
            reader = null;
        }
    }
}
