package io.splitdrive.sql.exec.cursor;

import io.splitdrive.sql.exec.task.Task;
import org.apache.arrow.util.AutoCloseables;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

public final class Cursors {

    private static final Logger logger = LoggerFactory.getLogger(Cursors.class);

    private Cursors() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Runs the plan and collects every batch. If the run fails the batches collected so far are
     * released before the error is rethrown.
     */
    public static CursorResult readCursor(CursorParameters parameters, Consumer<Task> addSplits) {
        var batches = new ArrayList<VectorSchemaRoot>();
        try (var cursor = ResultCursor.open(parameters, addSplits)) {
            while (cursor.hasNext()) {
                batches.add(cursor.next());
            }
            return new CursorResult(cursor.task(), batches);
        } catch (RuntimeException e) {
            try {
                AutoCloseables.close(batches);
            } catch (Exception closeException) {
                logger.atError().setCause(closeException).log("Error releasing batches of failed run");
            }
            throw e;
        }
    }

    /**
     * @param task    the finished task, already closed
     * @param batches output in production order, owned by the caller
     */
    public record CursorResult(Task task, List<VectorSchemaRoot> batches) implements AutoCloseable {

        public long rowCount() {
            long count = 0;
            for (var batch : batches) {
                count += batch.getRowCount();
            }
            return count;
        }

        @Override
        public void close() {
            for (var batch : batches) {
                batch.close();
            }
        }
    }
}
