package io.splitdrive.sql.exec.task.operator;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

final class Batches {

    private Batches() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Copies the content of {@code source} into a new batch with {@code schema}, allocated from
     * {@code allocator}. Columns are matched by position. The copy shares no buffer with
     * {@code source}, so it stays valid after the reader that produced {@code source} is closed.
     */
    static VectorSchemaRoot copy(VectorSchemaRoot source, Schema schema, BufferAllocator allocator) {
        int rows = source.getRowCount();
        var target = VectorSchemaRoot.create(schema, allocator);
        try {
            for (int j = 0; j < schema.getFields().size(); j++) {
                var to = target.getVector(j);
                var from = source.getVector(j);
                to.setInitialCapacity(rows);
                to.allocateNew();
                for (int i = 0; i < rows; i++) {
                    to.copyFromSafe(i, i, from);
                }
            }
            target.setRowCount(rows);
            return target;
        } catch (RuntimeException e) {
            target.close();
            throw e;
        }
    }
}
