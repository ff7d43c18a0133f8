package io.splitdrive.sql.exec.cursor;

import io.splitdrive.sql.commons.types.Schemas;
import io.splitdrive.sql.exec.SchemaMismatchException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.List;

/**
 * Concatenates batches into one, keeping their order. Input batches are not closed.
 */
public final class BatchAccumulator {

    private BatchAccumulator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @throws SchemaMismatchException if a batch does not have the columns of {@code schema}
     */
    public static MergedResult merge(Schema schema, List<VectorSchemaRoot> batches, BufferAllocator allocator) {
        long total = 0;
        for (var batch : batches) {
            if (!Schemas.sameColumns(schema, batch.getSchema())) {
                throw new SchemaMismatchException(schema, batch.getSchema());
            }
            total += batch.getRowCount();
        }
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many rows to merge: " + total);
        }
        var merged = VectorSchemaRoot.create(schema, allocator);
        try {
            for (var vector : merged.getFieldVectors()) {
                vector.setInitialCapacity((int) total);
                vector.allocateNew();
            }
            int offset = 0;
            for (var batch : batches) {
                int rows = batch.getRowCount();
                for (int j = 0; j < schema.getFields().size(); j++) {
                    var target = merged.getVector(j);
                    var source = batch.getVector(j);
                    for (int i = 0; i < rows; i++) {
                        target.copyFromSafe(i, offset + i, source);
                    }
                }
                offset += rows;
            }
            merged.setRowCount(offset);
            return new MergedResult(merged);
        } catch (RuntimeException e) {
            merged.close();
            throw e;
        }
    }
}
