package io.splitdrive.sql.commons.types;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorLoader;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.VectorUnloader;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.types.pojo.Schema;

import java.io.IOException;
import java.util.List;

/**
 * Reads existing batches one after the other. Each batch is copied into the reader's own root,
 * the batches stay owned by the caller.
 */
public class BatchListReader extends ArrowReader {

    private final Schema schema;
    private final List<VectorSchemaRoot> batches;
    private int nextBatch = 0;

    public BatchListReader(BufferAllocator allocator, Schema schema, List<VectorSchemaRoot> batches) {
        super(allocator);
        this.schema = schema;
        this.batches = batches;
    }

    @Override
    public boolean loadNextBatch() throws IOException {
        if (nextBatch >= batches.size()) {
            return false;
        }
        var source = batches.get(nextBatch++);
        try (var recordBatch = new VectorUnloader(source).getRecordBatch()) {
            new VectorLoader(getVectorSchemaRoot()).load(recordBatch);
        }
        return true;
    }

    @Override
    public long bytesRead() {
        return 0;
    }

    @Override
    protected void closeReadSource() {
    }

    @Override
    protected Schema readSchema() {
        return schema;
    }
}
