package io.splitdrive.sql.exec.split;

import io.splitdrive.sql.commons.types.JavaRow;
import io.splitdrive.sql.commons.types.VectorSchemaRootWriter;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.types.pojo.Schema;

import java.io.IOException;
import java.util.List;

/**
 * Reader producing one arrow batch per row group.
 */
public class InMemoryBatchReader extends ArrowReader {

    private final Schema schema;
    private final List<List<JavaRow>> batches;
    private final VectorSchemaRootWriter writer;
    private int nextBatch = 0;

    public InMemoryBatchReader(BufferAllocator allocator, Schema schema, List<List<JavaRow>> batches) {
        super(allocator);
        this.schema = schema;
        this.batches = batches;
        this.writer = VectorSchemaRootWriter.of(schema);
    }

    @Override
    public boolean loadNextBatch() throws IOException {
        if (nextBatch >= batches.size()) {
            return false;
        }
        prepareLoadNextBatch();
        writer.writeToVector(batches.get(nextBatch++), getVectorSchemaRoot());
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
