package io.splitdrive.sql.exec.split;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.ipc.ArrowReader;

import java.io.IOException;

/**
 * One unit of input data. Implementations are immutable and can be opened any number of times.
 */
public interface ConnectorSplit {

    /**
     * Stable identity of the data behind the split, used as cache key.
     */
    String splitId();

    /**
     * Opens a reader over the split's rows. Batches are allocated from {@code allocator},
     * the caller closes the reader.
     */
    ArrowReader openReader(BufferAllocator allocator) throws IOException;
}
