package io.splitdrive.sql.exec.task.operator;

import org.apache.arrow.vector.VectorSchemaRoot;

import java.io.IOException;

/**
 * Pull based operator. Every batch returned is owned by the caller.
 */
public interface Operator extends AutoCloseable {

    /**
     * @return the next batch, {@code null} when the operator is done
     */
    VectorSchemaRoot next() throws IOException, InterruptedException;

    @Override
    void close() throws IOException;
}
