package io.splitdrive.sql.exec.task.operator;

import org.apache.arrow.util.AutoCloseables;
import org.apache.arrow.vector.VectorSchemaRoot;

import java.io.IOException;
import java.util.List;

/**
 * Drains its sources one after the other.
 */
public class UnionAllOperator implements Operator {

    private final List<Operator> sources;
    private int current = 0;

    public UnionAllOperator(List<Operator> sources) {
        this.sources = List.copyOf(sources);
    }

    @Override
    public VectorSchemaRoot next() throws IOException, InterruptedException {
        while (current < sources.size()) {
            var batch = sources.get(current).next();
            if (batch != null) {
                return batch;
            }
            current++;
        }
        return null;
    }

    @Override
    public void close() throws IOException {
        try {
            AutoCloseables.close(sources);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException(e);
        }
    }
}
