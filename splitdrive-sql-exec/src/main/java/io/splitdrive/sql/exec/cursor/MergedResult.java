package io.splitdrive.sql.exec.cursor;

import io.splitdrive.sql.commons.types.JavaRow;
import io.splitdrive.sql.commons.types.JavaRowReader;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.List;

/**
 * All output of a run in one contiguous batch.
 */
public class MergedResult implements AutoCloseable {

    private final VectorSchemaRoot root;

    MergedResult(VectorSchemaRoot root) {
        this.root = root;
    }

    public VectorSchemaRoot root() {
        return root;
    }

    public Schema schema() {
        return root.getSchema();
    }

    public int rowCount() {
        return root.getRowCount();
    }

    public JavaRow row(int index) {
        return JavaRowReader.read(root, index);
    }

    public List<JavaRow> rows() {
        return JavaRowReader.read(root);
    }

    @Override
    public void close() {
        root.close();
    }
}
