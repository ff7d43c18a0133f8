package io.splitdrive.sql.exec.task.operator;

import io.splitdrive.sql.commons.types.VectorSchemaRootWriter;
import io.splitdrive.sql.exec.plan.ValuesNode;
import org.apache.arrow.vector.VectorSchemaRoot;

public class ValuesOperator implements Operator {

    private final OperatorContext context;
    private final ValuesNode node;
    private final VectorSchemaRootWriter writer;
    private int nextBatch = 0;

    public ValuesOperator(OperatorContext context, ValuesNode node) {
        this.context = context;
        this.node = node;
        this.writer = VectorSchemaRootWriter.of(node.outputSchema());
    }

    @Override
    public VectorSchemaRoot next() {
        if (nextBatch >= node.batches().size()) {
            return null;
        }
        var root = VectorSchemaRoot.create(node.outputSchema(), context.allocator());
        try {
            return writer.writeToVector(node.batches().get(nextBatch++), root);
        } catch (RuntimeException e) {
            root.close();
            throw e;
        }
    }

    @Override
    public void close() {
    }
}
