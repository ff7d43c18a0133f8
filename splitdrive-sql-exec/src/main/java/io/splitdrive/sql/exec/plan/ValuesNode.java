package io.splitdrive.sql.exec.plan;

import io.splitdrive.sql.commons.types.JavaRow;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.List;
import java.util.Objects;

/**
 * Leaf producing literal rows, one output batch per row group. Takes no splits.
 */
public class ValuesNode extends PlanNode {

    private final Schema outputSchema;
    private final List<List<JavaRow>> batches;

    public ValuesNode(String id, Schema outputSchema, List<List<JavaRow>> batches) {
        super(id);
        this.outputSchema = Objects.requireNonNull(outputSchema, "outputSchema");
        this.batches = List.copyOf(batches);
    }

    public List<List<JavaRow>> batches() {
        return batches;
    }

    @Override
    public List<PlanNode> sources() {
        return List.of();
    }

    @Override
    public Schema outputSchema() {
        return outputSchema;
    }

    @Override
    public String name() {
        return "Values";
    }
}
