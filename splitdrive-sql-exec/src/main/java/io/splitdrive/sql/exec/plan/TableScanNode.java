package io.splitdrive.sql.exec.plan;

import org.apache.arrow.vector.types.pojo.Schema;

import java.util.List;
import java.util.Objects;

/**
 * Leaf reading the splits added for its id.
 */
public class TableScanNode extends PlanNode {

    private final Schema outputSchema;

    public TableScanNode(String id, Schema outputSchema) {
        super(id);
        this.outputSchema = Objects.requireNonNull(outputSchema, "outputSchema");
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
        return "TableScan";
    }
}
