package io.splitdrive.sql.exec.plan;

import org.apache.arrow.vector.types.pojo.Schema;

import java.util.List;
import java.util.Objects;

public class LimitNode extends PlanNode {

    private final PlanNode source;
    private final long count;

    public LimitNode(String id, PlanNode source, long count) {
        super(id);
        if (count < 0) {
            throw new IllegalArgumentException("Limit must not be negative: " + count);
        }
        this.source = Objects.requireNonNull(source, "source");
        this.count = count;
    }

    public long count() {
        return count;
    }

    @Override
    public List<PlanNode> sources() {
        return List.of(source);
    }

    @Override
    public Schema outputSchema() {
        return source.outputSchema();
    }

    @Override
    public String name() {
        return "Limit";
    }
}
