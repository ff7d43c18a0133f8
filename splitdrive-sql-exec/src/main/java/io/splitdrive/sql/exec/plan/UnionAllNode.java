package io.splitdrive.sql.exec.plan;

import io.splitdrive.sql.commons.types.Schemas;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.List;

/**
 * Concatenates the output of its sources, all of the first source before any of the second.
 */
public class UnionAllNode extends PlanNode {

    private final List<PlanNode> sources;

    public UnionAllNode(String id, List<PlanNode> sources) {
        super(id);
        if (sources.size() < 2) {
            throw new IllegalArgumentException("UnionAll needs at least two sources, got " + sources.size());
        }
        var first = sources.get(0).outputSchema();
        for (var source : sources) {
            if (!Schemas.sameColumns(first, source.outputSchema())) {
                throw new IllegalArgumentException("Source %s produces %s, expected %s"
                        .formatted(source, source.outputSchema(), first));
            }
        }
        this.sources = List.copyOf(sources);
    }

    @Override
    public List<PlanNode> sources() {
        return sources;
    }

    @Override
    public Schema outputSchema() {
        return sources.get(0).outputSchema();
    }

    @Override
    public String name() {
        return "UnionAll";
    }
}
