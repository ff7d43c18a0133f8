package io.splitdrive.sql.exec.plan;

import io.splitdrive.sql.exec.expression.TypedExpr;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the rows of its source matching {@code filter} (all rows when absent) and computes
 * {@code projections} over them.
 */
public class FilterProjectNode extends PlanNode {

    private final PlanNode source;
    private final TypedExpr filter;
    private final List<String> names;
    private final List<TypedExpr> projections;
    private final Schema outputSchema;

    public FilterProjectNode(String id, PlanNode source, TypedExpr filter,
                             List<String> names, List<TypedExpr> projections) {
        super(id);
        this.source = Objects.requireNonNull(source, "source");
        if (names.size() != projections.size()) {
            throw new IllegalArgumentException("Got %d names for %d projections"
                    .formatted(names.size(), projections.size()));
        }
        if (filter != null && !(filter.type() instanceof ArrowType.Bool)) {
            throw new IllegalArgumentException("Filter must be boolean: " + filter);
        }
        this.filter = filter;
        this.names = List.copyOf(names);
        this.projections = List.copyOf(projections);
        var fields = new ArrayList<Field>(names.size());
        for (int i = 0; i < names.size(); i++) {
            fields.add(Field.nullable(names.get(i), projections.get(i).type()));
        }
        this.outputSchema = new Schema(fields);
    }

    public Optional<TypedExpr> filter() {
        return Optional.ofNullable(filter);
    }

    public List<String> names() {
        return names;
    }

    public List<TypedExpr> projections() {
        return projections;
    }

    @Override
    public List<PlanNode> sources() {
        return List.of(source);
    }

    @Override
    public Schema outputSchema() {
        return outputSchema;
    }

    @Override
    public String name() {
        return "FilterProject";
    }
}
