package io.splitdrive.sql.exec.plan;

import io.splitdrive.sql.commons.types.JavaRow;
import io.splitdrive.sql.exec.expression.Expressions;
import io.splitdrive.sql.exec.expression.FieldAccessExpr;
import io.splitdrive.sql.exec.expression.TypedExpr;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Fluent construction of plans, for example
 * {@code new PlanBuilder().tableScan(schema).filter("id > 1").project("id", "name").limit(10).planNode()}.
 * Builders that contribute nodes to the same plan must share a {@link PlanNodeIdGenerator}.
 */
public class PlanBuilder {

    private final PlanNodeIdGenerator idGenerator;
    private PlanNode planNode;

    public PlanBuilder() {
        this(new PlanNodeIdGenerator());
    }

    public PlanBuilder(PlanNodeIdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    public PlanBuilder tableScan(Schema schema) {
        planNode = new TableScanNode(idGenerator.next(), schema);
        return this;
    }

    public PlanBuilder values(Schema schema, List<List<JavaRow>> batches) {
        planNode = new ValuesNode(idGenerator.next(), schema, batches);
        return this;
    }

    public PlanBuilder filter(String predicate) {
        var source = current();
        var schema = source.outputSchema();
        var filter = Expressions.parseExpr(predicate, schema);
        if (filter.hasAlias()) {
            throw new IllegalArgumentException("Filter cannot have an alias: " + predicate);
        }
        var names = new ArrayList<String>();
        var projections = new ArrayList<TypedExpr>();
        for (var field : schema.getFields()) {
            names.add(field.getName());
            projections.add(new FieldAccessExpr(field.getName(), field.getType()));
        }
        planNode = new FilterProjectNode(idGenerator.next(), source, filter, names, projections);
        return this;
    }

    /**
     * Each projection is a DuckDB expression over the current output. Its output name is the
     * alias if one is given, the column name for a bare column reference and {@code p<i>} otherwise.
     */
    public PlanBuilder project(String... projections) {
        var source = current();
        var schema = source.outputSchema();
        var names = new ArrayList<String>();
        var exprs = new ArrayList<TypedExpr>();
        for (int i = 0; i < projections.length; i++) {
            var untyped = Expressions.parse(projections[i]);
            var typed = Expressions.inferTypes(untyped, schema);
            if (typed.hasAlias()) {
                names.add(typed.alias());
            } else if (untyped.isColumnReference()) {
                names.add(untyped.references().get(0));
            } else {
                names.add("p" + i);
            }
            exprs.add(typed);
        }
        planNode = new FilterProjectNode(idGenerator.next(), source, null, names, exprs);
        return this;
    }

    public PlanBuilder limit(long count) {
        planNode = new LimitNode(idGenerator.next(), current(), count);
        return this;
    }

    public PlanBuilder unionAll(List<PlanNode> sources) {
        planNode = new UnionAllNode(idGenerator.next(), sources);
        return this;
    }

    public PlanNode planNode() {
        return current();
    }

    private PlanNode current() {
        if (planNode == null) {
            throw new IllegalStateException("Plan has no source node yet");
        }
        return planNode;
    }
}
