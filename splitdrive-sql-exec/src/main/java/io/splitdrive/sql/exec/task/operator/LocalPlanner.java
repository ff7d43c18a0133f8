package io.splitdrive.sql.exec.task.operator;

import io.splitdrive.sql.exec.plan.FilterProjectNode;
import io.splitdrive.sql.exec.plan.LimitNode;
import io.splitdrive.sql.exec.plan.PlanNode;
import io.splitdrive.sql.exec.plan.TableScanNode;
import io.splitdrive.sql.exec.plan.UnionAllNode;
import io.splitdrive.sql.exec.plan.ValuesNode;

import java.util.ArrayList;

/**
 * Turns a plan into a tree of operators.
 */
public final class LocalPlanner {

    private LocalPlanner() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static Operator plan(PlanNode node, OperatorContext context) {
        if (node instanceof TableScanNode) {
            return new TableScanOperator(context, context.splitQueues().get(node.id()));
        } else if (node instanceof ValuesNode values) {
            return new ValuesOperator(context, values);
        } else if (node instanceof FilterProjectNode filterProject) {
            return new FilterProjectOperator(context, filterProject, plan(filterProject.sources().get(0), context));
        } else if (node instanceof LimitNode limit) {
            return new LimitOperator(plan(limit.sources().get(0), context), limit.count());
        } else if (node instanceof UnionAllNode union) {
            var sources = new ArrayList<Operator>();
            for (var source : union.sources()) {
                sources.add(plan(source, context));
            }
            return new UnionAllOperator(sources);
        }
        throw new UnsupportedOperationException("Unsupported plan node: " + node);
    }
}
