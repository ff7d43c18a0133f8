package io.splitdrive.sql.exec.plan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only navigation over a plan tree. All walks are iterative.
 */
public final class PlanTopology {

    private PlanTopology() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Descends from {@code root} through single-source nodes until it reaches a leaf.
     * Stops at the first node with several sources and reports it as ambiguous.
     */
    public static LeafResolution resolveOnlyLeaf(PlanNode root) {
        PlanNode current = Objects.requireNonNull(root, "root");
        while (true) {
            var sources = current.sources();
            if (sources.isEmpty()) {
                return new LeafResolution.Found(current);
            }
            if (sources.size() > 1) {
                return new LeafResolution.Ambiguous(current, sources.size());
            }
            current = sources.get(0);
        }
    }

    /**
     * @return id of the only leaf of the plan
     * @throws io.splitdrive.sql.exec.AmbiguousRoutingException if the plan has several leaves
     */
    public static String getOnlyLeafPlanNodeId(PlanNode root) {
        return resolveOnlyLeaf(root).leafOrThrow().id();
    }

    /**
     * All nodes of the plan in pre-order.
     *
     * @throws IllegalArgumentException if two nodes share an id
     */
    public static Map<String, PlanNode> nodesById(PlanNode root) {
        var result = new LinkedHashMap<String, PlanNode>();
        Deque<PlanNode> stack = new ArrayDeque<>();
        stack.push(Objects.requireNonNull(root, "root"));
        while (!stack.isEmpty()) {
            var node = stack.pop();
            var previous = result.putIfAbsent(node.id(), node);
            if (previous != null && previous != node) {
                throw new IllegalArgumentException("Duplicate plan node id %s: %s and %s"
                        .formatted(node.id(), previous, node));
            }
            var sources = node.sources();
            for (int i = sources.size() - 1; i >= 0; i--) {
                stack.push(sources.get(i));
            }
        }
        return result;
    }

    public static Optional<PlanNode> findNode(PlanNode root, String id) {
        return Optional.ofNullable(nodesById(root).get(id));
    }

    /**
     * Leaves from left to right.
     */
    public static List<PlanNode> leaves(PlanNode root) {
        var leaves = new ArrayList<PlanNode>();
        for (var node : nodesById(root).values()) {
            if (node.isLeaf()) {
                leaves.add(node);
            }
        }
        return leaves;
    }
}
