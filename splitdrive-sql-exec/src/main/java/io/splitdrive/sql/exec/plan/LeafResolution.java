package io.splitdrive.sql.exec.plan;

import io.splitdrive.sql.exec.AmbiguousRoutingException;

/**
 * Outcome of looking for the single leaf of a plan: either the leaf, or the first node
 * that has more than one source.
 */
public interface LeafResolution {

    PlanNode leafOrThrow();

    boolean isFound();

    record Found(PlanNode leaf) implements LeafResolution {
        @Override
        public PlanNode leafOrThrow() {
            return leaf;
        }

        @Override
        public boolean isFound() {
            return true;
        }
    }

    record Ambiguous(PlanNode branchingNode, int sourceCount) implements LeafResolution {
        @Override
        public PlanNode leafOrThrow() {
            throw new AmbiguousRoutingException(branchingNode.id(), sourceCount);
        }

        @Override
        public boolean isFound() {
            return false;
        }
    }
}
