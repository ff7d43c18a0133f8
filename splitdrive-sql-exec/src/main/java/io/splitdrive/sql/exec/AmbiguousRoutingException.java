package io.splitdrive.sql.exec;

/**
 * Splits were supplied without a node mapping but the plan has more than one leaf.
 */
public class AmbiguousRoutingException extends QueryHarnessException {

    private final String branchingNodeId;
    private final int sourceCount;

    public AmbiguousRoutingException(String branchingNodeId, int sourceCount) {
        super("Plan node %s has %d sources, splits must be mapped to plan nodes explicitly"
                .formatted(branchingNodeId, sourceCount));
        this.branchingNodeId = branchingNodeId;
        this.sourceCount = sourceCount;
    }

    public String getBranchingNodeId() {
        return branchingNodeId;
    }

    public int getSourceCount() {
        return sourceCount;
    }
}
