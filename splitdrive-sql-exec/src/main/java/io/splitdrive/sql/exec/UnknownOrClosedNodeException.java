package io.splitdrive.sql.exec;

public class UnknownOrClosedNodeException extends QueryHarnessException {

    private final String nodeId;

    public UnknownOrClosedNodeException(String nodeId, String reason) {
        super("Plan node %s cannot accept splits: %s".formatted(nodeId, reason));
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
