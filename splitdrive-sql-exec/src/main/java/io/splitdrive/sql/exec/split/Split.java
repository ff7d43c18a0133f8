package io.splitdrive.sql.exec.split;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A connector split together with its grouping index.
 */
public record Split(ConnectorSplit connectorSplit, int groupId) {

    public static final int UNGROUPED = -1;

    public Split {
        Objects.requireNonNull(connectorSplit, "connectorSplit");
    }

    public static Split of(ConnectorSplit connectorSplit) {
        return new Split(connectorSplit, UNGROUPED);
    }

    public static List<Split> ungrouped(List<? extends ConnectorSplit> connectorSplits) {
        var result = new ArrayList<Split>(connectorSplits.size());
        for (var connectorSplit : connectorSplits) {
            result.add(of(connectorSplit));
        }
        return result;
    }

    public String splitId() {
        return connectorSplit.splitId();
    }

    @Override
    public String toString() {
        return "Split[%s, group=%d]".formatted(connectorSplit.splitId(), groupId);
    }
}
