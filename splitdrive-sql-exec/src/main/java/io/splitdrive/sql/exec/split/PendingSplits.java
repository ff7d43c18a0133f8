package io.splitdrive.sql.exec.split;

import io.splitdrive.sql.exec.task.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Splits waiting to be handed to a task, keyed by the id of the plan node consuming them.
 * Delivery happens at most once: the first {@link #deliver(Task)} adds every split of every
 * node in map order and closes each node's input, later calls do nothing.
 * <p>
 * Not thread safe. The cursor invokes it from the thread pulling results.
 */
public class PendingSplits implements Consumer<Task> {

    private static final Logger logger = LoggerFactory.getLogger(PendingSplits.class);

    private final Map<String, List<Split>> splits;
    private boolean delivered = false;

    private PendingSplits(Map<String, List<Split>> splits) {
        this.splits = splits;
    }

    public static PendingSplits forNode(String nodeId, List<Split> splits) {
        var map = new LinkedHashMap<String, List<Split>>();
        map.put(nodeId, List.copyOf(splits));
        return new PendingSplits(map);
    }

    public static PendingSplits of(Map<String, List<Split>> splits) {
        var map = new LinkedHashMap<String, List<Split>>();
        splits.forEach((nodeId, list) -> map.put(nodeId, List.copyOf(list)));
        return new PendingSplits(map);
    }

    public static PendingSplits none() {
        return new PendingSplits(new LinkedHashMap<>());
    }

    public void deliver(Task task) {
        if (delivered) {
            logger.debug("Splits already delivered to task {}, ignoring", task.taskId());
            return;
        }
        delivered = true;
        for (var entry : splits.entrySet()) {
            var nodeId = entry.getKey();
            for (var split : entry.getValue()) {
                task.addSplit(nodeId, split);
            }
            task.noMoreSplits(nodeId);
            logger.debug("Delivered {} splits for node {} to task {}", entry.getValue().size(), nodeId, task.taskId());
        }
    }

    @Override
    public void accept(Task task) {
        deliver(task);
    }

    public boolean isDelivered() {
        return delivered;
    }

    public Map<String, List<Split>> splits() {
        return Collections.unmodifiableMap(splits);
    }
}
