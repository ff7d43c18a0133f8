package io.splitdrive.sql.exec.plan;

import org.apache.arrow.vector.types.pojo.Schema;

import java.util.List;
import java.util.Objects;

/**
 * Immutable node of a plan tree. A node with no sources is a leaf.
 */
public abstract class PlanNode {

    private final String id;

    protected PlanNode(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String id() {
        return id;
    }

    public abstract List<PlanNode> sources();

    public abstract Schema outputSchema();

    public abstract String name();

    public boolean isLeaf() {
        return sources().isEmpty();
    }

    @Override
    public String toString() {
        return "%s[%s]".formatted(name(), id);
    }
}
