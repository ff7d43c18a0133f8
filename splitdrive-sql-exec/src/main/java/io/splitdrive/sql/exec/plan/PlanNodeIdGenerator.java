package io.splitdrive.sql.exec.plan;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Issues plan node ids "0", "1", ... Share one generator between builders of the same plan.
 */
public class PlanNodeIdGenerator {

    private final AtomicInteger nextId = new AtomicInteger();

    public String next() {
        return String.valueOf(nextId.getAndIncrement());
    }
}
