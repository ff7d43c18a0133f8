package io.splitdrive.sql.exec.harness;

import io.splitdrive.sql.exec.cache.AsyncDataCache;
import io.splitdrive.sql.exec.cache.AsyncDataCacheTest;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.parallel.ResourceLock;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base of tests running plans through a {@link QueryHarness}. Tests run with the shared async
 * data cache unless {@link #useAsyncCache()} is overridden.
 */
@ResourceLock(AsyncDataCacheTest.ASYNC_DATA_CACHE)
public abstract class OperatorTestBase {

    private static final AtomicInteger TABLE_COUNTER = new AtomicInteger();

    protected static QueryHarness harness;

    @BeforeAll
    public static void createHarness() {
        harness = new QueryHarness();
    }

    @AfterAll
    public static void closeHarness() {
        harness.close();
    }

    @BeforeEach
    public void installCache() {
        harness.useAsyncCache(useAsyncCache());
        harness.asyncCache().ifPresent(AsyncDataCache::invalidateAll);
    }

    @AfterEach
    public void revertCache() {
        harness.useAsyncCache(false);
    }

    protected boolean useAsyncCache() {
        return true;
    }

    protected static String tableName(String prefix) {
        return prefix + "_" + TABLE_COUNTER.incrementAndGet();
    }
}
