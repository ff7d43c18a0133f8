package io.splitdrive.sql.exec.harness;

import io.splitdrive.sql.commons.types.JavaRow;
import io.splitdrive.sql.exec.HarnessConfig;
import io.splitdrive.sql.exec.cache.AsyncDataCache;
import io.splitdrive.sql.exec.cache.CacheContext;
import io.splitdrive.sql.exec.cache.DefaultMemoryBackend;
import io.splitdrive.sql.exec.cursor.BatchAccumulator;
import io.splitdrive.sql.exec.cursor.CursorParameters;
import io.splitdrive.sql.exec.cursor.Cursors;
import io.splitdrive.sql.exec.cursor.MergedResult;
import io.splitdrive.sql.exec.expression.Expressions;
import io.splitdrive.sql.exec.expression.FieldAccessExpr;
import io.splitdrive.sql.exec.expression.SqlExpr;
import io.splitdrive.sql.exec.plan.PlanNode;
import io.splitdrive.sql.exec.plan.PlanTopology;
import io.splitdrive.sql.exec.reference.DuckDbQueryRunner;
import io.splitdrive.sql.exec.split.ConnectorSplit;
import io.splitdrive.sql.exec.split.PendingSplits;
import io.splitdrive.sql.exec.split.Split;
import io.splitdrive.sql.exec.task.LocalTaskFactory;
import io.splitdrive.sql.exec.task.Task;
import io.splitdrive.sql.exec.task.TaskFactory;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Runs plans against splits and checks their output against DuckDB.
 * <p>
 * {@code assertQuery} runs the plan, merges its output and compares it with the rows of a DuckDB
 * query, returning the finished task. {@code getResults} returns the merged output instead.
 * Splits given as a list go to the only leaf of the plan, plans with several leaves need a map
 * from node id to splits.
 */
public class QueryHarness implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QueryHarness.class);

    private final HarnessConfig config;
    private final BufferAllocator allocator;
    private final LocalTaskFactory localTaskFactory;
    private final CacheContext cacheContext;
    private final DuckDbQueryRunner duckDb;

    public QueryHarness() {
        this(HarnessConfig.load());
    }

    public QueryHarness(HarnessConfig config) {
        this.config = config;
        this.allocator = DefaultMemoryBackend.INSTANCE.newAllocator("query-harness");
        this.localTaskFactory = new LocalTaskFactory(config);
        this.cacheContext = new CacheContext(config.cacheLoaderThreads());
        this.duckDb = new DuckDbQueryRunner(allocator, config.referenceBatchSize());
    }

    public HarnessConfig config() {
        return config;
    }

    public BufferAllocator allocator() {
        return allocator;
    }

    public CacheContext cacheContext() {
        return cacheContext;
    }

    public DuckDbQueryRunner duckDb() {
        return duckDb;
    }

    /**
     * Switches between the shared bounded cache, with the configured capacity, and passthrough.
     */
    public void useAsyncCache(boolean enabled) {
        if (enabled) {
            cacheContext.enableBoundedCache(config.cacheCapacityBytes());
        } else {
            cacheContext.disable();
        }
    }

    public Optional<AsyncDataCache> asyncCache() {
        return cacheContext.isBoundedCacheEnabled()
                ? Optional.of((AsyncDataCache) cacheContext.active())
                : Optional.empty();
    }

    public CursorParameters cursorParameters(PlanNode planNode) {
        return cursorParameters(planNode, localTaskFactory);
    }

    public CursorParameters cursorParameters(PlanNode planNode, TaskFactory taskFactory) {
        return new CursorParameters(planNode, taskFactory, cacheContext, allocator);
    }

    public Task assertQuery(PlanNode planNode, List<? extends ConnectorSplit> splits, String duckDbSql) {
        return assertQuery(planNode, splits, duckDbSql, Optional.empty());
    }

    public Task assertQuery(PlanNode planNode, List<? extends ConnectorSplit> splits, String duckDbSql,
                            Optional<List<Integer>> sortingKeys) {
        return assertQuery(cursorParameters(planNode), onlyLeafSplits(planNode, splits), duckDbSql, sortingKeys);
    }

    public Task assertQuery(PlanNode planNode, Map<String, List<Split>> splits, String duckDbSql) {
        return assertQuery(planNode, splits, duckDbSql, Optional.empty());
    }

    public Task assertQuery(PlanNode planNode, Map<String, List<Split>> splits, String duckDbSql,
                            Optional<List<Integer>> sortingKeys) {
        return assertQuery(cursorParameters(planNode), PendingSplits.of(splits), duckDbSql, sortingKeys);
    }

    public Task assertQuery(CursorParameters parameters, Consumer<Task> addSplits, String duckDbSql,
                            Optional<List<Integer>> sortingKeys) {
        try (var result = Cursors.readCursor(parameters, addSplits);
             var merged = BatchAccumulator.merge(parameters.planNode().outputSchema(), result.batches(), allocator)) {
            logger.debug("Task {} produced {} rows in {} batches",
                    result.task().taskId(), merged.rowCount(), result.batches().size());
            duckDb.assertResults(duckDbSql, merged.rows(), sortingKeys);
            return result.task();
        }
    }

    public MergedResult getResults(PlanNode planNode) {
        return getResults(cursorParameters(planNode), PendingSplits.none());
    }

    public MergedResult getResults(PlanNode planNode, List<? extends ConnectorSplit> splits) {
        return getResults(cursorParameters(planNode), onlyLeafSplits(planNode, splits));
    }

    public MergedResult getResults(PlanNode planNode, Map<String, List<Split>> splits) {
        return getResults(cursorParameters(planNode), PendingSplits.of(splits));
    }

    public MergedResult getResults(CursorParameters parameters) {
        return getResults(parameters, PendingSplits.none());
    }

    public MergedResult getResults(CursorParameters parameters, Consumer<Task> addSplits) {
        try (var result = Cursors.readCursor(parameters, addSplits)) {
            return BatchAccumulator.merge(parameters.planNode().outputSchema(), result.batches(), allocator);
        }
    }

    private static PendingSplits onlyLeafSplits(PlanNode planNode, List<? extends ConnectorSplit> splits) {
        return PendingSplits.forNode(PlanTopology.getOnlyLeafPlanNodeId(planNode), Split.ungrouped(splits));
    }

    public FieldAccessExpr toFieldExpr(String name, Schema schema) {
        return Expressions.toFieldExpr(name, schema);
    }

    public SqlExpr parseExpr(String text, Schema schema) {
        return Expressions.parseExpr(text, schema);
    }

    public void createDuckDbTable(String name, Schema schema, List<JavaRow> rows) {
        duckDb.createTable(name, schema, rows);
    }

    public void createDuckDbTable(String name, List<VectorSchemaRoot> batches) {
        duckDb.createTable(name, batches);
    }

    @Override
    public void close() {
        localTaskFactory.close();
        try {
            allocator.close();
        } catch (Exception e) {
            logger.atError().setCause(e).log("Error closing harness allocator");
        }
    }
}
