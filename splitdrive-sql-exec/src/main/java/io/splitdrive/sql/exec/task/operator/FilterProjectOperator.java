package io.splitdrive.sql.exec.task.operator;

import io.splitdrive.sql.commons.ConnectionPool;
import io.splitdrive.sql.commons.types.BatchListReader;
import io.splitdrive.sql.exec.expression.TypedExpr;
import io.splitdrive.sql.exec.plan.FilterProjectNode;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.duckdb.DuckDBConnection;

import java.io.Closeable;
import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Evaluates filter and projections with DuckDB, one input batch at a time. The input batch is
 * registered as an arrow stream and the output copied into batches of the node's schema.
 */
public class FilterProjectOperator implements Operator {

    private final OperatorContext context;
    private final FilterProjectNode node;
    private final Operator source;
    private final DuckDBConnection connection;
    private final Deque<VectorSchemaRoot> pending = new ArrayDeque<>();
    private final String selectList;
    private final String whereClause;
    private long inputCounter = 0;

    public FilterProjectOperator(OperatorContext context, FilterProjectNode node, Operator source) {
        this.context = context;
        this.node = node;
        this.source = source;
        this.connection = ConnectionPool.getConnection();
        this.selectList = node.projections().stream()
                .map(TypedExpr::toSql)
                .collect(Collectors.joining(", "));
        this.whereClause = node.filter().map(f -> " WHERE " + f.toSql()).orElse("");
    }

    @Override
    public VectorSchemaRoot next() throws IOException, InterruptedException {
        while (pending.isEmpty()) {
            var input = source.next();
            if (input == null) {
                return null;
            }
            try (input) {
                evaluate(input);
            }
        }
        return pending.pollFirst();
    }

    private void evaluate(VectorSchemaRoot input) throws IOException {
        var tableName = "fp_%s_%s_%d".formatted(context.taskId().replace('-', '_'), node.id(), inputCounter++);
        var sql = "SELECT " + selectList + " FROM " + tableName + whereClause;
        var inputReader = new BatchListReader(context.allocator(), input.getSchema(), List.of(input));
        try (Closeable ignored = ConnectionPool.registerArrowStream(connection, context.allocator(), inputReader, tableName);
             ArrowReader output = ConnectionPool.getReader(connection, context.allocator(),
                     sql, context.batchSize())) {
            while (output.loadNextBatch()) {
                var root = output.getVectorSchemaRoot();
                if (root.getRowCount() > 0) {
                    pending.addLast(Batches.copy(root, node.outputSchema(), context.allocator()));
                }
            }
        } catch (SQLException e) {
            throw new IOException("Cannot evaluate " + node + ": " + sql, e);
        }
    }

    @Override
    public void close() throws IOException {
        try {
            while (!pending.isEmpty()) {
                pending.pollFirst().close();
            }
            source.close();
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                throw new IOException(e);
            }
        }
    }
}
