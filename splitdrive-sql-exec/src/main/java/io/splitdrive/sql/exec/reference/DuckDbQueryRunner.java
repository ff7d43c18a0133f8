package io.splitdrive.sql.exec.reference;

import io.splitdrive.sql.commons.ConnectionPool;
import io.splitdrive.sql.commons.RuntimeSqlException;
import io.splitdrive.sql.commons.types.BatchListReader;
import io.splitdrive.sql.commons.types.JavaRow;
import io.splitdrive.sql.commons.types.JavaRowReader;
import io.splitdrive.sql.exec.split.InMemoryBatchReader;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.types.pojo.Schema;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Computes expected results with DuckDB. Test inputs are registered as DuckDB tables, expected
 * rows are read back through arrow.
 */
public class DuckDbQueryRunner {

    private static final Logger logger = LoggerFactory.getLogger(DuckDbQueryRunner.class);

    private final BufferAllocator allocator;
    private final int batchSize;

    public DuckDbQueryRunner(BufferAllocator allocator, int batchSize) {
        this.allocator = allocator;
        this.batchSize = batchSize;
    }

    public void createTable(String name, List<VectorSchemaRoot> batches) {
        if (batches.isEmpty()) {
            throw new IllegalArgumentException("Cannot infer the schema of table %s without batches".formatted(name));
        }
        createTable(name, new BatchListReader(allocator, batches.get(0).getSchema(), batches));
    }

    public void createTable(String name, Schema schema, List<JavaRow> rows) {
        createTable(name, new InMemoryBatchReader(allocator, schema, List.of(rows)));
    }

    private void createTable(String name, ArrowReader reader) {
        logger.debug("Creating reference table {}", name);
        try (DuckDBConnection connection = ConnectionPool.getConnection()) {
            ConnectionPool.materialize(connection, allocator, reader, name);
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public List<JavaRow> execute(String sql) {
        var rows = new ArrayList<JavaRow>();
        try (DuckDBConnection connection = ConnectionPool.getConnection();
             ArrowReader reader = ConnectionPool.getReader(connection, allocator, sql, batchSize)) {
            while (reader.loadNextBatch()) {
                rows.addAll(JavaRowReader.read(reader.getVectorSchemaRoot()));
            }
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return rows;
    }

    /**
     * Compares {@code actual} with the result of {@code sql} as multisets. With sorting keys the
     * key columns of {@code actual} must also follow the order of the expected rows, so
     * {@code sql} should order by them.
     *
     * @param sortingKeys 0 based column indices
     */
    public void assertResults(String sql, List<JavaRow> actual, Optional<List<Integer>> sortingKeys) {
        var expected = execute(sql);
        QueryAssertions.assertEqualIgnoringOrder(expected, actual);
        sortingKeys.ifPresent(keys -> QueryAssertions.assertSortedOn(expected, actual, keys));
    }

    public void assertResults(String sql, List<JavaRow> actual) {
        assertResults(sql, actual, Optional.empty());
    }

    public void assertResultsOrdered(String sql, List<JavaRow> actual) {
        QueryAssertions.assertEqualOrdered(execute(sql), actual);
    }

    public void dropTable(String name) {
        ConnectionPool.execute("DROP TABLE IF EXISTS " + name);
    }
}
