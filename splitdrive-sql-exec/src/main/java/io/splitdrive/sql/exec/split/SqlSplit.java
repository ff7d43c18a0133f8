package io.splitdrive.sql.exec.split;

import io.splitdrive.sql.commons.ConnectionPool;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.types.pojo.Schema;
import org.duckdb.DuckDBConnection;

import java.io.IOException;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Split whose rows are the result of a DuckDB query, for example over a parquet file.
 */
public record SqlSplit(String sql, int batchSize) implements ConnectorSplit {

    public static final int DEFAULT_BATCH_SIZE = 1024;

    public SqlSplit {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
    }

    public static SqlSplit of(String sql) {
        return new SqlSplit(sql, DEFAULT_BATCH_SIZE);
    }

    /**
     * @param format {@code parquet} or {@code csv}
     */
    public static SqlSplit ofFile(String path, String format) {
        var function = switch (format.toLowerCase(Locale.ROOT)) {
            case "parquet" -> "read_parquet";
            case "csv" -> "read_csv";
            default -> throw new IllegalArgumentException("Unsupported format: " + format);
        };
        return of("SELECT * FROM %s('%s')".formatted(function, path.replace("'", "''")));
    }

    @Override
    public String splitId() {
        return "sql:" + batchSize + ":" + sql;
    }

    @Override
    public ArrowReader openReader(BufferAllocator allocator) throws IOException {
        DuckDBConnection connection = ConnectionPool.getConnection();
        final ArrowReader internal;
        try {
            internal = ConnectionPool.getReader(connection, allocator, sql, batchSize);
        } catch (SQLException e) {
            closeQuietly(connection, e);
            throw new IOException("Cannot open split " + sql, e);
        }
        return new ArrowReader(allocator) {
            @Override
            public boolean loadNextBatch() throws IOException {
                return internal.loadNextBatch();
            }

            @Override
            public long bytesRead() {
                return internal.bytesRead();
            }

            @Override
            protected void closeReadSource() throws IOException {
                try {
                    internal.close();
                } finally {
                    try {
                        connection.close();
                    } catch (SQLException e) {
                        throw new IOException(e);
                    }
                }
            }

            @Override
            protected Schema readSchema() throws IOException {
                return internal.getVectorSchemaRoot().getSchema();
            }

            @Override
            public VectorSchemaRoot getVectorSchemaRoot() throws IOException {
                return internal.getVectorSchemaRoot();
            }
        };
    }

    private static void closeQuietly(DuckDBConnection connection, Exception primary) {
        try {
            connection.close();
        } catch (SQLException e) {
            primary.addSuppressed(e);
        }
    }
}
