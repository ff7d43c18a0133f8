package io.splitdrive.sql.commons;

import org.apache.arrow.c.ArrowArrayStream;
import org.apache.arrow.c.Data;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.AutoCloseables;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.types.pojo.Schema;
import org.duckdb.DuckDBConnection;
import org.duckdb.DuckDBDriver;
import org.duckdb.DuckDBResultSet;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Process wide in-memory DuckDB database. Every caller gets its own duplicated connection
 * on the same database, so tables created on one connection are visible to the others.
 */
public enum ConnectionPool {
    INSTANCE;

    private static final String DUCKDB_PROPERTY_FILENAME = "duckdb.properties";
    private final DuckDBConnection connection;

    static {
        try {
            Class.forName("org.duckdb.DuckDBDriver");
        } catch (ClassNotFoundException e) {
            throw new RuntimeException(e);
        }
    }

    ConnectionPool() {
        try {
            final Properties properties = loadProperties();
            if (!properties.containsKey(DuckDBDriver.JDBC_STREAM_RESULTS)) {
                properties.setProperty(DuckDBDriver.JDBC_STREAM_RESULTS, String.valueOf(true));
            }
            this.connection = (DuckDBConnection) DriverManager.getConnection("jdbc:duckdb:", properties);
        } catch (SQLException e) {
            throw new RuntimeException(e);
        }
    }

    public static DuckDBConnection getConnection() {
        return INSTANCE.getConnectionInternal();
    }

    /**
     * @param connection connection to run on
     * @param sql sql to be executed
     * @param tClass class of the return object
     * @return first value of the first row
     */
    public static <T> T collectFirst(Connection connection, String sql, Class<T> tClass) {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
            try (ResultSet resultSet = statement.getResultSet()) {
                if (!resultSet.next()) {
                    throw new SQLException("Query returned no results: " + sql);
                }
                return resultSet.getObject(1, tClass);
            }
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        }
    }

    /**
     * Runs the query and extracts every row eagerly. Row order is the order DuckDB returns.
     */
    public static <T> List<T> collectAll(Connection connection, String sql, Extractor<T> extractor) {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
            var result = new ArrayList<T>();
            try (ResultSet resultSet = statement.getResultSet()) {
                while (resultSet.next()) {
                    result.add(extractor.extract(resultSet));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        }
    }

    public static boolean execute(Connection connection, String sql) {
        try (Statement statement = connection.createStatement()) {
            return statement.execute(sql);
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        }
    }

    public static boolean execute(String sql) {
        try (Connection connection = ConnectionPool.getConnection();
             Statement statement = connection.createStatement()) {
            return statement.execute(sql);
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        }
    }

    /**
     * Streams the result of the query as arrow batches allocated from the given allocator.
     * Closing the reader closes the underlying statement. The connection stays open.
     */
    public static ArrowReader getReader(DuckDBConnection connection,
                                        BufferAllocator allocator,
                                        String sql,
                                        int batchSize) throws SQLException {

        final Statement statement = connection.createStatement();
        try {
            statement.execute(sql);
            final DuckDBResultSet resultSet = (DuckDBResultSet) statement.getResultSet();
            final ArrowReader internal = (ArrowReader) resultSet.arrowExportStream(allocator, batchSize);

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
                    internal.close();
                    try {
                        resultSet.close();
                        statement.close();
                    } catch (SQLException e) {
                        throw new IOException(e);
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
        } catch (SQLException e) {
            try {
                statement.close();
            } catch (SQLException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    /**
     * Exposes the reader to DuckDB as a table named {@code tableName}. The registration can be
     * scanned once. The returned handle closes the reader and the exported stream.
     * <p>
     * The reader must not be streaming a query of this database: registering it blocks inside
     * DuckDB. Copy such results into batches first and register a reader over the copies.
     */
    public static Closeable registerArrowStream(DuckDBConnection connection,
                                                BufferAllocator allocator,
                                                ArrowReader reader,
                                                String tableName) {
        final ArrowArrayStream arrowArrayStream = ArrowArrayStream.allocateNew(allocator);
        try {
            Data.exportArrayStream(allocator, reader, arrowArrayStream);
            connection.registerArrowStream(tableName, arrowArrayStream);
        } catch (RuntimeException e) {
            arrowArrayStream.close();
            throw e;
        }
        return () -> {
            try {
                AutoCloseables.close(reader, arrowArrayStream);
            } catch (Exception e) {
                throw new IOException(e);
            }
        };
    }

    /**
     * Copies every batch of the reader into a new DuckDB table so it can be queried more than once.
     * Same restriction on the reader as {@link #registerArrowStream}.
     */
    public static void materialize(DuckDBConnection connection,
                                   BufferAllocator allocator,
                                   ArrowReader reader,
                                   String tableName) throws IOException {
        String streamName = tableName + "_stream";
        try (Closeable ignored = registerArrowStream(connection, allocator, reader, streamName)) {
            execute(connection, String.format("CREATE TABLE %s AS SELECT * FROM %s", tableName, streamName));
        }
    }

    private DuckDBConnection getConnectionInternal() {
        try {
            return (DuckDBConnection) connection.duplicate();
        } catch (SQLException e) {
            throw new RuntimeException("Error creating connection", e);
        }
    }

    private static Properties loadProperties() {
        Properties properties = new Properties();
        try (InputStream input = ConnectionPool.class.getClassLoader().getResourceAsStream(DUCKDB_PROPERTY_FILENAME)) {
            if (input != null) {
                properties.load(input);
            }
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        return properties;
    }

    @FunctionalInterface
    public interface Extractor<T> {
        T extract(ResultSet resultSet) throws SQLException;
    }
}
