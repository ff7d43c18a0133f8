package io.splitdrive.sql.exec.expression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.splitdrive.sql.commons.ConnectionPool;
import io.splitdrive.sql.commons.RuntimeSqlException;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.stream.Collectors;

/**
 * Builds typed expressions against a schema. Parsing goes through DuckDB's
 * {@code json_serialize_sql}, type inference binds the expression in a {@code DESCRIBE}
 * over an empty relation with the schema's columns.
 */
public final class Expressions {

    private static final String JSON_SERIALIZE_SQL = "SELECT cast(json_serialize_sql(%s) as string)";
    private static final String DESCRIBE_SQL = "DESCRIBE SELECT %s FROM (%s) t";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Expressions() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static FieldAccessExpr toFieldExpr(String name, Schema schema) {
        Field field;
        try {
            field = schema.findField(name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Field %s not found in %s".formatted(name, schema), e);
        }
        return new FieldAccessExpr(name, field.getType());
    }

    public static SqlExpr parseExpr(String text, Schema schema) {
        return inferTypes(parse(text), schema);
    }

    public static UntypedExpr parse(String text) {
        var sql = JSON_SERIALIZE_SQL.formatted(DuckTypes.quoteLiteral("SELECT " + text));
        JsonNode tree;
        try (var connection = ConnectionPool.getConnection()) {
            tree = MAPPER.readTree(ConnectionPool.collectFirst(connection, sql, String.class));
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        } catch (JsonProcessingException e) {
            throw new ExpressionException("Cannot read parse tree of " + text, e);
        }
        if (tree.path("error").asBoolean(false)) {
            throw new ExpressionException("Cannot parse '%s': %s".formatted(text, tree.path("error_message").asText()));
        }
        var statements = tree.path("statements");
        if (statements.size() != 1) {
            throw new ExpressionException("Expected a single expression: " + text);
        }
        var node = statements.get(0).path("node");
        var selectList = node.path("select_list");
        var fromType = node.path("from_table").path("type").asText("EMPTY");
        if (selectList.size() != 1 || !fromType.startsWith("EMPTY")) {
            throw new ExpressionException("Expected a single expression: " + text);
        }
        var expr = selectList.get(0);
        return new UntypedExpr(text, expr, expr.path("alias").asText(""));
    }

    public static SqlExpr inferTypes(UntypedExpr untyped, Schema schema) {
        var columns = new HashSet<String>();
        for (var field : schema.getFields()) {
            columns.add(field.getName());
        }
        var references = untyped.references();
        for (var reference : references) {
            if (!columns.contains(reference)) {
                throw new ExpressionException("Unknown column %s in '%s', input is %s"
                        .formatted(reference, untyped.text(), schema));
            }
        }
        var sql = DESCRIBE_SQL.formatted(untyped.text(), emptyRelation(schema));
        String duckDbType;
        try (var connection = ConnectionPool.getConnection()) {
            var types = ConnectionPool.collectAll(connection, sql, rs -> rs.getString("column_type"));
            if (types.size() != 1) {
                throw new ExpressionException("Expected one column for '%s', got %d".formatted(untyped.text(), types.size()));
            }
            duckDbType = types.get(0);
        } catch (SQLException | RuntimeSqlException e) {
            throw new ExpressionException("Cannot bind '%s' against %s".formatted(untyped.text(), schema), e);
        }
        return new SqlExpr(untyped.text(), untyped.alias(), DuckTypes.toArrowType(duckDbType), references);
    }

    /**
     * A relation without rows whose columns have the names and types of the schema.
     */
    static String emptyRelation(Schema schema) {
        if (schema.getFields().isEmpty()) {
            return "SELECT 1 WHERE false";
        }
        var columns = new ArrayList<String>();
        for (var field : schema.getFields()) {
            columns.add("NULL::%s AS %s".formatted(DuckTypes.toSqlType(field.getType()),
                    DuckTypes.quoteIdentifier(field.getName())));
        }
        return columns.stream().collect(Collectors.joining(", ", "SELECT ", " WHERE false"));
    }
}
