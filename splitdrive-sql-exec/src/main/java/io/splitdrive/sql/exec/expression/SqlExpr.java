package io.splitdrive.sql.exec.expression;

import org.apache.arrow.vector.types.pojo.ArrowType;

import java.util.List;

/**
 * Expression kept as DuckDB SQL text together with the type DuckDB bound it to.
 *
 * @param sql        expression text as written, including its alias if it has one
 * @param alias      alias given in the text, empty when none
 * @param type       result type
 * @param references column names the expression reads
 */
public record SqlExpr(String sql, String alias, ArrowType type, List<String> references) implements TypedExpr {

    public SqlExpr {
        references = List.copyOf(references);
    }

    public boolean hasAlias() {
        return !alias.isEmpty();
    }

    @Override
    public String toSql() {
        return sql;
    }
}
