package io.splitdrive.sql.exec.expression;

import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Expression whose result type is known.
 */
public interface TypedExpr {

    ArrowType type();

    /**
     * DuckDB SQL text of the expression, usable in a select list.
     */
    String toSql();
}
