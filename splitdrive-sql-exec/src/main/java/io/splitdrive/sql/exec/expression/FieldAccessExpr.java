package io.splitdrive.sql.exec.expression;

import org.apache.arrow.vector.types.pojo.ArrowType;

public record FieldAccessExpr(String name, ArrowType type) implements TypedExpr {

    @Override
    public String toSql() {
        return DuckTypes.quoteIdentifier(name);
    }
}
