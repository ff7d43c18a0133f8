package io.splitdrive.sql.exec;

import io.splitdrive.sql.commons.types.JavaRow;
import io.splitdrive.sql.commons.types.VectorSchemaRootWriter;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.List;

public class TestSchemas {

    public static final Schema ID_NAME = new Schema(List.of(
            Field.nullable("id", new ArrowType.Int(32, true)),
            Field.nullable("name", new ArrowType.Utf8())));

    public static final List<JavaRow> S1_ROWS = List.of(
            JavaRow.of(1, "a"),
            JavaRow.of(2, "b"),
            JavaRow.of(3, "c"));

    public static final List<JavaRow> S2_ROWS = List.of(
            JavaRow.of(4, "d"),
            JavaRow.of(5, "e"));

    public static VectorSchemaRoot batch(BufferAllocator allocator, Schema schema, List<JavaRow> rows) {
        var root = VectorSchemaRoot.create(schema, allocator);
        return VectorSchemaRootWriter.of(schema).writeToVector(rows, root);
    }
}
