package io.splitdrive.sql.commons.types;

import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes {@link JavaRow}s into a {@link VectorSchemaRoot} column by column.
 * Supported column types are 32/64 bit signed int, double, utf8 and boolean.
 */
public class VectorSchemaRootWriter {

    @SuppressWarnings("rawtypes")
    private final VectorWriter[] functions;
    private final Schema schema;

    public VectorSchemaRootWriter(Schema schema,
                                  @SuppressWarnings("rawtypes") VectorWriter... functions) {
        this.functions = functions;
        this.schema = schema;
    }

    public Schema schema() {
        return schema;
    }

    public VectorSchemaRoot writeToVector(List<JavaRow> rows, VectorSchemaRoot root) {
        return writeToVector(rows.toArray(new JavaRow[0]), root);
    }

    public VectorSchemaRoot writeToVector(JavaRow[] rows, VectorSchemaRoot root) {
        root.allocateNew();
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].size() != functions.length) {
                throw new IllegalArgumentException("Row %d has %d values, schema has %d fields"
                        .formatted(i, rows[i].size(), functions.length));
            }
            for (int j = 0; j < functions.length; j++) {
                var function = functions[j];
                var vector = root.getVector(j);
                //noinspection unchecked
                function.write(vector, i, rows[i].get(j));
            }
        }
        root.setRowCount(rows.length);
        return root;
    }

    public static VectorSchemaRootWriter of(Schema schema) {
        List<VectorWriter<?>> listOfFunctions = new ArrayList<>();
        for (var field : schema.getFields()) {
            listOfFunctions.add(createWriter(field));
        }
        return new VectorSchemaRootWriter(schema, listOfFunctions.toArray(new VectorWriter[0]));
    }

    private static VectorWriter<?> createWriter(Field field) {
        var type = field.getType();
        if (type instanceof ArrowType.Int intType) {
            if (!intType.getIsSigned()) {
                throw new UnsupportedOperationException("Unsupported unsigned int: " + field.getName());
            }
            if (intType.getBitWidth() == 32) return new VectorWriter.IntVectorWriter();
            else if (intType.getBitWidth() == 64) return new VectorWriter.BigIntVectorWriter();
            else throw new UnsupportedOperationException("Unsupported int bit width: " + intType.getBitWidth());
        } else if (type instanceof ArrowType.FloatingPoint floatingPoint
                && floatingPoint.getPrecision() == FloatingPointPrecision.DOUBLE) {
            return new VectorWriter.FloatVectorWriter();
        } else if (type instanceof ArrowType.Utf8) {
            return new VectorWriter.VarCharVectorWriter();
        } else if (type instanceof ArrowType.Bool) {
            return new VectorWriter.BitVectorWriter();
        } else {
            throw new UnsupportedOperationException("Unsupported ArrowType: " + type);
        }
    }
}
