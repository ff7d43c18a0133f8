package io.splitdrive.sql.commons.types;

import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.util.Text;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads rows of a {@link VectorSchemaRoot} back into {@link JavaRow}s. Utf8 values come back as
 * {@link String}, every other value as returned by {@link FieldVector#getObject(int)}.
 */
public class JavaRowReader {

    private JavaRowReader() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static JavaRow read(VectorSchemaRoot root, int index) {
        var vectors = root.getFieldVectors();
        var objects = new Object[vectors.size()];
        for (int j = 0; j < objects.length; j++) {
            objects[j] = readValue(vectors.get(j), index);
        }
        return new JavaRow(objects);
    }

    public static List<JavaRow> read(VectorSchemaRoot root) {
        var rows = new ArrayList<JavaRow>(root.getRowCount());
        for (int i = 0; i < root.getRowCount(); i++) {
            rows.add(read(root, i));
        }
        return rows;
    }

    private static Object readValue(FieldVector vector, int index) {
        if (vector.isNull(index)) {
            return null;
        }
        var value = vector.getObject(index);
        if (value instanceof Text text) {
            return text.toString();
        }
        return value;
    }
}
