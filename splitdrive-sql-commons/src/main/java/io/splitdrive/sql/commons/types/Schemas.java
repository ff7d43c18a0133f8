package io.splitdrive.sql.commons.types;

import org.apache.arrow.vector.types.pojo.Schema;

public class Schemas {

    private Schemas() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * True when both schemas have the same column names and arrow types in the same order.
     * Nullability and metadata are not compared since DuckDB marks every exported column nullable.
     */
    public static boolean sameColumns(Schema expected, Schema actual) {
        var expectedFields = expected.getFields();
        var actualFields = actual.getFields();
        if (expectedFields.size() != actualFields.size()) {
            return false;
        }
        for (int i = 0; i < expectedFields.size(); i++) {
            var e = expectedFields.get(i);
            var a = actualFields.get(i);
            if (!e.getName().equals(a.getName()) || !e.getType().equals(a.getType())) {
                return false;
            }
        }
        return true;
    }
}
