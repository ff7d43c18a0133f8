package io.splitdrive.sql.exec;

import org.apache.arrow.vector.types.pojo.Schema;

public class SchemaMismatchException extends QueryHarnessException {

    public SchemaMismatchException(Schema expected, Schema actual) {
        super("Batch schema %s does not match declared output %s".formatted(actual, expected));
    }
}
