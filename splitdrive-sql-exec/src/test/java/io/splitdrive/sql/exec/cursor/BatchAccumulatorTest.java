package io.splitdrive.sql.exec.cursor;

import io.splitdrive.sql.commons.types.JavaRow;
import io.splitdrive.sql.exec.SchemaMismatchException;
import io.splitdrive.sql.exec.TestSchemas;
import io.splitdrive.sql.exec.cache.DefaultMemoryBackend;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.AutoCloseables;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BatchAccumulatorTest {

    private BufferAllocator allocator;
    private final List<VectorSchemaRoot> batches = new ArrayList<>();

    @BeforeEach
    public void setUp() {
        allocator = DefaultMemoryBackend.INSTANCE.newAllocator("accumulator-test");
    }

    @AfterEach
    public void tearDown() throws Exception {
        AutoCloseables.close(batches);
        allocator.close();
    }

    private VectorSchemaRoot batch(Schema schema, List<JavaRow> rows) {
        var batch = TestSchemas.batch(allocator, schema, rows);
        batches.add(batch);
        return batch;
    }

    @Test
    public void testMergeKeepsOrder() {
        var input = List.of(
                batch(TestSchemas.ID_NAME, TestSchemas.S1_ROWS),
                batch(TestSchemas.ID_NAME, List.of()),
                batch(TestSchemas.ID_NAME, TestSchemas.S2_ROWS));
        try (var merged = BatchAccumulator.merge(TestSchemas.ID_NAME, input, allocator)) {
            assertEquals(5, merged.rowCount());
            var rows = merged.rows();
            for (int k = 0; k < 3; k++) {
                assertEquals(TestSchemas.S1_ROWS.get(k).values(), rows.get(k).values());
            }
            for (int k = 0; k < 2; k++) {
                assertEquals(TestSchemas.S2_ROWS.get(k).values(), rows.get(3 + k).values());
            }
        }
    }

    @Test
    public void testNullsAreCopied() {
        var input = List.of(batch(TestSchemas.ID_NAME, List.of(JavaRow.of(null, "x"), JavaRow.of(7, null))));
        try (var merged = BatchAccumulator.merge(TestSchemas.ID_NAME, input, allocator)) {
            assertNull(merged.row(0).get(0));
            assertEquals("x", merged.row(0).get(1));
            assertEquals(7, merged.row(1).get(0));
            assertNull(merged.row(1).get(1));
        }
    }

    @Test
    public void testNoBatches() {
        try (var merged = BatchAccumulator.merge(TestSchemas.ID_NAME, List.of(), allocator)) {
            assertEquals(0, merged.rowCount());
            assertEquals(TestSchemas.ID_NAME, merged.schema());
        }
    }

    @Test
    public void testNullabilityIsIgnored() {
        var notNull = new Schema(List.of(
                Field.notNullable("id", new ArrowType.Int(32, true)),
                Field.notNullable("name", new ArrowType.Utf8())));
        var input = List.of(batch(notNull, TestSchemas.S2_ROWS));
        try (var merged = BatchAccumulator.merge(TestSchemas.ID_NAME, input, allocator)) {
            assertEquals(2, merged.rowCount());
        }
    }

    @Test
    public void testSchemaMismatch() {
        var other = new Schema(List.of(
                Field.nullable("id", new ArrowType.Int(64, true)),
                Field.nullable("name", new ArrowType.Utf8())));
        var input = List.of(
                batch(TestSchemas.ID_NAME, TestSchemas.S1_ROWS),
                batch(other, List.of(JavaRow.of(4L, "d"))));
        long before = allocator.getAllocatedMemory();
        assertThrows(SchemaMismatchException.class, () -> BatchAccumulator.merge(TestSchemas.ID_NAME, input, allocator));
        assertEquals(before, allocator.getAllocatedMemory());
    }
}
