package io.splitdrive.sql.exec.split;

import com.google.common.hash.Hashing;
import io.splitdrive.sql.commons.types.JavaRow;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.types.pojo.Schema;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Split over rows held in memory, read back as a single batch.
 */
public record RowsSplit(String id, Schema schema, List<JavaRow> rows) implements ConnectorSplit {

    public RowsSplit {
        rows = List.copyOf(rows);
    }

    /**
     * Includes a hash of the schema and the rows, so splits sharing an {@code id} but holding
     * different data are cached separately.
     */
    @Override
    public String splitId() {
        var hasher = Hashing.sha256().newHasher()
                .putString(schema.toJson(), StandardCharsets.UTF_8);
        for (var row : rows) {
            hasher.putString(row.values().toString(), StandardCharsets.UTF_8).putChar('\n');
        }
        return "rows:" + id + ":" + hasher.hash();
    }

    @Override
    public ArrowReader openReader(BufferAllocator allocator) {
        return new InMemoryBatchReader(allocator, schema, List.of(rows));
    }
}
