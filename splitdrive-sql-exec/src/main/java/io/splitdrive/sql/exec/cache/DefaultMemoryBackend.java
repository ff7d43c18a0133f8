package io.splitdrive.sql.exec.cache;

import io.splitdrive.sql.exec.split.Split;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.ipc.ArrowReader;

import java.io.IOException;

/**
 * Passthrough backend: unbounded child allocators of the process root, splits read directly.
 */
public enum DefaultMemoryBackend implements MemoryBackend {
    INSTANCE;

    private static final BufferAllocator ROOT_ALLOCATOR = new RootAllocator();

    public static BufferAllocator rootAllocator() {
        return ROOT_ALLOCATOR;
    }

    @Override
    public String backendName() {
        return "default";
    }

    @Override
    public BufferAllocator newAllocator(String name) {
        return ROOT_ALLOCATOR.newChildAllocator(name, 0, ROOT_ALLOCATOR.getLimit());
    }

    @Override
    public ArrowReader openSplit(Split split, BufferAllocator allocator) throws IOException {
        return split.connectorSplit().openReader(allocator);
    }
}
