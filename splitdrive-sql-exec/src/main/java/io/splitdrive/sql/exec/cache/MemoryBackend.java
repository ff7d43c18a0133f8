package io.splitdrive.sql.exec.cache;

import io.splitdrive.sql.exec.split.Split;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.ipc.ArrowReader;

import java.io.IOException;

/**
 * Where a task allocates its memory and how it reads the data of its splits.
 * All backends allocate below {@link DefaultMemoryBackend#rootAllocator()} so batches can be
 * transferred between allocators of different backends.
 */
public interface MemoryBackend {

    String backendName();

    BufferAllocator newAllocator(String name);

    ArrowReader openSplit(Split split, BufferAllocator allocator) throws IOException;
}
