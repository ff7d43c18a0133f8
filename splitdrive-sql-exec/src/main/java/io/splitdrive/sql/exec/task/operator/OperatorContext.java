package io.splitdrive.sql.exec.task.operator;

import io.splitdrive.sql.exec.cache.MemoryBackend;
import io.splitdrive.sql.exec.task.SplitQueue;
import org.apache.arrow.memory.BufferAllocator;

import java.util.Map;

/**
 * What operators of one task share.
 *
 * @param splitQueues split queue of every scan node of the plan, by node id
 */
public record OperatorContext(String taskId,
                              BufferAllocator allocator,
                              MemoryBackend backend,
                              Map<String, SplitQueue> splitQueues,
                              int batchSize) {
}
