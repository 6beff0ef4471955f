package io.mycelic.core.memory;

/**
 * One piece of a long memory. {@code level} 1 is paragraph level; the parent itself is level 0.
 */
public record MemoryChunk(String content, int index, int level) {
}
