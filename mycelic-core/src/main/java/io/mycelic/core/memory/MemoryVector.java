package io.mycelic.core.memory;

/**
 * A stored embedding together with the memory it belongs to.
 */
public record MemoryVector(String memoryId, float[] vector) {
}
