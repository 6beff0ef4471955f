package io.mycelic.core.graph;

import io.mycelic.core.memory.Memory;

/**
 * A memory reached by traversal and its shortest hop count from the root.
 */
public record GraphNode(Memory memory, int distance) {
}
