package io.mycelic.core.graph;

import java.util.List;

/**
 * Result of a traversal. When {@code truncated} is set the traversal was cancelled and the graph
 * holds only what had been reached; every edge listed joins two listed nodes.
 */
public record MemoryGraph(
    String rootId,
    int depth,
    List<GraphNode> nodes,
    List<Relationship> edges,
    boolean truncated
) {

    public MemoryGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }
}
