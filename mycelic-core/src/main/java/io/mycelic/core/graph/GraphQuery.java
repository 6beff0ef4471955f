package io.mycelic.core.graph;

import java.util.Set;

/**
 * @param depth       hops from the root; values below 1 mean {@value #DEFAULT_DEPTH}, values above
 *                    {@value #MAX_DEPTH} are capped
 * @param types       edge types to follow, empty for all
 * @param minStrength edges weaker than this are ignored; null for no floor
 */
public record GraphQuery(
    String rootId,
    int depth,
    Set<RelationshipType> types,
    Double minStrength,
    CancellationSignal cancellation
) {
    public static final int DEFAULT_DEPTH = 2;
    public static final int MAX_DEPTH = 5;

    public GraphQuery {
        types = types == null ? Set.of() : Set.copyOf(types);
        cancellation = cancellation == null ? CancellationSignal.none() : cancellation;
    }

    public static GraphQuery of(String rootId, int depth) {
        return new GraphQuery(rootId, depth, null, null, null);
    }

    public int effectiveDepth() {
        if (depth <= 0) {
            return DEFAULT_DEPTH;
        }
        return Math.min(depth, MAX_DEPTH);
    }
}
