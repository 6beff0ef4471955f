package io.mycelic.core.search;

import io.mycelic.core.memory.Memory;

/**
 * A search hit. {@code relevance} is always within [0, 1].
 */
public record ScoredResult(Memory memory, double relevance, MatchType matchType) {
}
