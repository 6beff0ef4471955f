package io.mycelic.core.search;

import java.util.List;

/**
 * Produces scored candidates for one {@link SearchMode}, best first. Filtering and limits are
 * applied by {@link SearchDispatcher}.
 */
public interface SearchHandler {

    SearchMode mode();

    List<ScoredResult> candidates(SearchRequest request, int candidateLimit);
}
