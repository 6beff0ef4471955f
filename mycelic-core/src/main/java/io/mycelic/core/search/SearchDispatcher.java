package io.mycelic.core.search;

import io.mycelic.core.config.model.SearchConfig;
import io.mycelic.core.error.ValidationException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a {@link SearchRequest} to the handler for its mode, then applies the shared filters,
 * the relevance floor and the result limit.
 */
public final class SearchDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(SearchDispatcher.class);

    private final Map<SearchMode, SearchHandler> handlers = new EnumMap<>(SearchMode.class);
    private final int defaultLimit;
    private final int maxLimit;
    private final int candidateLimit;

    public SearchDispatcher(List<SearchHandler> handlers, SearchConfig config) {
        for (SearchHandler handler : handlers) {
            this.handlers.put(handler.mode(), handler);
        }
        this.defaultLimit = config.defaultLimit() > 0 ? config.defaultLimit() : 10;
        this.maxLimit = config.maxLimit() > 0 ? config.maxLimit() : 100;
        this.candidateLimit = Math.max(config.candidateLimit(), this.maxLimit);
    }

    public List<ScoredResult> search(SearchRequest request) {
        if (request == null) {
            throw new ValidationException("search request must not be null");
        }
        SearchHandler handler = handlers.get(request.mode());
        if (handler == null) {
            throw new ValidationException("Search mode not supported: " + request.mode().wire());
        }
        double minRelevance = request.minRelevance() == null ? 0.0 : request.minRelevance();
        if (Double.isNaN(minRelevance) || minRelevance < 0.0 || minRelevance > 1.0) {
            throw new ValidationException("minRelevance must be between 0 and 1");
        }
        SearchFilters filters = request.filters();
        if (filters.effectiveSessionMode() != SessionFilterMode.ALL && !filters.hasSession()) {
            throw new ValidationException("sessionId is required for session filter mode " + filters.effectiveSessionMode());
        }
        int limit = effectiveLimit(request.limit());

        List<ScoredResult> results = handler.candidates(request, candidateLimit).stream()
            .filter(result -> filters.accepts(result.memory()))
            .filter(result -> result.relevance() >= minRelevance)
            .limit(limit)
            .toList();
        LOG.debug("{} search returned {} results", request.mode().wire(), results.size());
        return results;
    }

    int effectiveLimit(Integer requested) {
        if (requested == null || requested <= 0) {
            return defaultLimit;
        }
        return Math.min(requested, maxLimit);
    }
}
