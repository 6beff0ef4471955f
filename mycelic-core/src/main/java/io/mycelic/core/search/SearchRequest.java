package io.mycelic.core.search;

import java.time.Instant;
import java.util.List;

public record SearchRequest(
    String query,
    SearchMode mode,
    List<String> tags,
    TagOperator tagOperator,
    Instant start,
    Instant end,
    SearchFilters filters,
    Integer limit,
    Double minRelevance
) {

    public SearchRequest {
        mode = mode == null ? SearchMode.KEYWORD : mode;
        tags = tags == null ? List.of() : List.copyOf(tags);
        tagOperator = tagOperator == null ? TagOperator.OR : tagOperator;
        filters = filters == null ? SearchFilters.none() : filters;
    }

    public static SearchRequest keyword(String query) {
        return new SearchRequest(query, SearchMode.KEYWORD, null, null, null, null, null, null, null);
    }

    public static SearchRequest semantic(String query) {
        return new SearchRequest(query, SearchMode.SEMANTIC, null, null, null, null, null, null, null);
    }

    public static SearchRequest hybrid(String query) {
        return new SearchRequest(query, SearchMode.HYBRID, null, null, null, null, null, null, null);
    }

    public static SearchRequest byTags(List<String> tags, TagOperator operator) {
        return new SearchRequest(null, SearchMode.TAG, tags, operator, null, null, null, null, null);
    }

    public static SearchRequest dateRange(Instant start, Instant end) {
        return new SearchRequest(null, SearchMode.DATE_RANGE, null, null, start, end, null, null, null);
    }

    public SearchRequest withFilters(SearchFilters replacement) {
        return new SearchRequest(query, mode, tags, tagOperator, start, end, replacement, limit, minRelevance);
    }

    public SearchRequest withLimit(Integer replacement) {
        return new SearchRequest(query, mode, tags, tagOperator, start, end, filters, replacement, minRelevance);
    }

    public SearchRequest withMinRelevance(Double replacement) {
        return new SearchRequest(query, mode, tags, tagOperator, start, end, filters, limit, replacement);
    }
}
