package io.mycelic.core.search;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * How a result was found. Hybrid search reports {@link #HYBRID} for memories found by both
 * keyword and semantic search.
 */
public enum MatchType {
    KEYWORD,
    TAG,
    DATE_RANGE,
    SEMANTIC,
    HYBRID;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
