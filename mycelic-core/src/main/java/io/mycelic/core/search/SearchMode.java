package io.mycelic.core.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.mycelic.core.error.ValidationException;
import java.util.Locale;

public enum SearchMode {
    KEYWORD,
    TAG,
    DATE_RANGE,
    SEMANTIC,
    HYBRID;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts {@code date_range}, {@code date-range} and any letter case; blank means keyword.
     */
    @JsonCreator
    public static SearchMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return KEYWORD;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown search mode: " + raw);
        }
    }
}
