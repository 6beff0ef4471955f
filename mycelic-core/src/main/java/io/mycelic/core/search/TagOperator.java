package io.mycelic.core.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.mycelic.core.error.ValidationException;
import java.util.Locale;

public enum TagOperator {
    AND,
    OR;

    @JsonCreator
    public static TagOperator parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return OR;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown tag operator: " + raw);
        }
    }
}
