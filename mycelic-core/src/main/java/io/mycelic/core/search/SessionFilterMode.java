package io.mycelic.core.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.mycelic.core.error.ValidationException;
import java.util.Locale;

public enum SessionFilterMode {
    /** No session restriction. */
    ALL,
    /** Only memories written in the given session. */
    SESSION_ONLY,
    /** The given session plus anything with shared or global scope. */
    SESSION_AND_SHARED;

    @JsonCreator
    public static SessionFilterMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown session filter mode: " + raw);
        }
    }
}
