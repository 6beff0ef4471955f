package io.mycelic.core.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.mycelic.core.error.ValidationException;
import java.util.Locale;

public enum AccessScope {
    SESSION,
    SHARED,
    GLOBAL;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AccessScope parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return SESSION;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown access scope: " + raw);
        }
    }
}
