package io.mycelic.core.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import io.mycelic.core.error.ConstraintException;
import java.util.Locale;

public enum RelationshipType {
    REFERENCES("One memory refers to or cites another"),
    CONTRADICTS("The memories state conflicting information"),
    EXPANDS("One memory adds detail to another"),
    SIMILAR("The memories cover closely related content"),
    SEQUENTIAL("One memory follows the other in a sequence"),
    CAUSES("One memory describes a cause of the other"),
    ENABLES("One memory makes the other possible");

    private final String description;

    RelationshipType(String description) {
        this.description = description;
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String describe() {
        return description;
    }

    /**
     * Case-insensitive lookup; names outside the closed set violate the schema's type constraint.
     */
    public static RelationshipType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConstraintException("relationship type must not be blank");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConstraintException("Unknown relationship type: " + raw);
        }
    }
}
