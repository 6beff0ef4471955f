package io.mycelic.core.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.mycelic.core.error.ValidationException;
import java.util.Locale;

public enum AgentType {
    DESKTOP_AGENT("desktop-agent"),
    CODE_AGENT("code-agent"),
    API_CALLER("api-caller"),
    UNKNOWN("unknown");

    private final String wire;

    AgentType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /**
     * Blank input means {@link #UNKNOWN}; anything outside the known set is rejected.
     */
    @JsonCreator
    public static AgentType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (AgentType type : values()) {
            if (type.wire.equals(normalized)) {
                return type;
            }
        }
        throw new ValidationException("Unknown agent type: " + raw);
    }
}
