package io.mycelic.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionConfig(
    @JsonAlias({"default_session_id"}) String defaultSessionId,
    @JsonAlias({"default_agent_type"}) String defaultAgentType
) {

    public static SessionConfig defaults() {
        return new SessionConfig("cli", "unknown");
    }
}
